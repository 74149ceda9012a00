package uk.gegc.linguapath.shared.exception;

/**
 * Thrown while loading static engine configuration (level requirement table,
 * review interval table) when the configured values break an invariant the
 * engine relies on. Raised at startup so a bad table never reaches a learner.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
