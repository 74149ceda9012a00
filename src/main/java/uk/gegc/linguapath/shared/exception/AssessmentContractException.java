package uk.gegc.linguapath.shared.exception;

/**
 * Signals that a caller handed the assessment engine input it promised never to build,
 * e.g. a module set that is not exactly one assessment per skill module.
 */
public class AssessmentContractException extends IllegalArgumentException {

    public AssessmentContractException(String message) {
        super(message);
    }
}
