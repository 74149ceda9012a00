package uk.gegc.linguapath.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Configuration for centralized Clock management.
 * Provides a single source of time for the entire application.
 *
 * The zone of the primary clock decides which calendar day a practice
 * record falls on, so streaks and due-date checks follow the learner's
 * configured timezone rather than the host default.
 */
@Configuration
public class ClockConfig {

    /**
     * Default timezone for the application.
     * Can be overridden via application properties.
     */
    @Value("${app.timezone:UTC}")
    private String timezone;

    /**
     * Creates the primary Clock bean for the application.
     *
     * @return Clock instance configured with the application timezone
     */
    @Bean
    @Primary
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
