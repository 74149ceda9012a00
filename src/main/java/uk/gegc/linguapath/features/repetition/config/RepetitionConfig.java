package uk.gegc.linguapath.features.repetition.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewIntervalTable;

@Slf4j
@Configuration
public class RepetitionConfig {

    /**
     * Falls back to the built-in intervals when none are configured; a partially configured table is
     * validated as given and fails startup.
     */
    @Bean
    public ReviewIntervalTable reviewIntervalTable(RepetitionProperties properties) {
        if (properties.getIntervals() == null || properties.getIntervals().isEmpty()) {
            log.info("No review intervals configured, using built-in defaults");
            return ReviewIntervalTable.defaults();
        }
        ReviewIntervalTable table = ReviewIntervalTable.of(properties.getIntervals());
        log.info("Loaded review interval table: {}", table.asMap());
        return table;
    }
}
