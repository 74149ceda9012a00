package uk.gegc.linguapath.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi activityGroup() {
        return GroupedOpenApi.builder()
                .group("activity")
                .displayName("Activity Records & Aggregation")
                .pathsToMatch("/api/v1/activity/**")
                .build();
    }

    @Bean
    public GroupedOpenApi assessmentGroup() {
        return GroupedOpenApi.builder()
                .group("assessment")
                .displayName("CEFR Assessment")
                .pathsToMatch("/api/v1/assessment/**")
                .build();
    }

    @Bean
    public GroupedOpenApi repetitionGroup() {
        return GroupedOpenApi.builder()
                .group("repetition")
                .displayName("Spaced Repetition")
                .pathsToMatch("/api/v1/repetition/**")
                .build();
    }

    @Bean
    public GroupedOpenApi scoringGroup() {
        return GroupedOpenApi.builder()
                .group("scoring")
                .displayName("Pronunciation & Writing Scoring")
                .pathsToMatch("/api/v1/scoring/**")
                .build();
    }
}
