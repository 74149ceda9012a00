package uk.gegc.linguapath.features.repetition.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.linguapath.config.TestClockConfig;
import uk.gegc.linguapath.features.repetition.application.RepetitionPriorityCalculator;
import uk.gegc.linguapath.features.repetition.application.ReviewQueueService;
import uk.gegc.linguapath.features.repetition.application.ReviewScheduler;
import uk.gegc.linguapath.features.repetition.config.RepetitionProperties;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewIntervalTable;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewOutcome;
import uk.gegc.linguapath.features.repetition.domain.model.ScheduledReview;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;
import uk.gegc.linguapath.features.repetition.infra.mapping.RepetitionDtoMapper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RepetitionController.class)
@Import({TestClockConfig.class, RepetitionPriorityCalculator.class, RepetitionDtoMapper.class,
        RepetitionControllerTest.IntervalTableConfig.class})
@ActiveProfiles("test")
@DisplayName("RepetitionController Tests")
class RepetitionControllerTest {

    private static final Instant NOW = TestClockConfig.getFixedInstant();

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReviewScheduler reviewScheduler;

    @MockitoBean
    private ReviewQueueService reviewQueueService;

    @TestConfiguration
    static class IntervalTableConfig {
        @Bean
        ReviewIntervalTable reviewIntervalTable() {
            return ReviewIntervalTable.defaults();
        }

        @Bean
        RepetitionProperties repetitionProperties() {
            RepetitionProperties properties = new RepetitionProperties();
            properties.setDefaultQueueLimit(20);
            return properties;
        }
    }

    @Test
    @DisplayName("POST /api/v1/repetition/entries: creates a never-reviewed entry at the clock's time")
    void createEntry_returns201() throws Exception {
        when(reviewScheduler.newEntry("ubiquitous", NOW)).thenReturn(VocabularyEntry.neverReviewed("ubiquitous", NOW));

        mockMvc.perform(post("/api/v1/repetition/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  ubiquitous \"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.text").value("ubiquitous"))
                .andExpect(jsonPath("$.masteryLevel").value(0))
                .andExpect(jsonPath("$.lastReviewedAt").isEmpty())
                .andExpect(jsonPath("$.neverReviewed").doesNotExist());
    }

    @Test
    @DisplayName("POST /api/v1/repetition/entries: blank text returns 400")
    void createEntry_blank_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/repetition/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"));

        verifyNoInteractions(reviewScheduler);
    }

    @Test
    @DisplayName("POST /api/v1/repetition/review: applies the outcome at the given time")
    void review_returnsScheduledReview() throws Exception {
        Instant reviewedAt = Instant.parse("2024-01-10T09:00:00Z");
        VocabularyEntry updated = new VocabularyEntry("apple", 4, 7, 5, reviewedAt, reviewedAt.plus(Duration.ofDays(15)));
        when(reviewScheduler.applyReview(any(VocabularyEntry.class), eq(ReviewOutcome.KNOWN), eq(reviewedAt)))
                .thenReturn(new ScheduledReview(updated, List.of()));

        mockMvc.perform(post("/api/v1/repetition/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"entry":{"text":"apple","masteryLevel":3,"reviewCount":6,"correctCount":4,
                                  "lastReviewedAt":"2024-01-01T09:00:00Z","nextReviewDueAt":"2024-01-08T09:00:00Z"},
                                 "outcome":"KNOWN","reviewedAt":"2024-01-10T09:00:00Z"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entry.masteryLevel").value(4))
                .andExpect(jsonPath("$.entry.nextReviewDueAt").value("2024-01-25T09:00:00Z"))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    @DisplayName("POST /api/v1/repetition/review: unknown outcome returns 400")
    void review_unknownOutcome_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/repetition/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"entry":{"text":"apple","nextReviewDueAt":"2024-01-08T09:00:00Z"},"outcome":"MAYBE"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));
    }

    @Test
    @DisplayName("POST /api/v1/repetition/due: returns the queue with priority scores, capped at the configured limit")
    void due_returnsQueueWithPriority() throws Exception {
        VocabularyEntry overdue = new VocabularyEntry("dog", 1, 2, 1,
                NOW.minus(Duration.ofDays(4)), NOW.minus(Duration.ofDays(2)));
        when(reviewQueueService.dueForReview(anyCollection(), eq(NOW), eq(20))).thenReturn(List.of(overdue));

        mockMvc.perform(post("/api/v1/repetition/due")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"entries":[{"text":"dog","masteryLevel":1,"reviewCount":2,"correctCount":1,
                                  "lastReviewedAt":"2024-01-11T12:00:00Z","nextReviewDueAt":"2024-01-13T12:00:00Z"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].text").value("dog"))
                // 20 + 2 overdue days * 5 + 6 * (5 - 1)
                .andExpect(jsonPath("$[0].priorityScore").value(54));

        verify(reviewQueueService).dueForReview(anyCollection(), eq(NOW), eq(20));
    }

    @Test
    @DisplayName("POST /api/v1/repetition/due: explicit limit is passed through")
    void due_withLimit() throws Exception {
        when(reviewQueueService.dueForReview(anyCollection(), eq(NOW), eq(5))).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/repetition/due")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entries\":[],\"limit\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(reviewQueueService).dueForReview(anyCollection(), eq(NOW), eq(5));
    }

    @Test
    @DisplayName("POST /api/v1/repetition/due: negative limit returns 400")
    void due_negativeLimit_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/repetition/due")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entries\":[],\"limit\":-1}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /api/v1/repetition/intervals: returns six intervals per band")
    void intervals_returnsTable() throws Exception {
        mockMvc.perform(get("/api/v1/repetition/intervals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.SHORT.length()").value(6))
                .andExpect(jsonPath("$.MEDIUM.length()").value(6))
                .andExpect(jsonPath("$.LONG.length()").value(6));
    }
}
