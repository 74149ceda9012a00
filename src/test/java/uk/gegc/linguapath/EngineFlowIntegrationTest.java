package uk.gegc.linguapath;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.linguapath.features.activity.config.ActivityProperties;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.ActivityType;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.repetition.application.impl.IntervalTableReviewScheduler;
import uk.gegc.linguapath.features.repetition.config.RepetitionProperties;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewIntervalTable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application context: configuration binding and the record -> assessment and review flows over HTTP.
 * Requests carry explicit timestamps so results do not depend on the wall clock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Engine flow integration")
class EngineFlowIntegrationTest {

    private static final Instant REVIEWED_AT = Instant.parse("2024-03-10T08:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private LevelRequirementTable levelRequirementTable;

    @Autowired
    private ReviewIntervalTable reviewIntervalTable;

    @Autowired
    private RepetitionProperties repetitionProperties;

    @Autowired
    private ActivityProperties activityProperties;

    @Autowired
    private Clock clock;

    private ListAppender<ILoggingEvent> schedulerLogs;
    private Logger schedulerLogger;

    @BeforeEach
    void attachAppender() {
        schedulerLogger = (Logger) LoggerFactory.getLogger(IntervalTableReviewScheduler.class);
        schedulerLogs = new ListAppender<>();
        schedulerLogs.start();
        schedulerLogger.addAppender(schedulerLogs);
    }

    @AfterEach
    void detachAppender() {
        schedulerLogger.detachAppender(schedulerLogs);
    }

    @Test
    @DisplayName("application.properties binds to the built-in tables")
    void configuration_bindsTables() {
        assertEquals(LevelRequirementTable.defaults().asMap(), levelRequirementTable.asMap());
        assertEquals(ReviewIntervalTable.defaults().asMap(), reviewIntervalTable.asMap());
        assertEquals(20, repetitionProperties.getDefaultQueueLimit());
        assertEquals(50.0, activityProperties.getCorrectThreshold());
        assertEquals(ZoneId.of("UTC"), clock.getZone());
    }

    @Test
    @DisplayName("Practice records flow into a proficiency report")
    void records_flowIntoProficiencyReport() throws Exception {
        List<ActivityRecord> records = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            records.add(recordFromPractice("reading",
                    "{\"totalQuestions\":50,\"correctAnswers\":39,\"timeSpentSeconds\":120,\"completedAt\":\""
                            + REVIEWED_AT.minus(Duration.ofDays(i)) + "\"}"));
        }
        records.add(recordFromPractice("translation", "{\"word\":\"ubiquitous\",\"lookedUpAt\":\"" + REVIEWED_AT + "\"}"));
        assertThat(records).extracting(ActivityRecord::type).contains(ActivityType.READING, ActivityType.TRANSLATION);

        String body = objectMapper.writeValueAsString(Map.of("records", records));

        mockMvc.perform(post("/api/v1/assessment/proficiency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessment.modules.READING.currentLevel").value("B1"))
                .andExpect(jsonPath("$.assessment.modules.READING.nextLevelRequirement.currentProgress").value(80.0))
                .andExpect(jsonPath("$.assessment.modules.LISTENING.currentLevel").value("A1"))
                .andExpect(jsonPath("$.assessment.overallLevel").value("A1"))
                .andExpect(jsonPath("$.assessment.levelUpgrade.canUpgrade").value(false))
                .andExpect(jsonPath("$.assessment.levelUpgrade.nextLevel").value("A2"))
                .andExpect(jsonPath("$.assessment.levelUpgrade.overallProgress").value(20.0))
                .andExpect(jsonPath("$.assessment.weakestModule").value("LISTENING"))
                .andExpect(jsonPath("$.assessment.strongestModule").value("READING"))
                .andExpect(jsonPath("$.recommendations[0]").value("Focus on listening comprehension: current accuracy is 0.0%."))
                .andExpect(jsonPath("$.recommendations[1]")
                        .value("Listening: raise accuracy by 65.0 points and complete 15 more attempts"));
    }

    @Test
    @DisplayName("A reviewed word is rescheduled and appears in the due queue once its time comes")
    void review_thenQueue() throws Exception {
        String scheduled = mockMvc.perform(post("/api/v1/repetition/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"entry":{"text":"apple","masteryLevel":3,"reviewCount":4,"correctCount":3,
                                          "lastReviewedAt":"2024-03-01T08:00:00Z","nextReviewDueAt":"2024-03-08T08:00:00Z"},
                                 "outcome":"KNOWN","reviewedAt":"2024-03-10T08:00:00Z"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entry.masteryLevel").value(4))
                .andExpect(jsonPath("$.entry.correctCount").value(4))
                .andExpect(jsonPath("$.entry.nextReviewDueAt").value("2024-03-25T08:00:00Z"))
                .andExpect(jsonPath("$.warnings").isEmpty())
                .andReturn().getResponse().getContentAsString();

        JsonNode entry = objectMapper.readTree(scheduled).get("entry");
        String queueRequest = objectMapper.writeValueAsString(Map.of(
                "entries", List.of(entry),
                "now", "2024-03-26T08:00:00Z"));

        mockMvc.perform(post("/api/v1/repetition/due")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(queueRequest))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].text").value("apple"))
                .andExpect(jsonPath("$[0].priorityScore").value(31));
    }

    @Test
    @DisplayName("Corrupt stored mastery is clamped, reported and logged")
    void corruptMastery_isClampedAndLogged() throws Exception {
        mockMvc.perform(post("/api/v1/repetition/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"entry":{"text":"pear","masteryLevel":9,"reviewCount":2,"correctCount":2,
                                          "lastReviewedAt":"2024-03-01T08:00:00Z","nextReviewDueAt":"2024-03-02T08:00:00Z"},
                                 "outcome":"FAMILIAR","reviewedAt":"2024-03-10T08:00:00Z"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entry.masteryLevel").value(5))
                .andExpect(jsonPath("$.entry.nextReviewDueAt").value("2024-03-17T08:00:00Z"))
                .andExpect(jsonPath("$.warnings[0]")
                        .value("Stored masteryLevel 9 for 'pear' is out of range; clamped to 5"));

        assertThat(schedulerLogs.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).contains("'pear'");
                });
    }

    @Test
    @DisplayName("Writing score converts into an activity record the aggregator counts")
    void writingScore_feedsAggregation() throws Exception {
        mockMvc.perform(post("/api/v1/scoring/writing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"I like apples. They are sweet and crunchy. My sister likes them too.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallScore").value(85.0));

        mockMvc.perform(post("/api/v1/activity/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"records":[
                                   {"type":"WRITING","timestamp":"2024-03-10T08:00:00Z","timeSpentSeconds":600,"accuracy":85.0},
                                   {"type":"WRITING","timestamp":"2024-03-09T08:00:00Z","timeSpentSeconds":300,"accuracy":45.0}],
                                 "today":"2024-03-10"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTimeSpent").value(900))
                .andExpect(jsonPath("$.correctAttempts").value(1))
                .andExpect(jsonPath("$.averageAccuracy").value(65.0))
                .andExpect(jsonPath("$.streakDays").value(2));
    }

    @Test
    @DisplayName("GET /api/v1/repetition/intervals: durations render as ISO-8601")
    void intervals_renderAsIso() throws Exception {
        mockMvc.perform(get("/api/v1/repetition/intervals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.SHORT[0]").value("PT1H"))
                .andExpect(jsonPath("$.LONG[5]").value("PT720H"));
    }

    private ActivityRecord recordFromPractice(String kind, String practiceJson) throws Exception {
        String response = mockMvc.perform(post("/api/v1/activity/records/" + kind)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(practiceJson))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readValue(response, ActivityRecord.class);
    }
}
