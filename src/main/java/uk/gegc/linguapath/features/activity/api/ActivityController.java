package uk.gegc.linguapath.features.activity.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.linguapath.features.activity.api.dto.AggregateRequest;
import uk.gegc.linguapath.features.activity.application.PracticeRecordFactory;
import uk.gegc.linguapath.features.activity.application.RecordAggregator;
import uk.gegc.linguapath.features.activity.domain.model.ActivityAggregate;
import uk.gegc.linguapath.features.activity.domain.model.ActivityRecord;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.activity.domain.model.ComprehensionPractice;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.activity.domain.model.SpeakingPractice;
import uk.gegc.linguapath.features.activity.domain.model.TranslationLookup;
import uk.gegc.linguapath.features.activity.domain.model.VocabularyReviewPractice;
import uk.gegc.linguapath.features.activity.domain.model.WritingPractice;

import java.util.Map;

@Tag(name = "Activity", description = "Activity record construction and aggregation")
@RestController
@RequestMapping("/api/v1/activity")
@RequiredArgsConstructor
@Validated
public class ActivityController {

    private final RecordAggregator recordAggregator;
    private final PracticeRecordFactory practiceRecordFactory;

    @PostMapping("/aggregate")
    @Operation(
            summary = "Aggregate activity records",
            description = "Totals, accuracy, streak and per-type counts for records inside the window."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Aggregate",
                    content = @Content(schema = @Schema(implementation = ActivityAggregate.class))),
            @ApiResponse(responseCode = "400", description = "Validation error or window that ends before it starts",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ActivityAggregate> aggregate(@Valid @RequestBody AggregateRequest request) {
        AggregationWindow window = checkedWindow(request.window());
        ActivityAggregate aggregate = request.today() != null
                ? recordAggregator.aggregate(request.records(), window, request.today())
                : recordAggregator.aggregate(request.records(), window);
        return ResponseEntity.ok(aggregate);
    }

    @PostMapping("/aggregate/modules")
    @Operation(
            summary = "Aggregate activity records per skill module",
            description = "One aggregate per skill module; translation lookups are not counted towards any module."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Aggregates keyed by module"),
            @ApiResponse(responseCode = "400", description = "Validation error or window that ends before it starts",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Map<SkillModule, ActivityAggregate>> aggregateByModule(@Valid @RequestBody AggregateRequest request) {
        return ResponseEntity.ok(recordAggregator.aggregateByModule(request.records(), checkedWindow(request.window())));
    }

    @PostMapping("/records/reading")
    @Operation(summary = "Build a reading record", description = "Accuracy is the share of correct answers.")
    public ResponseEntity<ActivityRecord> readingRecord(@Valid @RequestBody ComprehensionPractice practice) {
        return ResponseEntity.ok(practiceRecordFactory.reading(practice));
    }

    @PostMapping("/records/listening")
    @Operation(summary = "Build a listening record", description = "Accuracy is the share of correct segments.")
    public ResponseEntity<ActivityRecord> listeningRecord(@Valid @RequestBody ComprehensionPractice practice) {
        return ResponseEntity.ok(practiceRecordFactory.listening(practice));
    }

    @PostMapping("/records/speaking")
    @Operation(summary = "Build a speaking record",
            description = "Accuracy weights pronunciation 60%, fluency 25% and completeness 15%.")
    public ResponseEntity<ActivityRecord> speakingRecord(@Valid @RequestBody SpeakingPractice practice) {
        return ResponseEntity.ok(practiceRecordFactory.speaking(practice));
    }

    @PostMapping("/records/writing")
    @Operation(summary = "Build a writing record",
            description = "Accuracy weights grammar 35%, vocabulary 25%, coherence 30% and creativity 10%.")
    public ResponseEntity<ActivityRecord> writingRecord(@Valid @RequestBody WritingPractice practice) {
        return ResponseEntity.ok(practiceRecordFactory.writing(practice));
    }

    @PostMapping("/records/translation")
    @Operation(summary = "Build a translation lookup record", description = "Lookups are recorded without accuracy.")
    public ResponseEntity<ActivityRecord> translationRecord(@Valid @RequestBody TranslationLookup lookup) {
        return ResponseEntity.ok(practiceRecordFactory.translation(lookup));
    }

    @PostMapping("/records/vocabulary-review")
    @Operation(summary = "Build a vocabulary review record",
            description = "A reading record for the word with accuracy 30, 70 or 100 for UNKNOWN, FAMILIAR or KNOWN.")
    public ResponseEntity<ActivityRecord> vocabularyReviewRecord(@Valid @RequestBody VocabularyReviewPractice review) {
        return ResponseEntity.ok(practiceRecordFactory.vocabularyReview(review));
    }

    private AggregationWindow checkedWindow(AggregationWindow window) {
        if (window == null) {
            return AggregationWindow.unbounded();
        }
        if (window.isInverted()) {
            throw new IllegalArgumentException("Window start " + window.from() + " is after its end " + window.to());
        }
        return window;
    }
}
