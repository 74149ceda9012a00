package uk.gegc.linguapath.features.repetition.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.linguapath.features.repetition.api.dto.DueQueueRequest;
import uk.gegc.linguapath.features.repetition.api.dto.NewEntryRequest;
import uk.gegc.linguapath.features.repetition.api.dto.ReviewRequest;
import uk.gegc.linguapath.features.repetition.application.RepetitionPriorityCalculator;
import uk.gegc.linguapath.features.repetition.application.ReviewQueueService;
import uk.gegc.linguapath.features.repetition.application.ReviewScheduler;
import uk.gegc.linguapath.features.repetition.application.dto.DueEntryDto;
import uk.gegc.linguapath.features.repetition.config.RepetitionProperties;
import uk.gegc.linguapath.features.repetition.domain.model.IntervalBand;
import uk.gegc.linguapath.features.repetition.domain.model.ReviewIntervalTable;
import uk.gegc.linguapath.features.repetition.domain.model.ScheduledReview;
import uk.gegc.linguapath.features.repetition.domain.model.VocabularyEntry;
import uk.gegc.linguapath.features.repetition.infra.mapping.RepetitionDtoMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Tag(name = "Repetition", description = "Spaced repetition scheduling and review queue")
@RestController
@RequestMapping("/api/v1/repetition")
@RequiredArgsConstructor
@Validated
public class RepetitionController {

    private final ReviewScheduler reviewScheduler;
    private final ReviewQueueService reviewQueueService;
    private final RepetitionPriorityCalculator calculator;
    private final RepetitionDtoMapper repetitionDtoMapper;
    private final ReviewIntervalTable intervalTable;
    private final RepetitionProperties properties;
    private final Clock clock;

    @PostMapping("/entries")
    @Operation(
            summary = "Start tracking a word",
            description = "Creates a never-reviewed entry at mastery level 0 that is due immediately."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "New entry",
                    content = @Content(schema = @Schema(implementation = VocabularyEntry.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<VocabularyEntry> createEntry(@Valid @RequestBody NewEntryRequest request) {
        VocabularyEntry entry = reviewScheduler.newEntry(request.text().trim(), Instant.now(clock));
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @PostMapping("/review")
    @Operation(
            summary = "Apply a review",
            description = "Returns the entry's new mastery level, counters and due time. Out-of-range stored values are clamped and reported as warnings."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated schedule",
                    content = @Content(schema = @Schema(implementation = ScheduledReview.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ScheduledReview> review(@Valid @RequestBody ReviewRequest request) {
        Instant reviewedAt = request.reviewedAt() != null ? request.reviewedAt() : Instant.now(clock);
        return ResponseEntity.ok(reviewScheduler.applyReview(request.entry(), request.outcome(), reviewedAt));
    }

    @PostMapping("/due")
    @Operation(
            summary = "Get due review queue",
            description = "Returns due entries with a priority score: previously reviewed words most overdue first, then new words."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Due entries in review order",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = DueEntryDto.class)))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<DueEntryDto>> getDue(@Valid @RequestBody DueQueueRequest request) {
        Instant now = request.now() != null ? request.now() : Instant.now(clock);
        int limit = request.limit() != null ? request.limit() : properties.getDefaultQueueLimit();
        List<VocabularyEntry> queue = reviewQueueService.dueForReview(request.entries(), now, limit);
        return ResponseEntity.ok(queue.stream()
                .map(entry -> repetitionDtoMapper.toDueEntryDto(entry, calculator.compute(entry, now)))
                .toList());
    }

    @GetMapping("/intervals")
    @Operation(
            summary = "Get review intervals",
            description = "Returns the configured interval per band, indexed by mastery level 0-5."
    )
    @ApiResponse(responseCode = "200", description = "Interval table")
    public ResponseEntity<Map<IntervalBand, List<Duration>>> getIntervals() {
        return ResponseEntity.ok(intervalTable.asMap());
    }
}
