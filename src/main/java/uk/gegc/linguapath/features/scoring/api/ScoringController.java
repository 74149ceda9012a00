package uk.gegc.linguapath.features.scoring.api;

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
import uk.gegc.linguapath.features.scoring.api.dto.PronunciationScoreRequest;
import uk.gegc.linguapath.features.scoring.api.dto.WritingScoreRequest;
import uk.gegc.linguapath.features.scoring.application.PronunciationScorer;
import uk.gegc.linguapath.features.scoring.application.WritingScorer;
import uk.gegc.linguapath.features.scoring.domain.model.PronunciationScore;
import uk.gegc.linguapath.features.scoring.domain.model.WritingScore;

@Tag(name = "Scoring", description = "Heuristic pronunciation and writing scores")
@RestController
@RequestMapping("/api/v1/scoring")
@RequiredArgsConstructor
@Validated
public class ScoringController {

    private final PronunciationScorer pronunciationScorer;
    private final WritingScorer writingScorer;

    @PostMapping("/pronunciation")
    @Operation(
            summary = "Score a spoken attempt",
            description = "Compares the recognised transcript with the reference text word by word."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pronunciation score",
                    content = @Content(schema = @Schema(implementation = PronunciationScore.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<PronunciationScore> scorePronunciation(@Valid @RequestBody PronunciationScoreRequest request) {
        double confidence = request.confidence() != null ? request.confidence() : 0.0;
        return ResponseEntity.ok(pronunciationScorer.score(request.originalText(), request.spokenText(), confidence));
    }

    @PostMapping("/writing")
    @Operation(
            summary = "Score a written attempt",
            description = "Scores the text against the rubric; every criterion gets points, feedback and, below 70%, a suggestion."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Writing score",
                    content = @Content(schema = @Schema(implementation = WritingScore.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<WritingScore> scoreWriting(@Valid @RequestBody WritingScoreRequest request) {
        return ResponseEntity.ok(writingScorer.score(
                request.content(),
                request.rubric(),
                request.wordLimit(),
                request.keywords()
        ));
    }
}
