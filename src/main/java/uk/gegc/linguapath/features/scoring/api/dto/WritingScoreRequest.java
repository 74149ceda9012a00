package uk.gegc.linguapath.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import uk.gegc.linguapath.features.scoring.domain.model.WritingRubric;

import java.util.List;

@Schema(name = "WritingScoreRequest", description = "Text to score with an optional rubric, length target and keywords")
public record WritingScoreRequest(
        @Schema(description = "The learner's text", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        String content,
        @Schema(description = "Rubric; the default five-criterion rubric is used when omitted")
        @Valid
        WritingRubric rubric,
        @Schema(description = "Target length in words", example = "150")
        @Positive
        Integer wordLimit,
        @Schema(description = "Words the task expects the text to use")
        List<String> keywords
) {
}
