package uk.gegc.linguapath.features.scoring.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "WritingRubric", description = "Scoring rubric supplied by the content collaborator")
public record WritingRubric(
        @Schema(description = "Rubric id")
        String id,
        @Schema(description = "Display name")
        String name,
        @Schema(description = "Criteria, scored in order")
        @NotEmpty
        List<@Valid RubricCriterion> criteria
) {

    public static final WritingRubric DEFAULT = new WritingRubric(
            "default_rubric",
            "General writing rubric",
            List.of(
                    new RubricCriterion(WritingCriterionKind.CONTENT.id(), "Content", 25),
                    new RubricCriterion(WritingCriterionKind.ORGANIZATION.id(), "Organization", 20),
                    new RubricCriterion(WritingCriterionKind.GRAMMAR.id(), "Grammar", 25),
                    new RubricCriterion(WritingCriterionKind.VOCABULARY.id(), "Vocabulary", 20),
                    new RubricCriterion(WritingCriterionKind.MECHANICS.id(), "Mechanics", 10)
            )
    );

    public WritingRubric {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }
}
