package uk.gegc.linguapath.features.assessment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
import org.springframework.web.bind.annotation.*;
import uk.gegc.linguapath.features.activity.domain.model.AggregationWindow;
import uk.gegc.linguapath.features.activity.domain.model.SkillModule;
import uk.gegc.linguapath.features.assessment.api.dto.DecideRequest;
import uk.gegc.linguapath.features.assessment.api.dto.EvaluateModuleRequest;
import uk.gegc.linguapath.features.assessment.api.dto.ProficiencyRequest;
import uk.gegc.linguapath.features.assessment.application.LevelUpgradeDecisionEngine;
import uk.gegc.linguapath.features.assessment.application.ModuleAssessmentEvaluator;
import uk.gegc.linguapath.features.assessment.application.ProficiencyAssessmentService;
import uk.gegc.linguapath.features.assessment.domain.model.CefrLevel;
import uk.gegc.linguapath.features.assessment.domain.model.LevelRequirementTable;
import uk.gegc.linguapath.features.assessment.domain.model.LevelThreshold;
import uk.gegc.linguapath.features.assessment.domain.model.ModuleAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyAssessment;
import uk.gegc.linguapath.features.assessment.domain.model.ProficiencyReport;

import java.util.Map;

@Tag(name = "Assessment", description = "CEFR level estimation and upgrade decisions")
@RestController
@RequestMapping("/api/v1/assessment")
@RequiredArgsConstructor
@Validated
public class AssessmentController {

    private final ModuleAssessmentEvaluator moduleAssessmentEvaluator;
    private final LevelUpgradeDecisionEngine levelUpgradeDecisionEngine;
    private final ProficiencyAssessmentService proficiencyAssessmentService;
    private final LevelRequirementTable levelRequirementTable;

    @PostMapping("/modules/{module}/evaluate")
    @Operation(
            summary = "Evaluate one skill module",
            description = "Maps the module's aggregate onto the configured CEFR requirement table."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Module assessment",
                    content = @Content(schema = @Schema(implementation = ModuleAssessment.class))),
            @ApiResponse(responseCode = "400", description = "Unknown module or validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ModuleAssessment> evaluateModule(
            @Parameter(description = "Skill module", example = "READING") @PathVariable SkillModule module,
            @Valid @RequestBody EvaluateModuleRequest request
    ) {
        return ResponseEntity.ok(moduleAssessmentEvaluator.evaluate(module, request.aggregate()));
    }

    @PostMapping("/decide")
    @Operation(
            summary = "Decide overall level",
            description = "Combines four module assessments into an overall level (the lowest module level) and an upgrade decision."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Proficiency assessment",
                    content = @Content(schema = @Schema(implementation = ProficiencyAssessment.class))),
            @ApiResponse(responseCode = "400", description = "Not exactly one assessment per module, or validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ProficiencyAssessment> decide(@Valid @RequestBody DecideRequest request) {
        return ResponseEntity.ok(levelUpgradeDecisionEngine.decide(request.assessments()));
    }

    @PostMapping("/proficiency")
    @Operation(
            summary = "Assess proficiency from activity records",
            description = "Aggregates the records per module, evaluates every module, decides the overall level and adds study recommendations."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Proficiency report",
                    content = @Content(schema = @Schema(implementation = ProficiencyReport.class))),
            @ApiResponse(responseCode = "400", description = "Validation error or window that ends before it starts",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ProficiencyReport> assess(@Valid @RequestBody ProficiencyRequest request) {
        AggregationWindow window = request.window() == null ? AggregationWindow.unbounded() : request.window();
        if (window.isInverted()) {
            throw new IllegalArgumentException("Window start " + window.from() + " is after its end " + window.to());
        }
        return ResponseEntity.ok(proficiencyAssessmentService.assess(request.records(), window));
    }

    @GetMapping("/level-requirements")
    @Operation(summary = "Get level requirements", description = "Returns the configured threshold per CEFR level and skill module.")
    @ApiResponse(responseCode = "200", description = "Requirement table")
    public ResponseEntity<Map<CefrLevel, Map<SkillModule, LevelThreshold>>> getLevelRequirements() {
        return ResponseEntity.ok(levelRequirementTable.asMap());
    }
}
