package uk.gegc.linguapath.features.scoring.domain.model;

import java.util.Map;

/**
 * Common shape of a heuristic score for one spoken or written attempt.
 */
public interface ScoreResult {

    /**
     * Overall score, 0-100.
     */
    double overallScore();

    /**
     * Named partial scores, each 0-100, in a stable order.
     */
    Map<String, Double> subScores();

    String feedback();
}
