package com.entity.reconciliation.store;

import com.entity.reconciliation.core.model.Candidate;
import com.entity.reconciliation.core.model.Entity;

import java.util.Locale;

/**
 * Scoring rules shared by every {@link EntityStore} implementation.
 *
 * <p>Scores live on a 0-100 scale (higher is better). The in-memory engine computes
 * them directly with {@link #heuristicScore}; the relational engine rescales the
 * full-text engine's native relevance with {@link #normalizationScale} so that callers
 * cannot tell the backends apart.</p>
 *
 * <p>The heuristic is a recall-weighted length ratio and is deliberately not clamped:
 * a query longer than the matched name scores above 100.</p>
 */
public final class MatchScoring {

    /** Scores strictly above this value are confident matches. */
    public static final double MATCH_THRESHOLD = 80.0;

    /** Score of a candidate found through its exact raw key. */
    public static final double EXACT_ID_SCORE = 100.0;

    /** Score of a candidate whose raw key equals the query ignoring case. */
    public static final double CASE_INSENSITIVE_ID_SCORE = 95.0;

    /** Bonus for candidates holding the requested type. */
    public static final double TYPE_BONUS = 10.0;

    private MatchScoring() {
        // utility class
    }

    public static boolean isMatch(double score) {
        return score > MATCH_THRESHOLD;
    }

    /**
     * Builds a fast-path candidate for an entity whose raw key equals the query text.
     */
    public static Candidate exactMatch(Entity entity) {
        return new Candidate(entity.getId(), entity.getName(), entity.getTypes(), EXACT_ID_SCORE, true);
    }

    /**
     * Builds a candidate, deriving the match flag from the score.
     */
    public static Candidate scored(Entity entity, double score) {
        return new Candidate(entity.getId(), entity.getName(), entity.getTypes(), score, isMatch(score));
    }

    /**
     * Scores an entity against a query for the in-memory engine.
     *
     * <ul>
     *   <li>{@value #CASE_INSENSITIVE_ID_SCORE} when the text equals the raw key ignoring case,</li>
     *   <li>otherwise {@code len(text) * 100 / len(name)} when the name contains the text ignoring case,</li>
     *   <li>plus {@value #TYPE_BONUS} when {@code typeId} is set and the entity holds it.</li>
     * </ul>
     *
     * @param text   the query text
     * @param entity the entity to score
     * @param typeId requested type id, blank for none
     * @return the score, 0 for no match
     */
    public static double heuristicScore(String text, Entity entity, String typeId) {
        String low = text.toLowerCase(Locale.ROOT);
        double score = 0.0;
        if (entity.getRawKey().toLowerCase(Locale.ROOT).equals(low)) {
            score = CASE_INSENSITIVE_ID_SCORE;
        } else if (!entity.getName().isEmpty()
                && entity.getName().toLowerCase(Locale.ROOT).contains(low)) {
            score = (low.length() * 100.0) / entity.getName().length();
        }
        if (typeId != null && !typeId.isEmpty() && entity.hasType(typeId)) {
            score += TYPE_BONUS;
        }
        return score;
    }

    /**
     * Computes the factor mapping a full-text engine's native relevance onto the
     * 0-100 scale, from the best hit of a result set.
     *
     * <p>{@code scale = max(len(text)/len(id), len(text)/len(name)) * 100 / nativeScore}.
     * The sign of the native score cancels out, so engines ranking with negative values
     * (SQLite's {@code bm25}) still produce positive scores.</p>
     *
     * @param text        the query text
     * @param candidateId composite id of the best hit
     * @param name        name of the best hit
     * @param nativeScore native relevance of the best hit
     * @return the scale factor, 0 when the native score is 0
     */
    public static double normalizationScale(String text, String candidateId, String name, double nativeScore) {
        if (nativeScore == 0.0) {
            return 0.0;
        }
        double byId = ratio(text.length(), candidateId.length());
        double byName = ratio(text.length(), name.length());
        return (Math.max(byId, byName) * 100.0) / nativeScore;
    }

    /**
     * Applies a scale factor to a native relevance score.
     */
    public static double normalize(double nativeScore, double scale) {
        return Math.max(0.0, nativeScore * scale);
    }

    private static double ratio(int queryLength, int targetLength) {
        return targetLength == 0 ? 0.0 : (double) queryLength / targetLength;
    }
}
