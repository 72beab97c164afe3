package com.prrules.analyzer.store;

import java.time.Duration;
import java.time.Instant;

/**
 * How often a rule has been seen in a repository and with what average confidence.
 */
public record RuleStatistics(
        long id,
        long ruleId,
        long repositoryId,
        int occurrenceCount,
        Instant firstSeen,
        Instant lastSeen,
        Double avgConfidence
) {

    public static final Duration DEFAULT_TREND_WINDOW = Duration.ofDays(30);

    /**
     * {@code inactive} when not seen within the window, otherwise {@code frequent}
     * (over 10), {@code moderate} (over 5) or {@code rare}.
     */
    public String trend(Instant now, Duration window) {
        if (lastSeen.isBefore(now.minus(window))) {
            return "inactive";
        }
        if (occurrenceCount > 10) {
            return "frequent";
        }
        if (occurrenceCount > 5) {
            return "moderate";
        }
        return "rare";
    }

    /**
     * Weighted 70/30 between average confidence and log-scaled frequency, rounded to two decimals.
     */
    public double impactScore() {
        if (avgConfidence == null || avgConfidence == 0.0 || occurrenceCount == 0) {
            return 0.0;
        }
        double normalizedFrequency = Math.min(Math.log(occurrenceCount + 1) / Math.log(100), 1.0);
        double score = avgConfidence * 0.7 + normalizedFrequency * 0.3;
        return Math.round(score * 100) / 100.0;
    }

    public String priorityLevel(Instant now) {
        double impact = impactScore();
        String trend = trend(now, DEFAULT_TREND_WINDOW);
        if (impact >= 0.8 && (trend.equals("frequent") || trend.equals("moderate"))) {
            return "high";
        }
        if (impact >= 0.6 || trend.equals("frequent")) {
            return "medium";
        }
        if (impact >= 0.3) {
            return "low";
        }
        return "minimal";
    }

    public String confidenceDescription() {
        if (avgConfidence == null) {
            return "No confidence data";
        }
        if (avgConfidence >= 0.9) {
            return "Very high confidence";
        }
        if (avgConfidence >= 0.7) {
            return "High confidence";
        }
        if (avgConfidence >= 0.5) {
            return "Medium confidence";
        }
        return "Low confidence";
    }
}
