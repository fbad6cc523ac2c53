package mail.digest.app.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class UrgencyResult {
    double score;
    UrgencyTier tier;
    /** Names of triggered rules, in evaluation order. */
    List<String> reasons;

    public UrgencyResult(double score, UrgencyTier tier, List<String> reasons) {
        this.score = Math.max(0.0, Math.min(1.0, score));
        this.tier = tier;
        this.reasons = List.copyOf(reasons);
    }

    public static UrgencyResult normal() {
        return new UrgencyResult(0.0, UrgencyTier.NORMAL, List.of());
    }

    public UrgencyResult withTier(UrgencyTier newTier, String reason) {
        List<String> merged = new ArrayList<>(reasons);
        if (reason != null && !merged.contains(reason)) {
            merged.add(reason);
        }
        return new UrgencyResult(score, newTier, merged);
    }
}
