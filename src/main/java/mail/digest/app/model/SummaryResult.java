package mail.digest.app.model;

import lombok.Value;

import java.util.List;

/**
 * Summary of one message (or one sender group), tagged with the tier that produced it.
 * Never mutated; re-summarizing creates a new instance.
 */
@Value
public class SummaryResult {
    String text;
    SummaryProvenance provider;
    boolean truncated;
    int originalLength;
    List<SummaryProvenance> failedProviders;
    double readingTimeMinutes;

    public SummaryResult(String text, SummaryProvenance provider, boolean truncated, int originalLength,
                         List<SummaryProvenance> failedProviders, double readingTimeMinutes) {
        this.text = text;
        this.provider = provider;
        this.truncated = truncated;
        this.originalLength = originalLength;
        this.failedProviders = List.copyOf(failedProviders);
        this.readingTimeMinutes = readingTimeMinutes;
    }

    public boolean isFallbackUsed() {
        return provider != SummaryProvenance.PRIMARY;
    }
}
