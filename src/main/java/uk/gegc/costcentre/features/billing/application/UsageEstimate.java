package uk.gegc.costcentre.features.billing.application;

public record UsageEstimate(long tokens, long pages) {

    public static final UsageEstimate NONE = new UsageEstimate(0L, 0L);

    public static UsageEstimate tokens(long tokens) {
        return new UsageEstimate(tokens, 0L);
    }
}
