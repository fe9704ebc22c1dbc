package uk.gegc.costcentre.features.billing.application;

/**
 * Actual consumption reported by a metered operation.
 */
public interface MeteredResult {

    long tokensUsed();

    default long pagesProcessed() {
        return 0L;
    }
}
