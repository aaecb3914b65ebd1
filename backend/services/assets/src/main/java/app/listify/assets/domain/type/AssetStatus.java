package app.listify.assets.domain.type;

public enum AssetStatus {
    completed,
    skipped,
    error;

    /**
     * Whether the caller should return the credit spent on this run.
     * Skipped runs never reached the paid generation call.
     */
    public boolean refundEligible() {
        return this == error;
    }
}
