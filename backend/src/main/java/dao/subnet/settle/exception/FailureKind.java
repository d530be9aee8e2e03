package dao.subnet.settle.exception;

/**
 * Every way a settlement attempt can fail.
 */
public enum FailureKind {

    /** Plan totals differ from the PoM delta. Raised before anything is signed. */
    POM_MISMATCH(true, false),

    /** The vault cannot cover the delta of at least one asset. */
    INSUFFICIENT_BALANCE(true, false),

    /** Fewer usable signers than the vault's medium threshold. */
    THRESHOLD_NOT_MET(true, false),

    /** A batch failed after earlier batches were already on the ledger. */
    PARTIAL_SUBMISSION(false, false),

    /** Timeout or transport error talking to the ledger. */
    LEDGER_TIMEOUT(false, true),

    /** The vault account does not exist on the ledger. */
    ACCOUNT_NOT_FOUND(false, false);

    private final boolean mustHalt;
    private final boolean retryable;

    FailureKind(boolean mustHalt, boolean retryable) {
        this.mustHalt = mustHalt;
        this.retryable = retryable;
    }

    /**
     * Must-halt failures are recorded and then re-thrown by the executor instead of being
     * folded into a failed result.
     */
    public boolean mustHalt() {
        return mustHalt;
    }

    public boolean retryable() {
        return retryable;
    }
}
