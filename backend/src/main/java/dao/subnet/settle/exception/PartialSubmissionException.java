package dao.subnet.settle.exception;

import dao.subnet.settle.model.BatchResult;

import java.util.List;

/**
 * A batch failed definitively. Batches before {@code failedAt} are on the ledger and are kept
 * in {@code succeeded}.
 */
public class PartialSubmissionException extends SettlementException {

    private final List<BatchResult> succeeded;
    private final int failedAt;

    public PartialSubmissionException(int failedAt, List<BatchResult> succeeded, Throwable cause) {
        super("Batch " + failedAt + " failed after " + succeeded.size() + " successful batch(es): "
                + cause.getMessage(), cause);
        this.failedAt = failedAt;
        this.succeeded = List.copyOf(succeeded);
    }

    public List<BatchResult> getSucceeded() {
        return succeeded;
    }

    public int getFailedAt() {
        return failedAt;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PARTIAL_SUBMISSION;
    }
}
