package dao.subnet.settle.model;

import dao.subnet.settle.exception.SettlementException;

import java.util.List;

/**
 * Outcome of running a plan through the orchestrator. On failure, {@code batchResults} holds the
 * batches that succeeded before {@code failedAt}.
 */
public record SettlementExecutionResult(
        boolean success,
        List<BatchResult> batchResults,
        Integer failedAt,
        SettlementException failure
) {

    public static SettlementExecutionResult succeeded(List<BatchResult> batchResults) {
        return new SettlementExecutionResult(true, List.copyOf(batchResults), null, null);
    }

    public static SettlementExecutionResult halted(List<BatchResult> batchResults, int failedAt,
                                                   SettlementException failure) {
        return new SettlementExecutionResult(false, List.copyOf(batchResults), failedAt, failure);
    }

    public List<String> txHashes() {
        return batchResults.stream().map(BatchResult::txHash).toList();
    }

    public List<Long> ledgerRefs() {
        return batchResults.stream().map(BatchResult::ledger).toList();
    }

    public String error() {
        return failure == null ? null : failure.getMessage();
    }
}
