package dao.subnet.settle.exception;

import java.util.List;

/**
 * The ledger refused a transaction outright (bad sequence, malformed envelope, underfunded...).
 * Resubmitting the same envelope cannot succeed, so this is never retried.
 */
public class LedgerRejectedException extends RuntimeException {

    private final String transactionResult;
    private final List<String> operationResults;

    public LedgerRejectedException(String transactionResult, List<String> operationResults) {
        super("Transaction rejected: " + transactionResult
                + (operationResults.isEmpty() ? "" : " " + operationResults));
        this.transactionResult = transactionResult;
        this.operationResults = List.copyOf(operationResults);
    }

    public String getTransactionResult() {
        return transactionResult;
    }

    public List<String> getOperationResults() {
        return operationResults;
    }
}
