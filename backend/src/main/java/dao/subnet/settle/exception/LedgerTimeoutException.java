package dao.subnet.settle.exception;

public class LedgerTimeoutException extends SettlementException {

    public LedgerTimeoutException(String message) {
        super(message);
    }

    public LedgerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.LEDGER_TIMEOUT;
    }
}
