package dao.subnet.settle.exception;

/**
 * Base type of all settlement failures. Callers branch on {@link #kind()}.
 */
public abstract class SettlementException extends RuntimeException {

    protected SettlementException(String message) {
        super(message);
    }

    protected SettlementException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
