package dao.subnet.settle.exception;

public record FailureClassification(
        FailureKind kind,
        Severity severity,
        RecoveryAction action,
        boolean retryable
) {

    public enum Severity {
        WARNING,
        ERROR,
        CRITICAL
    }

    public enum RecoveryAction {
        RETRY,
        HALT,
        MANUAL
    }
}
