package dao.subnet.settle.exception;

import dao.subnet.settle.exception.FailureClassification.RecoveryAction;
import dao.subnet.settle.exception.FailureClassification.Severity;
import org.springframework.stereotype.Component;

/**
 * Maps a failure to how loudly it is reported and what an operator (or the next commitment
 * event) should do about it.
 */
@Component
public class FailureClassifier {

    public FailureClassification classify(FailureKind kind) {
        return switch (kind) {
            case POM_MISMATCH, INSUFFICIENT_BALANCE, THRESHOLD_NOT_MET ->
                    new FailureClassification(kind, Severity.CRITICAL, RecoveryAction.HALT, false);
            // some assets are paid and some are not; only a human can reconcile that
            case PARTIAL_SUBMISSION ->
                    new FailureClassification(kind, Severity.CRITICAL, RecoveryAction.MANUAL, false);
            case LEDGER_TIMEOUT ->
                    new FailureClassification(kind, Severity.WARNING, RecoveryAction.RETRY, true);
            case ACCOUNT_NOT_FOUND ->
                    new FailureClassification(kind, Severity.ERROR, RecoveryAction.MANUAL, false);
        };
    }
}
