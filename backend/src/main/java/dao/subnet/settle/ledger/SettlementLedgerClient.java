package dao.subnet.settle.ledger;

import org.stellar.sdk.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Access to the settlement ledger.
 *
 * Failures surface as {@link dao.subnet.settle.exception.AccountNotFoundException} (account missing),
 * {@link dao.subnet.settle.exception.LedgerRejectedException} (transaction refused) or
 * {@link dao.subnet.settle.exception.LedgerTimeoutException} (anything transient).
 */
public interface SettlementLedgerClient {

    LedgerAccount loadAccount(String accountId);

    /**
     * Most recent transactions of the account, newest first.
     */
    List<LedgerTransaction> recentTransactions(String accountId, int limit);

    /**
     * Submits a signed transaction and blocks until the ledger includes it or the request times out.
     */
    SubmissionResult submitTransaction(Transaction transaction);

    Optional<LedgerTransaction> getTransaction(String hash);
}
