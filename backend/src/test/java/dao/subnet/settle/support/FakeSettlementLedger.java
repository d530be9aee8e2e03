package dao.subnet.settle.support;

import dao.subnet.settle.exception.AccountNotFoundException;
import dao.subnet.settle.exception.LedgerRejectedException;
import dao.subnet.settle.ledger.LedgerAccount;
import dao.subnet.settle.ledger.LedgerBalance;
import dao.subnet.settle.ledger.LedgerSigner;
import dao.subnet.settle.ledger.LedgerTransaction;
import dao.subnet.settle.ledger.SettlementLedgerClient;
import dao.subnet.settle.ledger.SubmissionResult;
import dao.subnet.settle.util.CryptoUtil;
import org.stellar.sdk.MemoHash;
import org.stellar.sdk.Transaction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory ledger with a single vault account. Records submitted transactions under their real
 * hash and memo, so replay scans behave like the real ledger.
 */
public class FakeSettlementLedger implements SettlementLedgerClient {

    private final String vault;

    private long sequence;
    private final List<LedgerBalance> balances = new ArrayList<>();
    private final List<LedgerSigner> signers = new ArrayList<>();
    private int medThreshold;

    private final List<LedgerTransaction> history = new ArrayList<>();
    private final List<Integer> signatureCounts = new ArrayList<>();
    private final Deque<RuntimeException> submitFailures = new ArrayDeque<>();
    private final Map<Integer, RuntimeException> submitFailuresAt = new HashMap<>();
    private final Deque<RuntimeException> loadFailures = new ArrayDeque<>();
    private RuntimeException historyFailure;
    private long ledger = 1000;

    public final AtomicInteger submitCalls = new AtomicInteger();
    public final AtomicInteger loadCalls = new AtomicInteger();
    public final AtomicInteger historyCalls = new AtomicInteger();

    public FakeSettlementLedger(String vault, long sequence) {
        this.vault = vault;
        this.sequence = sequence;
    }

    public synchronized FakeSettlementLedger withNativeBalance(String balance) {
        balances.add(new LedgerBalance(LedgerBalance.NATIVE, null, null, balance));
        return this;
    }

    public synchronized FakeSettlementLedger withBalance(String code, String issuer, String balance) {
        String type = code.length() <= 4 ? "credit_alphanum4" : "credit_alphanum12";
        balances.add(new LedgerBalance(type, code, issuer, balance));
        return this;
    }

    public synchronized FakeSettlementLedger withSigner(String key, int weight) {
        signers.add(new LedgerSigner(key, weight, LedgerSigner.ED25519_PUBLIC_KEY));
        return this;
    }

    public synchronized FakeSettlementLedger withThreshold(int medThreshold) {
        this.medThreshold = medThreshold;
        return this;
    }

    public synchronized void failNextSubmit(RuntimeException e) {
        submitFailures.addLast(e);
    }

    /**
     * Fails the {@code call}-th submission (1-based) regardless of what came before it.
     */
    public synchronized void failSubmitCall(int call, RuntimeException e) {
        submitFailuresAt.put(call, e);
    }

    public synchronized void failNextLoad(RuntimeException e) {
        loadFailures.addLast(e);
    }

    public synchronized void failHistory(RuntimeException e) {
        historyFailure = e;
    }

    /**
     * Puts a transaction in the vault history without going through submission.
     */
    public synchronized void addHistory(LedgerTransaction tx) {
        history.add(tx);
    }

    public synchronized List<LedgerTransaction> history() {
        return new ArrayList<>(history);
    }

    public synchronized List<Integer> signatureCounts() {
        return new ArrayList<>(signatureCounts);
    }

    public synchronized long sequence() {
        return sequence;
    }

    @Override
    public synchronized LedgerAccount loadAccount(String accountId) {
        loadCalls.incrementAndGet();
        if (!loadFailures.isEmpty()) throw loadFailures.pollFirst();
        if (!vault.equals(accountId)) throw new AccountNotFoundException(accountId);
        return new LedgerAccount(vault, sequence, List.copyOf(balances), List.copyOf(signers), 0, medThreshold, medThreshold);
    }

    @Override
    public synchronized List<LedgerTransaction> recentTransactions(String accountId, int limit) {
        historyCalls.incrementAndGet();
        if (historyFailure != null) throw historyFailure;
        List<LedgerTransaction> out = new ArrayList<>();
        for (int i = history.size() - 1; i >= 0 && out.size() < limit; i--) {
            out.add(history.get(i));
        }
        return out;
    }

    @Override
    public synchronized SubmissionResult submitTransaction(Transaction transaction) {
        int call = submitCalls.incrementAndGet();
        if (submitFailuresAt.containsKey(call)) throw submitFailuresAt.remove(call);
        if (!submitFailures.isEmpty()) throw submitFailures.pollFirst();

        if (transaction.getSignatures().isEmpty()) {
            throw new LedgerRejectedException("tx_bad_auth", List.of());
        }
        if (transaction.getSequenceNumber() != sequence + 1) {
            throw new LedgerRejectedException("tx_bad_seq", List.of());
        }
        sequence = transaction.getSequenceNumber();

        String memo = transaction.getMemo() instanceof MemoHash hashMemo
                ? Base64.getEncoder().encodeToString(hashMemo.getBytes())
                : null;
        LedgerTransaction recorded = new LedgerTransaction(CryptoUtil.toHex(transaction.hash()), ++ledger,
                memo == null ? null : LedgerTransaction.MEMO_TYPE_HASH, memo, true, null);
        history.add(recorded);
        signatureCounts.add(transaction.getSignatures().size());
        return new SubmissionResult(recorded.hash(), recorded.ledger());
    }

    @Override
    public synchronized Optional<LedgerTransaction> getTransaction(String hash) {
        return history.stream().filter(t -> t.hash().equals(hash)).findFirst();
    }
}
