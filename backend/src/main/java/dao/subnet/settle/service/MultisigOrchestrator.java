package dao.subnet.settle.service;

import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.exception.InsufficientBalanceException;
import dao.subnet.settle.exception.LedgerRejectedException;
import dao.subnet.settle.exception.LedgerTimeoutException;
import dao.subnet.settle.exception.PartialSubmissionException;
import dao.subnet.settle.exception.PomMismatchException;
import dao.subnet.settle.exception.ThresholdNotMetException;
import dao.subnet.settle.ledger.LedgerTransaction;
import dao.subnet.settle.ledger.PaymentTransactionFactory;
import dao.subnet.settle.ledger.SettlementLedgerClient;
import dao.subnet.settle.ledger.SubmissionResult;
import dao.subnet.settle.model.BatchResult;
import dao.subnet.settle.model.DeltaVerification;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.SettlementExecutionResult;
import dao.subnet.settle.model.SettlementPlan;
import dao.subnet.settle.model.SolvencyReport;
import dao.subnet.settle.model.TransferBatch;
import dao.subnet.settle.model.TreasurySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Transaction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The only path by which vault funds move. Verifies a plan (PoM, solvency, signer threshold)
 * before anything is signed, then signs and submits batch by batch, halting on the first failure.
 */
@Slf4j
@Service
public class MultisigOrchestrator {

    private final PomDeltaCalculator pomDeltaCalculator;
    private final TreasurySnapshotService snapshotService;
    private final SettlementLedgerClient ledgerClient;
    private final PaymentTransactionFactory transactionFactory;
    private final SettlementProperties.Retry submission;
    private final SettlementProperties.Polling polling;

    public MultisigOrchestrator(PomDeltaCalculator pomDeltaCalculator,
                                TreasurySnapshotService snapshotService,
                                SettlementLedgerClient ledgerClient,
                                PaymentTransactionFactory transactionFactory,
                                SettlementProperties props) {
        this.pomDeltaCalculator = pomDeltaCalculator;
        this.snapshotService = snapshotService;
        this.ledgerClient = ledgerClient;
        this.transactionFactory = transactionFactory;
        this.submission = props.getSubmission();
        this.polling = props.getPolling();
    }

    /**
     * @throws PomMismatchException         plan totals differ from {@code expectedDelta}
     * @throws InsufficientBalanceException the vault cannot cover {@code expectedDelta}
     * @throws ThresholdNotMetException     not enough of {@code availableSigners} are vault signers
     */
    public SettlementExecutionResult executeSettlement(SettlementPlan plan,
                                                       PomDelta expectedDelta,
                                                       TreasurySnapshot snapshot,
                                                       List<KeyPair> availableSigners) {
        verifyPlan(plan, expectedDelta);

        SolvencyReport solvency = snapshotService.checkSolvency(snapshot, expectedDelta);
        if (!solvency.solvent()) {
            log.error("Solvency check failed for subnet={} block={}: {}",
                    plan.subnetId(), plan.blockNumber(), solvency.shortfalls());
            throw new InsufficientBalanceException(solvency.shortfalls());
        }

        List<KeyPair> signers = usableSigners(snapshot, availableSigners);
        int required = requiredSignatures(snapshot);
        if (signers.size() < required) {
            log.error("Signer threshold not met for subnet={} block={}: required={}, available={}",
                    plan.subnetId(), plan.blockNumber(), required, signers.size());
            throw new ThresholdNotMetException(required, signers.size());
        }

        List<BatchResult> succeeded = new ArrayList<>();
        for (TransferBatch batch : plan.batches()) {
            try {
                SubmissionResult result = signAndSubmit(batch, signers, required);
                succeeded.add(new BatchResult(batch.index(), result.hash(), result.ledger(), batch.operationCount()));
                log.info("Batch {}/{} settled: hash={}, ledger={}, withdrawals={}",
                        batch.index() + 1, plan.batches().size(), result.hash(), result.ledger(), batch.operationCount());
            } catch (RuntimeException e) {
                log.error("Batch {} of subnet={} block={} failed, halting remaining {} batch(es): {}",
                        batch.index(), plan.subnetId(), plan.blockNumber(),
                        plan.batches().size() - batch.index() - 1, e.getMessage());
                PartialSubmissionException failure = new PartialSubmissionException(batch.index(), succeeded, e);
                return SettlementExecutionResult.halted(succeeded, batch.index(), failure);
            }
        }
        return SettlementExecutionResult.succeeded(succeeded);
    }

    /**
     * Checks both the plan's declared totals and the totals re-derived from its batches.
     */
    void verifyPlan(SettlementPlan plan, PomDelta expectedDelta) {
        DeltaVerification declared = pomDeltaCalculator.verifyDeltaMatch(plan.totalsByAsset(), expectedDelta);
        if (!declared.matches()) {
            log.error("PoM mismatch (plan totals) for subnet={} block={}: {}",
                    plan.subnetId(), plan.blockNumber(), declared.discrepancies());
            throw new PomMismatchException(declared.discrepancies());
        }
        DeltaVerification batched = pomDeltaCalculator.verifyDeltaMatch(plan.recomputeTotals(), expectedDelta);
        if (!batched.matches()) {
            log.error("PoM mismatch (batch contents) for subnet={} block={}: {}",
                    plan.subnetId(), plan.blockNumber(), batched.discrepancies());
            throw new PomMismatchException(batched.discrepancies());
        }
    }

    /**
     * A transaction needs at least one signature even when the vault threshold is zero.
     */
    static int requiredSignatures(TreasurySnapshot snapshot) {
        return Math.max(1, snapshot.threshold());
    }

    /**
     * Available signers the vault lists, deduplicated, in the caller's order.
     */
    static List<KeyPair> usableSigners(TreasurySnapshot snapshot, List<KeyPair> availableSigners) {
        Set<String> vaultSigners = new HashSet<>(snapshot.signers());
        Map<String, KeyPair> usable = new LinkedHashMap<>();
        for (KeyPair s : availableSigners) {
            if (vaultSigners.contains(s.getAccountId())) {
                usable.putIfAbsent(s.getAccountId(), s);
            }
        }
        return new ArrayList<>(usable.values());
    }

    private SubmissionResult signAndSubmit(TransferBatch batch, List<KeyPair> signers, int required) {
        Transaction transaction = transactionFactory.build(batch.bundle());
        if (!Arrays.equals(transaction.hash(), batch.bundle().hash())) {
            throw new IllegalStateException("Batch " + batch.index() + " no longer matches its planned hash");
        }
        int signed = 0;
        for (KeyPair signer : signers) {
            if (signed >= required) break;
            try {
                transaction.sign(signer);
                signed++;
            } catch (RuntimeException e) {
                log.warn("Signer {} could not sign batch {}: {}", signer.getAccountId(), batch.index(), e.getMessage());
            }
        }
        if (signed < required) {
            throw new ThresholdNotMetException(required, signed);
        }
        return submitWithRetry(batch, transaction);
    }

    /**
     * Timeouts are retried with exponential backoff; rejections are final. After a timeout the
     * transaction may still have landed, so the ledger is checked before resubmitting.
     */
    private SubmissionResult submitWithRetry(TransferBatch batch, Transaction transaction) {
        String hashHex = batch.bundle().hashHex();
        int attempts = Math.max(1, submission.getMaxAttempts());
        LedgerTimeoutException last = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return ledgerClient.submitTransaction(transaction);
            } catch (LedgerRejectedException e) {
                log.error("Batch {} rejected by ledger: {}", batch.index(), e.getMessage());
                throw e;
            } catch (LedgerTimeoutException e) {
                last = e;
                Optional<LedgerTransaction> landed = awaitConfirmation(hashHex);
                if (landed.isPresent()) {
                    LedgerTransaction tx = landed.get();
                    if (!tx.successful()) {
                        throw new LedgerRejectedException("tx_failed", List.of());
                    }
                    log.info("Batch {} landed despite submission timeout: hash={}", batch.index(), tx.hash());
                    return new SubmissionResult(tx.hash(), tx.ledger());
                }
                if (attempt + 1 < attempts) {
                    long delay = Math.min(submission.getMaxDelayMs(), submission.getBaseDelayMs() * (1L << attempt));
                    log.warn("Batch {} submission timed out (attempt {}/{}), retrying in {}ms: {}",
                            batch.index(), attempt + 1, attempts, delay, e.getMessage());
                    sleep(delay);
                }
            }
        }
        throw new LedgerTimeoutException("Batch " + batch.index() + " not confirmed after "
                + attempts + " submission attempts", last);
    }

    private Optional<LedgerTransaction> awaitConfirmation(String hashHex) {
        long deadline = System.currentTimeMillis() + Duration.ofSeconds(polling.getTxConfirmTimeoutSeconds()).toMillis();
        long sleepMs = Math.max(1, polling.getTxConfirmPollInitialMs());
        long maxSleepMs = Math.max(sleepMs, polling.getTxConfirmPollMaxMs());
        while (true) {
            try {
                Optional<LedgerTransaction> tx = ledgerClient.getTransaction(hashHex);
                if (tx.isPresent()) return tx;
            } catch (LedgerTimeoutException e) {
                log.debug("Confirmation lookup for {} failed: {}", hashHex, e.getMessage());
            }
            if (System.currentTimeMillis() >= deadline) {
                return Optional.empty();
            }
            long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1, sleepMs / 4));
            sleep(Math.min(sleepMs + jitter, Math.max(0, deadline - System.currentTimeMillis())));
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerTimeoutException("Interrupted while waiting on the ledger", ie);
        }
    }
}
