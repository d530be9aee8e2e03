package dao.subnet.settle.service;

import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.ledger.LedgerAccount;
import dao.subnet.settle.ledger.PaymentTransactionFactory;
import dao.subnet.settle.model.PaymentInstruction;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.SettlementPlan;
import dao.subnet.settle.model.TransferBatch;
import dao.subnet.settle.model.TransferBundle;
import dao.subnet.settle.model.WithdrawalIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.stellar.sdk.Transaction;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a withdrawal queue into memo-bound, sequenced, unsigned ledger transactions.
 */
@Slf4j
@Service
public class SettlementPlanner {

    private static final BigInteger MAX_INT64 = BigInteger.valueOf(Long.MAX_VALUE);

    private final PomDeltaCalculator pomDeltaCalculator;
    private final TreasurySnapshotService snapshotService;
    private final PaymentTransactionFactory transactionFactory;
    private final SettlementProperties.Batch batchProps;
    private final Clock clock;

    public SettlementPlanner(PomDeltaCalculator pomDeltaCalculator,
                             TreasurySnapshotService snapshotService,
                             PaymentTransactionFactory transactionFactory,
                             SettlementProperties props,
                             Clock clock) {
        this.pomDeltaCalculator = pomDeltaCalculator;
        this.snapshotService = snapshotService;
        this.transactionFactory = transactionFactory;
        this.batchProps = props.getBatch();
        this.clock = clock;

        int max = batchProps.getMaxOperations();
        if (max < 1 || max > PaymentTransactionFactory.MAX_OPERATIONS) {
            throw new IllegalStateException("settlement.batch.max-operations must be 1.."
                    + PaymentTransactionFactory.MAX_OPERATIONS + ", got " + max);
        }

        long budget = worstCaseSubmissionSeconds(props);
        if (batchProps.getTxTimeoutSeconds() < budget) {
            log.warn("settlement.batch.tx-timeout-seconds={} is below the {}s one batch may spend in submission"
                            + " retries; later batches of a plan can expire before they land",
                    batchProps.getTxTimeoutSeconds(), budget);
        }
    }

    /**
     * Longest time a single batch can spend in submission: every attempt waits out the
     * confirmation poll, plus the backoff between attempts. All batches of a plan share one
     * deadline, so this bounds how many timed-out batches the deadline can absorb.
     */
    static long worstCaseSubmissionSeconds(SettlementProperties props) {
        SettlementProperties.Retry submission = props.getSubmission();
        int attempts = Math.max(1, submission.getMaxAttempts());
        long backoffMs = 0;
        for (int attempt = 0; attempt + 1 < attempts; attempt++) {
            backoffMs += Math.min(submission.getMaxDelayMs(), submission.getBaseDelayMs() * (1L << attempt));
        }
        long pollSeconds = props.getPolling().getTxConfirmTimeoutSeconds();
        return attempts * pollSeconds + (backoffMs + 999) / 1000;
    }

    /**
     * Reads the vault's current sequence once; batch {@code i} then uses {@code sequence + 1 + i}.
     */
    public SettlementPlan buildSettlementPlan(String vaultAddress,
                                              String subnetId,
                                              long blockNumber,
                                              List<WithdrawalIntent> withdrawals) {
        byte[] memo = SettlementHashing.memo(subnetId, blockNumber);

        if (withdrawals.isEmpty()) {
            log.info("Empty withdrawal queue for subnet={} block={}, plan has no batches", subnetId, blockNumber);
            return new SettlementPlan(subnetId, blockNumber, memo, List.of(), PomDelta.empty());
        }

        LedgerAccount vault = snapshotService.loadVaultAccount(vaultAddress);
        long sequence = vault.sequence();
        byte[] memoHash = SettlementHashing.padMemo(memo);
        // one deadline for every batch, fixed at plan time so the plan is reproducible
        long maxTime = clock.instant().getEpochSecond() + batchProps.getTxTimeoutSeconds();
        int maxOps = batchProps.getMaxOperations();

        List<TransferBatch> batches = new ArrayList<>();
        for (Map.Entry<String, List<WithdrawalIntent>> group : pomDeltaCalculator.groupByAsset(withdrawals).entrySet()) {
            List<WithdrawalIntent> sorted = pomDeltaCalculator.sortDeterministically(group.getValue());
            for (int from = 0; from < sorted.size(); from += maxOps) {
                List<WithdrawalIntent> chunk = List.copyOf(sorted.subList(from, Math.min(from + maxOps, sorted.size())));
                sequence++;
                TransferBundle bundle = buildBundle(vaultAddress, sequence, memoHash, maxTime, chunk);
                batches.add(new TransferBatch(batches.size(), group.getKey(), chunk, bundle));
            }
        }

        PomDelta totals = pomDeltaCalculator.computeNetOutflow(withdrawals);
        log.info("Planned settlement subnet={} block={} memo={} batches={} withdrawals={} sequences={}..{}",
                subnetId, blockNumber, SettlementHashing.memoHex(subnetId, blockNumber), batches.size(),
                withdrawals.size(), vault.sequence() + 1, sequence);
        return new SettlementPlan(subnetId, blockNumber, memo, List.copyOf(batches), totals);
    }

    private TransferBundle buildBundle(String vaultAddress,
                                       long sequence,
                                       byte[] memoHash,
                                       long maxTime,
                                       List<WithdrawalIntent> withdrawals) {
        List<PaymentInstruction> ops = new ArrayList<>(withdrawals.size());
        for (WithdrawalIntent w : withdrawals) {
            if (w.amount().compareTo(MAX_INT64) > 0) {
                throw new IllegalArgumentException("Withdrawal " + w.withdrawalId() + " exceeds int64: " + w.amount());
            }
            ops.add(new PaymentInstruction(w.withdrawalId(), w.destination(), w.assetCode(), w.issuer(),
                    w.amount().longValueExact()));
        }
        Transaction transaction = transactionFactory.build(vaultAddress, sequence, memoHash, 0L, maxTime, ops);
        return new TransferBundle(vaultAddress, transaction.getSequenceNumber(), transaction.getFee(), memoHash,
                0L, maxTime, List.copyOf(ops), transaction.toEnvelopeXdrBase64(), transaction.hash());
    }
}
