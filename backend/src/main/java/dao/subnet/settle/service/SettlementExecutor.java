package dao.subnet.settle.service;

import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.crypto.SignerKeyring;
import dao.subnet.settle.exception.FailureClassification;
import dao.subnet.settle.exception.FailureClassifier;
import dao.subnet.settle.exception.PartialSubmissionException;
import dao.subnet.settle.exception.SettlementException;
import dao.subnet.settle.integration.WithdrawalQueueClient;
import dao.subnet.settle.model.CommitmentEvent;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.SettlementConfirmation;
import dao.subnet.settle.model.SettlementExecutionResult;
import dao.subnet.settle.model.SettlementPlan;
import dao.subnet.settle.model.SettlementRecord;
import dao.subnet.settle.model.SettlementResult;
import dao.subnet.settle.model.SettlementStats;
import dao.subnet.settle.model.SettlementStatus;
import dao.subnet.settle.model.TreasurySnapshot;
import dao.subnet.settle.model.WithdrawalIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for settling one commitment:
 * already settled? -> fetch queue -> empty queue? -> pending -> snapshot, delta, plan -> orchestrator -> confirmed | failed.
 */
@Slf4j
@Service
public class SettlementExecutor {

    private final ReplayProtectionService replayProtection;
    private final TreasurySnapshotService snapshotService;
    private final PomDeltaCalculator pomDeltaCalculator;
    private final SettlementPlanner planner;
    private final MultisigOrchestrator orchestrator;
    private final SignerKeyring signerKeyring;
    private final FailureClassifier failureClassifier;
    private final SettlementProperties props;

    /** Guards the vault's sequence number across a whole settlement attempt. */
    private final Map<String, ReentrantLock> vaultLocks = new ConcurrentHashMap<>();

    public SettlementExecutor(ReplayProtectionService replayProtection,
                              TreasurySnapshotService snapshotService,
                              PomDeltaCalculator pomDeltaCalculator,
                              SettlementPlanner planner,
                              MultisigOrchestrator orchestrator,
                              SignerKeyring signerKeyring,
                              FailureClassifier failureClassifier,
                              SettlementProperties props) {
        this.replayProtection = replayProtection;
        this.snapshotService = snapshotService;
        this.pomDeltaCalculator = pomDeltaCalculator;
        this.planner = planner;
        this.orchestrator = orchestrator;
        this.signerKeyring = signerKeyring;
        this.failureClassifier = failureClassifier;
        this.props = props;
    }

    /**
     * Settles a commitment with the queue fetched from the execution layer. The fetch happens
     * under the commitment lock and only once the commitment is known to be unsettled; a failed
     * fetch is recorded like any other failure.
     */
    public SettlementResult onCommitmentEvent(CommitmentEvent event, WithdrawalQueueClient withdrawalQueue) {
        return run(event, () -> {
            List<WithdrawalIntent> withdrawals =
                    withdrawalQueue.fetchWithdrawals(event.subnetId(), event.blockNumber());
            if (withdrawals == null) {
                throw new IllegalStateException("Withdrawal queue returned no list for block " + event.blockNumber());
            }
            log.info("Commitment subnet={} block={} stateRoot={}: {} withdrawal(s)",
                    event.subnetId(), event.blockNumber(), event.stateRoot(), withdrawals.size());
            return withdrawals;
        });
    }

    /**
     * Never throws except for must-halt failures (PoM mismatch, insufficient balance, threshold
     * not met), which are recorded as failed first.
     */
    public SettlementResult executeSettlement(CommitmentEvent event, List<WithdrawalIntent> withdrawals) {
        return run(event, () -> withdrawals);
    }

    private SettlementResult run(CommitmentEvent event, Supplier<List<WithdrawalIntent>> withdrawalSource) {
        String vault = props.getVaultAddress();
        if (vault == null || vault.isBlank()) {
            throw new IllegalStateException("settlement.vault-address is not configured");
        }
        String subnetId = event.subnetId();
        long blockNumber = event.blockNumber();
        // malformed subnet ids are rejected before any lock or record exists
        SettlementHashing.subnetIdBytes(subnetId);

        return replayProtection.withSettlementLock(subnetId, blockNumber,
                () -> withVaultLock(vault, () -> settle(vault, subnetId, blockNumber, withdrawalSource)));
    }

    public Optional<SettlementConfirmation> getSettlementConfirmation(String subnetId, long blockNumber) {
        return replayProtection.getSettlementConfirmation(subnetId, blockNumber);
    }

    public boolean hasSettlement(String subnetId, long blockNumber) {
        return replayProtection.getSettlementRecord(subnetId, blockNumber).isPresent();
    }

    public SettlementStats getStats() {
        return replayProtection.getStats();
    }

    private SettlementResult settle(String vault, String subnetId, long blockNumber,
                                    Supplier<List<WithdrawalIntent>> withdrawalSource) {
        try {
            if (replayProtection.isAlreadySettled(vault, subnetId, blockNumber)) {
                SettlementConfirmation confirmation = replayProtection.getSettlementConfirmation(subnetId, blockNumber)
                        .orElseThrow(() -> new IllegalStateException("Settled commitment has no confirmation record"));
                log.info("Subnet={} block={} already settled: {}", subnetId, blockNumber, confirmation.txHashes());
                return SettlementResult.alreadySettled(confirmation.txHashes(), confirmation.memo());
            }

            List<WithdrawalIntent> withdrawals = withdrawalSource.get();
            if (withdrawals.isEmpty()) {
                replayProtection.recordPendingSettlement(subnetId, blockNumber);
                replayProtection.recordConfirmedSettlement(subnetId, blockNumber, List.of(), List.of());
                return SettlementResult.confirmed(List.of(), "");
            }

            replayProtection.recordPendingSettlement(subnetId, blockNumber);

            TreasurySnapshot snapshot = snapshotService.getTreasurySnapshot(vault);
            PomDelta pomDelta = pomDeltaCalculator.computeNetOutflow(withdrawals);
            SettlementPlan plan = planner.buildSettlementPlan(vault, subnetId, blockNumber, withdrawals);

            SettlementExecutionResult result = orchestrator.executeSettlement(
                    plan, pomDelta, snapshot, signerKeyring.availableSigners());

            if (result.success()) {
                replayProtection.recordConfirmedSettlement(subnetId, blockNumber, result.txHashes(), result.ledgerRefs());
                return SettlementResult.confirmed(result.txHashes(), plan.memoHex());
            }

            logFailure(subnetId, blockNumber, result.failure());
            replayProtection.recordFailedSettlement(subnetId, blockNumber, result.error(),
                    result.txHashes(), result.ledgerRefs());
            return SettlementResult.failed(result.txHashes(), plan.memoHex(), result.error());

        } catch (SettlementException e) {
            logFailure(subnetId, blockNumber, e);
            recordFailure(subnetId, blockNumber, e);
            if (e.kind().mustHalt()) {
                throw e;
            }
            return SettlementResult.failed(List.of(), "", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Settlement subnet={} block={} failed", subnetId, blockNumber, e);
            recordFailure(subnetId, blockNumber, e);
            return SettlementResult.failed(List.of(), "", e.getMessage());
        }
    }

    private void recordFailure(String subnetId, long blockNumber, RuntimeException error) {
        Optional<SettlementRecord> existing = replayProtection.getSettlementRecord(subnetId, blockNumber);
        if (existing.isPresent() && existing.get().getStatus() == SettlementStatus.CONFIRMED) {
            log.error("Settlement subnet={} block={} is confirmed; not overwriting with failure: {}",
                    subnetId, blockNumber, error.getMessage());
            return;
        }
        replayProtection.recordFailedSettlement(subnetId, blockNumber, error.getMessage());
    }

    private void logFailure(String subnetId, long blockNumber, SettlementException failure) {
        FailureClassification c = failureClassifier.classify(failure.kind());
        switch (c.severity()) {
            case CRITICAL -> log.error("[{}] settlement subnet={} block={} halted ({}): {}",
                    c.kind(), subnetId, blockNumber, c.action(), failure.getMessage());
            case ERROR -> log.error("[{}] settlement subnet={} block={} failed ({}): {}",
                    c.kind(), subnetId, blockNumber, c.action(), failure.getMessage());
            case WARNING -> log.warn("[{}] settlement subnet={} block={} failed ({}): {}",
                    c.kind(), subnetId, blockNumber, c.action(), failure.getMessage());
        }
        if (failure instanceof PartialSubmissionException partial && !partial.getSucceeded().isEmpty()) {
            log.error("Subnet={} block={} is partially settled, batches on ledger: {}",
                    subnetId, blockNumber, partial.getSucceeded());
        }
    }

    private <T> T withVaultLock(String vault, Supplier<T> action) {
        ReentrantLock lock = vaultLocks.computeIfAbsent(vault, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
