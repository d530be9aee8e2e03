package dao.subnet.settle.scheduler;

import dao.subnet.settle.config.SchedulerProperties;
import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.crypto.SignerKeyring;
import dao.subnet.settle.exception.SettlementException;
import dao.subnet.settle.integration.CommitmentEventQueue;
import dao.subnet.settle.integration.ConfirmationPublisher;
import dao.subnet.settle.integration.WithdrawalQueueClient;
import dao.subnet.settle.model.CommitmentEvent;
import dao.subnet.settle.model.SettlementConfirmation;
import dao.subnet.settle.model.SettlementOutcome;
import dao.subnet.settle.model.SettlementResult;
import dao.subnet.settle.model.ThresholdReport;
import dao.subnet.settle.service.SettlementExecutor;
import dao.subnet.settle.service.TreasurySnapshotService;
import lombok.extern.slf4j.Slf4j;
import org.stellar.sdk.KeyPair;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Settles queued commitment events one at a time. A must-halt failure stops the worker until an
 * operator resumes it.
 */
@Slf4j
@Component
public class CommitmentEventWorker {

    private final CommitmentEventQueue eventQueue;
    private final SettlementExecutor executor;
    private final WithdrawalQueueClient withdrawalQueue;
    private final ConfirmationPublisher confirmationPublisher;
    private final TreasurySnapshotService snapshotService;
    private final SignerKeyring signerKeyring;
    private final SchedulerProperties schedulerProps;
    private final SettlementProperties settlementProps;

    private volatile SettlementException haltCause;

    public CommitmentEventWorker(CommitmentEventQueue eventQueue,
                                 SettlementExecutor executor,
                                 WithdrawalQueueClient withdrawalQueue,
                                 ConfirmationPublisher confirmationPublisher,
                                 TreasurySnapshotService snapshotService,
                                 SignerKeyring signerKeyring,
                                 SchedulerProperties schedulerProps,
                                 SettlementProperties settlementProps) {
        this.eventQueue = eventQueue;
        this.executor = executor;
        this.withdrawalQueue = withdrawalQueue;
        this.confirmationPublisher = confirmationPublisher;
        this.snapshotService = snapshotService;
        this.signerKeyring = signerKeyring;
        this.schedulerProps = schedulerProps;
        this.settlementProps = settlementProps;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkVaultOnStartup() {
        String vault = settlementProps.getVaultAddress();
        if (vault == null || vault.isBlank()) {
            log.warn("No vault configured. Set settlement.vault-address before sending commitments.");
            return;
        }
        if (!SettlementHashing.isValidAccountId(vault)) {
            log.error("settlement.vault-address {} is not a valid account id", vault);
            return;
        }
        try {
            List<String> keys = signerKeyring.availableSigners().stream().map(KeyPair::getAccountId).toList();
            ThresholdReport report = snapshotService.canMeetThreshold(vault, keys);
            if (report.canMeet()) {
                log.info("Vault {} ready: {} of {} required signer(s) available", vault, report.available(), report.required());
            } else {
                log.warn("Vault {} cannot be signed for: {} of {} required signer(s) available",
                        vault, report.available(), report.required());
            }
        } catch (RuntimeException e) {
            log.warn("Vault {} startup check failed (settlements will still be attempted): {}", vault, e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.commitments.check-interval-ms:1000}")
    public void processQueuedCommitments() {
        if (!schedulerProps.getCommitments().isEnabled() || haltCause != null) {
            return;
        }
        int max = schedulerProps.getCommitments().getMaxEventsPerRun();
        for (int i = 0; i < max && haltCause == null; i++) {
            CommitmentEvent event = eventQueue.poll();
            if (event == null) return;
            process(event);
        }
    }

    SettlementResult process(CommitmentEvent event) {
        SettlementResult result;
        try {
            result = executor.onCommitmentEvent(event, withdrawalQueue);
        } catch (SettlementException e) {
            haltCause = e;
            log.error("HALTED on subnet={} block={} [{}]: {}. Queued events stay queued until resume.",
                    event.subnetId(), event.blockNumber(), e.kind(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Commitment subnet={} block={} could not be processed: {}",
                    event.subnetId(), event.blockNumber(), e.getMessage(), e);
            return null;
        }

        log.info("Commitment subnet={} block={} -> {} {}",
                event.subnetId(), event.blockNumber(), result.status(), result.txHashes());
        if (result.status() != SettlementOutcome.FAILED) {
            publishConfirmation(event);
            withdrawalQueue.markSettled(event.subnetId(), event.blockNumber());
        }
        return result;
    }

    private void publishConfirmation(CommitmentEvent event) {
        Optional<SettlementConfirmation> confirmation =
                executor.getSettlementConfirmation(event.subnetId(), event.blockNumber());
        if (confirmation.isEmpty()) {
            log.error("No confirmation record for settled subnet={} block={}", event.subnetId(), event.blockNumber());
            return;
        }
        try {
            confirmationPublisher.publish(confirmation.get());
        } catch (RuntimeException e) {
            // the settlement stands; replaying the event re-sends the confirmation
            log.error("Confirmation for subnet={} block={} not delivered: {}",
                    event.subnetId(), event.blockNumber(), e.getMessage());
        }
    }

    public boolean isHalted() {
        return haltCause != null;
    }

    public Optional<SettlementException> getHaltCause() {
        return Optional.ofNullable(haltCause);
    }

    public void resume() {
        if (haltCause != null) {
            log.warn("Worker resumed by operator after halt: {}", haltCause.getMessage());
            haltCause = null;
        }
    }
}
