package dao.subnet.settle.controller;

import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.integration.CommitmentEventQueue;
import dao.subnet.settle.integration.WithdrawalQueueClient;
import dao.subnet.settle.model.SettlementRecord;
import dao.subnet.settle.model.SettlementStats;
import dao.subnet.settle.model.TreasurySnapshot;
import dao.subnet.settle.scheduler.CommitmentEventWorker;
import dao.subnet.settle.service.ReplayProtectionService;
import dao.subnet.settle.service.TreasurySnapshotService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Read-only view of the settlement log, the worker and the vault.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class SettlementMonitoringController {

    private final ReplayProtectionService replayProtection;
    private final TreasurySnapshotService snapshotService;
    private final CommitmentEventQueue eventQueue;
    private final CommitmentEventWorker worker;
    private final WithdrawalQueueClient withdrawalQueue;
    private final SettlementProperties settlementProps;

    public SettlementMonitoringController(ReplayProtectionService replayProtection,
                                          TreasurySnapshotService snapshotService,
                                          CommitmentEventQueue eventQueue,
                                          CommitmentEventWorker worker,
                                          WithdrawalQueueClient withdrawalQueue,
                                          SettlementProperties settlementProps) {
        this.replayProtection = replayProtection;
        this.snapshotService = snapshotService;
        this.eventQueue = eventQueue;
        this.worker = worker;
        this.withdrawalQueue = withdrawalQueue;
        this.settlementProps = settlementProps;
    }

    /**
     * GET /api/monitor/settlements/{subnetId}
     */
    @GetMapping("/settlements/{subnetId}")
    public ResponseEntity<Map<String, Object>> getSubnetSettlements(@PathVariable String subnetId) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            List<SettlementRecord> records = replayProtection.getSubnetSettlements(subnetId);
            response.put("status", "SUCCESS");
            response.put("subnetId", subnetId);
            response.put("totalSettlements", records.size());
            response.put("settlements", records);
        } catch (IllegalArgumentException e) {
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/settlements/{subnetId}/{blockNumber}
     */
    @GetMapping("/settlements/{subnetId}/{blockNumber}")
    public ResponseEntity<Map<String, Object>> getSettlement(@PathVariable String subnetId,
                                                             @PathVariable long blockNumber) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Optional<SettlementRecord> record = replayProtection.getSettlementRecord(subnetId, blockNumber);
            if (record.isEmpty()) {
                response.put("status", "NOT_FOUND");
                response.put("message", "No settlement for subnet " + subnetId + " at block " + blockNumber);
                return ResponseEntity.status(404).body(response);
            }
            response.put("status", "SUCCESS");
            response.put("settlement", record.get());
            replayProtection.getSettlementConfirmation(subnetId, blockNumber)
                    .ifPresent(c -> response.put("confirmation", c));
        } catch (IllegalArgumentException e) {
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();
        SettlementStats stats = replayProtection.getStats();
        response.put("status", "SUCCESS");
        response.put("pending", stats.pending());
        response.put("confirmed", stats.confirmed());
        response.put("failed", stats.failed());
        response.put("total", stats.total());
        response.put("queuedCommitments", eventQueue.getPendingCount());
        response.put("workerHalted", worker.isHalted());
        worker.getHaltCause().ifPresent(e -> response.put("haltReason", e.kind() + ": " + e.getMessage()));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/treasury
     * Live vault snapshot (balances in minor units keyed by asset id).
     */
    @GetMapping("/treasury")
    public ResponseEntity<Map<String, Object>> getTreasury() {
        Map<String, Object> response = new LinkedHashMap<>();
        String vault = settlementProps.getVaultAddress();
        try {
            TreasurySnapshot snapshot = snapshotService.getTreasurySnapshot(vault);
            Map<String, String> balances = new TreeMap<>();
            snapshot.balances().forEach((k, v) -> balances.put(k, v.toString()));
            response.put("status", "SUCCESS");
            response.put("vault", vault);
            response.put("balances", balances);
            response.put("signers", snapshot.signers());
            response.put("threshold", snapshot.threshold());
        } catch (Exception e) {
            log.error("Error reading treasury snapshot for {}", vault, e);
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/treasury/balance?assetCode=USDC&issuer=G...
     */
    @GetMapping("/treasury/balance")
    public ResponseEntity<Map<String, Object>> getAssetBalance(@RequestParam String assetCode,
                                                               @RequestParam String issuer) {
        Map<String, Object> response = new LinkedHashMap<>();
        String vault = settlementProps.getVaultAddress();
        try {
            response.put("status", "SUCCESS");
            response.put("assetCode", assetCode);
            response.put("issuer", issuer);
            response.put("balance", snapshotService.getAssetBalance(vault, assetCode, issuer).toString());
        } catch (IllegalArgumentException e) {
            response.clear();
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            log.error("Error reading {} balance for {}", assetCode, vault, e);
            response.clear();
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/withdrawals/{subnetId}/pending
     */
    @GetMapping("/withdrawals/{subnetId}/pending")
    public ResponseEntity<Map<String, Object>> getPendingWithdrawals(@PathVariable String subnetId) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            int count = withdrawalQueue.getPendingCount(subnetId);
            response.put("status", "SUCCESS");
            response.put("subnetId", subnetId);
            response.put("pendingWithdrawals", count);
        } catch (Exception e) {
            log.error("Error reading pending withdrawals for subnet {}", subnetId, e);
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
