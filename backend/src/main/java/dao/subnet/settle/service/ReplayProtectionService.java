package dao.subnet.settle.service;

import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.ledger.LedgerTransaction;
import dao.subnet.settle.ledger.SettlementLedgerClient;
import dao.subnet.settle.model.SettlementConfirmation;
import dao.subnet.settle.model.SettlementKey;
import dao.subnet.settle.model.SettlementRecord;
import dao.subnet.settle.model.SettlementStats;
import dao.subnet.settle.model.SettlementStatus;
import dao.subnet.settle.repository.SettlementRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Memo-based idempotency. A commitment counts as settled when the local log says so, or when a
 * transaction carrying its memo is found in the vault's recent ledger history.
 */
@Slf4j
@Service
public class ReplayProtectionService {

    private final SettlementRecordStore store;
    private final SettlementLedgerClient ledgerClient;
    private final int scanWindow;
    private final Clock clock;

    private final Map<SettlementKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReplayProtectionService(SettlementRecordStore store,
                                   SettlementLedgerClient ledgerClient,
                                   SettlementProperties props,
                                   Clock clock) {
        this.store = store;
        this.ledgerClient = ledgerClient;
        this.scanWindow = props.getReplay().getScanWindow();
        this.clock = clock;
    }

    /**
     * Runs {@code action} while holding the lock of one (subnet, block). A second caller for the
     * same commitment waits and then sees whatever the first one recorded.
     */
    public <T> T withSettlementLock(String subnetId, long blockNumber, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(SettlementKey.of(subnetId, blockNumber), k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ledger errors propagate: an unanswered lookup must never read as "not settled".
     */
    public boolean isAlreadySettled(String vaultAddress, String subnetId, long blockNumber) {
        SettlementKey key = SettlementKey.of(subnetId, blockNumber);
        Optional<SettlementRecord> local = store.get(key);
        if (local.isPresent() && local.get().getStatus() == SettlementStatus.CONFIRMED) {
            return true;
        }

        byte[] expected = SettlementHashing.padMemo(SettlementHashing.memo(subnetId, blockNumber));
        List<LedgerTransaction> recent = ledgerClient.recentTransactions(vaultAddress, scanWindow);

        List<LedgerTransaction> matches = new ArrayList<>();
        for (LedgerTransaction tx : recent) {
            if (tx.successful() && Arrays.equals(expected, tx.hashMemoBytes())) {
                matches.add(tx);
            }
        }
        if (matches.isEmpty()) {
            return false;
        }

        // ledger history is newest first; batches were submitted oldest first
        List<String> hashes = new ArrayList<>();
        List<Long> ledgers = new ArrayList<>();
        for (int i = matches.size() - 1; i >= 0; i--) {
            hashes.add(matches.get(i).hash());
            ledgers.add(matches.get(i).ledger());
        }
        log.warn("Settlement {} found on ledger without a local confirmation ({} tx, previous local status={}), backfilling",
                key, hashes.size(), local.map(r -> r.getStatus().name()).orElse("none"));
        store.put(newRecord(key, SettlementStatus.CONFIRMED, hashes, ledgers, null));
        return true;
    }

    public void recordPendingSettlement(String subnetId, long blockNumber) {
        SettlementKey key = SettlementKey.of(subnetId, blockNumber);
        store.put(newRecord(key, SettlementStatus.PENDING, List.of(), List.of(), null));
        log.info("Settlement {} pending", key);
    }

    public void recordConfirmedSettlement(String subnetId, long blockNumber, List<String> txHashes, List<Long> ledgerRefs) {
        SettlementKey key = SettlementKey.of(subnetId, blockNumber);
        store.put(newRecord(key, SettlementStatus.CONFIRMED, txHashes, ledgerRefs, null));
        log.info("Settlement {} confirmed: txHashes={}", key, txHashes);
    }

    public void recordFailedSettlement(String subnetId, long blockNumber, String error) {
        recordFailedSettlement(subnetId, blockNumber, error, List.of(), List.of());
    }

    /**
     * {@code txHashes} are the batches that landed before the failure, kept for reconciliation.
     */
    public void recordFailedSettlement(String subnetId, long blockNumber, String error,
                                       List<String> txHashes, List<Long> ledgerRefs) {
        SettlementKey key = SettlementKey.of(subnetId, blockNumber);
        store.put(newRecord(key, SettlementStatus.FAILED, txHashes, ledgerRefs, error));
        log.error("Settlement {} failed: {}", key, error);
    }

    public Optional<SettlementRecord> getSettlementRecord(String subnetId, long blockNumber) {
        return store.get(SettlementKey.of(subnetId, blockNumber));
    }

    public Optional<SettlementConfirmation> getSettlementConfirmation(String subnetId, long blockNumber) {
        return getSettlementRecord(subnetId, blockNumber)
                .filter(r -> r.getStatus() == SettlementStatus.CONFIRMED)
                .map(r -> new SettlementConfirmation(r.getSubnetId(), r.getBlockNumber(),
                        List.copyOf(r.getTxHashes()), r.getMemoHex(), r.getUpdatedAt()));
    }

    public List<SettlementRecord> getSubnetSettlements(String subnetId) {
        return store.scanBySubnet(SettlementHashing.normalizeSubnetId(subnetId));
    }

    public SettlementStats getStats() {
        long pending = 0, confirmed = 0, failed = 0;
        for (SettlementRecord r : store.findAll()) {
            switch (r.getStatus()) {
                case PENDING -> pending++;
                case CONFIRMED -> confirmed++;
                case FAILED -> failed++;
            }
        }
        return new SettlementStats(pending, confirmed, failed);
    }

    private SettlementRecord newRecord(SettlementKey key, SettlementStatus status,
                                       List<String> txHashes, List<Long> ledgerRefs, String error) {
        return new SettlementRecord(
                key.subnetId(),
                key.blockNumber(),
                SettlementHashing.memoHex(key.subnetId(), key.blockNumber()),
                new ArrayList<>(txHashes),
                new ArrayList<>(ledgerRefs),
                status,
                error,
                clock.millis()
        );
    }
}
