package dao.subnet.settle.repository;

import dao.subnet.settle.model.SettlementKey;
import dao.subnet.settle.model.SettlementRecord;
import dao.subnet.settle.model.SettlementStatus;

import java.util.List;
import java.util.Optional;

/**
 * Keyed settlement log. Implementations reject any write that would change a confirmed record.
 */
public interface SettlementRecordStore {

    Optional<SettlementRecord> get(SettlementKey key);

    void put(SettlementRecord record);

    /**
     * Records of one subnet, ascending block number.
     */
    List<SettlementRecord> scanBySubnet(String subnetId);

    List<SettlementRecord> findAll();

    static void checkWritable(SettlementRecord existing, SettlementRecord next) {
        if (existing != null && existing.getStatus() == SettlementStatus.CONFIRMED) {
            boolean same = next.getStatus() == SettlementStatus.CONFIRMED
                    && existing.getTxHashes().equals(next.getTxHashes())
                    && existing.getLedgerRefs().equals(next.getLedgerRefs());
            if (!same) {
                throw new IllegalStateException("Settlement " + existing.key() + " is confirmed and cannot be changed");
            }
        }
    }
}
