package dao.subnet.settle.repository;

import dao.subnet.settle.model.SettlementKey;
import dao.subnet.settle.model.SettlementRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "settlement.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySettlementRecordStore implements SettlementRecordStore {

    private final Map<SettlementKey, SettlementRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<SettlementRecord> get(SettlementKey key) {
        SettlementRecord r = records.get(key);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public synchronized void put(SettlementRecord record) {
        SettlementKey key = record.key();
        SettlementRecordStore.checkWritable(records.get(key), record);
        records.put(key, record.copy());
    }

    @Override
    public List<SettlementRecord> scanBySubnet(String subnetId) {
        List<SettlementRecord> out = new ArrayList<>();
        for (SettlementRecord r : records.values()) {
            if (r.getSubnetId().equals(subnetId)) out.add(r.copy());
        }
        out.sort(Comparator.comparingLong(SettlementRecord::getBlockNumber));
        return out;
    }

    @Override
    public List<SettlementRecord> findAll() {
        List<SettlementRecord> out = new ArrayList<>();
        for (SettlementRecord r : records.values()) out.add(r.copy());
        return out;
    }
}
