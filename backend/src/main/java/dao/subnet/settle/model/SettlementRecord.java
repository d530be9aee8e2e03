package dao.subnet.settle.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettlementRecord {

    private String subnetId;
    private long blockNumber;
    private String memoHex;
    private List<String> txHashes = new ArrayList<>();
    private List<Long> ledgerRefs = new ArrayList<>();
    private SettlementStatus status;
    private String error;
    private long updatedAt; // epoch millis

    public SettlementKey key() {
        return new SettlementKey(subnetId, blockNumber);
    }

    public SettlementRecord copy() {
        return new SettlementRecord(subnetId, blockNumber, memoHex,
                new ArrayList<>(txHashes), new ArrayList<>(ledgerRefs), status, error, updatedAt);
    }
}
