package dao.subnet.settle.model;

import dao.subnet.settle.crypto.SettlementHashing;

/**
 * (subnet, block) identity of a commitment. Subnet id is kept as lowercase hex without prefix.
 */
public record SettlementKey(String subnetId, long blockNumber) {

    public static SettlementKey of(String subnetId, long blockNumber) {
        return new SettlementKey(SettlementHashing.normalizeSubnetId(subnetId), blockNumber);
    }

    @Override
    public String toString() {
        return subnetId + ":" + blockNumber;
    }
}
