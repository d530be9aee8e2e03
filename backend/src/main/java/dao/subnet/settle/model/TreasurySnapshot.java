package dao.subnet.settle.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Vault state read from the ledger for one settlement attempt. Never cached across attempts.
 */
public record TreasurySnapshot(
        Map<String, BigInteger> balances,
        List<String> signers,
        int threshold
) {

    public BigInteger balanceOf(String assetId) {
        return balances.getOrDefault(assetId, BigInteger.ZERO);
    }
}
