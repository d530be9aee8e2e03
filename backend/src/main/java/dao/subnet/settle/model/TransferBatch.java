package dao.subnet.settle.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Withdrawals of a single asset that fit in one ledger transaction.
 */
public record TransferBatch(
        int index,
        String assetId,
        List<WithdrawalIntent> withdrawals,
        TransferBundle bundle
) {

    public int operationCount() {
        return withdrawals.size();
    }

    public BigInteger total() {
        return withdrawals.stream().map(WithdrawalIntent::amount).reduce(BigInteger.ZERO, BigInteger::add);
    }
}
