package dao.subnet.settle.model;

import dao.subnet.settle.util.CryptoUtil;

import java.util.List;

public record SettlementPlan(
        String subnetId,
        long blockNumber,
        byte[] memo,
        List<TransferBatch> batches,
        PomDelta totalsByAsset
) {

    public String memoHex() {
        return CryptoUtil.toHex(memo);
    }

    public boolean isEmpty() {
        return batches.isEmpty();
    }

    public int totalWithdrawals() {
        return batches.stream().mapToInt(TransferBatch::operationCount).sum();
    }

    /**
     * Totals re-derived from the batch contents, independent of {@link #totalsByAsset()}.
     */
    public PomDelta recomputeTotals() {
        PomDelta.Builder b = PomDelta.builder();
        for (TransferBatch batch : batches) {
            b.add(batch.assetId(), batch.total());
        }
        return b.build();
    }
}
