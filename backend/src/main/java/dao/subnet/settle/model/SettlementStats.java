package dao.subnet.settle.model;

public record SettlementStats(
        long pending,
        long confirmed,
        long failed
) {

    public long total() {
        return pending + confirmed + failed;
    }
}
