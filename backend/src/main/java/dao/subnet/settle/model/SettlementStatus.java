package dao.subnet.settle.model;

public enum SettlementStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
