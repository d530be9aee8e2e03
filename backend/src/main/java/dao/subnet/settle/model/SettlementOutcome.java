package dao.subnet.settle.model;

public enum SettlementOutcome {
    CONFIRMED,
    FAILED,
    ALREADY_SETTLED
}
