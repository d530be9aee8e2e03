package dao.subnet.settle.exception;

import dao.subnet.settle.model.AssetDiscrepancy;

import java.util.List;

public class InsufficientBalanceException extends SettlementException {

    /** expected = required amount, actual = vault balance */
    private final List<AssetDiscrepancy> shortfalls;

    public InsufficientBalanceException(List<AssetDiscrepancy> shortfalls) {
        super("Insufficient vault balance: " + shortfalls);
        this.shortfalls = List.copyOf(shortfalls);
    }

    public List<AssetDiscrepancy> getShortfalls() {
        return shortfalls;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.INSUFFICIENT_BALANCE;
    }
}
