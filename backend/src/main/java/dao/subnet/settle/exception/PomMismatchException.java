package dao.subnet.settle.exception;

import dao.subnet.settle.model.AssetDiscrepancy;

import java.util.List;

public class PomMismatchException extends SettlementException {

    private final List<AssetDiscrepancy> discrepancies;

    public PomMismatchException(List<AssetDiscrepancy> discrepancies) {
        super("PoM delta mismatch: " + discrepancies);
        this.discrepancies = List.copyOf(discrepancies);
    }

    public List<AssetDiscrepancy> getDiscrepancies() {
        return discrepancies;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.POM_MISMATCH;
    }
}
