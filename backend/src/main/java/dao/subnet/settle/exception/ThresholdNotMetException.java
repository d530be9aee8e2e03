package dao.subnet.settle.exception;

public class ThresholdNotMetException extends SettlementException {

    private final int required;
    private final int available;

    public ThresholdNotMetException(int required, int available) {
        super("Signer threshold not met: required=" + required + ", available=" + available);
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.THRESHOLD_NOT_MET;
    }
}
