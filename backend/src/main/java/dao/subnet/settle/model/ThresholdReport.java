package dao.subnet.settle.model;

public record ThresholdReport(
        boolean canMeet,
        int required,
        int available
) {}
