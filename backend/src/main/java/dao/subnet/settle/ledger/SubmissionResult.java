package dao.subnet.settle.ledger;

public record SubmissionResult(
        String hash,
        long ledger
) {}
