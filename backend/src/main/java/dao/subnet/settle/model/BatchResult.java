package dao.subnet.settle.model;

/**
 * A batch that made it onto the ledger.
 */
public record BatchResult(
        int index,
        String txHash,
        long ledger,
        int withdrawalCount
) {}
