package dao.subnet.settle.model;

/**
 * One ledger payment inside a transfer bundle, amount in minor units.
 */
public record PaymentInstruction(
        String withdrawalId,
        String destination,
        String assetCode,
        String issuer,
        long amount
) {}
