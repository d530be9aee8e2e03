package dao.subnet.settle.ledger;

/**
 * Balance line as Horizon reports it; {@code balance} is a 7-decimal fixed-point string.
 */
public record LedgerBalance(
        String assetType,
        String assetCode,
        String assetIssuer,
        String balance
) {

    public static final String NATIVE = "native";
    public static final String LIQUIDITY_POOL_SHARES = "liquidity_pool_shares";
}
