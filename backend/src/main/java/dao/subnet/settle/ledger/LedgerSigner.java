package dao.subnet.settle.ledger;

public record LedgerSigner(
        String key,
        int weight,
        String type
) {

    public static final String ED25519_PUBLIC_KEY = "ed25519_public_key";
}
