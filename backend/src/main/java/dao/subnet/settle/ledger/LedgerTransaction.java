package dao.subnet.settle.ledger;

import java.util.Base64;

public record LedgerTransaction(
        String hash,
        long ledger,
        String memoType,
        String memo,
        boolean successful,
        String createdAt
) {

    public static final String MEMO_TYPE_HASH = "hash";

    /**
     * Horizon renders hash memos as base64. Returns null for any other memo type.
     */
    public byte[] hashMemoBytes() {
        if (!MEMO_TYPE_HASH.equals(memoType) || memo == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(memo);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
