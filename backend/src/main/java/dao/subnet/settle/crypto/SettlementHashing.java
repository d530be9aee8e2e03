package dao.subnet.settle.crypto;

import dao.subnet.settle.util.CryptoUtil;
import org.stellar.sdk.KeyPair;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Asset id and settlement memo derivation. Both are consensus-critical: the execution layer
 * computes the same values, and replay detection searches the ledger for the exact memo bytes.
 */
public final class SettlementHashing {
    private SettlementHashing() {}

    public static final String NATIVE_ISSUER = "NATIVE";
    public static final String NATIVE_CODE = "XLM";

    public static final int MEMO_LENGTH = 28;
    public static final int MEMO_HASH_LENGTH = 32;

    /**
     * asset_id = SHA-256(utf8(code) || 0x00 || issuer_bytes)
     */
    public static byte[] assetId(String assetCode, String issuer) {
        if (assetCode == null || assetCode.isEmpty()) {
            throw new IllegalArgumentException("Asset code must not be empty");
        }
        byte[] code = assetCode.getBytes(StandardCharsets.UTF_8);
        return CryptoUtil.sha256(CryptoUtil.concat(code, new byte[]{0x00}, issuerBytes(issuer)));
    }

    public static String assetIdHex(String assetCode, String issuer) {
        return CryptoUtil.toHex(assetId(assetCode, issuer));
    }

    public static String nativeAssetIdHex() {
        return assetIdHex(NATIVE_CODE, NATIVE_ISSUER);
    }

    public static boolean isNative(String issuer) {
        return issuer != null && NATIVE_ISSUER.equalsIgnoreCase(issuer);
    }

    /**
     * NATIVE sentinel -> its ASCII bytes, G... account -> 32-byte key, otherwise hex (0x optional).
     */
    public static byte[] issuerBytes(String issuer) {
        if (issuer == null || issuer.isEmpty()) {
            throw new IllegalArgumentException("Issuer must not be empty");
        }
        if (isNative(issuer)) {
            return NATIVE_ISSUER.getBytes(StandardCharsets.UTF_8);
        }
        if (issuer.startsWith("G") && issuer.length() == 56) {
            return KeyPair.fromAccountId(issuer).getPublicKey();
        }
        return CryptoUtil.fromHex(issuer);
    }

    /**
     * True for a well-formed G... account id (version byte and checksum verified).
     */
    public static boolean isValidAccountId(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            return false;
        }
        try {
            KeyPair.fromAccountId(accountId);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * memo = SHA-256(subnet_id (32 bytes) || uint64_be(block_number))[0..28)
     */
    public static byte[] memo(String subnetId, long blockNumber) {
        byte[] subnet = subnetIdBytes(subnetId);
        byte[] digest = CryptoUtil.sha256(CryptoUtil.concat(subnet, CryptoUtil.uint64ToBytes(blockNumber)));
        return Arrays.copyOf(digest, MEMO_LENGTH);
    }

    public static String memoHex(String subnetId, long blockNumber) {
        return CryptoUtil.toHex(memo(subnetId, blockNumber));
    }

    /**
     * The ledger's hash memo is 32 bytes; the 28-byte memo travels with 4 trailing zero bytes.
     * Transaction building and memo search both go through here.
     */
    public static byte[] padMemo(byte[] memo) {
        if (memo == null || memo.length != MEMO_LENGTH) {
            throw new IllegalArgumentException("Memo must be " + MEMO_LENGTH + " bytes");
        }
        return Arrays.copyOf(memo, MEMO_HASH_LENGTH);
    }

    public static byte[] subnetIdBytes(String subnetId) {
        if (subnetId == null) {
            throw new IllegalArgumentException("Subnet id must not be null");
        }
        String clean = CryptoUtil.stripHexPrefix(subnetId);
        if (clean.length() != 64) {
            throw new IllegalArgumentException("Subnet id must be 32 bytes of hex: " + subnetId);
        }
        return CryptoUtil.fromHex(clean);
    }

    /**
     * Canonical key form: lowercase hex, no prefix.
     */
    public static String normalizeSubnetId(String subnetId) {
        return CryptoUtil.toHex(subnetIdBytes(subnetId)).toLowerCase(Locale.ROOT);
    }
}
