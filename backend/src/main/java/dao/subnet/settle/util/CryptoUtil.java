package dao.subnet.settle.util;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.jcajce.provider.digest.SHA256;

/**
 * Byte-level helpers shared by hashing, memo derivation and the transaction encoder.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static byte[] sha256(byte[] data) {
        SHA256.Digest digest = new SHA256.Digest();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int off = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, off, p.length);
            off += p.length;
        }
        return out;
    }

    /**
     * Big-endian uint64; negative values are rejected.
     */
    public static byte[] uint64ToBytes(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("uint64 value must be non-negative: " + value);
        }
        byte[] out = new byte[8];
        for (int i = 7; i >= 0; i--) {
            out[i] = (byte) (value & 0xff);
            value >>>= 8;
        }
        return out;
    }

    public static String toHex(byte[] bytes) {
        return Hex.encodeHexString(bytes);
    }

    /**
     * Accepts hex with or without a 0x prefix, any case.
     */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex must not be null");
        }
        String clean = stripHexPrefix(hex);
        try {
            return Hex.decodeHex(clean);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    public static String stripHexPrefix(String hex) {
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            return hex.substring(2);
        }
        return hex;
    }
}
