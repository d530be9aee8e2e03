package dao.subnet.settle.model;

import dao.subnet.settle.util.CryptoUtil;

import java.util.List;

/**
 * Unsigned ledger transaction for one batch: the fields it was built from, its unsigned
 * envelope and the hash every signer signs.
 */
public record TransferBundle(
        String sourceAccount,
        long sequence,
        long fee,
        byte[] memoHash,
        long minTime,
        long maxTime,
        List<PaymentInstruction> operations,
        String envelopeXdr,
        byte[] hash
) {

    public String hashHex() {
        return CryptoUtil.toHex(hash);
    }
}
