package dao.subnet.settle.ledger;

import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.model.PaymentInstruction;
import dao.subnet.settle.model.TransferBundle;
import org.springframework.stereotype.Component;
import org.stellar.sdk.Account;
import org.stellar.sdk.Asset;
import org.stellar.sdk.Memo;
import org.stellar.sdk.Network;
import org.stellar.sdk.TimeBounds;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilder;
import org.stellar.sdk.TransactionPreconditions;
import org.stellar.sdk.operations.PaymentOperation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Builds the vault's payment transactions for the configured network.
 *
 * The same inputs always give the same transaction hash, so a planned bundle can be rebuilt
 * later for signing.
 */
@Component
public class PaymentTransactionFactory {

    public static final int MAX_OPERATIONS = 100;

    /** Ledger amounts carry seven decimal places. */
    private static final int AMOUNT_SCALE = 7;

    private final Network network;
    private final long baseFeePerOperation;

    public PaymentTransactionFactory(SettlementProperties props) {
        this.network = new Network(props.getNetworkPassphrase());
        this.baseFeePerOperation = props.getBatch().getBaseFeePerOperation();
    }

    public Network network() {
        return network;
    }

    /**
     * Fee is {@code baseFeePerOperation * payments.size()}. Time bounds are {@code [minTime, maxTime]}.
     */
    public Transaction build(String sourceAccount,
                             long sequence,
                             byte[] memoHash,
                             long minTime,
                             long maxTime,
                             List<PaymentInstruction> payments) {
        if (payments.isEmpty() || payments.size() > MAX_OPERATIONS) {
            throw new IllegalArgumentException("Transaction must carry 1.." + MAX_OPERATIONS
                    + " operations, got " + payments.size());
        }
        if (memoHash == null || memoHash.length != SettlementHashing.MEMO_HASH_LENGTH) {
            throw new IllegalArgumentException("Hash memo must be " + SettlementHashing.MEMO_HASH_LENGTH + " bytes");
        }

        // the builder assigns the account's next sequence number
        TransactionBuilder builder = new TransactionBuilder(new Account(sourceAccount, sequence - 1), network)
                .setBaseFee(baseFeePerOperation)
                .addMemo(Memo.hash(memoHash))
                .addPreconditions(TransactionPreconditions.builder()
                        .timeBounds(new TimeBounds(minTime, maxTime))
                        .build());
        for (PaymentInstruction payment : payments) {
            builder.addOperation(toOperation(payment));
        }
        return builder.build();
    }

    public Transaction build(TransferBundle bundle) {
        return build(bundle.sourceAccount(), bundle.sequence(), bundle.memoHash(),
                bundle.minTime(), bundle.maxTime(), bundle.operations());
    }

    private PaymentOperation toOperation(PaymentInstruction payment) {
        if (payment.amount() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive for withdrawal "
                    + payment.withdrawalId() + ": " + payment.amount());
        }
        return PaymentOperation.builder()
                .destination(payment.destination())
                .asset(toAsset(payment.assetCode(), payment.issuer()))
                .amount(BigDecimal.valueOf(payment.amount(), AMOUNT_SCALE))
                .build();
    }

    static Asset toAsset(String assetCode, String issuer) {
        if (SettlementHashing.isNative(issuer)) {
            return Asset.createNativeAsset();
        }
        if (!SettlementHashing.isValidAccountId(issuer)) {
            throw new IllegalArgumentException("Issuer must be an account id: " + issuer);
        }
        return Asset.createNonNativeAsset(assetCode, issuer);
    }
}
