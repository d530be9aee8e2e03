package dao.subnet.settle.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.subnet.settle.exception.AccountNotFoundException;
import dao.subnet.settle.exception.LedgerRejectedException;
import dao.subnet.settle.exception.LedgerTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.stellar.sdk.Memo;
import org.stellar.sdk.MemoHash;
import org.stellar.sdk.Server;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.exception.NetworkException;
import org.stellar.sdk.requests.RequestBuilder;
import org.stellar.sdk.responses.AccountResponse;
import org.stellar.sdk.responses.Page;
import org.stellar.sdk.responses.TransactionResponse;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * {@link SettlementLedgerClient} over Horizon, through the Stellar SDK.
 */
@Slf4j
@Service
public class HorizonSettlementLedgerClient implements SettlementLedgerClient {

    private static final int NOT_FOUND = 404;
    private static final int TOO_MANY_REQUESTS = 429;

    private final Server server;
    private final ObjectMapper objectMapper;

    public HorizonSettlementLedgerClient(Server horizonServer, ObjectMapper objectMapper) {
        this.server = horizonServer;
        this.objectMapper = objectMapper;
        log.info("HorizonSettlementLedgerClient initialized");
    }

    @Override
    public LedgerAccount loadAccount(String accountId) {
        AccountResponse account;
        try {
            account = server.accounts().account(accountId);
        } catch (NetworkException e) {
            if (isNotFound(e)) {
                throw new AccountNotFoundException(accountId);
            }
            throw transientFailure("loadAccount", e);
        }
        return toLedgerAccount(account);
    }

    @Override
    public List<LedgerTransaction> recentTransactions(String accountId, int limit) {
        Page<TransactionResponse> page;
        try {
            page = server.transactions()
                    .forAccount(accountId)
                    .order(RequestBuilder.Order.DESC)
                    .limit(limit)
                    .execute();
        } catch (NetworkException e) {
            if (isNotFound(e)) {
                throw new AccountNotFoundException(accountId);
            }
            throw transientFailure("recentTransactions", e);
        }

        List<LedgerTransaction> out = new ArrayList<>();
        for (TransactionResponse tx : page.getRecords()) {
            out.add(toLedgerTransaction(tx));
        }
        return out;
    }

    @Override
    public SubmissionResult submitTransaction(Transaction transaction) {
        TransactionResponse response;
        try {
            // the memo is always set, so the SDK's memo-required account lookups are skipped
            response = server.submitTransaction(transaction, true);
        } catch (NetworkException e) {
            Integer code = e.getCode();
            if (code != null && code >= 400 && code < 500 && code != TOO_MANY_REQUESTS) {
                throw toRejection(e);
            }
            // 504 means Horizon gave up waiting for inclusion; the transaction may still land
            throw transientFailure("submitTransaction", e);
        }
        return new SubmissionResult(response.getHash(), ledgerOf(response));
    }

    @Override
    public Optional<LedgerTransaction> getTransaction(String hash) {
        try {
            return Optional.of(toLedgerTransaction(server.transactions().transaction(hash)));
        } catch (NetworkException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw transientFailure("getTransaction", e);
        }
    }

    private static LedgerAccount toLedgerAccount(AccountResponse account) {
        List<LedgerBalance> balances = new ArrayList<>();
        for (AccountResponse.Balance b : account.getBalances()) {
            balances.add(new LedgerBalance(b.getAssetType(), b.getAssetCode(), b.getAssetIssuer(),
                    String.valueOf(b.getBalance())));
        }

        List<LedgerSigner> signers = new ArrayList<>();
        for (AccountResponse.Signer s : account.getSigners()) {
            signers.add(new LedgerSigner(s.getKey(), intOrZero(s.getWeight()), s.getType()));
        }

        AccountResponse.Thresholds thresholds = account.getThresholds();
        return new LedgerAccount(
                account.getAccountId(),
                account.getSequenceNumber(),
                balances,
                signers,
                intOrZero(thresholds.getLowThreshold()),
                intOrZero(thresholds.getMedThreshold()),
                intOrZero(thresholds.getHighThreshold())
        );
    }

    private static LedgerTransaction toLedgerTransaction(TransactionResponse tx) {
        Memo memo = tx.getMemo();
        String memoType = null;
        String memoValue = null;
        if (memo instanceof MemoHash hashMemo) {
            memoType = LedgerTransaction.MEMO_TYPE_HASH;
            memoValue = Base64.getEncoder().encodeToString(hashMemo.getBytes());
        } else if (memo != null) {
            memoType = memo.getClass().getSimpleName();
        }
        return new LedgerTransaction(
                tx.getHash(),
                ledgerOf(tx),
                memoType,
                memoValue,
                Boolean.TRUE.equals(tx.getSuccessful()),
                tx.getCreatedAt()
        );
    }

    private LedgerRejectedException toRejection(NetworkException e) {
        String txResult = "http_" + e.getCode();
        List<String> opResults = new ArrayList<>();
        String body = e.getBody();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode codes = objectMapper.readTree(body).path("extras").path("result_codes");
                if (codes.hasNonNull("transaction")) {
                    txResult = codes.get("transaction").asText();
                }
                for (JsonNode op : codes.path("operations")) {
                    opResults.add(op.asText());
                }
            } catch (JsonProcessingException parseError) {
                log.warn("Could not parse Horizon rejection body: {}", parseError.getMessage());
            }
        }
        return new LedgerRejectedException(txResult, opResults);
    }

    private static LedgerTimeoutException transientFailure(String operation, NetworkException e) {
        String reason = e.getCode() == null ? String.valueOf(e.getMessage()) : "HTTP " + e.getCode();
        return new LedgerTimeoutException(operation + " failed: " + reason, e);
    }

    private static boolean isNotFound(NetworkException e) {
        return e.getCode() != null && e.getCode() == NOT_FOUND;
    }

    private static long ledgerOf(TransactionResponse tx) {
        return tx.getLedger() == null ? 0L : tx.getLedger();
    }

    private static int intOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
