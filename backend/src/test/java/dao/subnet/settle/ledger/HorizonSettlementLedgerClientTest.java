package dao.subnet.settle.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.exception.AccountNotFoundException;
import dao.subnet.settle.exception.LedgerRejectedException;
import dao.subnet.settle.exception.LedgerTimeoutException;
import dao.subnet.settle.model.PaymentInstruction;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.stellar.sdk.Server;
import org.stellar.sdk.Transaction;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static dao.subnet.settle.support.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class HorizonSettlementLedgerClientTest {

    private static final byte[] MEMO = SettlementHashing.padMemo(SettlementHashing.memo(SUBNET, 7));
    private static final String MEMO_BASE64 = Base64.getEncoder().encodeToString(MEMO);

    private MockWebServer horizon;
    private Server server;
    private HorizonSettlementLedgerClient client;

    @BeforeEach
    void setUp() throws IOException {
        horizon = new MockWebServer();
        horizon.start();
        server = new Server(horizon.url("/").toString());
        client = new HorizonSettlementLedgerClient(server, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
        horizon.shutdown();
    }

    private void respond(int status, String json) {
        horizon.enqueue(new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(json));
    }

    private static String transactionJson(String hash, long ledger, boolean successful, String memoType, String memo) {
        String memoField = memo == null ? "" : ", \"memo\": \"" + memo + "\"";
        return "{\"hash\": \"" + hash + "\", \"ledger\": " + ledger + ", \"successful\": " + successful
                + ", \"created_at\": \"2026-01-01T00:00:00Z\", \"memo_type\": \"" + memoType + "\"" + memoField + "}";
    }

    private Transaction signedTransaction() {
        PaymentTransactionFactory factory = new PaymentTransactionFactory(props());
        Transaction tx = factory.build(VAULT, 11, MEMO, 0, 1_700_000_300L,
                List.of(new PaymentInstruction("w1", ALICE, "XLM", "NATIVE", 10)));
        tx.sign(signer(100));
        return tx;
    }

    @Test
    @DisplayName("Account response is mapped to balances, signers and thresholds")
    void testLoadAccount() throws Exception {
        respond(200, """
                {
                  "id": "%1$s",
                  "account_id": "%1$s",
                  "sequence": "123456789012",
                  "thresholds": {"low_threshold": 1, "med_threshold": 2, "high_threshold": 3},
                  "balances": [
                    {"asset_type": "credit_alphanum4", "asset_code": "USDC", "asset_issuer": "%2$s", "balance": "10.0000000"},
                    {"asset_type": "native", "balance": "99.5000000"}
                  ],
                  "signers": [
                    {"key": "%1$s", "weight": 1, "type": "ed25519_public_key"}
                  ]
                }
                """.formatted(VAULT, USDC_ISSUER));

        LedgerAccount account = client.loadAccount(VAULT);

        RecordedRequest request = horizon.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/accounts/" + VAULT, request.getPath());
        assertEquals(VAULT, account.accountId());
        assertEquals(123456789012L, account.sequence());
        assertEquals(2, account.medThreshold());
        assertEquals(2, account.balances().size());
        assertEquals("USDC", account.balances().get(0).assetCode());
        assertEquals(USDC_ISSUER, account.balances().get(0).assetIssuer());
        assertEquals("native", account.balances().get(1).assetType());
        assertNull(account.balances().get(1).assetCode());
        assertEquals(VAULT, account.signers().get(0).key());
        assertEquals(1, account.signers().get(0).weight());
    }

    @Test
    @DisplayName("Missing account is reported as not found, server errors as timeouts")
    void testLoadAccountErrors() {
        respond(404, "{\"status\": 404, \"title\": \"Resource Missing\"}");
        respond(500, "{\"status\": 500, \"title\": \"Internal Server Error\"}");

        assertThrows(AccountNotFoundException.class, () -> client.loadAccount(VAULT));
        assertThrows(LedgerTimeoutException.class, () -> client.loadAccount(VAULT));
    }

    @Test
    @DisplayName("Recent transactions are read newest first with hash memos kept as base64")
    void testRecentTransactions() throws Exception {
        respond(200, "{\"_embedded\": {\"records\": ["
                + transactionJson("bb", 11, true, "hash", MEMO_BASE64) + ", "
                + transactionJson("aa", 10, false, "none", null)
                + "]}}");

        List<LedgerTransaction> txs = client.recentTransactions(VAULT, 2);

        String path = horizon.takeRequest().getPath();
        assertTrue(path.startsWith("/accounts/" + VAULT + "/transactions?"), path);
        assertTrue(path.contains("order=desc"), path);
        assertTrue(path.contains("limit=2"), path);
        assertEquals(2, txs.size());
        assertEquals("bb", txs.get(0).hash());
        assertEquals(11, txs.get(0).ledger());
        assertArrayEquals(MEMO, txs.get(0).hashMemoBytes());
        assertFalse(txs.get(1).successful());
        assertNull(txs.get(1).hashMemoBytes());
    }

    @Test
    @DisplayName("Submission posts the signed envelope as a form field")
    void testSubmit() throws Exception {
        Transaction tx = signedTransaction();
        respond(200, transactionJson(tx.hashHex(), 77, true, "hash", MEMO_BASE64));

        SubmissionResult result = client.submitTransaction(tx);

        RecordedRequest request = horizon.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/transactions", request.getPath());
        assertTrue(request.getBody().readUtf8().startsWith("tx="));
        assertEquals(tx.hashHex(), result.hash());
        assertEquals(77, result.ledger());
    }

    @Test
    @DisplayName("Ledger rejection carries the result codes and is not a timeout")
    void testSubmitRejected() {
        respond(400, """
                {"status": 400, "title": "Transaction Failed",
                 "extras": {"result_codes": {"transaction": "tx_failed", "operations": ["op_success", "op_underfunded"]}}}
                """);

        LedgerRejectedException e = assertThrows(LedgerRejectedException.class,
                () -> client.submitTransaction(signedTransaction()));

        assertEquals("tx_failed", e.getTransactionResult());
        assertEquals(List.of("op_success", "op_underfunded"), e.getOperationResults());
    }

    @Test
    @DisplayName("Gateway timeout and rate limiting are retryable")
    void testSubmitTimeouts() {
        respond(504, "{\"status\": 504, \"title\": \"Timeout\"}");
        respond(429, "{\"status\": 429, \"title\": \"Rate Limit Exceeded\"}");

        assertThrows(LedgerTimeoutException.class, () -> client.submitTransaction(signedTransaction()));
        assertThrows(LedgerTimeoutException.class, () -> client.submitTransaction(signedTransaction()));
    }

    @Test
    @DisplayName("Unknown transaction hash is empty rather than an error")
    void testGetTransaction() throws Exception {
        respond(404, "{\"status\": 404, \"title\": \"Resource Missing\"}");
        respond(200, transactionJson("bb", 12, true, "hash", MEMO_BASE64));

        assertTrue(client.getTransaction("aa").isEmpty());
        Optional<LedgerTransaction> found = client.getTransaction("bb");

        assertEquals("/transactions/aa", horizon.takeRequest().getPath());
        assertEquals("/transactions/bb", horizon.takeRequest().getPath());
        assertEquals(12, found.orElseThrow().ledger());
        assertTrue(found.get().successful());
    }
}
