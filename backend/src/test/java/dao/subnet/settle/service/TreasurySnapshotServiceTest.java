package dao.subnet.settle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.exception.AccountNotFoundException;
import dao.subnet.settle.exception.LedgerTimeoutException;
import dao.subnet.settle.ledger.LedgerAccount;
import dao.subnet.settle.ledger.LedgerBalance;
import dao.subnet.settle.ledger.LedgerSigner;
import dao.subnet.settle.ledger.SettlementLedgerClient;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.SolvencyReport;
import dao.subnet.settle.model.ThresholdReport;
import dao.subnet.settle.model.TreasurySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static dao.subnet.settle.support.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TreasurySnapshotServiceTest {

    @Mock
    private SettlementLedgerClient ledgerClient;

    private TreasurySnapshotService service;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        service = new TreasurySnapshotService(ledgerClient, objectMapper, props());
    }

    private static LedgerAccount vaultAccount() {
        return new LedgerAccount(VAULT, 10,
                List.of(
                        new LedgerBalance("native", null, null, "100.5000000"),
                        new LedgerBalance("credit_alphanum4", "USDC", USDC_ISSUER, "2500.0000001"),
                        new LedgerBalance("liquidity_pool_shares", null, null, "99.0000000")),
                List.of(
                        new LedgerSigner(ALICE, 1, "ed25519_public_key"),
                        new LedgerSigner(BOB, 0, "ed25519_public_key"),
                        new LedgerSigner("TABC", 1, "preauth_tx"),
                        new LedgerSigner(VAULT, 1, "ed25519_public_key")),
                1, 2, 3);
    }

    @Test
    @DisplayName("Balances, signers and medium threshold are parsed from the account")
    void testSnapshotParsing() {
        when(ledgerClient.loadAccount(VAULT)).thenReturn(vaultAccount());

        TreasurySnapshot snapshot = service.getTreasurySnapshot(VAULT);

        assertEquals(2, snapshot.balances().size());
        assertEquals(BigInteger.valueOf(1_005_000_000L), snapshot.balanceOf(SettlementHashing.nativeAssetIdHex()));
        assertEquals(BigInteger.valueOf(25_000_000_001L),
                snapshot.balanceOf(SettlementHashing.assetIdHex("USDC", USDC_ISSUER)));
        assertEquals(List.of(ALICE, VAULT), snapshot.signers());
        assertEquals(2, snapshot.threshold());
    }

    @Test
    @DisplayName("Decimal strings convert to minor units exactly")
    void testToMinorUnits() {
        assertEquals(BigInteger.valueOf(123_456_789L), TreasurySnapshotService.toMinorUnits("12.3456789"));
        assertEquals(BigInteger.valueOf(10_000_000L), TreasurySnapshotService.toMinorUnits("1"));
        assertEquals(BigInteger.valueOf(5L), TreasurySnapshotService.toMinorUnits("0.0000005"));
        assertEquals(new BigInteger("9223372036854775807"), TreasurySnapshotService.toMinorUnits("922337203685.4775807"));
        assertEquals(BigInteger.ZERO, TreasurySnapshotService.toMinorUnits("0.00000009"));
        assertThrows(IllegalArgumentException.class, () -> TreasurySnapshotService.toMinorUnits("1e"));
    }

    @Test
    @DisplayName("Timeouts are retried, then the account is returned")
    void testRetryThenSuccess() {
        when(ledgerClient.loadAccount(VAULT))
                .thenThrow(new LedgerTimeoutException("timeout"))
                .thenThrow(new LedgerTimeoutException("timeout"))
                .thenReturn(vaultAccount());

        assertEquals(10, service.loadVaultAccount(VAULT).sequence());
        verify(ledgerClient, times(3)).loadAccount(VAULT);
    }

    @Test
    @DisplayName("Missing account fails at once without retry")
    void testNotFoundIsNotRetried() {
        when(ledgerClient.loadAccount(VAULT)).thenThrow(new AccountNotFoundException(VAULT));

        assertThrows(AccountNotFoundException.class, () -> service.getTreasurySnapshot(VAULT));
        verify(ledgerClient, times(1)).loadAccount(VAULT);
    }

    @Test
    @DisplayName("Exhausted retries surface as a ledger timeout")
    void testRetryExhaustion() {
        when(ledgerClient.loadAccount(VAULT)).thenThrow(new LedgerTimeoutException("timeout"));

        LedgerTimeoutException e = assertThrows(LedgerTimeoutException.class, () -> service.getTreasurySnapshot(VAULT));
        assertTrue(e.getMessage().contains("after 3 attempts"));
        verify(ledgerClient, times(3)).loadAccount(VAULT);
    }

    @Test
    @DisplayName("Solvency reports each shortfall with required and available amounts")
    void testCheckSolvency() {
        TreasurySnapshot snapshot = service.toSnapshot(vaultAccount());
        String usdc = SettlementHashing.assetIdHex("USDC", USDC_ISSUER);
        String xlm = SettlementHashing.nativeAssetIdHex();

        SolvencyReport ok = service.checkSolvency(snapshot, PomDelta.of(Map.of(usdc, BigInteger.valueOf(25_000_000_001L))));
        SolvencyReport short1 = service.checkSolvency(snapshot, PomDelta.of(Map.of(
                usdc, BigInteger.ONE, xlm, BigInteger.valueOf(1_005_000_001L))));

        assertTrue(ok.solvent());
        assertFalse(short1.solvent());
        assertEquals(1, short1.shortfalls().size());
        assertEquals(xlm, short1.shortfalls().get(0).assetId());
        assertEquals(BigInteger.valueOf(1_005_000_000L), short1.shortfalls().get(0).actual());
    }

    @Test
    @DisplayName("Threshold counts only distinct vault signers")
    void testCanMeetThreshold() {
        TreasurySnapshot snapshot = service.toSnapshot(vaultAccount());

        ThresholdReport one = service.canMeetThreshold(snapshot, List.of(ALICE, ALICE, BOB));
        ThresholdReport two = service.canMeetThreshold(snapshot, List.of(ALICE, VAULT));

        assertFalse(one.canMeet());
        assertEquals(1, one.available());
        assertTrue(two.canMeet());
        assertEquals(2, two.required());
    }

    @Test
    @DisplayName("Snapshot JSON carries balances as decimal strings")
    void testSnapshotJson() throws Exception {
        when(ledgerClient.loadAccount(VAULT)).thenReturn(vaultAccount());

        JsonNode json = objectMapper.readTree(service.getTreasurySnapshotJson(VAULT));

        assertEquals("1005000000", json.path("balances").path(SettlementHashing.nativeAssetIdHex()).asText());
        assertEquals(2, json.path("signers").size());
        assertEquals(2, json.path("threshold").asInt());
    }
}
