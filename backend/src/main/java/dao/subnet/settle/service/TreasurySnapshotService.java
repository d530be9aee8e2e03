package dao.subnet.settle.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.subnet.settle.config.SettlementProperties;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.exception.AccountNotFoundException;
import dao.subnet.settle.exception.LedgerTimeoutException;
import dao.subnet.settle.ledger.LedgerAccount;
import dao.subnet.settle.ledger.LedgerBalance;
import dao.subnet.settle.ledger.LedgerSigner;
import dao.subnet.settle.ledger.SettlementLedgerClient;
import dao.subnet.settle.model.AssetDiscrepancy;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.SolvencyReport;
import dao.subnet.settle.model.ThresholdReport;
import dao.subnet.settle.model.TreasurySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads vault balances, signers and the payment threshold from the ledger.
 */
@Slf4j
@Service
public class TreasurySnapshotService {

    /** Ledger amounts carry 7 decimal places. */
    public static final int LEDGER_DECIMALS = 7;

    private final SettlementLedgerClient ledgerClient;
    private final ObjectMapper objectMapper;
    private final SettlementProperties.Retry retry;

    public TreasurySnapshotService(SettlementLedgerClient ledgerClient,
                                   ObjectMapper objectMapper,
                                   SettlementProperties props) {
        this.ledgerClient = ledgerClient;
        this.objectMapper = objectMapper;
        this.retry = props.getSnapshot();
    }

    public TreasurySnapshot getTreasurySnapshot(String vaultAddress) {
        TreasurySnapshot snapshot = toSnapshot(loadVaultAccount(vaultAddress));
        log.info("Treasury snapshot vault={} assets={} signers={} threshold={}",
                vaultAddress, snapshot.balances().size(), snapshot.signers().size(), snapshot.threshold());
        return snapshot;
    }

    /**
     * Account fetch with linearly growing delay between attempts. A missing account is final.
     */
    public LedgerAccount loadVaultAccount(String vaultAddress) {
        int attempts = Math.max(1, retry.getMaxAttempts());
        LedgerTimeoutException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return ledgerClient.loadAccount(vaultAddress);
            } catch (AccountNotFoundException e) {
                log.error("Vault account {} not found on ledger", vaultAddress);
                throw e;
            } catch (LedgerTimeoutException e) {
                last = e;
                if (attempt < attempts) {
                    long delay = Math.min(retry.getMaxDelayMs(), retry.getBaseDelayMs() * attempt);
                    log.warn("Vault account fetch failed (attempt {}/{}), retrying in {}ms: {}",
                            attempt, attempts, delay, e.getMessage());
                    sleep(delay);
                }
            }
        }
        throw new LedgerTimeoutException("Failed to load vault account " + vaultAddress
                + " after " + attempts + " attempts", last);
    }

    public TreasurySnapshot toSnapshot(LedgerAccount account) {
        Map<String, BigInteger> balances = new TreeMap<>();
        for (LedgerBalance b : account.balances()) {
            String assetId;
            if (LedgerBalance.NATIVE.equals(b.assetType())) {
                assetId = SettlementHashing.nativeAssetIdHex();
            } else if (LedgerBalance.LIQUIDITY_POOL_SHARES.equals(b.assetType())
                    || b.assetCode() == null || b.assetIssuer() == null) {
                continue;
            } else {
                assetId = SettlementHashing.assetIdHex(b.assetCode(), b.assetIssuer());
            }
            balances.merge(assetId, toMinorUnits(b.balance()), BigInteger::add);
        }

        List<String> signers = new ArrayList<>();
        for (LedgerSigner s : account.signers()) {
            if (s.weight() > 0 && LedgerSigner.ED25519_PUBLIC_KEY.equals(s.type())) {
                signers.add(s.key());
            }
        }

        return new TreasurySnapshot(balances, List.copyOf(signers), account.medThreshold());
    }

    public String getTreasurySnapshotJson(String vaultAddress) {
        return toJson(getTreasurySnapshot(vaultAddress));
    }

    public String toJson(TreasurySnapshot snapshot) {
        Map<String, String> balances = new LinkedHashMap<>();
        snapshot.balances().forEach((k, v) -> balances.put(k, v.toString()));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("balances", balances);
        out.put("signers", snapshot.signers());
        out.put("threshold", snapshot.threshold());
        try {
            return objectMapper.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot serialization failed: " + e.getMessage(), e);
        }
    }

    public BigInteger getAssetBalance(String vaultAddress, String assetCode, String issuer) {
        return getTreasurySnapshot(vaultAddress).balanceOf(SettlementHashing.assetIdHex(assetCode, issuer));
    }

    public SolvencyReport checkSolvency(String vaultAddress, PomDelta required) {
        return checkSolvency(getTreasurySnapshot(vaultAddress), required);
    }

    public SolvencyReport checkSolvency(TreasurySnapshot snapshot, PomDelta required) {
        List<AssetDiscrepancy> shortfalls = new ArrayList<>();
        required.amounts().forEach((assetId, amount) -> {
            BigInteger balance = snapshot.balanceOf(assetId);
            if (balance.compareTo(amount) < 0) {
                shortfalls.add(new AssetDiscrepancy(assetId, amount, balance));
            }
        });
        return new SolvencyReport(shortfalls.isEmpty(), shortfalls);
    }

    public ThresholdReport canMeetThreshold(String vaultAddress, List<String> availableSigners) {
        return canMeetThreshold(getTreasurySnapshot(vaultAddress), availableSigners);
    }

    /**
     * Counts distinct available signers that the vault actually lists.
     */
    public ThresholdReport canMeetThreshold(TreasurySnapshot snapshot, List<String> availableSigners) {
        Set<String> vaultSigners = new HashSet<>(snapshot.signers());
        Set<String> usable = new HashSet<>();
        for (String s : availableSigners) {
            if (vaultSigners.contains(s)) usable.add(s);
        }
        return new ThresholdReport(usable.size() >= snapshot.threshold(), snapshot.threshold(), usable.size());
    }

    /**
     * "12.3456789" -> 123456789. Digits past the 7th decimal are dropped.
     */
    public static BigInteger toMinorUnits(String decimal) {
        if (decimal == null || decimal.isBlank()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigDecimal(decimal.trim())
                    .movePointRight(LEDGER_DECIMALS)
                    .setScale(0, RoundingMode.DOWN)
                    .toBigIntegerExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid ledger amount: " + decimal, e);
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerTimeoutException("Interrupted while waiting to retry vault account fetch", ie);
        }
    }
}
