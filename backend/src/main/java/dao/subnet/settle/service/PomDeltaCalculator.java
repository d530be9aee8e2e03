package dao.subnet.settle.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.model.AssetDiscrepancy;
import dao.subnet.settle.model.DeltaVerification;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.WithdrawalIntent;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Proof-of-Money: the exact per-asset outflow a withdrawal queue demands. Pure, no I/O.
 */
@Service
public class PomDeltaCalculator {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final Comparator<WithdrawalIntent> BY_WITHDRAWAL_ID =
            Comparator.comparing(w -> w.withdrawalId().toLowerCase(Locale.ROOT));

    public PomDelta computeNetOutflow(List<WithdrawalIntent> withdrawals) {
        PomDelta.Builder delta = PomDelta.builder();
        for (WithdrawalIntent w : withdrawals) {
            if (w.amount() == null || w.amount().signum() < 0) {
                throw new IllegalArgumentException("Withdrawal " + w.withdrawalId() + " has invalid amount: " + w.amount());
            }
            delta.add(assetIdOf(w), w.amount());
        }
        return delta.build();
    }

    /**
     * Groups in ascending asset id order; withdrawals keep their input order inside a group.
     */
    public SortedMap<String, List<WithdrawalIntent>> groupByAsset(List<WithdrawalIntent> withdrawals) {
        SortedMap<String, List<WithdrawalIntent>> groups = new TreeMap<>();
        for (WithdrawalIntent w : withdrawals) {
            groups.computeIfAbsent(assetIdOf(w), k -> new ArrayList<>()).add(w);
        }
        return groups;
    }

    /**
     * Stable sort by withdrawal id, case-insensitive. Returns a new list.
     */
    public List<WithdrawalIntent> sortDeterministically(List<WithdrawalIntent> withdrawals) {
        List<WithdrawalIntent> sorted = new ArrayList<>(withdrawals);
        sorted.sort(BY_WITHDRAWAL_ID);
        return sorted;
    }

    /**
     * Compares what a plan pays against what the PoM delta requires. An asset missing on one
     * side counts as zero there.
     */
    public DeltaVerification verifyDeltaMatch(PomDelta planDelta, PomDelta pomDelta) {
        TreeSet<String> assets = new TreeSet<>(planDelta.amounts().keySet());
        assets.addAll(pomDelta.amounts().keySet());

        List<AssetDiscrepancy> discrepancies = new ArrayList<>();
        for (String assetId : assets) {
            BigInteger expected = pomDelta.get(assetId);
            BigInteger actual = planDelta.get(assetId);
            if (expected.compareTo(actual) != 0) {
                discrepancies.add(new AssetDiscrepancy(assetId, expected, actual));
            }
        }
        return new DeltaVerification(discrepancies.isEmpty(), discrepancies);
    }

    public String assetIdOf(WithdrawalIntent w) {
        return SettlementHashing.assetIdHex(w.assetCode(), w.issuer());
    }

    /**
     * {"asset_id_hex": "decimal amount", ...}
     */
    public String toJson(PomDelta delta) {
        Map<String, String> out = new LinkedHashMap<>();
        delta.amounts().forEach((k, v) -> out.put(k, v.toString()));
        try {
            return JSON.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("PoM delta serialization failed: " + e.getMessage(), e);
        }
    }

    public PomDelta fromJson(String json) {
        Map<String, String> raw;
        try {
            raw = JSON.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid PoM delta JSON: " + e.getMessage(), e);
        }
        PomDelta.Builder b = PomDelta.builder();
        raw.forEach((assetId, amount) -> b.add(assetId.toLowerCase(Locale.ROOT), new BigInteger(amount)));
        return b.build();
    }
}
