package dao.subnet.settle.service;

import dao.subnet.settle.crypto.SettlementHashing;
import dao.subnet.settle.model.DeltaVerification;
import dao.subnet.settle.model.PomDelta;
import dao.subnet.settle.model.WithdrawalIntent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static dao.subnet.settle.support.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PomDeltaCalculatorTest {

    private PomDeltaCalculator calculator;
    private String usdcId;
    private String xlmId;

    @BeforeEach
    void setUp() {
        calculator = new PomDeltaCalculator();
        usdcId = SettlementHashing.assetIdHex("USDC", USDC_ISSUER);
        xlmId = SettlementHashing.nativeAssetIdHex();
    }

    @Test
    @DisplayName("Net outflow sums amounts per asset id")
    void testComputeNetOutflow() {
        PomDelta delta = calculator.computeNetOutflow(List.of(
                usdc("w1", 100, ALICE),
                xlm("w2", 7, BOB),
                usdc("w3", 250, BOB)));

        assertEquals(2, delta.amounts().size());
        assertEquals(BigInteger.valueOf(350), delta.get(usdcId));
        assertEquals(BigInteger.valueOf(7), delta.get(xlmId));
        assertEquals(BigInteger.valueOf(357), delta.total());
    }

    @Test
    @DisplayName("Total of the delta equals the total of the withdrawals")
    void testDeltaConservation() {
        List<WithdrawalIntent> withdrawals = new ArrayList<>();
        BigInteger sum = BigInteger.ZERO;
        for (int i = 0; i < 40; i++) {
            long amount = 1_000L * i + 3;
            withdrawals.add(i % 3 == 0 ? xlm("w" + i, amount, ALICE) : usdc("w" + i, amount, BOB));
            sum = sum.add(BigInteger.valueOf(amount));
        }
        assertEquals(sum, calculator.computeNetOutflow(withdrawals).total());
    }

    @Test
    void testEmptyQueueGivesEmptyDelta() {
        assertTrue(calculator.computeNetOutflow(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void testRejectsNegativeAmount() {
        WithdrawalIntent bad = new WithdrawalIntent("w1", "u", "USDC", USDC_ISSUER, BigInteger.valueOf(-1), ALICE);
        assertThrows(IllegalArgumentException.class, () -> calculator.computeNetOutflow(List.of(bad)));
    }

    @Test
    @DisplayName("Groups come out in ascending asset id order")
    void testGroupByAssetOrdering() {
        SortedMap<String, List<WithdrawalIntent>> groups = calculator.groupByAsset(List.of(
                usdc("w1", 1, ALICE), xlm("w2", 1, ALICE), usdc("w3", 1, ALICE)));

        List<String> keys = new ArrayList<>(groups.keySet());
        List<String> sorted = new ArrayList<>(keys);
        sorted.sort(null);
        assertEquals(sorted, keys);
        assertEquals(2, groups.get(usdcId).size());
    }

    @Test
    @DisplayName("Sort is by withdrawal id, case-insensitive and stable")
    void testSortDeterministically() {
        WithdrawalIntent a = usdc("b-2", 1, ALICE);
        WithdrawalIntent b = usdc("A-1", 2, ALICE);
        WithdrawalIntent c = usdc("B-2", 3, BOB);
        List<WithdrawalIntent> input = List.of(a, b, c);

        List<WithdrawalIntent> sorted = calculator.sortDeterministically(input);

        assertEquals(List.of(b, a, c), sorted);
        assertEquals(List.of(a, b, c), input);
    }

    @Test
    @DisplayName("Plan omitting an asset shows expected > 0, actual = 0")
    void testVerifyDeltaMatchMissingAsset() {
        PomDelta pom = PomDelta.of(Map.of(usdcId, BigInteger.valueOf(100), xlmId, BigInteger.valueOf(5)));
        PomDelta plan = PomDelta.of(Map.of(usdcId, BigInteger.valueOf(100)));

        DeltaVerification v = calculator.verifyDeltaMatch(plan, pom);

        assertFalse(v.matches());
        assertEquals(1, v.discrepancies().size());
        assertEquals(xlmId, v.discrepancies().get(0).assetId());
        assertEquals(BigInteger.valueOf(5), v.discrepancies().get(0).expected());
        assertEquals(BigInteger.ZERO, v.discrepancies().get(0).actual());
    }

    @Test
    @DisplayName("Over-settlement and extra assets are discrepancies too")
    void testVerifyDeltaMatchOverSettlement() {
        PomDelta pom = PomDelta.of(Map.of(usdcId, BigInteger.valueOf(100)));
        PomDelta plan = PomDelta.of(Map.of(usdcId, BigInteger.valueOf(101), xlmId, BigInteger.ONE));

        DeltaVerification v = calculator.verifyDeltaMatch(plan, pom);

        assertFalse(v.matches());
        assertEquals(2, v.discrepancies().size());
        assertTrue(calculator.verifyDeltaMatch(pom, pom).matches());
    }

    @Test
    @DisplayName("JSON form maps asset id to a decimal string")
    void testJsonForm() {
        PomDelta delta = PomDelta.of(Map.of(usdcId, new BigInteger("123456789012345678901234567890")));

        String json = calculator.toJson(delta);

        assertEquals("{\"" + usdcId + "\":\"123456789012345678901234567890\"}", json);
        assertEquals(delta, calculator.fromJson(json));
    }
}
