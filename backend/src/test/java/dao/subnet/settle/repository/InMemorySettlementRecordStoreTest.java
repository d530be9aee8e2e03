package dao.subnet.settle.repository;

import dao.subnet.settle.model.SettlementKey;
import dao.subnet.settle.model.SettlementRecord;
import dao.subnet.settle.model.SettlementStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySettlementRecordStoreTest {

    private static final String SUBNET = "ab".repeat(32);

    private static SettlementRecord record(SettlementStatus status, List<String> hashes) {
        return new SettlementRecord(SUBNET, 1, "memo", new ArrayList<>(hashes), new ArrayList<>(), status, null, 0L);
    }

    @Test
    @DisplayName("Rewriting a confirmed record with the same hashes is accepted")
    void testIdenticalConfirmedWrite() {
        InMemorySettlementRecordStore store = new InMemorySettlementRecordStore();
        store.put(record(SettlementStatus.CONFIRMED, List.of("h1")));

        assertDoesNotThrow(() -> store.put(record(SettlementStatus.CONFIRMED, List.of("h1"))));
        assertThrows(IllegalStateException.class, () -> store.put(record(SettlementStatus.CONFIRMED, List.of("h2"))));
        assertThrows(IllegalStateException.class, () -> store.put(record(SettlementStatus.PENDING, List.of())));
        assertEquals(List.of("h1"), store.get(new SettlementKey(SUBNET, 1)).orElseThrow().getTxHashes());
    }

    @Test
    @DisplayName("Failed records may move back to pending")
    void testFailedCanRetry() {
        InMemorySettlementRecordStore store = new InMemorySettlementRecordStore();
        store.put(record(SettlementStatus.FAILED, List.of()));
        store.put(record(SettlementStatus.PENDING, List.of()));

        assertEquals(SettlementStatus.PENDING, store.get(new SettlementKey(SUBNET, 1)).orElseThrow().getStatus());
        assertTrue(store.scanBySubnet("cd".repeat(32)).isEmpty());
    }
}
