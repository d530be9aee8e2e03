package dao.subnet.settle.integration;

import dao.subnet.settle.model.SettlementKey;
import dao.subnet.settle.model.WithdrawalIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Withdrawal queues staged locally (through {@code /api/withdrawals}) instead of fetched from
 * the execution layer.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "execution-layer", name = "mode", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryWithdrawalQueue implements WithdrawalQueueClient {

    private final Map<SettlementKey, List<WithdrawalIntent>> queues = new ConcurrentHashMap<>();

    public void stage(String subnetId, long blockNumber, List<WithdrawalIntent> withdrawals) {
        SettlementKey key = SettlementKey.of(subnetId, blockNumber);
        queues.put(key, List.copyOf(withdrawals));
        log.info("Staged {} withdrawal(s) for {}", withdrawals.size(), key);
    }

    @Override
    public List<WithdrawalIntent> fetchWithdrawals(String subnetId, long blockNumber) {
        return queues.getOrDefault(SettlementKey.of(subnetId, blockNumber), List.of());
    }

    @Override
    public void markSettled(String subnetId, long blockNumber) {
        SettlementKey key = SettlementKey.of(subnetId, blockNumber);
        List<WithdrawalIntent> released = queues.remove(key);
        if (released != null) {
            log.debug("Released {} settled withdrawal(s) for {}", released.size(), key);
        }
    }

    @Override
    public int getPendingCount(String subnetId) {
        String normalized = SettlementKey.of(subnetId, 0).subnetId();
        return queues.entrySet().stream()
                .filter(e -> e.getKey().subnetId().equals(normalized))
                .mapToInt(e -> e.getValue().size())
                .sum();
    }
}
