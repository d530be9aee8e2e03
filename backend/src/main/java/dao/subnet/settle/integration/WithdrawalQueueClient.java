package dao.subnet.settle.integration;

import dao.subnet.settle.model.WithdrawalIntent;

import java.util.List;

/**
 * Source of the withdrawal queue that a subnet committed at a given block.
 */
public interface WithdrawalQueueClient {

    List<WithdrawalIntent> fetchWithdrawals(String subnetId, long blockNumber);

    int getPendingCount(String subnetId);

    /**
     * Called once the commitment is settled on the ledger. Queues held by this process can be
     * released; remote queues learn about it from the confirmation instead.
     */
    default void markSettled(String subnetId, long blockNumber) {
    }
}
