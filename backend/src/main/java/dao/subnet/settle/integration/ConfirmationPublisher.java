package dao.subnet.settle.integration;

import dao.subnet.settle.model.SettlementConfirmation;

/**
 * Tells the execution layer that a commitment is settled. Delivery is at-least-once: an
 * already-settled commitment is confirmed again when its event is replayed.
 */
public interface ConfirmationPublisher {

    void publish(SettlementConfirmation confirmation);
}
