package dao.subnet.settle.integration;

import dao.subnet.settle.model.SettlementConfirmation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Confirmation sink used when no execution layer is wired in.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "execution-layer", name = "mode", havingValue = "in-memory", matchIfMissing = true)
public class LoggingConfirmationPublisher implements ConfirmationPublisher {

    @Override
    public void publish(SettlementConfirmation confirmation) {
        log.info("Settlement confirmation subnet={} block={} memo={} txHashes={}",
                confirmation.subnetId(), confirmation.blockNumber(), confirmation.memo(), confirmation.txHashes());
    }
}
