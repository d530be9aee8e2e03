package dao.subnet.settle.integration;

import dao.subnet.settle.config.ExecutionLayerProperties;
import dao.subnet.settle.model.SettlementConfirmation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "execution-layer", name = "mode", havingValue = "http")
public class HttpConfirmationPublisher implements ConfirmationPublisher {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpConfirmationPublisher(RestTemplate settlementRestTemplate, ExecutionLayerProperties props) {
        this.restTemplate = settlementRestTemplate;
        this.baseUrl = props.getBaseUrl();
    }

    @Override
    public void publish(SettlementConfirmation confirmation) {
        try {
            restTemplate.postForEntity(baseUrl + "/subnets/{subnetId}/confirmations",
                    confirmation, Void.class, confirmation.subnetId());
            log.info("Posted confirmation subnet={} block={}", confirmation.subnetId(), confirmation.blockNumber());
        } catch (RestClientException e) {
            log.error("Posting confirmation subnet={} block={} failed: {}",
                    confirmation.subnetId(), confirmation.blockNumber(), e.getMessage());
            throw new RuntimeException("publish confirmation failed: " + e.getMessage(), e);
        }
    }
}
