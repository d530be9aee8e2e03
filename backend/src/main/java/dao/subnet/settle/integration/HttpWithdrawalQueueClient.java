package dao.subnet.settle.integration;

import com.fasterxml.jackson.databind.JsonNode;
import dao.subnet.settle.config.ExecutionLayerProperties;
import dao.subnet.settle.model.WithdrawalIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "execution-layer", name = "mode", havingValue = "http")
public class HttpWithdrawalQueueClient implements WithdrawalQueueClient {

    private static final ParameterizedTypeReference<List<WithdrawalIntent>> WITHDRAWAL_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpWithdrawalQueueClient(RestTemplate settlementRestTemplate, ExecutionLayerProperties props) {
        this.restTemplate = settlementRestTemplate;
        this.baseUrl = props.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("execution-layer.base-url is required when execution-layer.mode=http");
        }
    }

    @Override
    public List<WithdrawalIntent> fetchWithdrawals(String subnetId, long blockNumber) {
        try {
            ResponseEntity<List<WithdrawalIntent>> resp = restTemplate.exchange(
                    baseUrl + "/subnets/{subnetId}/withdrawals?block={block}",
                    HttpMethod.GET, null, WITHDRAWAL_LIST, subnetId, blockNumber);
            List<WithdrawalIntent> body = resp.getBody();
            if (body == null) {
                // only an explicit [] means the block has nothing to pay
                throw new IllegalStateException("Execution layer returned no withdrawal list for subnet="
                        + subnetId + " block=" + blockNumber + " (HTTP " + resp.getStatusCode().value() + ")");
            }
            return body;
        } catch (RestClientException e) {
            log.error("fetchWithdrawals failed for subnet={} block={}: {}", subnetId, blockNumber, e.getMessage());
            throw new RuntimeException("fetchWithdrawals failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int getPendingCount(String subnetId) {
        try {
            JsonNode body = restTemplate.getForObject(
                    baseUrl + "/subnets/{subnetId}/withdrawals/pending-count", JsonNode.class, subnetId);
            return body == null ? 0 : body.path("count").asInt();
        } catch (RestClientException e) {
            log.error("getPendingCount failed for subnet={}: {}", subnetId, e.getMessage());
            throw new RuntimeException("getPendingCount failed: " + e.getMessage(), e);
        }
    }
}
