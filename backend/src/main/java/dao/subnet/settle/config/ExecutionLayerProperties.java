package dao.subnet.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "execution-layer")
@Data
public class ExecutionLayerProperties {

    /**
     * in-memory: withdrawal queues are staged through the REST API and confirmations are logged.
     * http: withdrawal queues are fetched from, and confirmations posted to, the execution layer.
     */
    private String mode = "in-memory";

    /**
     * Execution layer REST endpoint
     * Example: http://localhost:8545/api
     */
    private String baseUrl;
}
