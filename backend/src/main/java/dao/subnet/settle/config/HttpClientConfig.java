package dao.subnet.settle.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.stellar.sdk.Server;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate settlementRestTemplate(RestTemplateBuilder builder, SettlementProperties props) {
        return builder
                .setConnectTimeout(Duration.ofMillis(props.getHttp().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getHttp().getReadTimeoutMs()))
                .build();
    }

    /**
     * Horizon client. Submissions use the SDK's long-read client so a request can wait for ledger
     * inclusion.
     */
    @Bean
    public Server horizonServer(SettlementProperties props) {
        return new Server(props.getHorizonUrl());
    }
}
