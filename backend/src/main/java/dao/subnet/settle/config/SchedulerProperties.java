package dao.subnet.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private CommitmentsConfig commitments = new CommitmentsConfig();

    @Data
    public static class CommitmentsConfig {
        /**
         * Enable/disable the commitment event worker
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Maximum number of queued commitment events before new ones are rejected
         * Default: 1000
         */
        private int queueCapacity = 1000;

        /**
         * Maximum number of events settled per worker run
         * Default: 10
         */
        private int maxEventsPerRun = 10;

        /**
         * How often the worker drains the queue (in milliseconds)
         * Default: 1000ms
         */
        private long checkIntervalMs = 1000;
    }
}
