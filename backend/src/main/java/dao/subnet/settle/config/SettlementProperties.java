package dao.subnet.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "settlement")
@Data
public class SettlementProperties {

    /**
     * Horizon REST endpoint of the settlement ledger
     * Example: https://horizon-testnet.stellar.org
     */
    private String horizonUrl = "https://horizon-testnet.stellar.org";

    /**
     * Network passphrase, part of every transaction hash
     * Example: Test SDF Network ; September 2015
     */
    private String networkPassphrase = "Test SDF Network ; September 2015";

    /**
     * Treasury vault account (G... strkey)
     * Example: GBRPYHIL2CI3FNQ4BXLFMNDLFJUNPU2HY3ZMFSHONUCEOASW7QC7OX2H
     */
    private String vaultAddress;

    /**
     * Secret seeds (S... strkey) of the vault signers held by this node.
     */
    private List<String> signerSeeds = new ArrayList<>();

    private Batch batch = new Batch();

    private Retry snapshot = new Retry(3, 1000, 10_000);

    private Retry submission = new Retry(3, 1000, 30_000);

    /**
     * Transaction confirmation polling settings (to reduce Horizon load).
     */
    private Polling polling = new Polling();

    private Replay replay = new Replay();

    private Store store = new Store();

    private Http http = new Http();

    @Data
    public static class Batch {
        /**
         * Operation ceiling per ledger transaction (protocol limit is 100).
         */
        private int maxOperations = 100;
        /**
         * Fee charged per operation, in stroops.
         */
        private long baseFeePerOperation = 100;
        /**
         * Upper time bound of every transaction, relative to planning time.
         */
        private long txTimeoutSeconds = 300;
    }

    @Data
    public static class Retry {
        private int maxAttempts;
        private long baseDelayMs;
        private long maxDelayMs;

        public Retry() {
        }

        public Retry(int maxAttempts, long baseDelayMs, long maxDelayMs) {
            this.maxAttempts = maxAttempts;
            this.baseDelayMs = baseDelayMs;
            this.maxDelayMs = maxDelayMs;
        }
    }

    @Data
    public static class Polling {
        /**
         * Timeout for finding a submitted transaction after Horizon timed out.
         */
        private long txConfirmTimeoutSeconds = 60;
        /**
         * Initial poll interval.
         */
        private long txConfirmPollInitialMs = 250;
        /**
         * Maximum poll interval (backoff cap).
         */
        private long txConfirmPollMaxMs = 2000;
    }

    @Data
    public static class Replay {
        /**
         * Number of most recent vault transactions searched for a settlement memo.
         * Horizon caps a single page at 200.
         */
        private int scanWindow = 200;
    }

    @Data
    public static class Store {
        /**
         * memory | file
         */
        private String type = "memory";
        /**
         * JSON file backing the settlement log when type=file.
         */
        private String path = "./data/settlements.json";
    }

    @Data
    public static class Http {
        private long connectTimeoutMs = 5000;
        /**
         * Execution-layer calls. Horizon calls use the Stellar SDK client and its own timeouts.
         */
        private long readTimeoutMs = 65_000;
    }
}
