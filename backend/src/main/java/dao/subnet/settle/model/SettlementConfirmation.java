package dao.subnet.settle.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sent back to the execution layer once a commitment is settled.
 */
public record SettlementConfirmation(
        @JsonProperty("subnet_id") String subnetId,
        @JsonProperty("block_number") long blockNumber,
        @JsonProperty("tx_hashes") List<String> txHashes,
        @JsonProperty("memo") String memo,
        @JsonProperty("timestamp") long timestamp
) {}
