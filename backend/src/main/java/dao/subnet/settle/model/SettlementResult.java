package dao.subnet.settle.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SettlementResult(
        @JsonProperty("status") SettlementOutcome status,
        @JsonProperty("tx_hashes") List<String> txHashes,
        @JsonProperty("memo") String memo,
        @JsonProperty("error") String error
) {

    public static SettlementResult confirmed(List<String> txHashes, String memo) {
        return new SettlementResult(SettlementOutcome.CONFIRMED, List.copyOf(txHashes), memo, null);
    }

    public static SettlementResult alreadySettled(List<String> txHashes, String memo) {
        return new SettlementResult(SettlementOutcome.ALREADY_SETTLED, List.copyOf(txHashes), memo, null);
    }

    public static SettlementResult failed(List<String> txHashes, String memo, String error) {
        return new SettlementResult(SettlementOutcome.FAILED, List.copyOf(txHashes), memo, error);
    }
}
