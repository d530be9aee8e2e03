package dao.subnet.settle.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A subnet state commitment that has been finalized and is ready to be settled.
 */
public record CommitmentEvent(
        @JsonProperty("subnet_id") @NotBlank String subnetId,
        @JsonProperty("block_number") @NotNull @PositiveOrZero Long blockNumber,
        @JsonProperty("state_root") String stateRoot
) {}
