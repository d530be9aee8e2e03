package dao.subnet.settle.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * One queued withdrawal from a subnet. Amount is in the asset's minor units (stroops).
 */
public record WithdrawalIntent(
        @JsonProperty("withdrawal_id") @NotBlank String withdrawalId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("asset_code") @NotBlank String assetCode,
        @JsonProperty("issuer") @NotBlank String issuer,
        @JsonProperty("amount") @JsonFormat(shape = JsonFormat.Shape.STRING) @NotNull BigInteger amount,
        @JsonProperty("destination") @NotBlank String destination
) {}
