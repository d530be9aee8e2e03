package dao.subnet.settle.model;

import java.math.BigInteger;

public record AssetDiscrepancy(
        String assetId,
        BigInteger expected,
        BigInteger actual
) {}
