package dao.subnet.settle.model;

import java.util.List;

public record DeltaVerification(
        boolean matches,
        List<AssetDiscrepancy> discrepancies
) {}
