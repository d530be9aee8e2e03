package dao.subnet.settle.model;

import java.util.List;

/**
 * Shortfalls carry expected = required, actual = vault balance.
 */
public record SolvencyReport(
        boolean solvent,
        List<AssetDiscrepancy> shortfalls
) {}
