package dao.subnet.settle.ledger;

import java.util.List;

public record LedgerAccount(
        String accountId,
        long sequence,
        List<LedgerBalance> balances,
        List<LedgerSigner> signers,
        int lowThreshold,
        int medThreshold,
        int highThreshold
) {}
