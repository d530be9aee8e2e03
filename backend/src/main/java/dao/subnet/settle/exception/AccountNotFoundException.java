package dao.subnet.settle.exception;

public class AccountNotFoundException extends SettlementException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super("Vault account not found: " + accountId);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.ACCOUNT_NOT_FOUND;
    }
}
