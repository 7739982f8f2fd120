package com.acme.cqrs.support;

import com.acme.cqrs.message.Query;

public class GetBalance extends Query {
    public static final String TYPE = "GetBalance";

    private final String accountId;

    public GetBalance(String accountId) {
        super(Account.TENANT, "user-1");
        this.accountId = accountId;
    }

    @Override
    public String queryType() {
        return TYPE;
    }

    public String getAccountId() {
        return accountId;
    }
}
