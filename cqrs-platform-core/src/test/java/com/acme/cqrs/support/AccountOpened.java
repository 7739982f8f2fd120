package com.acme.cqrs.support;

import com.acme.cqrs.message.DomainEvent;

public class AccountOpened extends DomainEvent {
    public static final String TYPE = "AccountOpened";

    private final String owner;

    public AccountOpened(String accountId, long version, String tenantId, String owner) {
        super(accountId, version, tenantId);
        this.owner = owner;
    }

    @Override
    public String eventType() {
        return TYPE;
    }

    public String getOwner() {
        return owner;
    }
}
