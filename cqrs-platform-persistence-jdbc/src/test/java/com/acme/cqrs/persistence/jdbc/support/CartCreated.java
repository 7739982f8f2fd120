package com.acme.cqrs.persistence.jdbc.support;

import com.acme.cqrs.message.DomainEvent;

public class CartCreated extends DomainEvent {
    public static final String TYPE = "CartCreated";

    private final String customer;

    public CartCreated(String cartId, long version, String tenantId, String customer) {
        super(cartId, version, tenantId);
        this.customer = customer;
    }

    private CartCreated() {
        super();
        this.customer = null;
    }

    @Override
    public String eventType() {
        return TYPE;
    }

    public String getCustomer() {
        return customer;
    }
}
