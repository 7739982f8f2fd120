package com.acme.cqrs.persistence.jdbc.support;

import com.acme.cqrs.aggregate.AggregateRoot;
import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.persistence.jdbc.EventCodec;

import java.util.LinkedHashMap;
import java.util.Map;

/** Shopping cart aggregate persisted through the JDBC stores in tests. */
public class Cart extends AggregateRoot {
    public static final String TENANT = "tenant-1";

    private String customer;
    private Map<String, Integer> items = new LinkedHashMap<>();

    public Cart(String id) {
        super(id);
    }

    public static Cart create(String id, String customer) {
        Cart cart = new Cart(id);
        cart.raise(new CartCreated(id, cart.nextVersion(), TENANT, customer));
        return cart;
    }

    public static EventCodec codec() {
        return new EventCodec()
                .register(CartCreated.TYPE, CartCreated.class)
                .register(ItemAdded.TYPE, ItemAdded.class);
    }

    public void add(String sku, int quantity) {
        raise(new ItemAdded(getId(), nextVersion(), TENANT, sku, quantity));
    }

    @Override
    protected void apply(DomainEvent event) {
        if (event instanceof CartCreated) {
            customer = ((CartCreated) event).getCustomer();
        } else if (event instanceof ItemAdded) {
            ItemAdded added = (ItemAdded) event;
            items.merge(added.getSku(), added.getQuantity(), Integer::sum);
        }
    }

    @Override
    protected Object captureState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("customer", customer);
        state.put("items", items);
        return state;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void restoreState(String stateJson) {
        Map<String, Object> state = Jsons.toMap(stateJson);
        customer = (String) state.get("customer");
        items = new LinkedHashMap<>();
        ((Map<String, Number>) state.get("items")).forEach((sku, qty) -> items.put(sku, qty.intValue()));
    }

    public String getCustomer() {
        return customer;
    }

    public int quantityOf(String sku) {
        return items.getOrDefault(sku, 0);
    }

    public int itemCount() {
        return items.values().stream().mapToInt(Integer::intValue).sum();
    }
}
