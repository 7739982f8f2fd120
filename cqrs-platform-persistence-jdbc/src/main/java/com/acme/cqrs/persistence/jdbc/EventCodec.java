package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.core.PermanentException;
import com.acme.cqrs.message.DomainEvent;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts domain events to and from the JSON payload column. Every event type read back from the
 * store must be registered with the class it decodes into; the class needs a no-arg constructor
 * (any visibility) since fields are populated directly.
 */
@Singleton
public class EventCodec {

    private static final Logger LOG = LoggerFactory.getLogger(EventCodec.class);

    private final Map<String, Class<? extends DomainEvent>> types = new ConcurrentHashMap<>();

    public EventCodec register(String eventType, Class<? extends DomainEvent> eventClass) {
        Class<? extends DomainEvent> previous = types.putIfAbsent(eventType, eventClass);
        if (previous != null && !previous.equals(eventClass)) {
            throw new IllegalStateException(
                    "Event type " + eventType + " already mapped to " + previous.getName());
        }
        LOG.debug("Registered event type {} -> {}", eventType, eventClass.getName());
        return this;
    }

    public boolean isRegistered(String eventType) {
        return types.containsKey(eventType);
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(types.keySet());
    }

    public String encode(DomainEvent event) {
        return Jsons.toJson(event);
    }

    /**
     * @throws PermanentException if the type is not registered or the payload does not match it
     */
    public DomainEvent decode(String eventType, String payload) {
        Class<? extends DomainEvent> eventClass = types.get(eventType);
        if (eventClass == null) {
            throw new PermanentException("No event class registered for type: " + eventType);
        }
        return Jsons.fromJson(payload, eventClass);
    }
}
