package com.intteq.reliable.subscriber.internal;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Channel entries keyed by {@code exchange:queue:routingKey}. At most one entry per key.
 *
 * <p>Concurrent registrations of the same key may each create an entry, but only the first one
 * inserted is kept; the others are closed immediately.
 */
@Slf4j
public class SubscriptionRegistry {

    private final ConcurrentMap<String, ChannelEntry> entries = new ConcurrentHashMap<>();

    public Registration registerOrReuse(String key, Supplier<ChannelEntry> factory) {
        ChannelEntry existing = entries.get(key);
        if (existing != null) {
            return new Registration(existing, false);
        }

        ChannelEntry created = factory.get();
        ChannelEntry winner = entries.putIfAbsent(key, created);
        if (winner != null) {
            log.debug("Subscription {} registered concurrently, releasing duplicate channel", key);
            created.close();
            return new Registration(winner, false);
        }

        return new Registration(created, true);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean remove(String key, ChannelEntry entry) {
        return entries.remove(key, entry);
    }

    /**
     * Removes and returns every entry. Used on shutdown.
     */
    public List<ChannelEntry> drain() {
        List<ChannelEntry> drained = new ArrayList<>();
        for (String key : entries.keySet()) {
            ChannelEntry entry = entries.remove(key);
            if (entry != null) {
                drained.add(entry);
            }
        }
        return drained;
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public static final class Registration {

        private final ChannelEntry entry;
        private final boolean isNew;

        Registration(ChannelEntry entry, boolean isNew) {
            this.entry = entry;
            this.isNew = isNew;
        }

        public ChannelEntry entry() {
            return entry;
        }

        public boolean isNew() {
            return isNew;
        }
    }
}
