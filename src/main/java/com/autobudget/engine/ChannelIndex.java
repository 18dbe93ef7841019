package com.autobudget.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Case-insensitive lookup from channel name to a record, built once per cycle.
 *
 * <p>Keys are trimmed and lower-cased. When two records share a channel name the first one
 * wins. Records without a channel name are not indexed.
 */
public final class ChannelIndex<T> {

    private final Map<String, T> byChannel;

    private ChannelIndex(Map<String, T> byChannel) {
        this.byChannel = byChannel;
    }

    public static <T> ChannelIndex<T> of(Collection<T> records, Function<T, String> channelOf) {
        Map<String, T> byChannel = new HashMap<>();
        for (T record : records) {
            String key = normalize(channelOf.apply(record));
            if (key != null) {
                byChannel.putIfAbsent(key, record);
            }
        }
        return new ChannelIndex<>(byChannel);
    }

    public static <T> ChannelIndex<T> empty() {
        return new ChannelIndex<>(Collections.emptyMap());
    }

    public Optional<T> lookup(String channel) {
        String key = normalize(channel);
        return key == null ? Optional.empty() : Optional.ofNullable(byChannel.get(key));
    }

    public int size() {
        return byChannel.size();
    }

    public static String normalize(String channel) {
        if (channel == null || channel.isBlank()) {
            return null;
        }
        return channel.trim().toLowerCase(Locale.ROOT);
    }
}
