package com.intteq.reliable.rabbit.connection;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Ordered, non-empty list of broker URLs with a rotating cursor.
 *
 * <p>The cursor always addresses a valid index: it advances modulo the list size.
 */
public final class EndpointSet {

    private final List<String> urls;
    private int cursor;

    public EndpointSet(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one broker URL is required");
        }
        if (urls.stream().anyMatch(url -> url == null || url.isBlank())) {
            throw new IllegalArgumentException("Broker URLs must not be blank");
        }
        this.urls = List.copyOf(urls);
    }

    /**
     * Returns the URL at the cursor and advances the cursor by one.
     */
    public synchronized String next() {
        String url = urls.get(cursor);
        cursor = (cursor + 1) % urls.size();
        return url;
    }

    public synchronized int cursor() {
        return cursor;
    }

    public List<String> urls() {
        return urls;
    }

    public int size() {
        return urls.size();
    }

    /**
     * Masks the credentials of an AMQP URI so it can be logged.
     */
    public static String redact(String url) {
        if (url == null) {
            return null;
        }
        try {
            String userInfo = new URI(url).getRawUserInfo();
            return userInfo == null ? url : url.replace(userInfo + "@", "***@");
        } catch (URISyntaxException e) {
            return "<unparseable url>";
        }
    }

    @Override
    public String toString() {
        return "EndpointSet" + urls.stream().map(EndpointSet::redact).toList() + "@" + cursor();
    }
}
