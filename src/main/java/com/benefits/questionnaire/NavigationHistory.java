package com.benefits.questionnaire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable stack of visited node ids. Every mutation returns a new history.
 */
public final class NavigationHistory {

    private static final NavigationHistory EMPTY = new NavigationHistory(List.of());

    private final List<String> entries;

    private NavigationHistory(List<String> entries) {
        this.entries = entries;
    }

    public static NavigationHistory empty() {
        return EMPTY;
    }

    public static NavigationHistory of(String... nodeIds) {
        return new NavigationHistory(List.of(nodeIds));
    }

    public NavigationHistory push(String nodeId) {
        List<String> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(nodeId);
        return new NavigationHistory(Collections.unmodifiableList(next));
    }

    public NavigationHistory pop() {
        if (entries.isEmpty()) {
            return this;
        }
        return new NavigationHistory(List.copyOf(entries.subList(0, entries.size() - 1)));
    }

    public Optional<String> peek() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NavigationHistory other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
