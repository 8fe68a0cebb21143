package com.questrail.testkit.fact;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An observer that keeps every fact it is notified of.
 */
public final class FactBuffer implements FactObserver {

    private final List<Fact> facts = new ArrayList<>();

    @Override
    public synchronized void onFact(Fact fact) {
        facts.add(fact);
    }

    /**
     * Returns a snapshot of the facts observed so far, in order.
     */
    public synchronized List<Fact> facts() {
        return new ArrayList<>(facts);
    }

    public synchronized <T extends Fact> List<T> factsOfType(Class<T> type) {
        return facts.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public synchronized <T extends Fact> boolean hasFactOfType(Class<T> type) {
        return facts.stream().anyMatch(type::isInstance);
    }

    public synchronized void clear() {
        facts.clear();
    }
}
