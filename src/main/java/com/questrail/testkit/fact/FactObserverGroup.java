package com.questrail.testkit.fact;

import java.util.List;
import java.util.Objects;

/**
 * Notifies each member observer of every fact, in order.
 */
public final class FactObserverGroup implements FactObserver {

    private final List<FactObserver> observers;

    public FactObserverGroup(List<? extends FactObserver> observers) {
        this.observers = List.copyOf(observers);
    }

    public static FactObserverGroup of(FactObserver... observers) {
        return new FactObserverGroup(List.of(observers));
    }

    public List<FactObserver> observers() {
        return observers;
    }

    @Override
    public void onFact(Fact fact) {
        Objects.requireNonNull(fact, "fact");
        for (FactObserver o : observers) {
            o.onFact(fact);
        }
    }
}
