package com.questrail.testkit.engine;

import com.questrail.testkit.config.ApplicationConfig;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.engine.time.WallClock;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.FactObserverGroup;
import com.questrail.testkit.fact.HandlerSkipReason;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The resolved options for one engine operation.
 */
public final class OperationOptions {

    private final Map<HandlerType, Boolean> enabledHandlerTypes;
    private final Map<String, Boolean> enabledHandlers;
    private final Instant now;
    private final FactObserverGroup observer;

    private OperationOptions(Builder b, Instant now) {
        this.enabledHandlerTypes = Collections.unmodifiableMap(new EnumMap<>(b.enabledHandlerTypes));
        this.enabledHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(b.enabledHandlers));
        this.now = now;
        this.observer = new FactObserverGroup(b.observers);
    }

    /**
     * Applies {@code options} in order on top of the defaults: every handler
     * type enabled, no per-handler overrides, the current time taken from
     * {@code clock}.
     *
     * @throws IllegalArgumentException if an option names an unknown handler
     */
    static OperationOptions resolve(ApplicationConfig config, WallClock clock, List<? extends OperationOption> options) {
        Builder b = new Builder();
        for (OperationOption o : options) {
            o.applyTo(b);
        }

        for (String name : b.enabledHandlers.keySet()) {
            if (config.handlerByName(name).isEmpty()) {
                throw new IllegalArgumentException(String.format(
                        "the '%s' application does not have a handler named '%s'",
                        config.identity().name(), name));
            }
        }

        return new OperationOptions(b, b.now != null ? b.now : clock.now());
    }

    public Map<HandlerType, Boolean> enabledHandlerTypes() {
        return enabledHandlerTypes;
    }

    public Map<String, Boolean> enabledHandlers() {
        return enabledHandlers;
    }

    public Instant now() {
        return now;
    }

    public FactObserver observer() {
        return observer;
    }

    /**
     * Returns the reason the handler must not be invoked, or empty if it is
     * enabled. A per-handler option takes precedence over the handler's
     * configuration, which takes precedence over the handler type option.
     */
    public Optional<HandlerSkipReason> skipReason(HandlerConfig handler) {
        Boolean explicit = enabledHandlers.get(handler.name());
        if (explicit != null) {
            return explicit ? Optional.empty() : Optional.of(HandlerSkipReason.INDIVIDUAL_HANDLER_DISABLED);
        }
        if (handler.isDisabled()) {
            return Optional.of(HandlerSkipReason.INDIVIDUAL_HANDLER_DISABLED_BY_CONFIGURATION);
        }
        if (!enabledHandlerTypes.get(handler.handlerType())) {
            return Optional.of(HandlerSkipReason.HANDLER_TYPE_DISABLED);
        }
        return Optional.empty();
    }

    /**
     * Mutable accumulator that {@link OperationOption}s write to.
     */
    public static final class Builder {
        private final Map<HandlerType, Boolean> enabledHandlerTypes = new EnumMap<>(HandlerType.class);
        private final Map<String, Boolean> enabledHandlers = new LinkedHashMap<>();
        private final List<FactObserver> observers = new ArrayList<>();
        private Instant now;

        private Builder() {
            for (HandlerType t : HandlerType.values()) {
                enabledHandlerTypes.put(t, true);
            }
        }

        public Builder enableHandlerType(HandlerType type, boolean enabled) {
            enabledHandlerTypes.put(type, enabled);
            return this;
        }

        public Builder enableHandler(String name, boolean enabled) {
            enabledHandlers.put(name, enabled);
            return this;
        }

        public Builder currentTime(Instant now) {
            this.now = now;
            return this;
        }

        public Builder addObserver(FactObserver observer) {
            observers.add(observer);
            return this;
        }
    }
}
