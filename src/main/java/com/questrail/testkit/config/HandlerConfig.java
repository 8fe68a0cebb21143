package com.questrail.testkit.config;

import com.questrail.testkit.api.HandlerConfigurer;
import com.questrail.testkit.api.Identity;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.Route;
import com.questrail.testkit.api.RouteType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * HandlerConfig
 * =============================================================================
 * Validated configuration of a single message handler.
 *
 * <p>A {@code HandlerConfig} is produced by calling the handler's
 * {@code configure()} method once and checking the declared routes against
 * the rules for its {@link HandlerType}. Instances are immutable and are used
 * by value wherever the engine needs to refer to a handler, including inside
 * envelopes and facts.</p>
 *
 * <h2>Route rules</h2>
 * <ul>
 *   <li>only the route types allowed for the handler type may be declared</li>
 *   <li>each required route type must be declared at least once</li>
 *   <li>a message type may appear in at most one route of a handler</li>
 * </ul>
 */
public abstract sealed class HandlerConfig
        permits AggregateConfig, ProcessConfig, IntegrationConfig, ProjectionConfig
{
    private final Identity identity;
    private final List<Route> routes;
    private final boolean disabled;
    private final Map<Class<? extends Message>, MessageKind> consumed;
    private final Map<Class<? extends Message>, MessageKind> produced;

    HandlerConfig(Collected collected) {
        this.identity = collected.identity;
        this.routes = List.copyOf(collected.routes);
        this.disabled = collected.disabled;

        Map<Class<? extends Message>, MessageKind> in = new LinkedHashMap<>();
        Map<Class<? extends Message>, MessageKind> out = new LinkedHashMap<>();
        for (Route r : routes) {
            if (r.type().isInbound()) {
                in.put(r.messageType(), r.kind());
            }
            if (r.type().isOutbound()) {
                out.put(r.messageType(), r.kind());
            }
        }
        this.consumed = Collections.unmodifiableMap(in);
        this.produced = Collections.unmodifiableMap(out);
    }

    public Identity identity() {
        return identity;
    }

    public String name() {
        return identity.name();
    }

    public abstract HandlerType handlerType();

    /**
     * Returns the handler implementation this configuration describes.
     */
    public abstract Object handler();

    public List<Route> routes() {
        return routes;
    }

    /**
     * Returns true if the handler disabled itself during configuration.
     */
    public boolean isDisabled() {
        return disabled;
    }

    public Map<Class<? extends Message>, MessageKind> consumedTypes() {
        return consumed;
    }

    public Map<Class<? extends Message>, MessageKind> producedTypes() {
        return produced;
    }

    public boolean consumes(Class<?> type) {
        return consumed.containsKey(type);
    }

    public boolean produces(Class<?> type) {
        return produced.containsKey(type);
    }

    /**
     * Returns the directions in which {@code type} is routed for this handler.
     * The set is empty if the handler does not use the type at all.
     */
    public Set<RouteDirection> directionOf(Class<?> type) {
        Set<RouteDirection> result = EnumSet.noneOf(RouteDirection.class);
        if (consumes(type)) {
            result.add(RouteDirection.INBOUND);
        }
        if (produces(type)) {
            result.add(RouteDirection.OUTBOUND);
        }
        return result;
    }

    @Override
    public String toString() {
        return identity.name() + " " + handlerType();
    }

    /**
     * Runs a handler's configure method and validates what it declared.
     */
    static Collected collect(
            Object handler,
            HandlerType type,
            Consumer<HandlerConfigurer> configure
    ) throws ConfigurationException {
        Objects.requireNonNull(handler, "handler");

        Collector collector = new Collector();
        configure.accept(collector);

        String implementation = handler.getClass().getName();

        if (collector.error != null) {
            throw new ConfigurationException(implementation + " is configured with an " + collector.error);
        }
        if (collector.identity == null) {
            throw new ConfigurationException(implementation + " is configured without an identity, identity() must be called exactly once within configure()");
        }

        Set<RouteType> seenTypes = EnumSet.noneOf(RouteType.class);
        Map<Class<?>, Route> seenMessages = new LinkedHashMap<>();

        for (Route r : collector.routes) {
            if (!type.allowedRoutes().contains(r.type())) {
                throw new ConfigurationException(String.format(
                        "%s (%s) is configured with a %s route, which is not allowed for %s handlers",
                        implementation, collector.identity, r, type));
            }

            Route previous = seenMessages.putIfAbsent(r.messageType(), r);
            if (previous != null) {
                throw new ConfigurationException(String.format(
                        "%s (%s) is configured with more than one route for %s: %s and %s",
                        implementation, collector.identity, r.messageType().getName(), previous, r));
            }

            seenTypes.add(r.type());
        }

        for (RouteType required : type.requiredRoutes()) {
            if (!seenTypes.contains(required)) {
                throw new ConfigurationException(String.format(
                        "%s (%s) is not configured with any %s routes, at least one is required for %s handlers",
                        implementation, collector.identity, required.name().toLowerCase(), type));
            }
        }

        return new Collected(collector.identity, collector.routes, collector.disabled);
    }

    static final class Collected {
        final Identity identity;
        final List<Route> routes;
        final boolean disabled;

        Collected(Identity identity, List<Route> routes, boolean disabled) {
            this.identity = identity;
            this.routes = routes;
            this.disabled = disabled;
        }
    }

    private static final class Collector implements HandlerConfigurer {
        private Identity identity;
        private final List<Route> routes = new ArrayList<>();
        private boolean disabled;
        private String error;

        @Override
        public void identity(String name, String key) {
            if (identity != null) {
                fail("identity declared more than once");
                return;
            }
            try {
                identity = new Identity(name, key);
            } catch (IllegalArgumentException | NullPointerException e) {
                fail("invalid identity: " + e.getMessage());
            }
        }

        @Override
        public void routes(Route... routes) {
            for (Route r : routes) {
                this.routes.add(Objects.requireNonNull(r, "route"));
            }
        }

        @Override
        public void disable() {
            disabled = true;
        }

        private void fail(String message) {
            if (error == null) {
                error = message;
            }
        }
    }
}
