package com.questrail.testkit.engine;

import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.config.ApplicationConfig;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.config.RouteDirection;
import com.questrail.testkit.engine.internal.Controller;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.Origin;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Router
 * -----------------------------------------------------------------------------
 * Maps envelopes to the controllers that must handle them.
 *
 * <p>Commands and events go to every consumer of their type, in the order
 * the handlers were registered. A timeout goes only to the controller of the
 * process that scheduled it.</p>
 */
public final class Router {

    private final ApplicationConfig config;
    private final Map<HandlerConfig, Controller> controllers = new LinkedHashMap<>();
    private final Map<Class<?>, List<Controller>> consumers = new HashMap<>();

    Router(ApplicationConfig config, List<? extends Controller> controllers) {
        this.config = config;

        for (Controller c : controllers) {
            this.controllers.put(c.handlerConfig(), c);
        }

        for (Class<?> type : config.messageTypes()) {
            List<Controller> list = new ArrayList<>();
            for (HandlerConfig h : config.consumersOf(type)) {
                list.add(this.controllers.get(h));
            }
            consumers.put(type, List.copyOf(list));
        }
    }

    public Optional<MessageKind> kindOf(Class<?> type) {
        return config.kindOf(type);
    }

    public List<Controller> consumersOf(Class<?> type) {
        return consumers.getOrDefault(type, List.of());
    }

    public Set<RouteDirection> directionOf(HandlerConfig handler, Class<?> type) {
        return handler.directionOf(type);
    }

    /**
     * Returns the controllers of every registered handler, in registration
     * order.
     */
    public List<Controller> controllers() {
        return List.copyOf(controllers.values());
    }

    List<Controller> route(Envelope env) {
        if (env.kind() == MessageKind.TIMEOUT) {
            Origin origin = env.origin().orElseThrow(
                    () -> new IllegalStateException("timeout " + env.messageId() + " has no origin"));
            return List.of(controllers.get(origin.handler()));
        }
        return consumersOf(env.messageType());
    }
}
