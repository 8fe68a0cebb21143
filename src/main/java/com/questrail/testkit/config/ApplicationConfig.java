package com.questrail.testkit.config;

import com.questrail.testkit.api.AggregateMessageHandler;
import com.questrail.testkit.api.Application;
import com.questrail.testkit.api.ApplicationConfigurer;
import com.questrail.testkit.api.Identity;
import com.questrail.testkit.api.IntegrationMessageHandler;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.ProcessMessageHandler;
import com.questrail.testkit.api.ProjectionMessageHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ApplicationConfig
 * =============================================================================
 * Validated configuration of an entire application: its identity, its
 * handlers in registration order, and the message-type registry derived from
 * the handlers' routes.
 *
 * <h2>Application-wide rules</h2>
 * <ul>
 *   <li>identity names and keys are unique across the application and its
 *       handlers</li>
 *   <li>every message type has exactly one {@link MessageKind}</li>
 *   <li>a command type is handled by at most one handler</li>
 *   <li>an event or timeout type is produced by at most one handler</li>
 * </ul>
 *
 * <p>Any violation is reported as a {@link ConfigurationException} from
 * {@link #of(Application)}.</p>
 */
public final class ApplicationConfig
{
    private final Identity identity;
    private final Object application;
    private final List<HandlerConfig> handlers;
    private final Map<String, HandlerConfig> handlersByName;
    private final Map<Class<? extends Message>, MessageKind> kinds;
    private final Map<Class<? extends Message>, List<HandlerConfig>> consumers;
    private final Map<Class<? extends Message>, HandlerConfig> producers;

    private ApplicationConfig(
            Identity identity,
            Object application,
            List<HandlerConfig> handlers,
            Map<Class<? extends Message>, MessageKind> kinds,
            Map<Class<? extends Message>, List<HandlerConfig>> consumers,
            Map<Class<? extends Message>, HandlerConfig> producers
    ) {
        this.identity = identity;
        this.application = application;
        this.handlers = List.copyOf(handlers);
        this.kinds = Collections.unmodifiableMap(kinds);
        this.consumers = Collections.unmodifiableMap(consumers);
        this.producers = Collections.unmodifiableMap(producers);

        Map<String, HandlerConfig> byName = new HashMap<>();
        for (HandlerConfig h : handlers) {
            byName.put(h.name(), h);
        }
        this.handlersByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Configures and validates {@code app}.
     */
    public static ApplicationConfig of(Application app) throws ConfigurationException {
        Objects.requireNonNull(app, "app");

        Registrar registrar = new Registrar();
        app.configure(registrar);

        String implementation = app.getClass().getName();

        if (registrar.error != null) {
            throw registrar.error;
        }
        if (registrar.identity == null) {
            throw new ConfigurationException(implementation + " is configured without an identity, identity() must be called exactly once within configure()");
        }

        Map<String, Identity> names = new HashMap<>();
        Map<String, Identity> keys = new HashMap<>();
        names.put(registrar.identity.name(), registrar.identity);
        keys.put(registrar.identity.key(), registrar.identity);

        Map<Class<? extends Message>, MessageKind> kinds = new LinkedHashMap<>();
        Map<Class<? extends Message>, List<HandlerConfig>> consumers = new LinkedHashMap<>();
        Map<Class<? extends Message>, HandlerConfig> producers = new LinkedHashMap<>();

        for (HandlerConfig h : registrar.handlers) {
            Identity conflict = names.putIfAbsent(h.name(), h.identity());
            if (conflict != null) {
                throw new ConfigurationException(String.format(
                        "%s can not use the name \"%s\" because it is already used by %s",
                        h.identity(), h.name(), conflict));
            }
            conflict = keys.putIfAbsent(h.identity().key(), h.identity());
            if (conflict != null) {
                throw new ConfigurationException(String.format(
                        "%s can not use the key \"%s\" because it is already used by %s",
                        h.identity(), h.identity().key(), conflict));
            }

            registerKinds(h, h.consumedTypes(), kinds);
            registerKinds(h, h.producedTypes(), kinds);

            for (Map.Entry<Class<? extends Message>, MessageKind> e : h.consumedTypes().entrySet()) {
                List<HandlerConfig> existing = consumers.computeIfAbsent(e.getKey(), k -> new ArrayList<>());
                if (e.getValue() == MessageKind.COMMAND && !existing.isEmpty()) {
                    throw new ConfigurationException(String.format(
                            "%s can not handle %s commands because they are already handled by %s",
                            h.identity(), e.getKey().getName(), existing.get(0).identity()));
                }
                existing.add(h);
            }

            for (Map.Entry<Class<? extends Message>, MessageKind> e : h.producedTypes().entrySet()) {
                if (e.getValue() == MessageKind.COMMAND) {
                    continue;
                }
                HandlerConfig existing = producers.putIfAbsent(e.getKey(), h);
                if (existing != null) {
                    throw new ConfigurationException(String.format(
                            "%s can not produce %s %ss because they are already produced by %s",
                            h.identity(), e.getKey().getName(), e.getValue(), existing.identity()));
                }
            }

            // Commands may be executed by many processes, so they are tracked separately.
            for (Map.Entry<Class<? extends Message>, MessageKind> e : h.producedTypes().entrySet()) {
                if (e.getValue() == MessageKind.COMMAND) {
                    producers.putIfAbsent(e.getKey(), h);
                }
            }
        }

        Map<Class<? extends Message>, List<HandlerConfig>> frozen = new LinkedHashMap<>();
        consumers.forEach((k, v) -> frozen.put(k, List.copyOf(v)));

        return new ApplicationConfig(registrar.identity, app, registrar.handlers, kinds, frozen, producers);
    }

    private static void registerKinds(
            HandlerConfig h,
            Map<Class<? extends Message>, MessageKind> types,
            Map<Class<? extends Message>, MessageKind> kinds
    ) throws ConfigurationException {
        for (Map.Entry<Class<? extends Message>, MessageKind> e : types.entrySet()) {
            MessageKind existing = kinds.putIfAbsent(e.getKey(), e.getValue());
            if (existing != null && existing != e.getValue()) {
                throw new ConfigurationException(String.format(
                        "%s configures %s as a %s, but it is configured as a %s elsewhere in the application",
                        h.identity(), e.getKey().getName(), e.getValue(), existing));
            }
        }
    }

    public Identity identity() {
        return identity;
    }

    public Object application() {
        return application;
    }

    /**
     * Returns the handlers in registration order.
     */
    public List<HandlerConfig> handlers() {
        return handlers;
    }

    public Optional<HandlerConfig> handlerByName(String name) {
        return Optional.ofNullable(handlersByName.get(name));
    }

    public Set<Class<? extends Message>> messageTypes() {
        return kinds.keySet();
    }

    public Optional<MessageKind> kindOf(Class<?> type) {
        return Optional.ofNullable(kinds.get(type));
    }

    /**
     * Returns the handlers that consume {@code type}, in registration order.
     */
    public List<HandlerConfig> consumersOf(Class<?> type) {
        return consumers.getOrDefault(type, List.of());
    }

    /**
     * Returns the first handler, in registration order, that produces
     * {@code type}.
     */
    public Optional<HandlerConfig> producerOf(Class<?> type) {
        return Optional.ofNullable(producers.get(type));
    }

    public boolean isProduced(Class<?> type) {
        return producers.containsKey(type);
    }

    public boolean isConsumed(Class<?> type) {
        return consumers.containsKey(type);
    }

    private static final class Registrar implements ApplicationConfigurer {
        private Identity identity;
        private final List<HandlerConfig> handlers = new ArrayList<>();
        private ConfigurationException error;

        @Override
        public void identity(String name, String key) {
            if (identity != null) {
                fail(new ConfigurationException("application identity declared more than once"));
                return;
            }
            try {
                identity = new Identity(name, key);
            } catch (IllegalArgumentException | NullPointerException e) {
                fail(new ConfigurationException("application is configured with an invalid identity: " + e.getMessage()));
            }
        }

        @Override
        public void registerAggregate(AggregateMessageHandler<?> handler) {
            try {
                handlers.add(AggregateConfig.of(handler));
            } catch (ConfigurationException e) {
                fail(e);
            }
        }

        @Override
        public void registerProcess(ProcessMessageHandler<?> handler) {
            try {
                handlers.add(ProcessConfig.of(handler));
            } catch (ConfigurationException e) {
                fail(e);
            }
        }

        @Override
        public void registerIntegration(IntegrationMessageHandler handler) {
            try {
                handlers.add(IntegrationConfig.of(handler));
            } catch (ConfigurationException e) {
                fail(e);
            }
        }

        @Override
        public void registerProjection(ProjectionMessageHandler handler) {
            try {
                handlers.add(ProjectionConfig.of(handler));
            } catch (ConfigurationException e) {
                fail(e);
            }
        }

        private void fail(ConfigurationException e) {
            if (error == null) {
                error = e;
            }
        }
    }
}
