package com.questrail.testkit.engine.internal.process;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.MessageValidationException;
import com.questrail.testkit.api.ProcessEventScope;
import com.questrail.testkit.api.ProcessRoot;
import com.questrail.testkit.api.ProcessScope;
import com.questrail.testkit.api.ProcessTimeoutScope;
import com.questrail.testkit.api.ValidationScope;
import com.questrail.testkit.config.ProcessConfig;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.envelope.Origin;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.LogEntry;
import com.questrail.testkit.fact.ProcessFact;
import com.questrail.testkit.location.Location;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProcessInstanceScope
 * -----------------------------------------------------------------------------
 * Collects the commands and timeouts produced by one call to a process
 * handler.
 *
 * <p>Timeouts scheduled for the current engine time, or earlier, are
 * <em>ready</em> and go back to the engine with the commands. Later timeouts
 * are <em>pending</em> and are merged into the controller's queue once the
 * call returns.</p>
 */
abstract class ProcessInstanceScope implements ProcessScope {

    private final ProcessConfig config;
    private final String instanceId;
    private final MessageIdGenerator messageIds;
    private final FactObserver observer;
    private final Instant now;
    private final Envelope envelope;
    private final ProcessRoot root;
    private final String method;

    private boolean ended;
    private final List<Envelope> commands = new ArrayList<>();
    private final List<Envelope> ready = new ArrayList<>();
    private final List<Envelope> pending = new ArrayList<>();

    private ProcessInstanceScope(
            ProcessConfig config,
            String instanceId,
            MessageIdGenerator messageIds,
            FactObserver observer,
            Instant now,
            Envelope envelope,
            ProcessRoot root,
            String method
    ) {
        this.config = config;
        this.instanceId = instanceId;
        this.messageIds = messageIds;
        this.observer = observer;
        this.now = now;
        this.envelope = envelope;
        this.root = root;
        this.method = method;
    }

    static ProcessInstanceScope.ForEvent forEvent(
            ProcessConfig config,
            String instanceId,
            MessageIdGenerator messageIds,
            FactObserver observer,
            Instant now,
            Envelope event,
            ProcessRoot root
    ) {
        return new ForEvent(config, instanceId, messageIds, observer, now, event, root);
    }

    static ProcessInstanceScope.ForTimeout forTimeout(
            ProcessConfig config,
            String instanceId,
            MessageIdGenerator messageIds,
            FactObserver observer,
            Instant now,
            Envelope timeout,
            ProcessRoot root
    ) {
        return new ForTimeout(config, instanceId, messageIds, observer, now, timeout, root);
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public void end() {
        if (ended) {
            return;
        }

        ended = true;
        observer.onFact(new ProcessFact.InstanceEnded(config, instanceId, root, envelope));
    }

    @Override
    public void executeCommand(Message command) {
        Objects.requireNonNull(command, "command");

        if (config.producedTypes().get(command.getClass()) != MessageKind.COMMAND) {
            throw violation(String.format(
                    "executed a command of type %s, which is not produced by this handler",
                    command.getClass().getName()));
        }

        try {
            command.validate(ValidationScope.forCommand());
        } catch (MessageValidationException e) {
            throw violation(String.format(
                    "executed an invalid %s command: %s",
                    command.getClass().getName(), e.getMessage()));
        }

        revertEnding();

        Envelope env = envelope.newCommand(
                messageIds.next(),
                command,
                now,
                new Origin(config, instanceId));

        commands.add(env);

        observer.onFact(new ProcessFact.CommandExecuted(config, instanceId, root, envelope, env));
    }

    @Override
    public void scheduleTimeout(Message timeout, Instant at) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(at, "at");

        if (config.producedTypes().get(timeout.getClass()) != MessageKind.TIMEOUT) {
            throw violation(String.format(
                    "scheduled a timeout of type %s, which is not produced by this handler",
                    timeout.getClass().getName()));
        }

        try {
            timeout.validate(ValidationScope.forTimeout());
        } catch (MessageValidationException e) {
            throw violation(String.format(
                    "scheduled an invalid %s timeout: %s",
                    timeout.getClass().getName(), e.getMessage()));
        }

        revertEnding();

        Envelope env = envelope.newTimeout(
                messageIds.next(),
                timeout,
                now,
                at,
                new Origin(config, instanceId));

        if (at.isAfter(now)) {
            pending.add(env);
        } else {
            ready.add(env);
        }

        observer.onFact(new ProcessFact.TimeoutScheduled(config, instanceId, root, envelope, env));
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public void log(String format, Object... args) {
        observer.onFact(new ProcessFact.MessageLogged(config, instanceId, root, envelope, LogEntry.of(format, args)));
    }

    boolean ended() {
        return ended;
    }

    List<Envelope> commands() {
        return commands;
    }

    List<Envelope> readyTimeouts() {
        return ready;
    }

    List<Envelope> pendingTimeouts() {
        return pending;
    }

    Envelope envelope() {
        return envelope;
    }

    private void revertEnding() {
        if (ended) {
            ended = false;
            observer.onFact(new ProcessFact.EndingReverted(config, instanceId, root, envelope));
        }
    }

    private UnexpectedBehaviorException violation(String description) {
        return new UnexpectedBehaviorException(
                config,
                "ProcessMessageHandler",
                method,
                config.handler(),
                envelope.message(),
                description,
                Location.ofCaller(2));
    }

    static final class ForEvent extends ProcessInstanceScope implements ProcessEventScope {

        private ForEvent(
                ProcessConfig config,
                String instanceId,
                MessageIdGenerator messageIds,
                FactObserver observer,
                Instant now,
                Envelope event,
                ProcessRoot root
        ) {
            super(config, instanceId, messageIds, observer, now, event, root, "handleEvent");
        }

        @Override
        public Instant recordedAt() {
            return envelope().createdAt();
        }
    }

    static final class ForTimeout extends ProcessInstanceScope implements ProcessTimeoutScope {

        private ForTimeout(
                ProcessConfig config,
                String instanceId,
                MessageIdGenerator messageIds,
                FactObserver observer,
                Instant now,
                Envelope timeout,
                ProcessRoot root
        ) {
            super(config, instanceId, messageIds, observer, now, timeout, root, "handleTimeout");
        }

        @Override
        public Instant scheduledFor() {
            return envelope().scheduledFor().orElseThrow();
        }
    }
}
