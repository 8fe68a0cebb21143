package com.questrail.testkit.envelope;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.envelope.EventStreams.StreamPosition;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Envelope
 * =============================================================================
 * The engine's immutable carrier of a single message.
 *
 * <h2>Causality</h2>
 * <p>A <em>root</em> envelope is one created at dispatch entry: its causation
 * and correlation IDs both equal its own message ID, and it has no
 * {@link Origin}. A <em>child</em> envelope is created inside a handler scope
 * from the envelope being handled; its causation ID is the parent's message ID
 * and its correlation ID is carried over unchanged from the parent.</p>
 *
 * <h2>Kind-specific data</h2>
 * <ul>
 *   <li>events always carry a {@link StreamPosition}</li>
 *   <li>timeouts always carry a scheduled-for time and a process origin</li>
 * </ul>
 */
public final class Envelope
{
    private final String messageId;
    private final String causationId;
    private final String correlationId;
    private final Message message;
    private final MessageKind kind;
    private final Instant createdAt;
    private final Instant scheduledFor;
    private final Origin origin;
    private final StreamPosition streamPosition;

    private Envelope(
            String messageId,
            String causationId,
            String correlationId,
            Message message,
            MessageKind kind,
            Instant createdAt,
            Instant scheduledFor,
            Origin origin,
            StreamPosition streamPosition
    ) {
        if (Objects.requireNonNull(messageId, "messageId").isEmpty()) {
            throw new IllegalArgumentException("message ID must not be empty");
        }
        this.messageId = messageId;
        this.causationId = Objects.requireNonNull(causationId, "causationId");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.message = Objects.requireNonNull(message, "message");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.scheduledFor = scheduledFor;
        this.origin = origin;
        this.streamPosition = streamPosition;
    }

    /**
     * Creates a root command envelope.
     */
    public static Envelope newCommand(String id, Message command, Instant now) {
        return new Envelope(id, id, id, command, MessageKind.COMMAND, now, null, null, null);
    }

    /**
     * Creates a root event envelope.
     */
    public static Envelope newEvent(String id, Message event, Instant now, StreamPosition position) {
        Objects.requireNonNull(position, "position");
        return new Envelope(id, id, id, event, MessageKind.EVENT, now, null, null, position);
    }

    /**
     * Creates a command envelope caused by this envelope.
     */
    public Envelope newCommand(String id, Message command, Instant now, Origin origin) {
        Objects.requireNonNull(origin, "origin");
        return new Envelope(id, messageId, correlationId, command, MessageKind.COMMAND, now, null, origin, null);
    }

    /**
     * Creates an event envelope caused by this envelope.
     */
    public Envelope newEvent(String id, Message event, Instant now, Origin origin, StreamPosition position) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(position, "position");
        return new Envelope(id, messageId, correlationId, event, MessageKind.EVENT, now, null, origin, position);
    }

    /**
     * Creates a timeout envelope caused by this envelope.
     */
    public Envelope newTimeout(String id, Message timeout, Instant now, Instant scheduledFor, Origin origin) {
        Objects.requireNonNull(scheduledFor, "scheduledFor");
        Objects.requireNonNull(origin, "origin");
        return new Envelope(id, messageId, correlationId, timeout, MessageKind.TIMEOUT, now, scheduledFor, origin, null);
    }

    public String messageId() {
        return messageId;
    }

    public String causationId() {
        return causationId;
    }

    public String correlationId() {
        return correlationId;
    }

    public Message message() {
        return message;
    }

    public Class<? extends Message> messageType() {
        return message.getClass();
    }

    public MessageKind kind() {
        return kind;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Present for timeouts only.
     */
    public Optional<Instant> scheduledFor() {
        return Optional.ofNullable(scheduledFor);
    }

    /**
     * Empty for root envelopes.
     */
    public Optional<Origin> origin() {
        return Optional.ofNullable(origin);
    }

    public boolean isRoot() {
        return origin == null && messageId.equals(causationId);
    }

    /**
     * Present for events only.
     */
    public Optional<StreamPosition> streamPosition() {
        return Optional.ofNullable(streamPosition);
    }

    public String eventStreamId() {
        return requirePosition().streamId();
    }

    public long eventStreamOffset() {
        return requirePosition().offset();
    }

    private StreamPosition requirePosition() {
        if (streamPosition == null) {
            throw new IllegalStateException("envelope " + messageId + " does not contain an event");
        }
        return streamPosition;
    }

    @Override
    public String toString() {
        return "Envelope{"
                + "id=" + messageId
                + ", causation=" + causationId
                + ", correlation=" + correlationId
                + ", " + kind + "=" + message.describe()
                + '}';
    }
}
