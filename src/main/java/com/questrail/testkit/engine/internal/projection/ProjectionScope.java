package com.questrail.testkit.engine.internal.projection;

import com.questrail.testkit.api.ProjectionCompactScope;
import com.questrail.testkit.api.ProjectionEventScope;
import com.questrail.testkit.config.ProjectionConfig;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.LogEntry;
import com.questrail.testkit.fact.ProjectionFact;

import java.time.Instant;

/**
 * Scope for both event handling and compaction. {@code event} is null while
 * compacting, in which case only {@link #now()} and {@link #log} are reachable
 * through the compaction interface.
 */
final class ProjectionScope implements ProjectionEventScope, ProjectionCompactScope {

    private final ProjectionConfig config;
    private final FactObserver observer;
    private final Instant now;
    private final Envelope event;
    private final long checkpointOffset;

    private ProjectionScope(ProjectionConfig config, FactObserver observer, Instant now, Envelope event, long checkpointOffset) {
        this.config = config;
        this.observer = observer;
        this.now = now;
        this.event = event;
        this.checkpointOffset = checkpointOffset;
    }

    static ProjectionScope forEvent(ProjectionConfig config, FactObserver observer, Instant now, Envelope event, long checkpointOffset) {
        return new ProjectionScope(config, observer, now, event, checkpointOffset);
    }

    static ProjectionScope forCompaction(ProjectionConfig config, FactObserver observer, Instant now) {
        return new ProjectionScope(config, observer, now, null, 0);
    }

    @Override
    public String streamId() {
        return event.eventStreamId();
    }

    @Override
    public long offset() {
        return event.eventStreamOffset();
    }

    @Override
    public long checkpointOffset() {
        return checkpointOffset;
    }

    @Override
    public Instant recordedAt() {
        return event.createdAt();
    }

    @Override
    public boolean isPrimaryDelivery() {
        return true;
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public void log(String format, Object... args) {
        observer.onFact(new ProjectionFact.MessageLogged(config, event, LogEntry.of(format, args)));
    }
}
