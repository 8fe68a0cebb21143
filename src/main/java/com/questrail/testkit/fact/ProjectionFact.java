package com.questrail.testkit.fact;

import com.questrail.testkit.config.ProjectionConfig;
import com.questrail.testkit.envelope.Envelope;

import java.util.Optional;

/**
 * Facts about projection handlers.
 */
public sealed interface ProjectionFact extends Fact
{
    ProjectionConfig handler();

    record CompactionBegun(ProjectionConfig handler) implements ProjectionFact {
    }

    record CompactionCompleted(ProjectionConfig handler, Exception error) implements ProjectionFact {
    }

    /**
     * A message logged by the projection. {@code envelope} is null when the
     * message was logged during compaction.
     */
    record MessageLogged(ProjectionConfig handler, Envelope envelope, LogEntry entry)
            implements ProjectionFact {

        public Optional<Envelope> event() {
            return Optional.ofNullable(envelope);
        }
    }
}
