package com.questrail.testkit;

import com.questrail.testkit.api.EventRecorder;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.engine.EngineEventRecorder;

/**
 * The {@link EventRecorder} returned by {@link Test#eventRecorder()}.
 *
 * <p>It forwards to the engine only while a {@link Actions#call} action is
 * running.</p>
 */
final class BoundEventRecorder implements EventRecorder {

    private EngineEventRecorder next;

    synchronized void bind(EngineEventRecorder next) {
        this.next = next;
    }

    synchronized void unbind() {
        this.next = null;
    }

    @Override
    public void recordEvent(OperationContext ctx, Message event) throws Exception {
        EngineEventRecorder r;
        synchronized (this) {
            r = next;
        }
        if (r == null) {
            throw new IllegalStateException("recordEvent(): cannot be called outside of a call action");
        }
        r.recordEvent(ctx, event);
    }
}
