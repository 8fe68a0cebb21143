package com.questrail.testkit.envelope;

import com.questrail.testkit.api.Identity;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * EventStreams
 * -----------------------------------------------------------------------------
 * Assigns stream IDs and offsets to events.
 *
 * <p>Each identity owns exactly one stream. The stream ID is a name-based UUID
 * of the identity key, so it is stable across runs and never collides for two
 * distinct keys. Offsets are dense per stream, starting at 0, and are shared by
 * every instance of the owning handler.</p>
 */
public final class EventStreams {

    private final Map<String, Long> nextOffsets = new HashMap<>();

    /**
     * Returns the stream ID owned by {@code identity}.
     */
    public static String streamIdOf(Identity identity) {
        return UUID.nameUUIDFromBytes(identity.key().getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Allocates the next offset on the stream owned by {@code identity}.
     */
    public StreamPosition next(Identity identity) {
        String streamId = streamIdOf(identity);
        long offset = nextOffsets.merge(streamId, 1L, Long::sum) - 1;
        return new StreamPosition(streamId, offset);
    }

    public void reset() {
        nextOffsets.clear();
    }

    /**
     * A position within an event stream.
     */
    public record StreamPosition(String streamId, long offset) {
    }
}
