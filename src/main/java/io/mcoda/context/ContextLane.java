package io.mcoda.context;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a lane after its last mutation.
 */
public record ContextLane(
        String id,
        LaneRole role,
        List<LaneMessage> messages,
        int tokenEstimate,
        boolean persisted,
        int redactionCount,
        Instant updatedAt
) {
    public ContextLane {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public long byteSize() {
        long total = 0L;
        for (LaneMessage message : messages) {
            total += message.byteSize();
        }
        return total;
    }
}
