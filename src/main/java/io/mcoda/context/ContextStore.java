package io.mcoda.context;

import java.util.List;

/**
 * Durable message lists keyed by lane id.
 */
public interface ContextStore {
    /**
     * Returns the stored messages oldest first, or an empty list for an unknown lane.
     */
    List<LaneMessage> loadLane(String laneId);

    /**
     * Appends one message and returns the full stored list.
     */
    List<LaneMessage> append(String laneId, LaneMessage message);

    /**
     * Replaces the stored list in one step; readers see either the old or the new list.
     */
    List<LaneMessage> replace(String laneId, List<LaneMessage> messages);
}
