package tl.core.queue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Waiting requests grouped by priority, FIFO inside each priority.
 *
 * <p>Structure:
 * <ul>
 *   <li>One {@link Lane} per priority currently in use, created on first enqueue
 *       and dropped the moment it empties</li>
 *   <li>A cached highest active priority, recomputed whenever the lane it points
 *       at disappears</li>
 * </ul>
 *
 * <p>Costs: enqueue is O(1). Dequeue is O(1) unless it empties a lane, in which
 * case the cache is rebuilt by scanning the remaining priorities. Cancellation is
 * linear in the requests queued ahead of the cancelled one at the same priority.
 * Neither cost depends on the total number of waiters across priorities.
 *
 * <p>Thread-safety: none. The owner serializes every call.
 */
public final class PriorityWaitQueue {

    private final Map<Integer, Lane> lanes = new HashMap<>();
    private Integer highestPriority;

    /**
     * Appends a request to the tail of its priority's lane.
     *
     * @param request Request to park (must not already be queued)
     * @return index assigned inside the lane
     * @throws IllegalArgumentException if request is null
     * @throws IllegalStateException if request is already queued
     */
    public long enqueue(WaitingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.isQueued()) {
            throw new IllegalStateException("request is already queued");
        }

        int priority = request.priority();
        Lane lane = lanes.computeIfAbsent(priority, p -> new Lane());
        if (highestPriority == null || priority > highestPriority) {
            highestPriority = priority;
        }
        return lane.append(request);
    }

    /**
     * Removes and returns the oldest request at the highest active priority.
     *
     * @return the request, or null if nothing is waiting
     */
    public WaitingRequest dequeueHighest() {
        if (highestPriority == null) {
            return null;
        }

        Lane lane = lanes.get(highestPriority);
        WaitingRequest next = lane.pollFirst();
        if (lane.isEmpty()) {
            lanes.remove(highestPriority);
            highestPriority = scanHighestPriority();
        }
        return next;
    }

    /**
     * Takes a request out of the queue before it is admitted. Idempotent.
     *
     * @return true if the request was still waiting and has now been removed
     */
    public boolean cancel(WaitingRequest request) {
        if (request == null || !request.isQueued()) {
            return false;
        }

        int priority = request.priority();
        Lane lane = lanes.get(priority);
        if (lane == null || !lane.remove(request)) {
            return false;
        }

        if (lane.isEmpty()) {
            lanes.remove(priority);
            if (highestPriority != null && priority == highestPriority) {
                highestPriority = scanHighestPriority();
            }
        }
        return true;
    }

    /**
     * Removes every waiting request, highest priority first and FIFO inside a priority.
     */
    public List<WaitingRequest> drain() {
        List<WaitingRequest> drained = new ArrayList<>(length());
        WaitingRequest next;
        while ((next = dequeueHighest()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public boolean isEmpty() {
        for (Lane lane : lanes.values()) {
            if (!lane.isEmpty()) return false;
        }
        return true;
    }

    /**
     * Total number of waiting requests across all priorities.
     */
    public int length() {
        int length = 0;
        for (Lane lane : lanes.values()) {
            length += lane.size();
        }
        return length;
    }

    /**
     * Number of requests waiting at one priority.
     */
    public int length(int priority) {
        Lane lane = lanes.get(priority);
        return lane != null ? lane.size() : 0;
    }

    public OptionalInt highestPriority() {
        return highestPriority != null ? OptionalInt.of(highestPriority) : OptionalInt.empty();
    }

    /**
     * Number of priorities that currently have at least one waiter.
     */
    public int activePriorities() {
        return lanes.size();
    }

    private Integer scanHighestPriority() {
        Integer highest = null;
        for (Map.Entry<Integer, Lane> entry : lanes.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            if (highest == null || entry.getKey() > highest) {
                highest = entry.getKey();
            }
        }
        return highest;
    }
}
