package tl.core.queue;

import java.util.HashMap;
import java.util.Map;

/**
 * FIFO lane for a single priority.
 *
 * <p>Live requests occupy the contiguous index range {@code [head, tail)}. Both
 * cursors only move forward. Removing a request from the middle shifts every
 * request ahead of it one slot towards the tail to close the hole, then advances
 * {@code head}; relative order is unchanged.
 */
final class Lane {

    private final Map<Long, WaitingRequest> slots = new HashMap<>();
    private long head;
    private long tail;

    long append(WaitingRequest request) {
        long position = tail;
        slots.put(position, request);
        request.moveTo(position);
        tail++;
        return position;
    }

    WaitingRequest pollFirst() {
        if (isEmpty()) {
            return null;
        }
        WaitingRequest first = slots.remove(head);
        head++;
        first.moveTo(WaitingRequest.DETACHED);
        return first;
    }

    /**
     * Removes {@code request} if it still sits in this lane.
     * Cost is linear in the number of requests queued ahead of it.
     *
     * @return false if the request was already admitted or removed
     */
    boolean remove(WaitingRequest request) {
        long position = request.position();
        if (position < head || position >= tail || slots.get(position) != request) {
            return false;
        }

        for (long i = position; i > head; i--) {
            WaitingRequest ahead = slots.get(i - 1);
            slots.put(i, ahead);
            ahead.moveTo(i);
        }
        slots.remove(head);
        head++;
        request.moveTo(WaitingRequest.DETACHED);
        return true;
    }

    boolean isEmpty() {
        return head == tail;
    }

    int size() {
        return (int) (tail - head);
    }

    long head() {
        return head;
    }

    long tail() {
        return tail;
    }
}
