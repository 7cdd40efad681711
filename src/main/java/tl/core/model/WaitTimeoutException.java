package tl.core.model;

/**
 * Raised through a caller's future when its wait deadline passes before a slot frees up.
 * The request is already gone from the queue by then; retrying means calling
 * {@code awaitTurn} again, which joins the back of the lane.
 */
public final class WaitTimeoutException extends RuntimeException {

    public static final String MESSAGE = "Limiter timed out.";

    private static final long serialVersionUID = 1L;

    private final int priority;

    public WaitTimeoutException(int priority) {
        super(MESSAGE);
        this.priority = priority;
    }

    /**
     * Priority the timed-out request was waiting at.
     */
    public int priority() {
        return priority;
    }
}
