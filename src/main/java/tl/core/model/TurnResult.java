package tl.core.model;

/**
 * Outcome of a non-waiting admission attempt.
 *
 * @param decision ALLOW if a slot was taken, REJECT otherwise
 * @param retryAfterNanos Time until the earliest in-flight slot is released (0 on ALLOW)
 */
public record TurnResult(
    Decision decision,
    long retryAfterNanos
) {
    public static TurnResult allow() {
        return new TurnResult(Decision.ALLOW, 0L);
    }

    public static TurnResult reject(long retryAfterNanos) {
        return new TurnResult(Decision.REJECT, Math.max(0L, retryAfterNanos));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
