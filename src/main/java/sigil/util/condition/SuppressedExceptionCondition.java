// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

/**
 * A non-fatal condition reporting an exception that was caught and replaced by a fallback result.
 * <p>
 * Signaled by {@link ConditionContext#signalSuppressedException(Exception)}; handlers must not unwind in response.
 */
public final class SuppressedExceptionCondition extends Condition {
    /**
     * Initializes a new condition reporting that the given exception was suppressed.
     */
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
        this.exception = exception;
    }

    /**
     * Retrieves the exception that was suppressed.
     */
    public Exception exception() {
        return exception;
    }

    private final Exception exception;
}
