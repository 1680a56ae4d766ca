// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control away from a fatal
 * condition.
 * <p>
 * Not installing a handler around code that can fail is a programming error, hence the {@link AssertionError}
 * supertype. The condition that went unhandled is still available through {@link #condition()}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the fatal condition no handler took care of.
     */
    public Condition condition() {
        return condition;
    }

    // Conditions aren't serializable, and neither are these errors in any meaningful way.
    private final transient Condition condition;
}
