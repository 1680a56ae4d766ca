// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * Unlike exceptions, conditions can represent any occurrence that may be of interest to code at different levels of
 * the call stack, and unlike exceptions, condition handlers execute <em>before</em> the stack is unwound, so they can
 * still see restart points established deep inside the signaling code.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message of this condition, including any context subtypes know about, such as
     * a source excerpt.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
