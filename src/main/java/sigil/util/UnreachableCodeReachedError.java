// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util;

/**
 * Thrown when control flow arrives somewhere it never should, such as the default branch of a dispatch over
 * a sealed hierarchy.
 * <p>
 * This is a programming error, hence the {@link AssertionError} supertype.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final String message) {
        super(message);
    }
}
