// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

/**
 * The throwable carrying control flow from a handler to its {@link Restart} point.
 * <p>
 * Public only so that methods can declare that they throw it. Catching or throwing it manually is strongly
 * discouraged.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it is not a failure, so generic exception handlers in
 * between must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    // Unwinds are never serialized; they just inherit Serializable from Throwable.
    private final transient Restart target;
}
