// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 * <p>
 * Only {@link sigil.util.condition.Unwind} is thrown this way: it has to travel through arbitrary user code between
 * a handler and its restart point, and declaring it everywhere would add nothing but noise.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable without the compiler knowing its checked type.
     * <p>
     * Never returns normally. The declared {@link UnreachableCodeReachedError} return type lets call sites write
     * {@code throw SneakyThrow.doThrow(t)} so that control flow analysis sees the jump.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    /**
     * Does nothing, but tells the compiler that it may throw {@code E}, so that a sneaky {@code E} can be caught at
     * the call site.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E is erased to Throwable, so the cast below does not exist in bytecode; the caller picks RuntimeException for E.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
