// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.test;

import java.util.concurrent.atomic.AtomicInteger;
import sigil.util.Trace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

final class TraceTest {
    @Test
    void tracesNestNewestFirst() {
        assertThat(Trace.activeTraces()).isEmpty();
        try (final var outer = new Trace("outer")) {
            outer.use();
            try (final var inner = new Trace(() -> "inner")) {
                inner.use();
                assertThat(Trace.activeTraces()).containsExactly("inner", "outer");
            }
            assertThat(Trace.activeTraces()).containsExactly("outer");
        }
        assertThat(Trace.activeTraces()).isEmpty();
    }

    @Test
    void messagesAreComputedLazilyOnce() {
        final var calls = new AtomicInteger();
        try (final var trace = new Trace(() -> "call " + calls.incrementAndGet())) {
            trace.use();
            assertThat(calls).hasValue(0);
            assertThat(Trace.activeTraces()).containsExactly("call 1");
            assertThat(Trace.activeTraces()).containsExactly("call 1");
        }
        assertThat(calls).hasValue(1);
    }

    @Test
    void tracesArePerThread() throws InterruptedException {
        try (final var trace = new Trace("main thread")) {
            trace.use();
            final var seen = new AtomicInteger(-1);
            final var thread = new Thread(() -> {
                var count = 0;
                for (final var ignored : Trace.activeTraces()) {
                    count += 1;
                }
                seen.set(count);
            });
            thread.start();
            thread.join();
            assertThat(seen).hasValue(0);
        }
    }

    @Test
    void closingOutOfOrderLeavesChainIntact() {
        final var outer = new Trace("outer");
        final var inner = new Trace("inner");
        assertThatThrownBy(outer::close).isInstanceOf(AssertionError.class).hasMessage("Trace chain corrupt");
        assertThat(Trace.activeTraces()).containsExactly("inner", "outer");
        inner.close();
        outer.close();
        assertThat(Trace.activeTraces()).isEmpty();
    }
}
