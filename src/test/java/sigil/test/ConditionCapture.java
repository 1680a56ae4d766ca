// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.test;

import java.util.ArrayList;
import java.util.List;
import sigil.util.condition.Condition;
import sigil.util.condition.ConditionContext;
import sigil.util.condition.ConditionReport;
import sigil.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs code that's expected to signal a fatal condition, and captures that condition with a handler that unwinds to a
 * restart, the way host code does.
 */
final class ConditionCapture {
    private ConditionCapture() {
    }

    static <T extends Condition> T captureError(final Class<T> type, final Runnable body) {
        return type.cast(captureErrorReport(body).condition());
    }

    /**
     * Like {@link #captureError(Class, Runnable)}, but also returns the report of the condition, rendered while the
     * traces of the signaling code are still active.
     */
    static Captured captureErrorReport(final Runnable body) {
        final var captured = new ArrayList<Captured>();
        ConditionContext.withRestart("Abort test body", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    captured.add(new Captured(signaled.condition(), ConditionReport.describe(signaled)));
                    restart.unwindTo();
                }
            })) {
                handler.use();
                body.run();
            }
            return null;
        });
        assertThat(captured).as("fatal conditions signaled").hasSize(1);
        return captured.get(0);
    }

    /**
     * Runs the given code, collecting every non-fatal condition it signals.
     */
    static List<Condition> captureNonFatal(final Runnable body) {
        final var captured = new ArrayList<Condition>();
        try (final var handler = new Handler(signaled -> {
            if (!signaled.isFatal()) {
                captured.add(signaled.condition());
            }
        })) {
            handler.use();
            body.run();
        }
        return captured;
    }

    record Captured(Condition condition, String report) {
    }
}
