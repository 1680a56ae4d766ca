// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

import sigil.util.Trace;

/**
 * Renders signaled conditions as user-readable reports.
 */
public final class ConditionReport {
    private ConditionReport() {
    }

    /**
     * Describes the given signaled condition: its type and severity, its detailed message, and the operation traces
     * active in the calling thread.
     * <p>
     * Meant to be called from a handler, while the traces of the signaling code are still registered.
     */
    public static String describe(final SignaledCondition signaled) {
        final var condition = signaled.condition();
        final var builder = new StringBuilder();
        builder.append(signaled.isFatal() ? "A fatal condition" : "A condition")
            .append(" of type ")
            .append(condition.getClass().getName())
            .append(" has been signaled.\n");
        builder.append("\nDetailed message:\n");
        builder.append(condition.detailedMessage().stripTrailing()).append('\n');
        builder.append("\nOperation trace:\n");
        for (final var traceMessage : Trace.activeTraces()) {
            builder.append(" - ").append(traceMessage).append('\n');
        }
        return builder.toString();
    }
}
