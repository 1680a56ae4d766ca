// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

import java.io.PrintStream;

/**
 * A handler procedure that writes a {@link ConditionReport} of every condition it sees to a stream, then declines.
 * <p>
 * Hosts usually install one of these outermost, so that conditions nobody else cares about, fatal or not, still end
 * up on the console before an {@link UnhandledErrorError} is thrown.
 */
public final class ReportingHandler implements HandlerProcedure {
    /**
     * Creates a procedure writing reports to the given stream.
     *
     * @param stream     The stream to write to.
     * @param fatalsOnly Whether non-fatal conditions, like suppressed exceptions, should be skipped.
     */
    public ReportingHandler(final PrintStream stream, final boolean fatalsOnly) {
        this.stream = stream;
        this.fatalsOnly = fatalsOnly;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (fatalsOnly && !condition.isFatal()) {
            return;
        }
        stream.println(ConditionReport.describe(condition));
    }

    private final PrintStream stream;
    private final boolean fatalsOnly;
}
