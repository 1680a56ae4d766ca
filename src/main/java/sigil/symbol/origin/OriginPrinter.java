// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.origin;

import java.util.Arrays;
import sigil.symbol.SymbolOrigin;
import sigil.symbol.SymbolPosition;
import sigil.util.annotation.Nullable;
import sigil.util.condition.ConditionContext;

/**
 * Renders {@link SymbolOrigin}s for diagnostics: a location line, followed by the lines around the start of the
 * origin with the origin underlined by carets.
 * <p>
 * For example, an origin covering {@code b} on the second line of {@code "[a\n [b]]"} is printed as:
 * <pre>
 * At location: [Ln: 2, Col: 3] thru [Ln: 2, Col: 4]
 * In context:
 *
 * [a
 *  [b]]
 *   ^
 * </pre>
 */
public final class OriginPrinter {
    private OriginPrinter() {
    }

    /**
     * Prints the start of the given origin as {@code [Ln: line, Col: column]}.
     */
    public static String printStart(final SymbolOrigin origin) {
        return printPosition(origin.start());
    }

    /**
     * Prints the stop of the given origin as {@code [Ln: line, Col: column]}.
     */
    public static String printStop(final SymbolOrigin origin) {
        return printPosition(origin.stop());
    }

    /**
     * Prints the context of the given origin: up to {@value #linesBefore} lines before its start line, the start line
     * itself, an underline, and up to {@value #linesAfter} lines after.
     * <p>
     * Origins spanning multiple lines get a fixed underline rather than an exact one.
     * <p>
     * This method never fails. If the origin doesn't fit its source, the problem is signaled as a
     * {@link sigil.util.condition.SuppressedExceptionCondition} and a fallback message is returned.
     */
    public static String printContext(final SymbolOrigin origin) {
        try {
            return printContextUnchecked(origin);
        } catch (final IndexOutOfBoundsException | IllegalArgumentException e) {
            ConditionContext.signalSuppressedException(e);
            return contextFallback;
        }
    }

    /**
     * Prints the location of the given origin followed by its context.
     */
    public static String print(final SymbolOrigin origin) {
        return "At location: " + printStart(origin) + " thru " + printStop(origin) + '\n'
            + "In context:\n"
            + '\n'
            + printContext(origin);
    }

    /**
     * Prints the given origin if there is one, otherwise returns a message saying it's unknown.
     */
    public static String tryPrint(final @Nullable SymbolOrigin origin) {
        return (origin != null) ? print(origin) : unknownOrigin;
    }

    private static String printPosition(final SymbolPosition position) {
        return "[Ln: " + position.line() + ", Col: " + position.column() + ']';
    }

    private static String printContextUnchecked(final SymbolOrigin origin) {
        final var lines = Arrays.asList(origin.source().text().split(lineTerminators, -1));
        final var start = origin.start();
        final var stop = origin.stop();
        final var lineIndex = start.line() - 1;
        final var firstLineIndex = Math.max(0, lineIndex - linesBefore);

        // subList throws for a start line outside the text, which is what we want.
        final var before = String.join("\n", lines.subList(firstLineIndex, lineIndex + 1));
        final var lastLineIndex = Math.min(lines.size(), lineIndex + 1 + linesAfter);
        final var after = String.join("\n", lines.subList(lineIndex + 1, lastLineIndex));
        final var underline = " ".repeat(start.column() - 1)
            + ((start.line() == stop.line()) ? "^".repeat(stop.column() - start.column()) : multiLineUnderline);

        final var builder = new StringBuilder();
        if (!before.isEmpty()) {
            builder.append(before).append('\n');
        }
        builder.append(underline);
        if (!after.isEmpty()) {
            builder.append('\n').append(after);
        }
        return builder.toString();
    }

    // The same line ends the reader counts lines by.
    private static final String lineTerminators = "\r\n|\r|\n";
    private static final int linesBefore = 3;
    private static final int linesAfter = 4;
    private static final String multiLineUnderline = "^^^^^^^";
    private static final String contextFallback = "Error creating violation context.";
    private static final String unknownOrigin = "Error origin unknown or not applicable.";
}
