// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.test;

import sigil.symbol.Symbol;
import sigil.symbol.conversion.ConversionErrorCondition;
import sigil.symbol.conversion.Conversions;
import sigil.symbol.reader.Reader;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ConversionsTest {
    @Test
    void failureNamesSourceSymbol() {
        final var symbol = Reader.read("[a b]", "data.sigil");
        final var condition = ConditionCapture.captureError(
            ConversionErrorCondition.class,
            () -> Conversions.fail("Expected a number.", symbol)
        );
        assertThat(condition.symbol()).isSameAs(symbol);
        assertThat(condition.message()).isEqualTo("Expected a number.\nConversion source: [a b]");
        assertThat(condition.detailedMessage()).isEqualTo(
            "Expected a number.\nConversion source: [a b]\n"
                + "At location: [Ln: 1, Col: 1] thru [Ln: 1, Col: 6]\n"
                + "In context:\n"
                + "\n"
                + "[a b]\n"
                + "^^^^^"
        );
    }

    @Test
    void failureWithoutSymbol() {
        final var condition = ConditionCapture.captureError(
            ConversionErrorCondition.class,
            () -> Conversions.fail("Invalid conversion.", null)
        );
        assertThat(condition.symbol()).isNull();
        assertThat(condition.message()).isEqualTo("Invalid conversion.\nConversion source not available.");
        assertThat(condition.detailedMessage()).isEqualTo(condition.message());
    }

    @Test
    void failureWithSynthesizedSymbol() {
        final var condition = ConditionCapture.captureError(
            ConversionErrorCondition.class,
            () -> Conversions.fail("Invalid conversion.", new Symbol.Atom("a b"))
        );
        assertThat(condition.message()).isEqualTo("Invalid conversion.\nConversion source: \"a b\"");
        assertThat(condition.detailedMessage()).endsWith("\nError origin unknown or not applicable.");
    }
}
