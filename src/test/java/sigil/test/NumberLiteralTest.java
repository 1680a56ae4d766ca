// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.test;

import sigil.symbol.NumberLiteral;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class NumberLiteralTest {
    @Test
    void scansLiteralLength() {
        assertThat(NumberLiteral.scan("123 rest", 0)).isEqualTo(3);
        assertThat(NumberLiteral.scan("[-1.5e3]", 1)).isEqualTo(6);
        assertThat(NumberLiteral.scan("0x1.8p3]", 0)).isEqualTo(7);
        assertThat(NumberLiteral.scan("1.", 0)).isEqualTo(2);
        assertThat(NumberLiteral.scan("1.x", 0)).isEqualTo(3);
    }

    @Test
    void keepsAtMostFourSuffixLetters() {
        assertThat(NumberLiteral.scan("10UL", 0)).isEqualTo(4);
        assertThat(NumberLiteral.scan("10abcdef", 0)).isEqualTo(2 + NumberLiteral.maxSuffixLength);
    }

    @Test
    void rejectsIncompleteLiterals() {
        assertThat(NumberLiteral.scan("abc", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan("+", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan(".", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan("1e+", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan("0x.1", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan(".5", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan("-.5", 0)).isEqualTo(-1);
        assertThat(NumberLiteral.scan("5", 1)).isEqualTo(-1);
    }

    @Test
    void doesNotTreatUnicodeDigitsAsDigits() {
        assertThat(NumberLiteral.scan("\u0661", 0)).isEqualTo(-1);
    }
}
