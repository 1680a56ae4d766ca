// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.test;

import sigil.symbol.Lexicon;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class LexiconTest {
    @Test
    void classifiesCharacters() {
        assertThat(Lexicon.isWhitespaceChar(' ')).isTrue();
        assertThat(Lexicon.isWhitespaceChar('\r')).isTrue();
        assertThat(Lexicon.isWhitespaceChar('_')).isFalse();
        assertThat(Lexicon.isStructureChar('.')).isTrue();
        assertThat(Lexicon.isStructureChar('`')).isTrue();
        assertThat(Lexicon.isStructureChar('"')).isTrue();
        assertThat(Lexicon.isStructureChar('(')).isFalse();
        assertThat(Lexicon.isNonAtomChar('\t')).isTrue();
        assertThat(Lexicon.isNonAtomChar('$')).isFalse();
    }

    @Test
    void reservedCharsAreIllegalInNames() {
        assertThat(Lexicon.isIllegalNameChar('$')).isTrue();
        assertThat(Lexicon.isIllegalNameChar(':')).isTrue();
        assertThat(Lexicon.isIllegalNameChar('#')).isTrue();
        assertThat(Lexicon.isIllegalNameChar('_')).isFalse();
        assertThat(Lexicon.isValidName("Entity_1")).isTrue();
        assertThat(Lexicon.isValidName("")).isFalse();
        assertThat(Lexicon.isValidName("a:b")).isFalse();
        assertThat(Lexicon.isValidName("a b")).isFalse();
    }

    @Test
    void distillsExplicitStrings() {
        assertThat(Lexicon.isExplicit("\"a\"")).isTrue();
        assertThat(Lexicon.isExplicit("\"")).isFalse();
        assertThat(Lexicon.distill("\"a b\"")).isEqualTo("a b");
        assertThat(Lexicon.distill("\"\"")).isEmpty();
        assertThat(Lexicon.distill("a\"")).isEqualTo("a\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-5", "+5", "0.0f", "1.", "1e10", "1E-3", "0x1F", "0X1.8p-3", "10UL"})
    void recognizesNumbers(final String string) {
        assertThat(Lexicon.isNumber(string)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "-", ".", ".5", "-.5", "1e", "0x", "5x9y", "a1", "1 ", "0xG"})
    void rejectsNonNumbers(final String string) {
        assertThat(Lexicon.isNumber(string)).isFalse();
    }

    @Test
    void recognizesColors() {
        assertThat(Lexicon.isColor("#FF000080")).isTrue();
        assertThat(Lexicon.isColor("#ffffffffffffffff")).isTrue();
        assertThat(Lexicon.isColor("#1ffffffffffffffff")).isFalse();
        assertThat(Lexicon.isColor("#")).isFalse();
        assertThat(Lexicon.isColor("#xyz")).isFalse();
        assertThat(Lexicon.isColor("#+F")).isFalse();
        assertThat(Lexicon.isColor("#-F")).isFalse();
        assertThat(Lexicon.isColor("#\uFF26\uFF26")).isFalse();
        assertThat(Lexicon.isColor("FF")).isFalse();
    }

    @Test
    void decidesExplicitness() {
        assertThat(Lexicon.shouldBeExplicit("abc")).isFalse();
        assertThat(Lexicon.shouldBeExplicit("a b")).isTrue();
        assertThat(Lexicon.shouldBeExplicit("a\u00A0b")).isFalse();
        assertThat(Lexicon.shouldBeExplicit("a\u2003b")).isTrue();
        assertThat(Lexicon.shouldBeExplicit("a\tb")).isTrue();
        assertThat(Lexicon.shouldBeExplicit("a.b")).isTrue();
        assertThat(Lexicon.shouldBeExplicit("`a")).isTrue();
        assertThat(Lexicon.shouldBeExplicit("#FF")).isFalse();
        assertThat(Lexicon.shouldBeExplicit("#FF GG")).isTrue();
        assertThat(Lexicon.shouldBeExplicit("a\"b")).isFalse();
    }
}
