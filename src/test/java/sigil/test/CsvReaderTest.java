// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.test;

import sigil.symbol.Symbol;
import sigil.symbol.SymbolOrigin;
import sigil.symbol.SymbolPosition;
import sigil.symbol.SymbolSource;
import sigil.symbol.Symbols;
import sigil.symbol.reader.CsvFormat;
import sigil.symbol.reader.CsvReader;
import sigil.symbol.reader.ReadErrorCondition;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class CsvReaderTest {
    @Test
    void readsRowsAfterHeader() {
        final var symbol = CsvReader.read("a,b\n1,[x y]", true, "table.csv");
        final var expected = Symbol.List.of(
            Symbol.List.of(
                new Symbol.Number("1"),
                Symbol.List.of(new Symbol.Atom("x"), new Symbol.Atom("y"))
            )
        );
        assertThat(Symbols.stripOrigins(symbol)).isEqualTo(expected);
    }

    @Test
    void wholeInputOriginIsZeroed() {
        final var text = "a,b\n1,2";
        final var symbol = CsvReader.read(text, false, "table.csv");
        assertThat(symbol.origin()).isEqualTo(new SymbolOrigin(
            new SymbolSource("table.csv", text),
            SymbolPosition.empty(),
            SymbolPosition.empty()
        ));
        final var rows = symbol.value();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).origin()).isNull();
    }

    @Test
    void headerOnlyYieldsNoRows() {
        assertThat(CsvReader.read("a,b\n", true, null).value()).isEmpty();
        assertThat(CsvReader.read("", true, null).value()).isEmpty();
    }

    @Test
    void convertsCells() {
        final var symbol = CsvReader.read(",hello world,\"#FF\",None,a.b,[x.0]", false, null);
        final var expected = Symbol.List.of(
            Symbol.List.of(
                new Symbol.Text(""),
                new Symbol.Text("hello world"),
                new Symbol.Text("#FF"),
                new Symbol.Atom("None"),
                new Symbol.Text("a.b"),
                Symbol.List.of(Symbol.List.of(new Symbol.Atom("Index"), new Symbol.Number("0"), new Symbol.Atom("x")))
            )
        );
        assertThat(Symbols.stripOrigins(symbol)).isEqualTo(expected);
    }

    @Test
    void handlesQuotedFields() {
        final var symbol = CsvReader.read("\"a, b\",\"say \"\"hi\"\"\",\"two\nlines\",\"plain\"", false, null);
        final var expected = Symbol.List.of(
            Symbol.List.of(
                new Symbol.Text("a, b"),
                new Symbol.Text("say \"hi\""),
                new Symbol.Text("two\nlines"),
                new Symbol.Atom("plain")
            )
        );
        assertThat(Symbols.stripOrigins(symbol)).isEqualTo(expected);
    }

    @Test
    void handlesLineBreaksAndBlankLines() {
        final var symbol = CsvReader.read("a\n\n\nb\r\nc\rd,\n", false, null);
        final var expected = Symbol.List.of(
            Symbol.List.of(new Symbol.Atom("a")),
            Symbol.List.of(new Symbol.Atom("b")),
            Symbol.List.of(new Symbol.Atom("c")),
            Symbol.List.of(new Symbol.Atom("d"), new Symbol.Text(""))
        );
        assertThat(Symbols.stripOrigins(symbol)).isEqualTo(expected);
    }

    @Test
    void readsCustomFormat() {
        final var symbol = CsvReader.read("h1;h2\n'a b';z;'it''s'", new CsvFormat(';', '\'', true), null);
        final var expected = Symbol.List.of(
            Symbol.List.of(new Symbol.Text("a b"), new Symbol.Atom("z"), new Symbol.Atom("it's"))
        );
        assertThat(Symbols.stripOrigins(symbol)).isEqualTo(expected);
    }

    @Test
    void unterminatedQuoteIsStructural() {
        final var condition = ConditionCapture.captureError(
            ReadErrorCondition.class,
            () -> CsvReader.read("a,\"open\nstill open", false, null)
        );
        assertThat(condition.kind()).isEqualTo(ReadErrorCondition.Kind.STRUCTURAL);
        assertThat(condition.origin().start()).isEqualTo(new SymbolPosition(2, 1, 3));
        assertThat(condition.message()).isEqualTo("Expected closing '\"' but found end of input");
    }

    @Test
    void failingCellIsTraced() {
        final var captured = ConditionCapture.captureErrorReport(() -> CsvReader.read("h\n[a\n", true, "table.csv"));
        assertThat(captured.condition()).isInstanceOf(ReadErrorCondition.class);
        assertThat(captured.report())
            .contains("Reading cell at row 2, column 1")
            .contains("Reading delimited text from table.csv");
    }
}
