// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.reader;

/**
 * The dialect of delimited text read by {@link CsvReader}.
 *
 * @param separator The character separating the fields of a record.
 * @param quote     The character enclosing quoted fields; doubled within a quoted field, it stands for itself.
 * @param hasHeader Whether the first record is a header, to be discarded.
 */
public record CsvFormat(char separator, char quote, boolean hasHeader) {
    public CsvFormat {
        assert separator != quote : "Separator and quote characters must differ";
        assert separator != '\n' && separator != '\r' && quote != '\n' && quote != '\r' : "Line breaks are reserved";
    }

    /**
     * Returns the RFC 4180 dialect: comma-separated, with double-quoted fields.
     */
    public static CsvFormat standard(final boolean hasHeader) {
        return new CsvFormat(',', '"', hasHeader);
    }
}
