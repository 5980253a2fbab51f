package io.finetl.campaign;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Splits one decoded line into cells for a fixed delimiter. Quoted cells ({@code "a";"b"} or {@code "a","b"}) are
 * unwrapped; a line with unbalanced quotes is split on the bare delimiter instead.
 */
final class CellSplitter {
    private final Delimiter delimiter;
    private final CSVParser parser;
    private final Pattern plainSplit;

    CellSplitter(Delimiter delimiter) {
        this.delimiter = delimiter;
        if (delimiter == Delimiter.NONE) {
            this.parser = null;
            this.plainSplit = null;
        } else {
            this.parser = new CSVParserBuilder()
                    .withSeparator(delimiter.symbol())
                    .withQuoteChar('"')
                    .withEscapeChar(ICSVParser.NULL_CHARACTER)
                    .withIgnoreQuotations(false)
                    .build();
            this.plainSplit = Pattern.compile(Pattern.quote(String.valueOf(delimiter.symbol())));
        }
    }

    String[] split(String line) {
        if (delimiter == Delimiter.NONE) return new String[] {unquote(line)};
        try {
            return parser.parseLine(line);
        } catch (IOException unterminatedQuote) {
            return splitPlain(line);
        }
    }

    private String[] splitPlain(String line) {
        String[] cells = plainSplit.split(line, -1);
        for (int i = 0; i < cells.length; i++) cells[i] = unquote(cells[i]);
        return cells;
    }

    private static String unquote(String cell) {
        String s = cell.strip();
        if (s.length() >= 2 && s.charAt(0) == '"' && s.charAt(s.length() - 1) == '"') {
            return s.substring(1, s.length() - 1);
        }
        if (s.startsWith("\"")) return s.substring(1);
        if (s.endsWith("\"")) return s.substring(0, s.length() - 1);
        return s;
    }
}
