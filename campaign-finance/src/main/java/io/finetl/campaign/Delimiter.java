package io.finetl.campaign;

public enum Delimiter {
    SEMICOLON(';'),
    COMMA(','),
    /** No delimiter found on the header line; each line is a single cell. */
    NONE('\0');

    private final char symbol;

    Delimiter(char symbol) { this.symbol = symbol; }

    public char symbol() { return symbol; }

    static Delimiter sniff(String firstLine) {
        if (firstLine.indexOf(';') >= 0) return SEMICOLON;
        if (firstLine.indexOf(',') >= 0) return COMMA;
        return NONE;
    }
}
