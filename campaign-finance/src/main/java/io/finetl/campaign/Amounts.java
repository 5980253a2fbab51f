package io.finetl.campaign;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses monetary cells. The publisher writes decimal commas ({@code 1500,00}); other sources use points. When both
 * separators occur the last one is the decimal separator and the other is grouping.
 */
public final class Amounts {
    private Amounts() {}

    private static final Pattern PLAIN = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.strip();
        if (s.isEmpty()) return Optional.empty();
        int comma = s.lastIndexOf(',');
        int point = s.lastIndexOf('.');
        if (comma >= 0 && point >= 0) {
            s = comma > point
                    ? s.replace(".", "").replace(',', '.')
                    : s.replace(",", "");
        } else if (comma >= 0) {
            if (s.indexOf(',') != comma) return Optional.empty();
            s = s.replace(',', '.');
        }
        if (!PLAIN.matcher(s).matches()) return Optional.empty();
        return Optional.of(new BigDecimal(s));
    }
}
