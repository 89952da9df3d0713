package com.valan.harvester.crawl.extract;

/**
 * Parses amounts written in Dutch or English notation, with spaces (including the
 * typographic spaces PDFs produce) as digit grouping.
 */
public final class MonetaryValueParser {
    static final String GROUPING_CHARS = " \u00A0\u2008\u2009\u202F";
    public static final double MIN_EXCLUSIVE = 100.0;
    public static final double MAX_EXCLUSIVE = 1_000_000_000.0;

    private MonetaryValueParser() {
    }

    /**
     * With both separators present the rightmost one is the decimal mark. A lone comma
     * is decimal only when exactly two digits follow the last one. A lone period is
     * decimal when it occurs once, so {@code 1.234} parses as 1.234, and a thousands
     * separator when repeated, so {@code 1.234.567} parses as 1234567.
     *
     * @throws NumberFormatException when the remaining text is not a number
     */
    public static double parse(String raw) {
        if (raw == null) {
            throw new NumberFormatException("null amount");
        }
        StringBuilder digits = new StringBuilder(raw.length());
        for (char c : raw.trim().toCharArray()) {
            if (GROUPING_CHARS.indexOf(c) < 0) {
                digits.append(c);
            }
        }
        String value = digits.toString();
        int lastComma = value.lastIndexOf(',');
        int lastPeriod = value.lastIndexOf('.');
        if (lastComma >= 0 && lastPeriod >= 0) {
            if (lastComma > lastPeriod) {
                value = value.replace(".", "").replace(',', '.');
            } else {
                value = value.replace(",", "");
            }
        } else if (lastComma >= 0) {
            if (value.length() - lastComma - 1 == 2) {
                value = value.replace(',', '.');
            } else {
                value = value.replace(",", "");
            }
        } else if (lastPeriod >= 0 && value.indexOf('.') != lastPeriod) {
            value = value.replace(".", "");
        }
        if (value.isEmpty()) {
            throw new NumberFormatException("empty amount: " + raw);
        }
        return Double.parseDouble(value);
    }

    public static boolean isPlausible(Double value) {
        return value != null && value > MIN_EXCLUSIVE && value < MAX_EXCLUSIVE;
    }
}
