package com.search.negatives.bulk;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal RFC 4180 line handling shared by the loaders and exporters.
 * Quoted fields may contain commas and doubled quotes but not line breaks.
 */
final class CsvSupport {

    private CsvSupport() {
    }

    /**
     * Splits one CSV line into cells, unquoting quoted cells.
     */
    static List<String> parseLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }

    static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    static String number(Double value) {
        return value == null ? "" : number(value.doubleValue());
    }

    static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Parses an ad platform number: thousands separators, currency signs, percent
     * signs and surrounding spaces are ignored. Blank, {@code --} and unparsable
     * values yield {@code null}.
     */
    static Double parseNumber(String raw) {
        if (raw == null) return null;
        String cleaned = raw.trim().replaceAll("[,$\\u20AC\\u00A3\\u00A5%\\s]", "");
        if (cleaned.isEmpty() || cleaned.equals("--") || cleaned.equals("-")) {
            return null;
        }
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String stripBom(String header) {
        return header != null && header.startsWith("\uFEFF") ? header.substring(1) : header;
    }
}
