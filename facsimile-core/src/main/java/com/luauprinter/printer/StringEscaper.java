package com.luauprinter.printer;

/**
 * Escapes string contents for a quoted Luau string literal.
 */
public final class StringEscaper {

    private StringEscaper() {
    }

    /**
     * Escapes {@code value} for a literal delimited by {@code quote}. Only the
     * chosen quote character is escaped; backslashes and control characters
     * always are.
     */
    public static String escape(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == quote) {
                sb.append('\\').append(c);
            } else {
                appendEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes one segment of an interpolated string. Braces and backticks
     * are escaped as well since they delimit segments.
     */
    public static String escapeInterpolated(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '`' || c == '{' || c == '}') {
                sb.append('\\').append(c);
            } else {
                appendEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, char c) {
        switch (c) {
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            case '\u0007' -> sb.append("\\a");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            case '\u000B' -> sb.append("\\v");
            default -> {
                if (c < ' ' || c == 127) {
                    sb.append('\\').append(String.format("%03d", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
    }
}
