package com.prqlc.parser;

import com.prqlc.exception.ParseException;
import com.prqlc.pl.Span;

/**
 * Helpers for the text of string tokens: quote stripping and escape processing.
 */
final class StringLiterals {

    private StringLiterals() {
    }

    /**
     * Returns the number of quote characters delimiting {@code quoted} (1 or 3).
     */
    static int quoteWidth(String quoted) {
        if (quoted.length() >= 6 && (quoted.startsWith("\"\"\"") || quoted.startsWith("'''"))) {
            return 3;
        }
        return 1;
    }

    /**
     * Strips the delimiting quotes from a string token, without a prefix.
     */
    static String unquote(String quoted) {
        int width = quoteWidth(quoted);
        return quoted.substring(width, quoted.length() - width);
    }

    /**
     * Processes backslash escapes.
     *
     * @param text the raw string content
     * @param span span of the content, used for error reporting
     * @return the unescaped text
     */
    static String unescape(String text, Span span) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = text.charAt(i + 1);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '\\', '"', '\'', '`', '/' -> sb.append(next);
                case 'u' -> {
                    int close = text.indexOf('}', i);
                    if (i + 2 >= text.length() || text.charAt(i + 2) != '{' || close < 0) {
                        throw new ParseException("invalid unicode escape, expected `\\u{XXXX}`", span);
                    }
                    String hex = text.substring(i + 3, close);
                    try {
                        sb.appendCodePoint(Integer.parseInt(hex, 16));
                    } catch (IllegalArgumentException e) {
                        throw new ParseException("invalid unicode escape `\\u{" + hex + "}`", span);
                    }
                    i = close + 1;
                    continue;
                }
                case 'x' -> {
                    if (i + 4 > text.length()) {
                        throw new ParseException("invalid escape `\\x`, expected two hex digits", span);
                    }
                    String hex = text.substring(i + 2, i + 4);
                    try {
                        sb.append((char) Integer.parseInt(hex, 16));
                    } catch (NumberFormatException e) {
                        throw new ParseException("invalid escape `\\x" + hex + "`", span);
                    }
                    i += 4;
                    continue;
                }
                default -> throw new ParseException("unknown escape sequence `\\" + next + "`", span);
            }
            i += 2;
        }
        return sb.toString();
    }
}
