package com.prqlc.dialect;

import java.util.Map;

/**
 * Translates strftime-style date formats, as written in queries, into the
 * format syntax of a dialect's date formatting function.
 *
 * <p>Supported specifiers: {@code %Y %y %m %d %H %I %M %S %b %B %a %A %p %j %F %T %%}
 * and the fractional seconds {@code %.3f} and {@code %.6f}. Padding flags
 * ({@code %-d}) are accepted and ignored.
 */
public final class DateFormats {

    private static final Map<String, String> POSTGRES = Map.ofEntries(
        Map.entry("Y", "YYYY"),
        Map.entry("y", "YY"),
        Map.entry("m", "MM"),
        Map.entry("d", "DD"),
        Map.entry("H", "HH24"),
        Map.entry("I", "HH12"),
        Map.entry("M", "MI"),
        Map.entry("S", "SS"),
        Map.entry("b", "Mon"),
        Map.entry("B", "Month"),
        Map.entry("a", "Dy"),
        Map.entry("A", "Day"),
        Map.entry("p", "AM"),
        Map.entry("j", "DDD"),
        Map.entry(".3f", "MS"),
        Map.entry(".6f", "US"),
        Map.entry("%", "%"));

    private static final Map<String, String> MSSQL = Map.ofEntries(
        Map.entry("Y", "yyyy"),
        Map.entry("y", "yy"),
        Map.entry("m", "MM"),
        Map.entry("d", "dd"),
        Map.entry("H", "HH"),
        Map.entry("I", "hh"),
        Map.entry("M", "mm"),
        Map.entry("S", "ss"),
        Map.entry("b", "MMM"),
        Map.entry("B", "MMMM"),
        Map.entry("a", "ddd"),
        Map.entry("A", "dddd"),
        Map.entry("p", "tt"),
        Map.entry(".3f", "fff"),
        Map.entry(".6f", "ffffff"),
        Map.entry("%", "%"));

    private static final Map<String, String> MYSQL = Map.ofEntries(
        Map.entry("Y", "%Y"),
        Map.entry("y", "%y"),
        Map.entry("m", "%m"),
        Map.entry("d", "%d"),
        Map.entry("H", "%H"),
        Map.entry("I", "%h"),
        Map.entry("M", "%i"),
        Map.entry("S", "%S"),
        Map.entry("b", "%b"),
        Map.entry("B", "%M"),
        Map.entry("a", "%a"),
        Map.entry("A", "%W"),
        Map.entry("p", "%p"),
        Map.entry("j", "%j"),
        Map.entry(".6f", "%f"),
        Map.entry("%", "%%"));

    /**
     * Format syntax families.
     */
    public enum Style {
        POSTGRES,
        MSSQL,
        MYSQL,
        STRFTIME
    }

    private DateFormats() {
    }

    /**
     * Returns the format syntax used by a dialect, or null if the dialect has no
     * date formatting function.
     */
    public static Style styleOf(Dialect dialect) {
        return switch (dialect) {
            case GENERIC, ANSI, POSTGRES, SNOWFLAKE -> Style.POSTGRES;
            case MSSQL -> Style.MSSQL;
            case MYSQL, CLICKHOUSE -> Style.MYSQL;
            case DUCKDB, SQLITE, BIGQUERY, HIVE -> Style.STRFTIME;
            case GLAREDB -> null;
        };
    }

    /**
     * Translates a format.
     *
     * @param format the strftime-style format
     * @param style the target syntax
     * @return the translated format
     * @throws IllegalArgumentException if the format uses a specifier the target
     *         cannot express
     */
    public static String translate(String format, Style style) {
        if (style == Style.STRFTIME) {
            return format;
        }
        Map<String, String> table = switch (style) {
            case POSTGRES -> POSTGRES;
            case MSSQL -> MSSQL;
            default -> MYSQL;
        };

        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }
            i++;
            if (i < format.length() && "-_0".indexOf(format.charAt(i)) >= 0) {
                i++;
            }
            if (i >= format.length()) {
                throw new IllegalArgumentException("Date format ends with an incomplete specifier: " + format);
            }
            String specifier;
            if (format.charAt(i) == '.' && i + 2 < format.length()) {
                specifier = format.substring(i, i + 3);
                i += 3;
            } else {
                specifier = String.valueOf(format.charAt(i));
                i++;
            }
            switch (specifier) {
                case "F" -> out.append(translate("%Y-%m-%d", style));
                case "T" -> out.append(translate("%H:%M:%S", style));
                default -> {
                    String translated = table.get(specifier);
                    if (translated == null) {
                        throw new IllegalArgumentException(
                            "Date format specifier %" + specifier + " is not supported for " + style.name().toLowerCase());
                    }
                    out.append(translated);
                }
            }
        }
        return out.toString();
    }
}
