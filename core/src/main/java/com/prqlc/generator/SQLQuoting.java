package com.prqlc.generator;

import com.prqlc.dialect.Dialect;

import java.util.Set;

/**
 * Utilities for quoting SQL identifiers and literals.
 *
 * <p>Identifiers are quoted only when they need it, which keeps the generated
 * SQL readable. Identifiers that need quoting include:
 * <ul>
 *   <li>Reserved words (SELECT, FROM, WHERE, etc.)</li>
 *   <li>Names with characters other than letters, digits and underscores</li>
 *   <li>Names with uppercase letters, which most databases would fold</li>
 *   <li>Names starting with digits</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("user id", Dialect.GENERIC);
 *   // Result: "user id"
 *
 *   SQLQuoting.quoteIdentifierIfNeeded("user id", Dialect.MYSQL);
 *   // Result: `user id`
 *
 *   SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "ORDER", "HAVING", "JOIN", "LEFT", "RIGHT",
        "INNER", "OUTER", "FULL", "CROSS", "ON", "USING", "AS", "AND", "OR", "NOT", "IN",
        "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END", "NULL", "TRUE", "FALSE", "UNION",
        "INTERSECT", "EXCEPT", "LIMIT", "OFFSET", "ALL", "DISTINCT", "IS", "BETWEEN", "LIKE",
        "ILIKE", "ASC", "DESC", "NULLS", "WITH", "TABLE", "TOP", "FETCH", "ROWS", "OVER",
        "PARTITION", "RANGE", "INTERVAL", "DEFAULT", "CAST", "CREATE", "INSERT", "UPDATE",
        "DELETE", "INTO", "VALUES", "KEY", "PRIMARY", "WINDOW");

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier with the dialect's quote character, escaping
     * embedded quote characters by doubling them.
     *
     * @param identifier the identifier to quote
     * @param dialect the target dialect
     * @return the quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier, Dialect dialect) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String quote = String.valueOf(dialect.identQuote());
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    /**
     * Quotes a string literal value. Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return the quoted literal
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Quotes an identifier only if needed.
     *
     * @param identifier the identifier to conditionally quote
     * @param dialect the target dialect
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier, Dialect dialect) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier, dialect) : identifier;
    }

    /**
     * Quotes a possibly schema-qualified table name such as {@code db.schema.table},
     * quoting each part on its own.
     *
     * <p>BigQuery names are quoted as a whole, since project names may contain
     * dashes and the backticks span the full path.
     *
     * @param tableName the table name
     * @param dialect the target dialect
     * @return the quoted table name
     */
    public static String quoteTableName(String tableName, Dialect dialect) {
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        if (dialect == Dialect.BIGQUERY) {
            boolean needed = false;
            for (String part : tableName.split("\\.", -1)) {
                needed |= part.isEmpty() || needsQuoting(part);
            }
            return needed ? quoteIdentifier(tableName, dialect) : tableName;
        }
        String[] parts = tableName.split("\\.", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(quoteIdentifierIfNeeded(parts[i], dialect));
        }
        return sb.toString();
    }

    /**
     * Checks if an identifier needs quoting.
     *
     * @param identifier the identifier to check
     * @return true if quoting is needed
     */
    static boolean needsQuoting(String identifier) {
        if (identifier.isEmpty()) {
            return true;
        }

        char first = identifier.charAt(0);
        if (!(first >= 'a' && first <= 'z') && first != '_') {
            return true;
        }

        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            boolean plain = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '$';
            if (!plain) {
                return true;
            }
        }

        return isReservedWord(identifier.toUpperCase());
    }

    /**
     * Checks if a word is a SQL reserved word.
     *
     * @param word the word to check (should be uppercase)
     * @return true if reserved
     */
    static boolean isReservedWord(String word) {
        return RESERVED_WORDS.contains(word);
    }
}
