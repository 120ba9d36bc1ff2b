package com.prqlc.generator;

import com.prqlc.dialect.Dialect;
import com.prqlc.dialect.DialectHandler;
import com.prqlc.exception.GenerationException;
import com.prqlc.rq.RelationalQuery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * SQL generator that converts relational queries (RQ) to SQL text.
 *
 * <p>Operators are assigned to the clauses of as few SELECT statements as
 * possible; a new SELECT, wrapped in a CTE, is started only when an operator
 * cannot share the clauses already claimed (see {@link Segment}). Literals,
 * identifiers and functions are rendered for the target dialect.
 *
 * <p>Example usage:
 * <pre>
 *   RelationalQuery rq = ...;
 *   SQLGenerator generator = new SQLGenerator(Dialect.POSTGRES, true);
 *   String sql = generator.generate(rq);
 * </pre>
 *
 * <p>Generators hold no state between calls and may be shared.
 *
 * @see RelationalQuery
 */
public class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    private final DialectHandler handler;
    private final boolean pretty;

    /**
     * Creates a new SQL generator.
     *
     * @param dialect the target dialect
     * @param pretty whether to print one clause per line
     */
    public SQLGenerator(Dialect dialect, boolean pretty) {
        this.handler = new DialectHandler(Objects.requireNonNull(dialect, "dialect must not be null"));
        this.pretty = pretty;
    }

    public Dialect dialect() {
        return handler.dialect();
    }

    /**
     * Generates SQL for a relational query.
     *
     * @param query the query to translate
     * @return the generated SQL
     * @throws GenerationException if the dialect cannot express the query
     */
    public String generate(RelationalQuery query) {
        return generate(query, null);
    }

    /**
     * Generates SQL for a relational query, followed by a comment line.
     *
     * @param query the query to translate
     * @param signatureComment the comment text without the leading {@code --}, or null for none
     * @return the generated SQL
     * @throws GenerationException if the dialect cannot express the query
     */
    public String generate(RelationalQuery query, String signatureComment) {
        Objects.requireNonNull(query, "query must not be null");

        String sql;
        try {
            sql = new QuerySplitter(handler).split(query).render(pretty);
        } catch (GenerationException e) {
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new GenerationException("Unexpected error during SQL generation: " + e.getMessage(), e,
                query.main().kind());
        }

        if (signatureComment != null) {
            sql = sql + "\n\n-- " + signatureComment + "\n";
        }
        logger.debug("Generated {} SQL:\n{}", handler.dialect(), sql);
        return sql;
    }
}
