package com.prqlc;

import com.prqlc.exception.ErrorMessages;
import com.prqlc.exception.PrqlException;
import com.prqlc.exception.ResolveException;
import com.prqlc.generator.SQLGenerator;
import com.prqlc.json.PlJson;
import com.prqlc.json.RqJson;
import com.prqlc.parser.PrqlSourceParser;
import com.prqlc.pl.QueryDef;
import com.prqlc.pl.Stmt;
import com.prqlc.rq.RelationalQuery;
import com.prqlc.semantic.Lowering;
import com.prqlc.semantic.ResolvedQuery;
import com.prqlc.semantic.Resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the PRQL compiler.
 *
 * <p>Compilation runs in three stages, each also available on its own:
 * <ol>
 *   <li>{@link #parse(String)}: source text to PL statements</li>
 *   <li>{@link #resolveAndLower(List, CompileOptions)}: PL to a relational query (RQ)</li>
 *   <li>{@link #generate(RelationalQuery, CompileOptions)}: RQ to SQL</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>
 *   String sql = Compiler.compile("from employees | select {name}", CompileOptions.defaults());
 * </pre>
 *
 * <p>All methods are stateless and thread-safe.
 */
public final class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    public static final String VERSION = "0.13.5";

    static final String SIGNATURE = "Generated by PRQL compiler version:" + VERSION + " (https://prql-lang.org)";

    private Compiler() {
    }

    // ==================== Compilation ====================

    /**
     * Compiles PRQL source to SQL.
     *
     * @param source the PRQL source
     * @param options the compile options
     * @return the SQL
     * @throws PrqlException if the source is invalid
     */
    public static String compile(String source, CompileOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        List<Stmt> stmts = parse(source);
        RelationalQuery rq = resolveAndLower(stmts, options);
        return generate(rq, options);
    }

    /**
     * Compiles PRQL source to SQL, reporting failures as structured messages
     * instead of exceptions.
     */
    public static CompileResult compileResult(String source, CompileOptions options) {
        try {
            return CompileResult.success(compile(source, options));
        } catch (PrqlException e) {
            logger.debug("Compilation failed: {}", e.getTechnicalMessage());
            return CompileResult.failure(ErrorMessages.from(e, source));
        }
    }

    /**
     * Parses PRQL source into PL statements.
     *
     * @throws com.prqlc.exception.ParseException if the source is syntactically invalid
     */
    public static List<Stmt> parse(String source) {
        return PrqlSourceParser.getInstance().parse(source);
    }

    /**
     * Resolves PL statements and lowers them to a relational query.
     *
     * <p>The version requirement of the query header is checked first.
     *
     * @throws com.prqlc.exception.UnsupportedVersionException if the query needs a newer compiler
     * @throws ResolveException if a name or call cannot be resolved
     * @throws com.prqlc.exception.LowerException if the query cannot be expressed as RQ
     */
    public static RelationalQuery resolveAndLower(List<Stmt> stmts, CompileOptions options) {
        Objects.requireNonNull(stmts, "stmts must not be null");
        Objects.requireNonNull(options, "options must not be null");

        QueryDef header = header(stmts);
        Lowering.checkVersion(header, VERSION);
        if (header != null && header.target() != null) {
            checkTarget(header);
        }

        ResolvedQuery resolved = new Resolver(options.catalog()).resolve(stmts);
        return new Lowering().lower(resolved);
    }

    /**
     * Generates SQL for a relational query.
     *
     * <p>A target recorded in the query overrides the target of the options.
     *
     * @throws com.prqlc.exception.GenerationException if the dialect cannot express the query
     */
    public static String generate(RelationalQuery rq, CompileOptions options) {
        Objects.requireNonNull(rq, "rq must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Target target = rq.target() != null ? Target.parse(rq.target()) : options.target();
        logger.debug("Generating SQL for target {}", target);
        SQLGenerator generator = new SQLGenerator(target.dialect(), options.format());
        return generator.generate(rq, options.signatureComment() ? SIGNATURE : null);
    }

    private static QueryDef header(List<Stmt> stmts) {
        for (Stmt stmt : stmts) {
            if (stmt instanceof QueryDef queryDef) {
                return queryDef;
            }
        }
        return null;
    }

    private static void checkTarget(QueryDef header) {
        try {
            Target.parse(header.target());
        } catch (IllegalArgumentException e) {
            throw ResolveException.invalidArgument(e.getMessage(), header.span());
        }
    }

    // ==================== JSON Exchange ====================

    /**
     * Parses PRQL source and returns its PL as JSON.
     */
    public static String parseToJson(String source) {
        return PlJson.toJson(parse(source));
    }

    /**
     * Reads PL statements from JSON.
     *
     * @throws IllegalArgumentException if the JSON is not a PL document
     */
    public static List<Stmt> plFromJson(String json) {
        return PlJson.fromJson(json);
    }

    public static String rqToJson(RelationalQuery rq) {
        return RqJson.toJson(rq);
    }

    /**
     * Reads a relational query from JSON.
     *
     * @throws IllegalArgumentException if the JSON is not an RQ document
     */
    public static RelationalQuery rqFromJson(String json) {
        return RqJson.fromJson(json);
    }

    /**
     * Resolves and lowers PL given as JSON, returning RQ as JSON.
     */
    public static String plToRqJson(String plJson) {
        return plToRqJson(plJson, CompileOptions.defaults());
    }

    public static String plToRqJson(String plJson, CompileOptions options) {
        return RqJson.toJson(resolveAndLower(PlJson.fromJson(plJson), options));
    }

    /**
     * Generates SQL for RQ given as JSON.
     */
    public static String rqToSql(String rqJson, CompileOptions options) {
        return generate(RqJson.fromJson(rqJson), options);
    }
}
