package com.prqlc.parser;

import com.prqlc.exception.ParseException;
import com.prqlc.pl.Expr;
import com.prqlc.pl.Stmt;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for parsing PRQL source text into the PL AST.
 *
 * <p>Wraps the ANTLR4-generated parser with:
 * <ul>
 *   <li>SLL-first, LL-fallback two-phase parsing</li>
 *   <li>Structured errors via {@link PrqlErrorListener}</li>
 *   <li>Thread-safety via a ThreadLocal parser pool</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 *   List&lt;Stmt&gt; stmts = PrqlSourceParser.getInstance().parse("from employees | take 10");
 * </pre>
 */
public class PrqlSourceParser {

    private static final Logger logger = LoggerFactory.getLogger(PrqlSourceParser.class);

    private static final ThreadLocal<PrqlSourceParser> PARSER_POOL =
        ThreadLocal.withInitial(PrqlSourceParser::new);

    private final PrqlLexer lexer;
    private final CommonTokenStream tokens;
    private final PrqlParser parser;

    public PrqlSourceParser() {
        this.lexer = new PrqlLexer(CharStreams.fromString(""));
        this.tokens = new CommonTokenStream(lexer);
        this.parser = new PrqlParser(tokens);
    }

    /**
     * Returns the thread-local parser instance.
     *
     * @return parser for the current thread
     */
    public static PrqlSourceParser getInstance() {
        return PARSER_POOL.get();
    }

    /**
     * Parses a complete source into statements.
     *
     * @param source the PRQL source text
     * @return the statements in source order
     * @throws ParseException if the source is syntactically invalid
     */
    @SuppressWarnings("unchecked")
    public List<Stmt> parse(String source) {
        if (source == null) {
            throw new ParseException("source must not be null", null);
        }
        logger.debug("Parsing PRQL source ({} chars)", source.length());

        reset(source, 0);
        PrqlParser.SourceContext tree;
        try {
            tree = parser.source();
        } catch (ParseCancellationException e) {
            logger.debug("SLL parse failed, falling back to LL mode");
            fallbackToLL(0);
            tree = parser.source();
        }

        List<Stmt> stmts = (List<Stmt>) new PrqlAstBuilder(0).visit(tree);
        logger.debug("Parsed {} statement(s)", stmts.size());
        return stmts;
    }

    /**
     * Parses an expression embedded in an interpolated string.
     *
     * @param text the expression text
     * @param offset position of {@code text} in the enclosing source
     * @return the parsed expression, with spans relative to the enclosing source
     */
    Expr parseEmbedded(String text, int offset) {
        // Embedded parses may run while an outer parse of the same thread is in progress.
        PrqlSourceParser nested = new PrqlSourceParser();
        nested.reset(text, offset);
        PrqlParser.StandaloneExprContext tree;
        try {
            tree = nested.parser.standaloneExpr();
        } catch (ParseCancellationException e) {
            nested.fallbackToLL(offset);
            tree = nested.parser.standaloneExpr();
        }
        return (Expr) new PrqlAstBuilder(offset).visit(tree);
    }

    private void reset(String source, int offset) {
        lexer.setInputStream(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new PrqlErrorListener(offset));
        tokens.setTokenSource(lexer);
        parser.setTokenStream(tokens);

        // Phase 1: SLL with bail-out
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
    }

    private void fallbackToLL(int offset) {
        // Phase 2: full LL with error reporting
        tokens.seek(0);
        parser.reset();
        parser.getInterpreter().setPredictionMode(PredictionMode.LL);
        parser.removeErrorListeners();
        parser.addErrorListener(new PrqlErrorListener(offset));
        parser.setErrorHandler(new DefaultErrorStrategy());
    }
}
