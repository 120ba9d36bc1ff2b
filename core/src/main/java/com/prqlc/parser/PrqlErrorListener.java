package com.prqlc.parser;

import com.prqlc.exception.ParseException;
import com.prqlc.pl.Span;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts ANTLR lexer and parser errors into {@link ParseException}s.
 *
 * <p>Reports the first error only: the exception aborts parsing. Dedicated error
 * tokens of the lexer (bad numbers, unknown string prefixes, unterminated strings)
 * are turned into specific messages instead of a generic "unexpected token".
 */
public class PrqlErrorListener extends BaseErrorListener {

    private static final int MAX_EXPECTED_IN_HINT = 8;

    private final int offset;

    /**
     * @param offset added to every reported position; non-zero when parsing an
     *               expression embedded in an interpolated string
     */
    public PrqlErrorListener(int offset) {
        this.offset = offset;
    }

    public PrqlErrorListener() {
        this(0);
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        if (offendingSymbol instanceof Token token) {
            throw parserError(recognizer, token);
        }
        throw lexerError(msg, e);
    }

    private ParseException parserError(Recognizer<?, ?> recognizer, Token token) {
        Span span = spanOf(token);
        String text = token.getText();

        switch (token.getType()) {
            case PrqlLexer.INVALID_NUMBER:
                return new ParseException(ParseException.INVALID_NUMBER,
                    "invalid numeric literal `" + text + "`", span);
            case PrqlLexer.UNKNOWN_PREFIX_STRING:
                return new ParseException(ParseException.UNKNOWN_STRING_PREFIX,
                    "unknown string prefix `" + text.charAt(0) + "`", span,
                    List.of("valid prefixes are `s` (SQL splice), `f` (format) and `r` (raw)"));
            case PrqlLexer.UNTERMINATED_STRING:
                return new ParseException(ParseException.UNTERMINATED,
                    "unterminated string", span,
                    List.of("add the closing quote " + text.charAt(0)));
            default:
                break;
        }

        List<String> expected = expectedTokens(recognizer);
        List<String> hints = new ArrayList<>();
        if (!expected.isEmpty() && expected.size() <= MAX_EXPECTED_IN_HINT) {
            hints.add("expected one of " + String.join(", ", expected));
        }

        if (token.getType() == Token.EOF) {
            boolean closing = expected.stream().anyMatch(t -> t.equals("`)`") || t.equals("`]`") || t.equals("`}`"));
            if (closing) {
                return new ParseException(ParseException.UNTERMINATED, "unterminated bracket", span, hints);
            }
            return new ParseException(ParseException.UNEXPECTED_TOKEN, "unexpected end of input", span, hints);
        }
        String shown = token.getType() == PrqlLexer.NEWLINE ? "new line" : "`" + text + "`";
        return new ParseException(ParseException.UNEXPECTED_TOKEN, "unexpected " + shown, span, hints);
    }

    private ParseException lexerError(String msg, RecognitionException e) {
        if (e instanceof LexerNoViableAltException lexError) {
            int start = lexError.getStartIndex() + offset;
            String symbol = lexError.getInputStream()
                .getText(Interval.of(lexError.getStartIndex(), lexError.getStartIndex()));
            return new ParseException(ParseException.UNEXPECTED_TOKEN,
                "unexpected character `" + symbol + "`", new Span(start, start + 1));
        }
        return new ParseException(ParseException.UNEXPECTED_TOKEN, msg, null);
    }

    private static List<String> expectedTokens(Recognizer<?, ?> recognizer) {
        List<String> names = new ArrayList<>();
        if (!(recognizer instanceof Parser parser)) {
            return names;
        }
        IntervalSet expected;
        try {
            expected = parser.getExpectedTokens();
        } catch (IllegalArgumentException | IllegalStateException ex) {
            return names;
        }
        for (int type : expected.toList()) {
            String literal = parser.getVocabulary().getLiteralName(type);
            if (literal != null) {
                names.add("`" + literal.substring(1, literal.length() - 1) + "`");
            } else if (type == Token.EOF) {
                names.add("end of input");
            } else if (type == PrqlLexer.NEWLINE) {
                names.add("new line");
            } else {
                names.add(parser.getVocabulary().getSymbolicName(type).toLowerCase().replace('_', ' '));
            }
        }
        return names;
    }

    private Span spanOf(Token token) {
        int start = token.getStartIndex();
        int stop = token.getStopIndex();
        if (start < 0) {
            return null;
        }
        int end = stop >= start ? stop + 1 : start;
        return new Span(start + offset, end + offset);
    }
}
