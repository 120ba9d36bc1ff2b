package com.prqlc.parser;

import com.prqlc.exception.ParseException;
import com.prqlc.pl.BinOp;
import com.prqlc.pl.BinaryExpr;
import com.prqlc.pl.Expr;
import com.prqlc.pl.FuncCall;
import com.prqlc.pl.Ident;
import com.prqlc.pl.Interpolation;
import com.prqlc.pl.Literal;
import com.prqlc.pl.Pipeline;
import com.prqlc.pl.QueryDef;
import com.prqlc.pl.Range;
import com.prqlc.pl.Stmt;
import com.prqlc.pl.Tuple;
import com.prqlc.pl.UnOp;
import com.prqlc.pl.UnaryExpr;
import com.prqlc.pl.VarDef;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PrqlSourceParser}: source text to PL statements.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PRQL Source Parser Tests")
public class PrqlSourceParserTest extends TestBase {

    private final PrqlSourceParser parser = PrqlSourceParser.getInstance();

    private List<Stmt> parse(String source) {
        logStep("Parsing: " + source);
        List<Stmt> stmts = parser.parse(source);
        logData("Statements", stmts);
        return stmts;
    }

    /** Parses {@code let x = <expr>} and returns the value. */
    private Expr letValue(String expr) {
        List<Stmt> stmts = parse("let x = " + expr);
        assertThat(stmts).hasSize(1);
        return ((VarDef) stmts.get(0)).value();
    }

    private static String parseErrorCode(Runnable action) {
        try {
            action.run();
        } catch (ParseException e) {
            return e.getCode();
        }
        throw new AssertionError("expected a parse error");
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("TC-PARSE-001: Main pipeline becomes a main declaration")
        void testMainPipeline() {
            List<Stmt> stmts = parse("from employees | select {name}");

            assertThat(stmts).hasSize(1);
            VarDef main = (VarDef) stmts.get(0);
            assertThat(main.kind()).isEqualTo(VarDef.Kind.MAIN);
            assertThat(main.name()).isEqualTo(VarDef.MAIN);

            Pipeline pipeline = (Pipeline) main.value();
            assertThat(pipeline.exprs()).hasSize(2);
            FuncCall from = (FuncCall) pipeline.exprs().get(0);
            assertThat(((Ident) from.name()).name()).isEqualTo("from");
            assertThat(((Ident) from.args().get(0)).name()).isEqualTo("employees");
            FuncCall select = (FuncCall) pipeline.exprs().get(1);
            assertThat(select.args().get(0)).isInstanceOf(Tuple.class);
        }

        @Test
        @DisplayName("TC-PARSE-002: Newlines separate pipeline steps")
        void testNewlinePipeline() {
            List<Stmt> stmts = parse("from employees\nfilter has_dog\ntake 3");

            Pipeline pipeline = (Pipeline) ((VarDef) stmts.get(0)).value();
            assertThat(pipeline.exprs()).hasSize(3);
        }

        @Test
        @DisplayName("TC-PARSE-003: Query header carries target and version")
        void testHeader() {
            List<Stmt> stmts = parse("prql target:sql.postgres version:\"0.13\"\nfrom employees");

            assertThat(stmts).hasSize(2);
            QueryDef header = (QueryDef) stmts.get(0);
            assertThat(header.target()).isEqualTo("sql.postgres");
            assertThat(header.version()).isEqualTo("0.13");
        }

        @Test
        @DisplayName("TC-PARSE-004: Aliased relation argument")
        void testAlias() {
            List<Stmt> stmts = parse("from e = employees");

            FuncCall from = (FuncCall) ((VarDef) stmts.get(0)).value();
            Expr source = from.args().get(0);
            assertThat(source.alias()).isEqualTo("e");
            assertThat(((Ident) source).name()).isEqualTo("employees");
        }

        @Test
        @DisplayName("TC-PARSE-005: Let declaration and into")
        void testLetAndInto() {
            List<Stmt> stmts = parse("let top = (from employees | take 5)\nfrom top\ninto result");

            assertThat(stmts).hasSize(2);
            VarDef let = (VarDef) stmts.get(0);
            assertThat(let.kind()).isEqualTo(VarDef.Kind.LET);
            assertThat(let.name()).isEqualTo("top");
            VarDef into = (VarDef) stmts.get(1);
            assertThat(into.kind()).isEqualTo(VarDef.Kind.INTO);
            assertThat(into.name()).isEqualTo("result");
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("TC-PARSE-010: Multiplication binds tighter than addition")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) letValue("a + b * c");

            assertThat(add.op()).isEqualTo(BinOp.ADD);
            assertThat(((Ident) add.left()).name()).isEqualTo("a");
            assertThat(((BinaryExpr) add.right()).op()).isEqualTo(BinOp.MUL);
        }

        @Test
        @DisplayName("TC-PARSE-011: Equal precedence folds left")
        void testLeftFold() {
            BinaryExpr outer = (BinaryExpr) letValue("a - b - c");

            assertThat(outer.op()).isEqualTo(BinOp.SUB);
            assertThat(outer.left()).isInstanceOf(BinaryExpr.class);
            assertThat(((Ident) outer.right()).name()).isEqualTo("c");
        }

        @Test
        @DisplayName("TC-PARSE-012: Power folds right")
        void testPowerFoldsRight() {
            BinaryExpr outer = (BinaryExpr) letValue("2 ** 3 ** 2");

            assertThat(outer.op()).isEqualTo(BinOp.POW);
            assertThat(outer.left()).isInstanceOf(Literal.class);
            assertThat(((BinaryExpr) outer.right()).op()).isEqualTo(BinOp.POW);
        }

        @Test
        @DisplayName("TC-PARSE-013: Negative numbers are literals, negated names are unary")
        void testNegation() {
            Literal literal = (Literal) letValue("-3");
            assertThat(literal.kind()).isEqualTo(Literal.Kind.INTEGER);
            assertThat(literal.value()).isEqualTo("-3");

            UnaryExpr unary = (UnaryExpr) letValue("-salary");
            assertThat(unary.op()).isEqualTo(UnOp.NEG);
        }

        @Test
        @DisplayName("TC-PARSE-014: Ranges with open ends")
        void testRanges() {
            Range closed = (Range) letValue("1..5");
            assertThat(((Literal) closed.start()).value()).isEqualTo("1");
            assertThat(((Literal) closed.end()).value()).isEqualTo("5");

            Range open = (Range) letValue("..5");
            assertThat(open.start()).isNull();
            assertThat(open.end()).isNotNull();
        }

        @Test
        @DisplayName("TC-PARSE-017: Open range as a call argument")
        void testOpenRangeArgument() {
            String source = "from t | take ..10";
            Pipeline pipeline = (Pipeline) ((VarDef) parse(source).get(0)).value();

            FuncCall take = (FuncCall) pipeline.exprs().get(1);
            assertThat(take.args()).hasSize(1);
            Range range = (Range) take.args().get(0);
            assertThat(range.start()).isNull();
            assertThat(((Literal) range.end()).value()).isEqualTo("10");
            assertThat(range.span().start()).isEqualTo(source.indexOf(".."));

            Pipeline nested = (Pipeline) ((FuncCall) ((Pipeline) ((VarDef) parse("from t | filter (age | in ..5)")
                .get(0)).value()).exprs().get(1)).args().get(0);
            FuncCall in = (FuncCall) nested.exprs().get(1);
            assertThat(((Ident) in.name()).name()).isEqualTo("in");
            assertThat(((Range) in.args().get(0)).start()).isNull();
        }

        @Test
        @DisplayName("TC-PARSE-018: Minus before a number starts a negative argument, spaced minus subtracts")
        void testNegativeArgument() {
            Pipeline pipeline = (Pipeline) ((VarDef) parse("from t | take -3").get(0)).value();

            FuncCall take = (FuncCall) pipeline.exprs().get(1);
            assertThat(take.args()).hasSize(1);
            assertThat(((Literal) take.args().get(0)).value()).isEqualTo("-3");

            BinaryExpr difference = (BinaryExpr) letValue("a - 3");
            assertThat(difference.op()).isEqualTo(BinOp.SUB);
            BinaryExpr compact = (BinaryExpr) letValue("a-3");
            assertThat(compact.op()).isEqualTo(BinOp.SUB);
        }

        @Test
        @DisplayName("TC-PARSE-015: Dotted names merge into one identifier")
        void testDottedName() {
            Ident ident = (Ident) letValue("e.salary");

            assertThat(ident.parts()).containsExactly("e", "salary");
        }

        @Test
        @DisplayName("TC-PARSE-016: S-string splits into text and expressions")
        void testSString() {
            Interpolation sstring = (Interpolation) letValue("s\"UPPER({name})\"");

            assertThat(sstring.kind()).isEqualTo(Interpolation.Kind.S_STRING);
            assertThat(sstring.items()).hasSize(3);
            assertThat(sstring.items().get(0).text()).isEqualTo("UPPER(");
            assertThat(((Ident) sstring.items().get(1).expr()).name()).isEqualTo("name");
            assertThat(sstring.items().get(2).text()).isEqualTo(")");
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("TC-PARSE-020: Integer separators and radix prefixes")
        void testIntegers() {
            assertThat(((Literal) letValue("1_000")).value()).isEqualTo("1000");
            assertThat(((Literal) letValue("0xff")).value()).isEqualTo("255");
            assertThat(((Literal) letValue("0b101")).value()).isEqualTo("5");
        }

        @Test
        @DisplayName("TC-PARSE-021: Dates, timestamps and times")
        void testDateTimes() {
            assertThat(((Literal) letValue("@2024-01-02")).kind()).isEqualTo(Literal.Kind.DATE);
            assertThat(((Literal) letValue("@2024-01-02T10:30")).kind()).isEqualTo(Literal.Kind.TIMESTAMP);
            assertThat(((Literal) letValue("@10:30")).kind()).isEqualTo(Literal.Kind.TIME);
        }

        @Test
        @DisplayName("TC-PARSE-022: Value with unit")
        void testValueAndUnit() {
            Literal interval = (Literal) letValue("5days");

            assertThat(interval.kind()).isEqualTo(Literal.Kind.VALUE_AND_UNIT);
            assertThat(interval.value()).isEqualTo("5");
            assertThat(interval.unit()).isEqualTo("days");
        }

        @Test
        @DisplayName("TC-PARSE-023: String escapes are decoded, raw strings are not")
        void testStrings() {
            assertThat(((Literal) letValue("\"a\\nb\"")).value()).isEqualTo("a\nb");
            assertThat(((Literal) letValue("r\"a\\nb\"")).value()).isEqualTo("a\\nb");
        }
    }

    @Nested
    @DisplayName("Syntax Errors")
    class SyntaxErrors {

        @Test
        @DisplayName("TC-PARSE-030: Unclosed bracket is unterminated")
        void testUnclosedBracket() {
            assertThat(parseErrorCode(() -> parse("from employees | select {name"))).isEqualTo(ParseException.UNTERMINATED);
        }

        @Test
        @DisplayName("TC-PARSE-031: Unterminated string")
        void testUnterminatedString() {
            assertThat(parseErrorCode(() -> parse("from employees | filter name == \"bob")))
                .isEqualTo(ParseException.UNTERMINATED);
        }

        @Test
        @DisplayName("TC-PARSE-032: Digits running into letters are an invalid number")
        void testInvalidNumber() {
            assertThat(parseErrorCode(() -> parse("from employees | take 12abc")))
                .isEqualTo(ParseException.INVALID_NUMBER);
        }

        @Test
        @DisplayName("TC-PARSE-033: Unknown string prefix")
        void testUnknownPrefix() {
            assertThat(parseErrorCode(() -> parse("from employees | derive {a = x\"text\"}")))
                .isEqualTo(ParseException.UNKNOWN_STRING_PREFIX);
        }

        @Test
        @DisplayName("TC-PARSE-034: Unknown header argument")
        void testUnknownHeaderArgument() {
            assertThatThrownBy(() -> parse("prql dialect:postgres\nfrom employees"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unknown query header argument `dialect`");
        }

        @Test
        @DisplayName("TC-PARSE-035: Error span points into the source")
        void testErrorSpan() {
            assertThatThrownBy(() -> parse("from employees | take 12abc"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getSpan().start()).isEqualTo(22));
        }
    }
}
