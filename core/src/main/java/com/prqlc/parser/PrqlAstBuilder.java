package com.prqlc.parser;

import com.prqlc.exception.ParseException;
import com.prqlc.pl.Array;
import com.prqlc.pl.BinOp;
import com.prqlc.pl.BinaryExpr;
import com.prqlc.pl.Case;
import com.prqlc.pl.Expr;
import com.prqlc.pl.Func;
import com.prqlc.pl.FuncCall;
import com.prqlc.pl.FuncParam;
import com.prqlc.pl.Ident;
import com.prqlc.pl.InterpolateItem;
import com.prqlc.pl.Interpolation;
import com.prqlc.pl.Internal;
import com.prqlc.pl.Literal;
import com.prqlc.pl.ModuleDef;
import com.prqlc.pl.Pipeline;
import com.prqlc.pl.QueryDef;
import com.prqlc.pl.Range;
import com.prqlc.pl.Span;
import com.prqlc.pl.Stmt;
import com.prqlc.pl.Tuple;
import com.prqlc.pl.Ty;
import com.prqlc.pl.UnOp;
import com.prqlc.pl.UnaryExpr;
import com.prqlc.pl.VarDef;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the ANTLR4 parse tree into the PL AST.
 *
 * <p>Each {@code visitXxx} method corresponds to a grammar rule in Prql.g4 and
 * returns a PL node ({@link Expr}, {@link Stmt}, {@link Ty}) or a list of them.
 *
 * <p>Beyond the plain tree shape it takes care of:
 * <ul>
 *   <li>collapsing single-step pipelines and argument-less calls into their only element</li>
 *   <li>left-folding binary operators of equal precedence ({@code **} folds right)</li>
 *   <li>merging dotted names into a single {@link Ident}</li>
 *   <li>decoding literals: digit separators, escapes, dates and intervals</li>
 *   <li>parsing the embedded expressions of {@code s"..."} and {@code f"..."} strings</li>
 * </ul>
 */
public class PrqlAstBuilder extends PrqlBaseVisitor<Object> {

    private static final String TARGET_ARG = "target";
    private static final String VERSION_ARG = "version";

    /** Position of the parsed text within the enclosing source */
    private final int offset;

    public PrqlAstBuilder(int offset) {
        this.offset = offset;
    }

    // ==================== Statements ====================

    @Override
    public Object visitSource(PrqlParser.SourceContext ctx) {
        List<Stmt> stmts = new ArrayList<>();
        if (ctx.queryHeader() != null) {
            stmts.add((Stmt) visit(ctx.queryHeader()));
        }
        for (PrqlParser.StmtContext stmt : ctx.stmt()) {
            stmts.add((Stmt) visit(stmt));
        }
        return stmts;
    }

    @Override
    public Object visitStandaloneExpr(PrqlParser.StandaloneExprContext ctx) {
        return visit(ctx.pipeline());
    }

    @Override
    public Object visitQueryHeader(PrqlParser.QueryHeaderContext ctx) {
        String target = null;
        String version = null;
        for (PrqlParser.HeaderArgContext arg : ctx.headerArg()) {
            String key = identText(arg.ident());
            Expr value = (Expr) visit(arg.expr());
            switch (key) {
                case TARGET_ARG -> {
                    if (!(value instanceof Ident ident)) {
                        throw new ParseException("query target must be a name such as `sql.postgres`", value.span());
                    }
                    target = String.join(".", ident.parts());
                }
                case VERSION_ARG -> {
                    if (!(value instanceof Literal lit) || lit.kind() != Literal.Kind.STRING) {
                        throw new ParseException("query version must be a string such as \"0.13\"", value.span());
                    }
                    version = lit.value();
                }
                default -> throw new ParseException(ParseException.UNEXPECTED_TOKEN,
                    "unknown query header argument `" + key + "`", span(arg),
                    List.of("valid arguments are `target` and `version`"));
            }
        }
        return new QueryDef(target, version, span(ctx));
    }

    @Override
    public Object visitStmt(PrqlParser.StmtContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Object visitLetDef(PrqlParser.LetDefContext ctx) {
        String name = identText(ctx.ident());
        Ty type = ctx.typeAnnotation() != null ? (Ty) visit(ctx.typeAnnotation()) : null;
        Expr value = ctx.exprCall() != null ? (Expr) visit(ctx.exprCall()) : null;
        if (value == null && type == null) {
            throw new ParseException("`let " + name + "` needs a value", span(ctx));
        }
        return new VarDef(VarDef.Kind.LET, name, value, type, span(ctx));
    }

    @Override
    public Object visitModuleDef(PrqlParser.ModuleDefContext ctx) {
        List<Stmt> stmts = new ArrayList<>();
        for (PrqlParser.StmtContext stmt : ctx.stmt()) {
            stmts.add((Stmt) visit(stmt));
        }
        return new ModuleDef(identText(ctx.ident()), stmts, span(ctx));
    }

    @Override
    public Object visitMainPipeline(PrqlParser.MainPipelineContext ctx) {
        Expr value = (Expr) visit(ctx.pipeline());
        if (ctx.INTO() != null) {
            return new VarDef(VarDef.Kind.INTO, identText(ctx.ident()), value, null, span(ctx));
        }
        return new VarDef(VarDef.Kind.MAIN, VarDef.MAIN, value, null, span(ctx));
    }

    // ==================== Pipelines ====================

    @Override
    public Object visitPipeline(PrqlParser.PipelineContext ctx) {
        List<Expr> steps = new ArrayList<>();
        for (PrqlParser.PipelineStepContext step : ctx.pipelineStep()) {
            steps.add((Expr) visit(step));
        }
        if (steps.size() == 1) {
            return steps.get(0);
        }
        return new Pipeline(steps, span(ctx), null);
    }

    @Override
    public Object visitPipelineStep(PrqlParser.PipelineStepContext ctx) {
        Expr expr = (Expr) visit(ctx.exprCall());
        return ctx.ident() != null ? expr.withAlias(identText(ctx.ident())) : expr;
    }

    @Override
    public Object visitInlinePipeline(PrqlParser.InlinePipelineContext ctx) {
        List<Expr> steps = new ArrayList<>();
        for (PrqlParser.ExprCallContext step : ctx.exprCall()) {
            steps.add((Expr) visit(step));
        }
        if (steps.size() == 1) {
            return steps.get(0);
        }
        return new Pipeline(steps, span(ctx), null);
    }

    @Override
    public Object visitExprCall(PrqlParser.ExprCallContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Object visitFuncCall(PrqlParser.FuncCallContext ctx) {
        Expr callee = (Expr) visit(ctx.expr());
        if (ctx.callArg().isEmpty()) {
            return callee;
        }

        List<Expr> args = new ArrayList<>();
        Map<String, Expr> namedArgs = new LinkedHashMap<>();
        for (PrqlParser.CallArgContext arg : ctx.callArg()) {
            if (arg instanceof PrqlParser.NamedArgContext named) {
                String name = identText(named.ident());
                if (namedArgs.containsKey(name)) {
                    throw new ParseException("argument `" + name + "` is given more than once", span(named));
                }
                namedArgs.put(name, (Expr) visit(named.expr()));
            } else {
                PrqlParser.PositionalArgContext positional = (PrqlParser.PositionalArgContext) arg;
                Expr value = (Expr) visit(positional.expr());
                if (positional.ident() != null) {
                    value = value.withAlias(identText(positional.ident()));
                }
                args.add(value);
            }
        }
        return new FuncCall(callee, args, namedArgs, span(ctx), null);
    }

    @Override
    public Object visitLambda(PrqlParser.LambdaContext ctx) {
        List<FuncParam> params = new ArrayList<>();
        List<FuncParam> namedParams = new ArrayList<>();
        for (PrqlParser.LambdaParamContext p : ctx.lambdaParam()) {
            String name = identText(p.ident());
            Ty type = p.typeAnnotation() != null ? (Ty) visit(p.typeAnnotation()) : null;
            if (p.expr() != null) {
                namedParams.add(new FuncParam(name, type, (Expr) visit(p.expr())));
            } else {
                params.add(new FuncParam(name, type, null));
            }
        }
        Ty returnType = ctx.typeAnnotation() != null ? (Ty) visit(ctx.typeAnnotation()) : null;
        Expr body = (Expr) visit(ctx.exprCall());
        return new Func(params, namedParams, body, returnType, span(ctx), null);
    }

    // ==================== Types ====================

    @Override
    public Object visitTypeAnnotation(PrqlParser.TypeAnnotationContext ctx) {
        return visit(ctx.typeExpr());
    }

    @Override
    public Object visitTypeExpr(PrqlParser.TypeExprContext ctx) {
        List<Ty> variants = new ArrayList<>();
        for (PrqlParser.TypeTermContext term : ctx.typeTerm()) {
            variants.add((Ty) visit(term));
        }
        return Ty.union(variants);
    }

    @Override
    public Object visitNamedType(PrqlParser.NamedTypeContext ctx) {
        return Ty.named(identText(ctx.ident()));
    }

    @Override
    public Object visitArrayType(PrqlParser.ArrayTypeContext ctx) {
        return Ty.array((Ty) visit(ctx.typeExpr()));
    }

    @Override
    public Object visitTupleType(PrqlParser.TupleTypeContext ctx) {
        List<Ty.Field> fields = new ArrayList<>();
        for (PrqlParser.TypeFieldContext field : ctx.typeField()) {
            String name = field.ident() != null ? identText(field.ident()) : null;
            fields.add(new Ty.Field(name, (Ty) visit(field.typeExpr())));
        }
        return Ty.tuple(fields);
    }

    // ==================== Operators ====================

    @Override
    public Object visitExpr(PrqlParser.ExprContext ctx) {
        return visit(ctx.orExpr());
    }

    @Override
    public Object visitOrExpr(PrqlParser.OrExprContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public Object visitAndExpr(PrqlParser.AndExprContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public Object visitCoalesceExpr(PrqlParser.CoalesceExprContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public Object visitCompareExpr(PrqlParser.CompareExprContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public Object visitAddExpr(PrqlParser.AddExprContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public Object visitMulExpr(PrqlParser.MulExprContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public Object visitPowExpr(PrqlParser.PowExprContext ctx) {
        Expr base = (Expr) visit(ctx.rangeExpr());
        if (ctx.powExpr() == null) {
            return base;
        }
        Expr exponent = (Expr) visit(ctx.powExpr());
        return new BinaryExpr(base, BinOp.POW, exponent, span(ctx), null);
    }

    @Override
    public Object visitRangeExpr(PrqlParser.RangeExprContext ctx) {
        List<PrqlParser.UnaryExprContext> bounds = ctx.unaryExpr();
        boolean leadingRange = ctx.getChild(0) instanceof TerminalNode;
        if (ctx.RANGE() == null && !leadingRange) {
            return visit(bounds.get(0));
        }
        Expr start = null;
        Expr end = null;
        if (leadingRange) {
            if (!bounds.isEmpty()) {
                end = (Expr) visit(bounds.get(0));
            }
        } else {
            start = (Expr) visit(bounds.get(0));
            if (bounds.size() > 1) {
                end = (Expr) visit(bounds.get(1));
            }
        }
        return new Range(start, end, span(ctx), null);
    }

    @Override
    public Object visitUnaryExpr(PrqlParser.UnaryExprContext ctx) {
        if (ctx.postfixExpr() != null) {
            return visit(ctx.postfixExpr());
        }
        UnOp op = UnOp.fromSymbol(ctx.getChild(0).getText().strip());
        Expr operand = (Expr) visit(ctx.unaryExpr());

        // Fold negative numeric constants so that `-3` is a plain literal.
        if (op == UnOp.NEG && operand instanceof Literal lit && operand.alias() == null
                && (lit.kind() == Literal.Kind.INTEGER || lit.kind() == Literal.Kind.FLOAT)
                && !lit.value().startsWith("-")) {
            return new Literal(lit.kind(), "-" + lit.value(), null, span(ctx), null);
        }
        return new UnaryExpr(op, operand, span(ctx), null);
    }

    @Override
    public Object visitPostfixExpr(PrqlParser.PostfixExprContext ctx) {
        Expr base = (Expr) visit(ctx.term());
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            ParseTree field = ctx.getChild(i + 1);
            String name = field instanceof PrqlParser.IdentContext id ? identText(id) : Ident.STAR;
            Span fieldSpan = field instanceof ParserRuleContext rule ? span(rule) : span(((TerminalNode) field).getSymbol());
            if (!(base instanceof Ident ident)) {
                throw new ParseException("field lookup `." + name + "` is only supported on names", fieldSpan);
            }
            if (ident.isStar()) {
                throw new ParseException("`*` must be the last part of a name", fieldSpan);
            }
            base = ident.append(name, fieldSpan);
        }
        return base;
    }

    // ==================== Terms ====================

    @Override
    public Object visitLiteralTerm(PrqlParser.LiteralTermContext ctx) {
        return visit(ctx.literal());
    }

    @Override
    public Object visitInternalTerm(PrqlParser.InternalTermContext ctx) {
        List<String> parts = new ArrayList<>();
        for (PrqlParser.IdentContext id : ctx.ident()) {
            parts.add(identText(id));
        }
        return new Internal(String.join(".", parts), span(ctx), null);
    }

    @Override
    public Object visitTupleTerm(PrqlParser.TupleTermContext ctx) {
        return visit(ctx.tuple());
    }

    @Override
    public Object visitArrayTerm(PrqlParser.ArrayTermContext ctx) {
        return visit(ctx.array());
    }

    @Override
    public Object visitCaseTerm(PrqlParser.CaseTermContext ctx) {
        return visit(ctx.caseExpr());
    }

    @Override
    public Object visitIdentTerm(PrqlParser.IdentTermContext ctx) {
        return new Ident(List.of(identText(ctx.ident())), span(ctx));
    }

    @Override
    public Object visitNestedTerm(PrqlParser.NestedTermContext ctx) {
        return visit(ctx.pipeline());
    }

    @Override
    public Object visitInterpolationTerm(PrqlParser.InterpolationTermContext ctx) {
        Token token = ctx.getStart();
        Interpolation.Kind kind = token.getType() == PrqlLexer.S_STRING
            ? Interpolation.Kind.S_STRING
            : Interpolation.Kind.F_STRING;

        String quoted = token.getText().substring(1);
        int width = StringLiterals.quoteWidth(quoted);
        String content = quoted.substring(width, quoted.length() - width);
        int contentStart = token.getStartIndex() + 1 + width + offset;

        List<InterpolateItem> items = parseInterpolation(content, contentStart);
        return new Interpolation(kind, items, span(ctx), null);
    }

    @Override
    public Object visitTuple(PrqlParser.TupleContext ctx) {
        List<Expr> fields = new ArrayList<>();
        for (PrqlParser.TupleFieldContext field : ctx.tupleField()) {
            Expr value = (Expr) visit(field.inlinePipeline());
            if (field.ident() != null) {
                value = value.withAlias(identText(field.ident()));
            }
            fields.add(value);
        }
        return new Tuple(fields, span(ctx), null);
    }

    @Override
    public Object visitArray(PrqlParser.ArrayContext ctx) {
        List<Expr> items = new ArrayList<>();
        for (PrqlParser.InlinePipelineContext item : ctx.inlinePipeline()) {
            items.add((Expr) visit(item));
        }
        return new Array(items, span(ctx), null);
    }

    @Override
    public Object visitCaseExpr(PrqlParser.CaseExprContext ctx) {
        List<Case.Arm> arms = new ArrayList<>();
        for (PrqlParser.CaseArmContext arm : ctx.caseArm()) {
            Expr condition = (Expr) visit(arm.funcCall(0));
            Expr value = (Expr) visit(arm.funcCall(1));
            arms.add(new Case.Arm(condition, value));
        }
        return new Case(arms, span(ctx), null);
    }

    // ==================== Literals ====================

    @Override
    public Object visitLiteral(PrqlParser.LiteralContext ctx) {
        Token token = ctx.getStart();
        String text = token.getText();
        Span span = span(ctx);

        switch (token.getType()) {
            case PrqlLexer.INTEGER:
                return new Literal(Literal.Kind.INTEGER, parseInteger(text, span), span);
            case PrqlLexer.FLOAT:
                return new Literal(Literal.Kind.FLOAT, text.replace("_", ""), span);
            case PrqlLexer.STRING:
                return Literal.string(StringLiterals.unescape(StringLiterals.unquote(text), span), span);
            case PrqlLexer.R_STRING:
                return Literal.string(StringLiterals.unquote(text.substring(1)), span);
            case PrqlLexer.TRUE:
                return Literal.bool(true, span);
            case PrqlLexer.FALSE:
                return Literal.bool(false, span);
            case PrqlLexer.NULL:
                return Literal.nullValue(span);
            case PrqlLexer.DATETIME:
                return parseDateTime(text.substring(1), span);
            case PrqlLexer.VALUE_AND_UNIT:
                return parseValueAndUnit(text, span);
            default:
                throw new ParseException("unexpected literal `" + text + "`", span);
        }
    }

    private static String parseInteger(String text, Span span) {
        String digits = text.replace("_", "");
        try {
            if (digits.startsWith("0x")) {
                return Long.toString(Long.parseLong(digits.substring(2), 16));
            }
            if (digits.startsWith("0b")) {
                return Long.toString(Long.parseLong(digits.substring(2), 2));
            }
            if (digits.startsWith("0o")) {
                return Long.toString(Long.parseLong(digits.substring(2), 8));
            }
            return Long.toString(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw new ParseException(ParseException.INVALID_NUMBER, "invalid numeric literal `" + text + "`", span);
        }
    }

    private static Literal parseDateTime(String text, Span span) {
        if (text.contains("T")) {
            return new Literal(Literal.Kind.TIMESTAMP, text, span);
        }
        if (text.length() >= 10 && text.charAt(4) == '-') {
            return new Literal(Literal.Kind.DATE, text, span);
        }
        return new Literal(Literal.Kind.TIME, text, span);
    }

    private static Literal parseValueAndUnit(String text, Span span) {
        int split = 0;
        while (split < text.length() && (Character.isDigit(text.charAt(split)) || text.charAt(split) == '_')) {
            split++;
        }
        String value = parseInteger(text.substring(0, split), span);
        return new Literal(Literal.Kind.VALUE_AND_UNIT, value, text.substring(split), span, null);
    }

    // ==================== Interpolation ====================

    /**
     * Splits interpolated-string content into text and expression segments.
     * Doubled braces stand for literal braces.
     */
    private List<InterpolateItem> parseInterpolation(String content, int contentStart) {
        List<InterpolateItem> items = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int textStart = 0;
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '{' && i + 1 < content.length() && content.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < content.length() && content.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '{') {
                int close = findClosingBrace(content, i);
                if (close < 0) {
                    throw new ParseException(ParseException.UNTERMINATED, "unterminated interpolation, expected `}`",
                        new Span(contentStart + i, contentStart + content.length()));
                }
                String exprText = content.substring(i + 1, close);
                if (exprText.isBlank()) {
                    throw new ParseException("interpolated string expected an expression, but found `}`",
                        new Span(contentStart + close, contentStart + close + 1));
                }
                if (text.length() > 0) {
                    Span textSpan = new Span(contentStart + textStart, contentStart + i);
                    items.add(InterpolateItem.text(StringLiterals.unescape(text.toString(), textSpan)));
                    text.setLength(0);
                }
                Expr expr = PrqlSourceParser.getInstance().parseEmbedded(exprText, contentStart + i + 1);
                items.add(InterpolateItem.expr(expr));
                i = close + 1;
                textStart = i;
            } else {
                text.append(c);
                i++;
            }
        }
        if (text.length() > 0) {
            Span textSpan = new Span(contentStart + textStart, contentStart + content.length());
            items.add(InterpolateItem.text(StringLiterals.unescape(text.toString(), textSpan)));
        }
        return items;
    }

    private static int findClosingBrace(String content, int open) {
        int depth = 0;
        for (int i = open; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // ==================== Helpers ====================

    private Expr foldBinary(ParserRuleContext ctx) {
        Expr result = (Expr) visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            BinOp op = BinOp.fromSymbol(ctx.getChild(i).getText());
            Expr right = (Expr) visit(ctx.getChild(i + 1));
            result = new BinaryExpr(result, op, right, Span.merge(result.span(), right.span()), null);
        }
        return result;
    }

    /**
     * Start of a token, past the whitespace that prefix operators include.
     */
    private static int startIndex(Token token) {
        int type = token.getType();
        if (type == PrqlLexer.PREFIX_RANGE || type == PrqlLexer.PREFIX_MINUS) {
            String text = token.getText();
            return token.getStartIndex() + text.length() - text.stripLeading().length();
        }
        return token.getStartIndex();
    }

    private static String identText(PrqlParser.IdentContext ctx) {
        if (ctx.QUOTED_IDENT() != null) {
            String quoted = ctx.QUOTED_IDENT().getText();
            return quoted.substring(1, quoted.length() - 1);
        }
        return ctx.getText();
    }

    private Span span(ParserRuleContext ctx) {
        int start = startIndex(ctx.getStart());
        Token stop = ctx.getStop();
        int end = stop != null && stop.getStopIndex() >= start ? stop.getStopIndex() + 1 : start;
        return new Span(start + offset, end + offset);
    }

    private Span span(Token token) {
        int start = startIndex(token);
        int end = token.getStopIndex() >= start ? token.getStopIndex() + 1 : start;
        return new Span(start + offset, end + offset);
    }
}
