package com.prqlc.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prqlc.pl.Array;
import com.prqlc.pl.BinOp;
import com.prqlc.pl.BinaryExpr;
import com.prqlc.pl.Case;
import com.prqlc.pl.Expr;
import com.prqlc.pl.Func;
import com.prqlc.pl.FuncCall;
import com.prqlc.pl.FuncParam;
import com.prqlc.pl.Ident;
import com.prqlc.pl.Internal;
import com.prqlc.pl.InterpolateItem;
import com.prqlc.pl.Interpolation;
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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts PL statements to and from JSON.
 *
 * <p>Every node is an object with a {@code "kind"} field naming its type. Spans
 * are written as {@code [start, end]} character offsets and aliases as an
 * {@code "alias"} field, so a round trip preserves both.
 *
 * <p>Example: {@code from employees} becomes
 * <pre>
 * {"stmts": [{"kind": "VarDef", "var_kind": "main", "name": "main",
 *   "value": {"kind": "FuncCall", "name": {"kind": "Ident", "parts": ["from"], ...},
 *             "args": [{"kind": "Ident", "parts": ["employees"], ...}]}}]}
 * </pre>
 */
public final class PlJson {

    static final ObjectMapper objectMapper = new ObjectMapper();

    private PlJson() {
    }

    /**
     * Serializes statements.
     *
     * @param stmts the statements
     * @return the JSON text
     */
    public static String toJson(List<Stmt> stmts) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode array = root.putArray("stmts");
        stmts.forEach(stmt -> array.add(stmt(stmt)));
        return write(root);
    }

    /**
     * Deserializes statements.
     *
     * @param json the JSON text
     * @return the statements
     * @throws IllegalArgumentException if the JSON is malformed or not a PL document
     */
    public static List<Stmt> fromJson(String json) {
        JsonNode root = read(json, "PL");
        List<Stmt> stmts = new ArrayList<>();
        for (JsonNode node : array(root, "stmts")) {
            stmts.add(stmt(node));
        }
        return stmts;
    }

    // ==================== Shared Helpers ====================

    static String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON", e);
        }
    }

    static JsonNode read(String json, String what) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException(what + " JSON cannot be null or empty");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field \"" + field + "\" in " + node);
        }
        return value;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static JsonNode array(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isArray()) {
            throw new IllegalArgumentException("Field \"" + field + "\" must be an array in " + node);
        }
        return value;
    }

    static void putSpan(ObjectNode node, Span span) {
        if (span != null) {
            node.putArray("span").add(span.start()).add(span.end());
        }
    }

    static Span span(JsonNode node) {
        JsonNode span = node.get("span");
        if (span == null || span.isNull()) {
            return null;
        }
        return new Span(span.get(0).asInt(), span.get(1).asInt());
    }

    static ObjectNode literal(Literal literal) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", "Literal");
        node.put("type", literal.kind().name().toLowerCase(Locale.ROOT));
        if (literal.value() != null) {
            node.put("value", literal.value());
        }
        if (literal.unit() != null) {
            node.put("unit", literal.unit());
        }
        putSpan(node, literal.span());
        return node;
    }

    static Literal literal(JsonNode node) {
        Literal.Kind kind = Literal.Kind.valueOf(required(node, "type").asText().toUpperCase(Locale.ROOT));
        return new Literal(kind, text(node, "value"), text(node, "unit"), span(node), text(node, "alias"));
    }

    // ==================== Statements ====================

    private static ObjectNode stmt(Stmt stmt) {
        ObjectNode node = objectMapper.createObjectNode();
        if (stmt instanceof VarDef def) {
            node.put("kind", "VarDef");
            node.put("var_kind", def.kind().name().toLowerCase(Locale.ROOT));
            node.put("name", def.name());
            if (def.value() != null) {
                node.set("value", expr(def.value()));
            }
            if (def.type() != null) {
                node.set("ty", ty(def.type()));
            }
        } else if (stmt instanceof ModuleDef module) {
            node.put("kind", "ModuleDef");
            node.put("name", module.name());
            ArrayNode stmts = node.putArray("stmts");
            module.stmts().forEach(s -> stmts.add(stmt(s)));
        } else if (stmt instanceof QueryDef query) {
            node.put("kind", "QueryDef");
            node.put("target", query.target());
            node.put("version", query.version());
        } else {
            throw new IllegalArgumentException("Unknown statement: " + stmt);
        }
        putSpan(node, stmt.span());
        return node;
    }

    private static Stmt stmt(JsonNode node) {
        String kind = required(node, "kind").asText();
        Span span = span(node);
        return switch (kind) {
            case "VarDef" -> {
                JsonNode value = node.get("value");
                JsonNode ty = node.get("ty");
                yield new VarDef(VarDef.Kind.valueOf(required(node, "var_kind").asText().toUpperCase(Locale.ROOT)),
                    required(node, "name").asText(),
                    value == null || value.isNull() ? null : expr(value),
                    ty == null || ty.isNull() ? null : ty(ty), span);
            }
            case "ModuleDef" -> {
                List<Stmt> stmts = new ArrayList<>();
                for (JsonNode child : array(node, "stmts")) {
                    stmts.add(stmt(child));
                }
                yield new ModuleDef(required(node, "name").asText(), stmts, span);
            }
            case "QueryDef" -> new QueryDef(text(node, "target"), text(node, "version"), span);
            default -> throw new IllegalArgumentException("Unknown statement kind: " + kind);
        };
    }

    // ==================== Expressions ====================

    private static ObjectNode expr(Expr expr) {
        ObjectNode node;
        if (expr instanceof Literal literal) {
            node = literal(literal);
        } else {
            node = objectMapper.createObjectNode();
            node.put("kind", expr.getClass().getSimpleName());
            exprFields(node, expr);
            putSpan(node, expr.span());
        }
        if (expr.alias() != null) {
            node.put("alias", expr.alias());
        }
        return node;
    }

    private static void exprFields(ObjectNode node, Expr expr) {
        if (expr instanceof Ident ident) {
            ArrayNode parts = node.putArray("parts");
            ident.parts().forEach(parts::add);
        } else if (expr instanceof BinaryExpr binary) {
            node.set("left", expr(binary.left()));
            node.put("op", binary.op().symbol());
            node.set("right", expr(binary.right()));
        } else if (expr instanceof UnaryExpr unary) {
            node.put("op", unary.op().symbol());
            node.set("expr", expr(unary.operand()));
        } else if (expr instanceof FuncCall call) {
            node.set("name", expr(call.name()));
            node.set("args", exprs(call.args()));
            if (!call.namedArgs().isEmpty()) {
                ObjectNode named = node.putObject("named_args");
                call.namedArgs().forEach((name, arg) -> named.set(name, expr(arg)));
            }
        } else if (expr instanceof Func func) {
            node.set("params", params(func.params()));
            node.set("named_params", params(func.namedParams()));
            node.set("body", expr(func.body()));
            if (func.returnType() != null) {
                node.set("return_ty", ty(func.returnType()));
            }
        } else if (expr instanceof Pipeline pipeline) {
            node.set("exprs", exprs(pipeline.exprs()));
        } else if (expr instanceof Tuple tuple) {
            node.set("fields", exprs(tuple.fields()));
        } else if (expr instanceof Array array) {
            node.set("items", exprs(array.items()));
        } else if (expr instanceof Range range) {
            if (range.start() != null) {
                node.set("start", expr(range.start()));
            }
            if (range.end() != null) {
                node.set("end", expr(range.end()));
            }
        } else if (expr instanceof Interpolation interpolation) {
            node.put("string_kind", interpolation.kind().prefix());
            ArrayNode items = node.putArray("items");
            for (InterpolateItem item : interpolation.items()) {
                ObjectNode itemNode = items.addObject();
                if (item.isText()) {
                    itemNode.put("text", item.text());
                } else {
                    itemNode.set("expr", expr(item.expr()));
                }
            }
        } else if (expr instanceof Case caseExpr) {
            ArrayNode arms = node.putArray("arms");
            for (Case.Arm arm : caseExpr.arms()) {
                ObjectNode armNode = arms.addObject();
                armNode.set("condition", expr(arm.condition()));
                armNode.set("value", expr(arm.value()));
            }
        } else if (expr instanceof Internal internal) {
            node.put("name", internal.name());
        } else {
            throw new IllegalArgumentException("Unknown expression: " + expr);
        }
    }

    private static ArrayNode exprs(List<Expr> exprs) {
        ArrayNode array = objectMapper.createArrayNode();
        exprs.forEach(e -> array.add(expr(e)));
        return array;
    }

    private static ArrayNode params(List<FuncParam> params) {
        ArrayNode array = objectMapper.createArrayNode();
        for (FuncParam param : params) {
            ObjectNode node = array.addObject();
            node.put("name", param.name());
            if (param.type() != null) {
                node.set("ty", ty(param.type()));
            }
            if (param.defaultValue() != null) {
                node.set("default_value", expr(param.defaultValue()));
            }
        }
        return array;
    }

    private static Expr expr(JsonNode node) {
        String kind = required(node, "kind").asText();
        Span span = span(node);
        String alias = text(node, "alias");
        return switch (kind) {
            case "Literal" -> literal(node);
            case "Ident" -> {
                List<String> parts = new ArrayList<>();
                array(node, "parts").forEach(part -> parts.add(part.asText()));
                yield new Ident(parts, span, alias);
            }
            case "BinaryExpr" -> new BinaryExpr(expr(required(node, "left")),
                BinOp.fromSymbol(required(node, "op").asText()), expr(required(node, "right")), span, alias);
            case "UnaryExpr" -> new UnaryExpr(UnOp.fromSymbol(required(node, "op").asText()),
                expr(required(node, "expr")), span, alias);
            case "FuncCall" -> {
                Map<String, Expr> named = new LinkedHashMap<>();
                JsonNode namedNode = node.get("named_args");
                if (namedNode != null) {
                    Iterator<Map.Entry<String, JsonNode>> fields = namedNode.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        named.put(field.getKey(), expr(field.getValue()));
                    }
                }
                yield new FuncCall(expr(required(node, "name")), exprs(array(node, "args")), named, span, alias);
            }
            case "Func" -> {
                JsonNode returnTy = node.get("return_ty");
                yield new Func(params(array(node, "params")), params(array(node, "named_params")),
                    expr(required(node, "body")), returnTy == null ? null : ty(returnTy), span, alias);
            }
            case "Pipeline" -> new Pipeline(exprs(array(node, "exprs")), span, alias);
            case "Tuple" -> new Tuple(exprs(array(node, "fields")), span, alias);
            case "Array" -> new Array(exprs(array(node, "items")), span, alias);
            case "Range" -> new Range(optionalExpr(node, "start"), optionalExpr(node, "end"), span, alias);
            case "Interpolation" -> {
                List<InterpolateItem> items = new ArrayList<>();
                for (JsonNode item : array(node, "items")) {
                    items.add(item.has("text") ? InterpolateItem.text(item.get("text").asText())
                        : InterpolateItem.expr(expr(required(item, "expr"))));
                }
                Interpolation.Kind stringKind = "s".equals(required(node, "string_kind").asText())
                    ? Interpolation.Kind.S_STRING : Interpolation.Kind.F_STRING;
                yield new Interpolation(stringKind, items, span, alias);
            }
            case "Case" -> {
                List<Case.Arm> arms = new ArrayList<>();
                for (JsonNode arm : array(node, "arms")) {
                    arms.add(new Case.Arm(expr(required(arm, "condition")), expr(required(arm, "value"))));
                }
                yield new Case(arms, span, alias);
            }
            case "Internal" -> new Internal(required(node, "name").asText(), span, alias);
            default -> throw new IllegalArgumentException("Unknown expression kind: " + kind);
        };
    }

    private static Expr optionalExpr(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : expr(value);
    }

    private static List<Expr> exprs(JsonNode array) {
        List<Expr> exprs = new ArrayList<>();
        array.forEach(item -> exprs.add(expr(item)));
        return exprs;
    }

    private static List<FuncParam> params(JsonNode array) {
        List<FuncParam> params = new ArrayList<>();
        for (JsonNode node : array) {
            JsonNode ty = node.get("ty");
            params.add(new FuncParam(required(node, "name").asText(), ty == null ? null : ty(ty),
                optionalExpr(node, "default_value")));
        }
        return params;
    }

    // ==================== Types ====================

    private static ObjectNode ty(Ty ty) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", ty.kind().name().toLowerCase(Locale.ROOT));
        switch (ty.kind()) {
            case NAMED -> node.put("name", ty.name());
            case ARRAY -> node.set("item", ty(ty.variants().get(0)));
            case UNION -> {
                ArrayNode variants = node.putArray("variants");
                ty.variants().forEach(v -> variants.add(ty(v)));
            }
            case TUPLE -> {
                ArrayNode fields = node.putArray("fields");
                for (Ty.Field field : ty.fields()) {
                    ObjectNode fieldNode = fields.addObject();
                    if (field.name() != null) {
                        fieldNode.put("name", field.name());
                    }
                    fieldNode.set("ty", ty(field.type()));
                }
            }
        }
        return node;
    }

    private static Ty ty(JsonNode node) {
        String kind = required(node, "kind").asText();
        return switch (kind) {
            case "named" -> Ty.named(required(node, "name").asText());
            case "array" -> Ty.array(ty(required(node, "item")));
            case "union" -> {
                List<Ty> variants = new ArrayList<>();
                array(node, "variants").forEach(v -> variants.add(ty(v)));
                yield Ty.union(variants);
            }
            case "tuple" -> {
                List<Ty.Field> fields = new ArrayList<>();
                for (JsonNode field : array(node, "fields")) {
                    fields.add(new Ty.Field(text(field, "name"), ty(required(field, "ty"))));
                }
                yield Ty.tuple(fields);
            }
            default -> throw new IllegalArgumentException("Unknown type kind: " + kind);
        };
    }
}
