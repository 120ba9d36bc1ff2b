package com.prqlc.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prqlc.pl.Literal;
import com.prqlc.rq.Aggregate;
import com.prqlc.rq.Append;
import com.prqlc.rq.ArrayExpr;
import com.prqlc.rq.CId;
import com.prqlc.rq.Case;
import com.prqlc.rq.ColumnDef;
import com.prqlc.rq.ColumnRef;
import com.prqlc.rq.ColumnSort;
import com.prqlc.rq.Compute;
import com.prqlc.rq.Constant;
import com.prqlc.rq.Distinct;
import com.prqlc.rq.Filter;
import com.prqlc.rq.From;
import com.prqlc.rq.Intersect;
import com.prqlc.rq.Join;
import com.prqlc.rq.LiteralRelation;
import com.prqlc.rq.Loop;
import com.prqlc.rq.Operator;
import com.prqlc.rq.RawSplice;
import com.prqlc.rq.Relation;
import com.prqlc.rq.RelationColumn;
import com.prqlc.rq.RelationalQuery;
import com.prqlc.rq.Remove;
import com.prqlc.rq.RqExpr;
import com.prqlc.rq.SStringRelation;
import com.prqlc.rq.Select;
import com.prqlc.rq.SetOperation;
import com.prqlc.rq.Sort;
import com.prqlc.rq.TId;
import com.prqlc.rq.TableDecl;
import com.prqlc.rq.TableRef;
import com.prqlc.rq.Take;
import com.prqlc.rq.Window;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.prqlc.json.PlJson.array;
import static com.prqlc.json.PlJson.objectMapper;
import static com.prqlc.json.PlJson.required;
import static com.prqlc.json.PlJson.span;
import static com.prqlc.json.PlJson.text;

/**
 * Converts relational queries to and from JSON.
 *
 * <p>Column and table ids are written as plain integers and kept as they are,
 * so a query read back generates the same SQL. Each relation object names its
 * operator in {@code "kind"} and nests the relation it reads from under
 * {@code "input"}.
 */
public final class RqJson {

    private RqJson() {
    }

    public static String toJson(RelationalQuery query) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode def = root.putObject("def");
        if (query.target() != null) {
            def.put("target", query.target());
        }
        if (query.version() != null) {
            def.put("version", query.version());
        }
        ArrayNode tables = root.putArray("tables");
        for (TableDecl decl : query.tables()) {
            ObjectNode table = tables.addObject();
            table.put("id", decl.id().value());
            if (decl.name() != null) {
                table.put("name", decl.name());
            }
            if (!decl.isExtern()) {
                table.set("relation", relation(decl.relation()));
            }
            table.set("columns", columns(decl.columns()));
        }
        root.set("relation", relation(query.main()));
        return PlJson.write(root);
    }

    /**
     * @throws IllegalArgumentException if the JSON is malformed or not an RQ document
     */
    public static RelationalQuery fromJson(String json) {
        JsonNode root = PlJson.read(json, "RQ");
        JsonNode def = root.path("def");
        List<TableDecl> tables = new ArrayList<>();
        for (JsonNode table : array(root, "tables")) {
            JsonNode relation = table.get("relation");
            tables.add(new TableDecl(new TId(required(table, "id").asInt()), text(table, "name"),
                relation == null || relation.isNull() ? null : relation(relation),
                columns(array(table, "columns"))));
        }
        return new RelationalQuery(text(def, "target"), text(def, "version"), tables,
            relation(required(root, "relation")));
    }

    // ==================== Relations ====================

    private static ObjectNode relation(Relation relation) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", relation.kind());
        if (relation instanceof From from) {
            node.set("table", tableRef(from.table()));
        } else if (relation instanceof Select select) {
            node.set("columns", ids(select.columns()));
        } else if (relation instanceof Compute compute) {
            node.set("column", columnDef(compute.column()));
        } else if (relation instanceof Filter filter) {
            node.set("condition", expr(filter.condition()));
        } else if (relation instanceof Aggregate aggregate) {
            node.set("partition", ids(aggregate.partition()));
            ArrayNode computes = node.putArray("computes");
            aggregate.computes().forEach(def -> computes.add(columnDef(def)));
        } else if (relation instanceof Sort sort) {
            node.set("columns", sorts(sort.columns()));
        } else if (relation instanceof Take take) {
            node.put("offset", take.offset());
            if (take.limit() != null) {
                node.put("limit", take.limit());
            }
        } else if (relation instanceof Join join) {
            node.put("side", join.side().name().toLowerCase(Locale.ROOT));
            node.set("with", tableRef(join.with()));
            node.set("condition", expr(join.condition()));
        } else if (relation instanceof SetOperation set) {
            node.set("other", tableRef(set.other()));
        } else if (relation instanceof Distinct) {
            // No arguments.
        } else if (relation instanceof Loop loop) {
            node.put("table", loop.table().value());
            node.set("columns", columns(loop.columns()));
            node.set("step", relation(loop.step()));
        } else if (relation instanceof SStringRelation sstring) {
            node.set("items", items(sstring.items()));
        } else if (relation instanceof LiteralRelation literal) {
            ArrayNode columns = node.putArray("columns");
            literal.columns().forEach(columns::add);
            ArrayNode rows = node.putArray("rows");
            for (List<Literal> row : literal.rows()) {
                ArrayNode rowNode = rows.addArray();
                row.forEach(value -> rowNode.add(PlJson.literal(value)));
            }
        } else {
            throw new IllegalArgumentException("Unknown relation: " + relation.kind());
        }
        if (relation.input() != null) {
            node.set("input", relation(relation.input()));
        }
        return node;
    }

    private static Relation relation(JsonNode node) {
        String kind = required(node, "kind").asText();
        switch (kind) {
            case "From":
                return new From(tableRef(required(node, "table")));
            case "SString":
                return new SStringRelation(items(array(node, "items")));
            case "Literal": {
                List<String> columns = new ArrayList<>();
                array(node, "columns").forEach(c -> columns.add(c.asText()));
                List<List<Literal>> rows = new ArrayList<>();
                for (JsonNode row : array(node, "rows")) {
                    List<Literal> values = new ArrayList<>();
                    row.forEach(value -> values.add(PlJson.literal(value)));
                    rows.add(values);
                }
                return new LiteralRelation(columns, rows);
            }
            default:
                break;
        }

        Relation input = relation(required(node, "input"));
        return switch (kind) {
            case "Select" -> new Select(input, ids(array(node, "columns")));
            case "Compute" -> new Compute(input, columnDef(required(node, "column")));
            case "Filter" -> new Filter(input, expr(required(node, "condition")));
            case "Aggregate" -> {
                List<ColumnDef> computes = new ArrayList<>();
                array(node, "computes").forEach(def -> computes.add(columnDef(def)));
                yield new Aggregate(input, ids(array(node, "partition")), computes);
            }
            case "Sort" -> new Sort(input, sorts(array(node, "columns")));
            case "Take" -> new Take(input, node.path("offset").asLong(0),
                node.hasNonNull("limit") ? node.get("limit").asLong() : null);
            case "Join" -> new Join(input,
                Join.Side.valueOf(required(node, "side").asText().toUpperCase(Locale.ROOT)),
                tableRef(required(node, "with")), expr(required(node, "condition")));
            case "Append" -> new Append(input, tableRef(required(node, "other")));
            case "Remove" -> new Remove(input, tableRef(required(node, "other")));
            case "Intersect" -> new Intersect(input, tableRef(required(node, "other")));
            case "Distinct" -> new Distinct(input);
            case "Loop" -> new Loop(input, new TId(required(node, "table").asInt()),
                columns(array(node, "columns")), relation(required(node, "step")));
            default -> throw new IllegalArgumentException("Unknown relation kind: " + kind);
        };
    }

    // ==================== Columns and Tables ====================

    private static ObjectNode tableRef(TableRef ref) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("source", ref.source().value());
        if (ref.alias() != null) {
            node.put("alias", ref.alias());
        }
        node.set("columns", columns(ref.columns()));
        return node;
    }

    private static TableRef tableRef(JsonNode node) {
        return new TableRef(new TId(required(node, "source").asInt()), text(node, "alias"),
            columns(array(node, "columns")));
    }

    private static ArrayNode columns(List<RelationColumn> columns) {
        ArrayNode array = objectMapper.createArrayNode();
        for (RelationColumn column : columns) {
            ObjectNode node = array.addObject();
            // A missing name is the wildcard.
            if (!column.isWildcard()) {
                node.put("name", column.name());
            }
            node.put("id", column.id().value());
        }
        return array;
    }

    private static List<RelationColumn> columns(JsonNode array) {
        List<RelationColumn> columns = new ArrayList<>();
        for (JsonNode node : array) {
            columns.add(new RelationColumn(text(node, "name"), new CId(required(node, "id").asInt())));
        }
        return columns;
    }

    private static ObjectNode columnDef(ColumnDef def) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", def.id().value());
        if (def.name() != null) {
            node.put("name", def.name());
        }
        node.set("expr", expr(def.expr()));
        if (def.window() != null) {
            node.set("window", window(def.window()));
        }
        return node;
    }

    private static ColumnDef columnDef(JsonNode node) {
        JsonNode window = node.get("window");
        return new ColumnDef(new CId(required(node, "id").asInt()), text(node, "name"),
            expr(required(node, "expr")), window == null || window.isNull() ? null : window(window));
    }

    private static ObjectNode window(Window window) {
        ObjectNode node = objectMapper.createObjectNode();
        if (window.hasFrame()) {
            ObjectNode frame = node.putObject("frame");
            frame.put("kind", window.kind().name().toLowerCase(Locale.ROOT));
            if (window.start() != null) {
                frame.put("start", window.start());
            }
            if (window.end() != null) {
                frame.put("end", window.end());
            }
        }
        node.set("partition", ids(window.partition()));
        node.set("sort", sorts(window.sort()));
        return node;
    }

    private static Window window(JsonNode node) {
        JsonNode frame = node.get("frame");
        Window.Kind kind = null;
        Long start = null;
        Long end = null;
        if (frame != null && !frame.isNull()) {
            kind = Window.Kind.valueOf(required(frame, "kind").asText().toUpperCase(Locale.ROOT));
            start = frame.hasNonNull("start") ? frame.get("start").asLong() : null;
            end = frame.hasNonNull("end") ? frame.get("end").asLong() : null;
        }
        return new Window(kind, start, end, ids(array(node, "partition")), sorts(array(node, "sort")));
    }

    private static ArrayNode ids(List<CId> ids) {
        ArrayNode array = objectMapper.createArrayNode();
        ids.forEach(id -> array.add(id.value()));
        return array;
    }

    private static List<CId> ids(JsonNode array) {
        List<CId> ids = new ArrayList<>();
        array.forEach(id -> ids.add(new CId(id.asInt())));
        return ids;
    }

    private static ArrayNode sorts(List<ColumnSort> sorts) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ColumnSort sort : sorts) {
            ObjectNode node = array.addObject();
            node.put("column", sort.column().value());
            node.put("direction", sort.descending() ? "desc" : "asc");
        }
        return array;
    }

    private static List<ColumnSort> sorts(JsonNode array) {
        List<ColumnSort> sorts = new ArrayList<>();
        for (JsonNode node : array) {
            sorts.add(new ColumnSort(new CId(required(node, "column").asInt()),
                "desc".equals(text(node, "direction"))));
        }
        return sorts;
    }

    // ==================== Expressions ====================

    private static ObjectNode expr(RqExpr expr) {
        if (expr instanceof Constant constant) {
            return PlJson.literal(constant.literal());
        }
        ObjectNode node = objectMapper.createObjectNode();
        if (expr instanceof ColumnRef ref) {
            node.put("kind", "ColumnRef");
            node.put("id", ref.id().value());
        } else if (expr instanceof Operator op) {
            node.put("kind", "Operator");
            node.put("name", op.name());
            ArrayNode args = node.putArray("args");
            op.args().forEach(arg -> args.add(expr(arg)));
        } else if (expr instanceof RawSplice splice) {
            node.put("kind", "SString");
            node.set("items", items(splice.items()));
        } else if (expr instanceof Case caseExpr) {
            node.put("kind", "Case");
            ArrayNode arms = node.putArray("arms");
            for (Case.Arm arm : caseExpr.arms()) {
                ObjectNode armNode = arms.addObject();
                armNode.set("condition", expr(arm.condition()));
                armNode.set("value", expr(arm.value()));
            }
        } else if (expr instanceof ArrayExpr arrayExpr) {
            node.put("kind", "Array");
            ArrayNode items = node.putArray("items");
            arrayExpr.items().forEach(item -> items.add(expr(item)));
        } else {
            throw new IllegalArgumentException("Unknown RQ expression: " + expr);
        }
        PlJson.putSpan(node, expr.span());
        return node;
    }

    private static RqExpr expr(JsonNode node) {
        String kind = required(node, "kind").asText();
        return switch (kind) {
            case "Literal" -> new Constant(PlJson.literal(node));
            case "ColumnRef" -> new ColumnRef(new CId(required(node, "id").asInt()), span(node));
            case "Operator" -> {
                List<RqExpr> args = new ArrayList<>();
                array(node, "args").forEach(arg -> args.add(expr(arg)));
                yield new Operator(required(node, "name").asText(), args, span(node));
            }
            case "SString" -> new RawSplice(items(array(node, "items")), span(node));
            case "Case" -> {
                List<Case.Arm> arms = new ArrayList<>();
                for (JsonNode arm : array(node, "arms")) {
                    arms.add(new Case.Arm(expr(required(arm, "condition")), expr(required(arm, "value"))));
                }
                yield new Case(arms, span(node));
            }
            case "Array" -> {
                List<RqExpr> items = new ArrayList<>();
                array(node, "items").forEach(item -> items.add(expr(item)));
                yield new ArrayExpr(items, span(node));
            }
            default -> throw new IllegalArgumentException("Unknown RQ expression kind: " + kind);
        };
    }

    private static ArrayNode items(List<RawSplice.Item> items) {
        ArrayNode array = objectMapper.createArrayNode();
        for (RawSplice.Item item : items) {
            ObjectNode node = array.addObject();
            if (item.isText()) {
                node.put("text", item.text());
            } else {
                node.set("expr", expr(item.expr()));
            }
        }
        return array;
    }

    private static List<RawSplice.Item> items(JsonNode array) {
        List<RawSplice.Item> items = new ArrayList<>();
        for (JsonNode node : array) {
            items.add(node.has("text") ? RawSplice.Item.text(node.get("text").asText())
                : RawSplice.Item.expr(expr(required(node, "expr"))));
        }
        return items;
    }
}
