package com.prqlc.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses table catalogs from JSON.
 *
 * <p>Expected format:
 * <pre>
 * {
 *   "tables": [
 *     {"name": "employees", "columns": [{"name": "id", "type": "int"}, {"name": "name"}]}
 *   ]
 * }
 * </pre>
 *
 * <p>A column may also be given as a bare string holding its name.
 */
public class CatalogParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a catalog.
     *
     * @param json the catalog in JSON format
     * @return the parsed catalog
     * @throws IllegalArgumentException if the JSON is malformed or misses required fields
     */
    public static TableCatalog parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Catalog JSON cannot be null or empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse catalog JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode tablesNode = root.get("tables");
        if (tablesNode == null || !tablesNode.isArray()) {
            throw new IllegalArgumentException("Catalog JSON needs a \"tables\" array");
        }

        List<TableSchema> tables = new ArrayList<>();
        for (JsonNode tableNode : tablesNode) {
            tables.add(parseTable(tableNode));
        }
        return TableCatalog.of(tables);
    }

    private static TableSchema parseTable(JsonNode node) {
        JsonNode nameNode = node.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            throw new IllegalArgumentException("Every catalog table needs a \"name\": " + node);
        }
        List<ColumnSchema> columns = new ArrayList<>();
        JsonNode columnsNode = node.get("columns");
        if (columnsNode != null) {
            if (!columnsNode.isArray()) {
                throw new IllegalArgumentException("\"columns\" of table " + nameNode.asText() + " must be an array");
            }
            for (JsonNode columnNode : columnsNode) {
                columns.add(parseColumn(columnNode, nameNode.asText()));
            }
        }
        return new TableSchema(nameNode.asText(), columns);
    }

    private static ColumnSchema parseColumn(JsonNode node, String table) {
        if (node.isTextual()) {
            return new ColumnSchema(node.asText(), null);
        }
        JsonNode nameNode = node.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            throw new IllegalArgumentException("Column of table " + table + " has no \"name\": " + node);
        }
        JsonNode typeNode = node.get("type");
        return new ColumnSchema(nameNode.asText(), typeNode == null || typeNode.isNull() ? null : typeNode.asText());
    }
}
