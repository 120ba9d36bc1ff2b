package com.prqlc.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prqlc.pl.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One structured diagnostic, the unit of the error contract every caller consumes.
 *
 * <p>Besides the raw data it carries a {@code display} rendering: the offending
 * source line with the span underlined, for example
 * <pre>
 * Error [E0100]: Unknown name `invalid`
 *  --&gt; 1:25
 *   |
 * 1 | from employees | filter invalid
 *   |                         ^^^^^^^
 * </pre>
 */
public final class ErrorMessage {

    /**
     * Message severity.
     */
    public enum Kind {
        ERROR("Error"),
        WARNING("Warning"),
        LINT("Lint");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final String code;
    private final String reason;
    private final List<String> hints;
    private final Span span;
    private final String display;
    private final SourceLocation location;

    public ErrorMessage(Kind kind, String code, String reason, List<String> hints, Span span,
                        String display, SourceLocation location) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.code = code;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.hints = Collections.unmodifiableList(new ArrayList<>(hints));
        this.span = span;
        this.display = display;
        this.location = location;
    }

    /**
     * Builds the message for an exception raised while compiling {@code source}.
     *
     * @param e the exception
     * @param source the compiled text, may be null when compiling from JSON
     * @return the structured message
     */
    public static ErrorMessage from(PrqlException e, String source) {
        Span span = e.getSpan();
        SourceLocation location = null;
        if (span != null && source != null && span.end() <= source.length()) {
            location = SourceLocation.of(span, source);
        }
        String display = render(Kind.ERROR, e.getCode(), e.getReason(), e.getHints(), location, source);
        return new ErrorMessage(Kind.ERROR, e.getCode(), e.getReason(), e.getHints(), span, display, location);
    }

    public Kind kind() {
        return kind;
    }

    public String code() {
        return code;
    }

    public String reason() {
        return reason;
    }

    public List<String> hints() {
        return hints;
    }

    public Span span() {
        return span;
    }

    public String display() {
        return display;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Converts this message to a JSON object.
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("kind", kind.label());
        if (code != null) {
            node.put("code", code);
        }
        node.put("reason", reason);
        ArrayNode hintsNode = node.putArray("hints");
        hints.forEach(hintsNode::add);
        if (span != null) {
            ObjectNode spanNode = node.putObject("span");
            spanNode.put("start", span.start());
            spanNode.put("end", span.end());
        }
        if (display != null) {
            node.put("display", display);
        }
        if (location != null) {
            ObjectNode loc = node.putObject("location");
            loc.putArray("start").add(location.startLine()).add(location.startColumn());
            loc.putArray("end").add(location.endLine()).add(location.endColumn());
        }
        return node;
    }

    // ==================== Display Rendering ====================

    private static String render(Kind kind, String code, String reason, List<String> hints,
                                 SourceLocation location, String source) {
        StringBuilder sb = new StringBuilder(kind.label());
        if (code != null) {
            sb.append(" [").append(code).append(']');
        }
        sb.append(": ").append(reason).append('\n');

        if (location != null) {
            String[] lines = source.split("\n", -1);
            int lineNo = location.startLine();
            String line = lineNo < lines.length ? lines[lineNo] : "";
            String gutter = Integer.toString(lineNo + 1);
            String pad = " ".repeat(gutter.length());

            sb.append(pad).append("--> ").append(lineNo + 1).append(':').append(location.startColumn() + 1).append('\n');
            sb.append(pad).append(" |\n");
            sb.append(gutter).append(" | ").append(line).append('\n');

            int endColumn = location.endLine() == lineNo ? location.endColumn() : line.length();
            int width = Math.max(1, endColumn - location.startColumn());
            sb.append(pad).append(" | ").append(" ".repeat(location.startColumn()))
                .append("^".repeat(width)).append('\n');
        }

        for (String hint : hints) {
            sb.append("Hint: ").append(hint).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return display != null ? display : kind.label() + ": " + reason;
    }
}
