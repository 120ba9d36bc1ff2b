package com.prqlc.pl;

/**
 * The query header {@code prql target:sql.<dialect> version:"<req>"}.
 *
 * <p>Both fields are optional.
 */
public final class QueryDef extends Stmt {

    private final String target;
    private final String version;

    public QueryDef(String target, String version, Span span) {
        super(span);
        this.target = target;
        this.version = version;
    }

    public String target() {
        return target;
    }

    public String version() {
        return version;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("prql");
        if (target != null) {
            sb.append(" target:").append(target);
        }
        if (version != null) {
            sb.append(" version:\"").append(version).append('"');
        }
        return sb.toString();
    }
}
