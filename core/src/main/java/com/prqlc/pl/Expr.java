package com.prqlc.pl;

/**
 * Base class for all PL (pipeline language) expression nodes.
 *
 * <p>PL nodes are produced by the parser (or read back from JSON) and are never
 * mutated afterwards. Resolution builds a separate tree instead of annotating
 * these nodes in place.
 *
 * <p>Every node may carry an alias: the {@code name} in {@code name = expr}, which
 * may appear on pipeline steps, tuple fields and positional call arguments.
 *
 * @see com.prqlc.semantic.Resolver
 */
public abstract class Expr {

    /** Source location, null for synthesized nodes */
    protected final Span span;

    /** Optional alias given to this expression */
    protected final String alias;

    protected Expr(Span span, String alias) {
        this.span = span;
        this.alias = alias;
    }

    public Span span() {
        return span;
    }

    public String alias() {
        return alias;
    }

    /**
     * Returns a copy of this node carrying the given alias.
     *
     * @param alias the new alias, or null to remove it
     * @return the aliased copy
     */
    public abstract Expr withAlias(String alias);

    /**
     * Returns the alias prefix used by {@link #toString()} implementations.
     */
    protected String aliasPrefix() {
        return alias == null ? "" : alias + " = ";
    }
}
