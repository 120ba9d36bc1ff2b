package com.prqlc.rq;

/**
 * Base class of relational operators.
 *
 * <p>Relations form a chain: every operator except the sources ({@link From},
 * {@link SStringRelation}, {@link LiteralRelation}) wraps exactly one input.
 * Joins and set operations reach other tables through a {@link TableRef}, never
 * through a nested relation, so every chain is a straight pipeline. The one
 * exception is the step of a {@link Loop}, a separate chain held by the loop.
 */
public abstract class Relation {

    /**
     * Returns the input this operator is applied to, or null for sources.
     */
    public abstract Relation input();

    /**
     * Returns the operator name used in JSON and debug output.
     */
    public abstract String kind();
}
