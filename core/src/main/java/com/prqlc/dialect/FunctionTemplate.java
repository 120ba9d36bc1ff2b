package com.prqlc.dialect;

import java.util.List;

/**
 * Renders a builtin function call from its rendered arguments.
 *
 * <p>Used for functions whose SQL is not a plain call of the same arity, such
 * as infix operators or calls with reordered arguments.
 *
 * @see FunctionRegistry
 */
@FunctionalInterface
public interface FunctionTemplate {

    /**
     * Renders the call.
     *
     * @param args the rendered arguments, in declaration order
     * @return the rendered call
     */
    SqlFragment render(List<SqlFragment> args);
}
