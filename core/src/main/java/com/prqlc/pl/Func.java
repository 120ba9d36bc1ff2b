package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function literal: {@code a b c:default -> body}.
 *
 * <p>Parameters without defaults are positional and bind left to right. Parameters
 * with defaults are named. The last positional parameter of a transform receives the
 * piped relation.
 */
public final class Func extends Expr {

    private final List<FuncParam> params;
    private final List<FuncParam> namedParams;
    private final Expr body;
    private final Ty returnType;

    public Func(List<FuncParam> params, List<FuncParam> namedParams, Expr body, Ty returnType,
                Span span, String alias) {
        super(span, alias);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.namedParams = Collections.unmodifiableList(new ArrayList<>(namedParams));
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.returnType = returnType;
    }

    public List<FuncParam> params() {
        return params;
    }

    public List<FuncParam> namedParams() {
        return namedParams;
    }

    public Expr body() {
        return body;
    }

    public Ty returnType() {
        return returnType;
    }

    @Override
    public Func withAlias(String alias) {
        return new Func(params, namedParams, body, returnType, span, alias);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(aliasPrefix()).append("func");
        for (FuncParam p : params) {
            sb.append(' ').append(p);
        }
        for (FuncParam p : namedParams) {
            sb.append(' ').append(p);
        }
        return sb.append(" -> ").append(body).toString();
    }
}
