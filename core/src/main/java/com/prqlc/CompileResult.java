package com.prqlc;

import com.prqlc.exception.ErrorMessages;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a compilation: either SQL or the errors that prevented it.
 */
public final class CompileResult {

    private final String sql;
    private final ErrorMessages errors;

    private CompileResult(String sql, ErrorMessages errors) {
        this.sql = sql;
        this.errors = errors;
    }

    public static CompileResult success(String sql) {
        return new CompileResult(Objects.requireNonNull(sql, "sql must not be null"), null);
    }

    public static CompileResult failure(ErrorMessages errors) {
        return new CompileResult(null, Objects.requireNonNull(errors, "errors must not be null"));
    }

    public boolean isSuccess() {
        return sql != null;
    }

    public Optional<String> sql() {
        return Optional.ofNullable(sql);
    }

    /**
     * Returns the errors, empty on success.
     */
    public ErrorMessages errors() {
        return errors != null ? errors : new ErrorMessages(List.of());
    }

    @Override
    public String toString() {
        return isSuccess() ? "CompileResult(sql=" + sql + ")" : "CompileResult(errors=" + errors + ")";
    }
}
