package com.prqlc.test;

import com.prqlc.CompileOptions;
import com.prqlc.Compiler;
import com.prqlc.Target;
import com.prqlc.catalog.TableCatalog;
import com.prqlc.dialect.Dialect;
import com.prqlc.rq.RelationalQuery;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of all tests: step logging and compilation helpers.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void logTestStart(TestInfo info) {
        testName = info.getDisplayName();
        logger.debug("Running {}", testName);
    }

    protected String getTestName() {
        return testName;
    }

    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {}: {}", testName, label, value);
    }

    // ==================== Compilation Helpers ====================

    /**
     * Compiles to single-line generic SQL without signature comment.
     */
    protected String compile(String prql) {
        return compile(prql, Dialect.GENERIC);
    }

    protected String compile(String prql, Dialect dialect) {
        return compile(prql, options(dialect));
    }

    protected String compile(String prql, CompileOptions options) {
        logStep("Compiling: " + prql);
        String sql = Compiler.compile(prql, options);
        logData("SQL", sql);
        return sql;
    }

    protected String compileWithCatalog(String prql, TableCatalog catalog) {
        return compile(prql, options(Dialect.GENERIC).toBuilder().catalog(catalog).build());
    }

    protected RelationalQuery lower(String prql) {
        return Compiler.resolveAndLower(Compiler.parse(prql), options(Dialect.GENERIC));
    }

    protected static CompileOptions options(Dialect dialect) {
        return CompileOptions.builder()
            .target(Target.of(dialect))
            .format(false)
            .signatureComment(false)
            .build();
    }
}
