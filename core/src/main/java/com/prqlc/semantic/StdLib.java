package com.prqlc.semantic;

import com.prqlc.exception.PrqlException;
import com.prqlc.parser.PrqlSourceParser;
import com.prqlc.pl.Stmt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads the standard library from the {@code prqlc/std.prql} resource.
 *
 * <p>The library is parsed once and the resulting module is shared by all
 * compilations. It only declares functions, which are never mutated after
 * loading, so sharing it across threads is safe.
 */
public final class StdLib {

    private static final Logger logger = LoggerFactory.getLogger(StdLib.class);

    public static final String MODULE_NAME = "std";
    static final String RESOURCE = "/prqlc/std.prql";

    private StdLib() {
    }

    private static final class Holder {
        static final Module MODULE = load();
    }

    /**
     * Returns the shared standard library module.
     */
    public static Module module() {
        return Holder.MODULE;
    }

    static Module load() {
        String source = readResource();
        List<Stmt> stmts;
        try {
            stmts = new PrqlSourceParser().parse(source);
        } catch (PrqlException e) {
            throw new IllegalStateException("The bundled standard library does not parse: " + e.getUserMessage(), e);
        }
        Module std = new Module(MODULE_NAME, null);
        ModuleBuilder.declareAll(std, stmts);
        for (Decl decl : std.decls().values()) {
            if (decl.kind() == Decl.Kind.VALUE && !decl.isFunction()) {
                throw new IllegalStateException("The standard library may only declare functions: " + decl);
            }
        }
        logger.debug("Loaded standard library with {} declarations", std.allNames().size());
        return std;
    }

    private static String readResource() {
        try (InputStream in = StdLib.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Standard library resource not found: " + RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read the standard library", e);
        }
    }
}
