package com.prqlc.semantic;

import com.prqlc.exception.ResolveException;
import com.prqlc.pl.ModuleDef;
import com.prqlc.pl.QueryDef;
import com.prqlc.pl.Stmt;
import com.prqlc.pl.Ty;
import com.prqlc.pl.VarDef;

import java.util.List;

/**
 * Registers parsed statements as declarations of a module.
 */
final class ModuleBuilder {

    private ModuleBuilder() {
    }

    static void declareAll(Module module, List<Stmt> stmts) {
        for (Stmt stmt : stmts) {
            declare(module, stmt);
        }
    }

    static void declare(Module module, Stmt stmt) {
        if (stmt instanceof ModuleDef moduleDef) {
            Module sub = module.submodule(moduleDef.name());
            declareAll(sub, moduleDef.stmts());
        } else if (stmt instanceof VarDef varDef) {
            if (varDef.kind() == VarDef.Kind.MAIN) {
                throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
                    "a main pipeline is only allowed at the top level", varDef.span());
            }
            module.declare(varDef.name(), toDecl(module, varDef));
        } else if (stmt instanceof QueryDef queryDef) {
            throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
                "the query header must be the first statement of the query", queryDef.span());
        } else {
            throw new IllegalStateException("Unknown statement: " + stmt);
        }
    }

    private static Decl toDecl(Module module, VarDef varDef) {
        String fullName = module.qualify(varDef.name());
        if (varDef.value() == null) {
            Ty type = varDef.type();
            if (!type.isRelationShape()) {
                throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                    "`let " + varDef.name() + "` without a value must declare a relation type such as <[{a, b}]>",
                    varDef.span());
            }
            return Decl.table(fullName, module, type, varDef.span());
        }
        return Decl.value(fullName, module, varDef.value(), varDef.type(), varDef.span());
    }
}
