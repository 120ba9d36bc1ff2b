package com.prqlc.semantic;

import com.prqlc.exception.ResolveException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A namespace of declarations. Modules nest; the root module holds the
 * declarations of a query and {@code std} holds the standard library.
 */
public final class Module {

    private final String name;
    private final Module parent;
    private final Map<String, Decl> decls = new LinkedHashMap<>();

    public Module(String name, Module parent) {
        this.name = name;
        this.parent = parent;
    }

    public static Module root() {
        return new Module(null, null);
    }

    public String name() {
        return name;
    }

    public Module parent() {
        return parent;
    }

    /**
     * Returns the dotted path of this module; empty for the root module.
     */
    public String path() {
        if (parent == null || parent.path().isEmpty()) {
            return name == null ? "" : name;
        }
        return parent.path() + "." + name;
    }

    /**
     * Returns the full name a declaration of this module gets.
     */
    public String qualify(String declName) {
        String path = path();
        return path.isEmpty() ? declName : path + "." + declName;
    }

    public void declare(String declName, Decl decl) {
        if (decls.containsKey(declName)) {
            throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
                "`" + qualify(declName) + "` is declared more than once", decl.span());
        }
        decls.put(declName, decl);
    }

    /**
     * Returns the submodule with the given name, creating it if needed.
     */
    public Module submodule(String moduleName) {
        Decl existing = decls.get(moduleName);
        if (existing != null) {
            if (existing.kind() != Decl.Kind.MODULE) {
                throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
                    "`" + qualify(moduleName) + "` is already declared and is not a module", existing.span());
            }
            return existing.module();
        }
        Module sub = new Module(moduleName, this);
        decls.put(moduleName, Decl.module(sub));
        return sub;
    }

    public Decl get(String declName) {
        return decls.get(declName);
    }

    /**
     * Looks up a possibly dotted path, descending through submodules.
     *
     * @return the declaration, or null if the path does not exist
     */
    public Decl lookup(List<String> parts) {
        Module current = this;
        for (int i = 0; i < parts.size() - 1; i++) {
            Decl decl = current.get(parts.get(i));
            if (decl == null || decl.kind() != Decl.Kind.MODULE) {
                return null;
            }
            current = decl.module();
        }
        return current.get(parts.get(parts.size() - 1));
    }

    public Map<String, Decl> decls() {
        return Collections.unmodifiableMap(decls);
    }

    /**
     * Returns the names of all declarations in this module and its submodules,
     * relative to this module.
     */
    public List<String> allNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Decl> entry : decls.entrySet()) {
            names.add(entry.getKey());
            if (entry.getValue().kind() == Decl.Kind.MODULE) {
                for (String nested : entry.getValue().module().allNames()) {
                    names.add(entry.getKey() + "." + nested);
                }
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return "Module(" + (name == null ? "<root>" : path()) + ", " + decls.keySet() + ")";
    }
}
