package org.polyfront.symbols;

import org.polyfront.astnode.ResolvedName;
import org.polyfront.lexer.SourceInfo;

import java.util.HashMap;
import java.util.Map;

/**
 * The scope environment threaded through lowering.
 * <p>
 * Block-scoped and parameter bindings live in an immutable list where newer
 * bindings are prepended, so the first match is the nearest enclosing one.
 * Extending the list returns a new environment; the caller continues with the
 * returned value, so a block never leaks bindings to its siblings' parents.
 * <p>
 * Function-scoped ({@code var}-style) bindings live in a mutable map shared by
 * all environments of the same function. {@link #enterFunction()} copies it, so
 * nested functions never see or change the bindings of an enclosing function
 * declared after they were entered.
 */
public final class ScopeEnv {

    // Immutable cons cell of the local binding list
    private record Binding(String name, ResolvedName resolved, Binding next) {
    }

    private final Binding locals;
    private final Map<String, ResolvedName> vars;

    private ScopeEnv(Binding locals, Map<String, ResolvedName> vars) {
        this.locals = locals;
        this.vars = vars;
    }

    public static ScopeEnv empty() {
        return new ScopeEnv(null, new HashMap<>());
    }

    /**
     * Returns an environment where name is a block-scoped local binding.
     */
    public ScopeEnv withLocal(String name, SourceInfo defSite) {
        return new ScopeEnv(new Binding(name, ResolvedName.local(defSite), locals), vars);
    }

    /**
     * Returns an environment where name refers to a binding of another module.
     */
    public ScopeEnv withImport(String name, SourceInfo defSite) {
        return new ScopeEnv(new Binding(name, ResolvedName.imported(defSite), locals), vars);
    }

    public ScopeEnv withParam(String name, SourceInfo defSite) {
        return new ScopeEnv(new Binding(name, ResolvedName.param(defSite), locals), vars);
    }

    /**
     * Registers a function-scoped binding. It is visible to every environment of
     * the current function, and to functions entered afterwards.
     */
    public void declareVar(String name, SourceInfo defSite) {
        vars.put(name, ResolvedName.local(defSite));
    }

    /**
     * Returns the environment for the body of a nested function: same locals, a
     * private copy of the function-scoped bindings.
     */
    public ScopeEnv enterFunction() {
        return new ScopeEnv(locals, new HashMap<>(vars));
    }

    /**
     * Looks the name up in the local list, then in the function-scoped set.
     *
     * @return the resolution, or null when the name is not bound
     */
    public ResolvedName lookup(String name) {
        for (Binding b = locals; b != null; b = b.next) {
            if (b.name.equals(name)) {
                return b.resolved;
            }
        }
        return vars.get(name);
    }

    public boolean isBound(String name) {
        return lookup(name) != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ScopeEnv{locals=[");
        for (Binding b = locals; b != null; b = b.next) {
            sb.append(b.name).append(':').append(b.resolved.kind().toString().toLowerCase());
            if (b.next != null) {
                sb.append(", ");
            }
        }
        return sb.append("], vars=").append(vars.keySet()).append('}').toString();
    }
}
