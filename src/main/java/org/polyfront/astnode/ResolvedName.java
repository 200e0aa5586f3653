package org.polyfront.astnode;

import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Result of resolving an identifier.
 * <p>
 * Lowering only produces LOCAL, PARAM, IMPORTED and NOT_RESOLVED. GLOBAL is
 * left to later passes that know the enclosing module, which record it with
 * the qualifier of the owning module.
 *
 * @param kind      the classification
 * @param defSite   where the binding was introduced; null when unknown or not resolved
 * @param qualifier module path of a GLOBAL binding, e.g. [scala, math]; empty otherwise
 */
public record ResolvedName(ResolvedKind kind, SourceInfo defSite, List<String> qualifier) {

    public static final ResolvedName NOT_RESOLVED = new ResolvedName(ResolvedKind.NOT_RESOLVED, null);

    public ResolvedName {
        qualifier = qualifier == null ? List.of() : List.copyOf(qualifier);
    }

    public ResolvedName(ResolvedKind kind, SourceInfo defSite) {
        this(kind, defSite, List.of());
    }

    public static ResolvedName local(SourceInfo defSite) {
        return new ResolvedName(ResolvedKind.LOCAL, defSite);
    }

    public static ResolvedName param(SourceInfo defSite) {
        return new ResolvedName(ResolvedKind.PARAM, defSite);
    }

    public static ResolvedName imported(SourceInfo defSite) {
        return new ResolvedName(ResolvedKind.IMPORTED, defSite);
    }

    public static ResolvedName global(List<String> qualifier) {
        return new ResolvedName(ResolvedKind.GLOBAL, null, qualifier);
    }

    public static ResolvedName global(List<String> qualifier, SourceInfo defSite) {
        return new ResolvedName(ResolvedKind.GLOBAL, defSite, qualifier);
    }
}
