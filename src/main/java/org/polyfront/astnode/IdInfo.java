package org.polyfront.astnode;

/**
 * The resolution slot of an identifier.
 * <p>
 * The slot is an owned, mutable cell: lowering fills it in, and a later pass may
 * overwrite it without re-walking the tree. A unit is processed by a single
 * owner at a time, so no two components ever write the same cell concurrently.
 */
public class IdInfo {
    private ResolvedName resolved;

    public IdInfo() {
    }

    public IdInfo(ResolvedName resolved) {
        this.resolved = resolved;
    }

    /**
     * @return the resolution, or null when it was never set
     */
    public ResolvedName getResolved() {
        return resolved;
    }

    public void setResolved(ResolvedName resolved) {
        this.resolved = resolved;
    }

    public boolean isResolved() {
        return resolved != null;
    }

    @Override
    public String toString() {
        if (resolved == null) {
            return "?";
        }
        return resolved.qualifier().isEmpty()
                ? resolved.kind().toString()
                : resolved.kind() + " " + String.join(".", resolved.qualifier());
    }
}
