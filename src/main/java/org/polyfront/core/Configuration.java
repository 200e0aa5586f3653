package org.polyfront.core;

/**
 * Central configuration constants of the front end.
 * <p>
 * The version of the Generic AST is bumped whenever the shape of a node
 * changes, since every downstream consumer depends on it.
 */
public final class Configuration {

    public static final String jarVersion = "1.0.0";
    public static final int genericAstVersion = 1;

    // Prevent instantiation
    private Configuration() {
    }

    public static String getVersionString() {
        return "polyfront " + jarVersion + " (generic AST v" + genericAstVersion + ")";
    }
}
