package org.polyfront.astnode;

/**
 * What a {@link DefinitionNode} defines.
 */
public interface DefinitionKind extends Node {
}
