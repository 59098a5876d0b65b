package org.metalift.ir;

/**
 * A node of the intermediate representation. The set of node kinds is closed: every
 * implementation has a matching method on {@link IRVisitor}.
 * <p>
 * Nodes are immutable once built. A parent owns its children, except for {@link Var}s,
 * which are references into the owning function's symbol table.
 */
public interface Node
{
	<R> R accept(IRVisitor<R> visitor);
}
