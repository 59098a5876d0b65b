package org.metalift.ir;

import java.util.List;

/**
 * An ordered sequence of statements. Besides {@link Stmt}s a block may hold expressions
 * evaluated for their effect (e.g. a bare call) and {@link Var}s, which mark a declaration
 * without an initializer.
 */
public final class Block implements Node
{
	public static final Block EMPTY = new Block(List.of());

	private final List<Node> statements;

	public Block(List<Node> statements)
	{
		this.statements = List.copyOf(statements);
	}

	public List<Node> getStatements()
	{
		return statements;
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitBlock(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		return statements.equals(((Block) o).statements);
	}

	@Override
	public int hashCode()
	{
		return statements.hashCode();
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
