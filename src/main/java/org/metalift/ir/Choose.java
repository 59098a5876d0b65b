package org.metalift.ir;

import java.util.List;

/**
 * A synthesis hole: one of the alternatives is picked later by the synthesizer.
 */
public final class Choose implements Expr
{
	private final List<Expr> alternatives;

	public Choose(List<Expr> alternatives)
	{
		this.alternatives = List.copyOf(alternatives);
	}

	public List<Expr> getAlternatives()
	{
		return alternatives;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitChoose(this);
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
		return alternatives.equals(((Choose) o).alternatives);
	}

	@Override
	public int hashCode()
	{
		return alternatives.hashCode();
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
