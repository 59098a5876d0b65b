package org.metalift.ir;

import org.metalift.semantic.symbol.Symbol;
import org.metalift.semantic.type.Type;

import java.util.Objects;

/**
 * A typed variable. Owned by the declaring function's symbol table; every node that reads
 * or writes it holds a reference, never a copy.
 */
public final class Var implements Expr, Symbol
{
	private final String name;
	private final Type type;

	public Var(String name, Type type)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitVar(this);
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
		Var var = (Var) o;
		return name.equals(var.name) && type.equals(var.type);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
