package org.metalift.ir;

import java.util.List;
import java.util.Objects;

/**
 * A call by name. The callee is not linked to its declaration: forward references and
 * recursion resolve later against the program's function list.
 */
public final class Call implements Expr
{
	private final String callee;
	private final List<Expr> arguments;

	public Call(String callee, List<Expr> arguments)
	{
		this.callee = Objects.requireNonNull(callee, "callee");
		this.arguments = List.copyOf(arguments);
	}

	public String getCallee()
	{
		return callee;
	}

	public List<Expr> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitCall(this);
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
		Call call = (Call) o;
		return callee.equals(call.callee) && arguments.equals(call.arguments);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(callee, arguments);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
