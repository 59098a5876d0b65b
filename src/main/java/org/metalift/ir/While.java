package org.metalift.ir;

import java.util.List;
import java.util.Objects;

public final class While implements Stmt
{
	private final Expr condition;
	private final List<Node> body;

	public While(Expr condition, List<Node> body)
	{
		this.condition = Objects.requireNonNull(condition, "condition");
		this.body = List.copyOf(body);
	}

	public Expr getCondition()
	{
		return condition;
	}

	public List<Node> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitWhile(this);
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
		While that = (While) o;
		return condition.equals(that.condition) && body.equals(that.body);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(condition, body);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
