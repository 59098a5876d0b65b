package org.metalift.ir;

import java.util.Objects;

public final class UnaryOp implements Expr
{
	private final Operator operator;
	private final Expr operand;

	public UnaryOp(Operator operator, Expr operand)
	{
		if (!operator.isUnary())
		{
			throw new IllegalArgumentException("Operator " + operator.getTag() + " is not unary");
		}
		this.operator = operator;
		this.operand = Objects.requireNonNull(operand, "operand");
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Expr getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitUnaryOp(this);
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
		UnaryOp that = (UnaryOp) o;
		return operator == that.operator && operand.equals(that.operand);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator, operand);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
