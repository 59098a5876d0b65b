package org.metalift.ir;

import java.util.Objects;

public final class BinaryOp implements Expr
{
	private final Operator operator;
	private final Expr left;
	private final Expr right;

	public BinaryOp(Operator operator, Expr left, Expr right)
	{
		if (operator.isUnary())
		{
			throw new IllegalArgumentException("Operator " + operator.getTag() + " is not binary");
		}
		this.operator = operator;
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Expr getLeft()
	{
		return left;
	}

	public Expr getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitBinaryOp(this);
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
		BinaryOp that = (BinaryOp) o;
		return operator == that.operator && left.equals(that.left) && right.equals(that.right);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator, left, right);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
