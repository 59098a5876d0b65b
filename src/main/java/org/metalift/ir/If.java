package org.metalift.ir;

import java.util.Objects;

/**
 * Both branches are always present; a missing else-clause is an empty block.
 */
public final class If implements Stmt
{
	private final Expr condition;
	private final Block thenBlock;
	private final Block elseBlock;

	public If(Expr condition, Block thenBlock, Block elseBlock)
	{
		this.condition = Objects.requireNonNull(condition, "condition");
		this.thenBlock = Objects.requireNonNull(thenBlock, "thenBlock");
		this.elseBlock = Objects.requireNonNull(elseBlock, "elseBlock");
	}

	public Expr getCondition()
	{
		return condition;
	}

	public Block getThenBlock()
	{
		return thenBlock;
	}

	public Block getElseBlock()
	{
		return elseBlock;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitIf(this);
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
		If that = (If) o;
		return condition.equals(that.condition) && thenBlock.equals(that.thenBlock) && elseBlock.equals(that.elseBlock);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(condition, thenBlock, elseBlock);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
