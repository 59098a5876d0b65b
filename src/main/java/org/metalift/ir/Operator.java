package org.metalift.ir;

/**
 * The fixed operator tag set. {@link #FLOOR_DIV} rounds toward negative infinity.
 */
public enum Operator
{
	ADD("add", 2),
	SUB("sub", 2),
	MUL("mul", 2),
	FLOOR_DIV("floordiv", 2),
	EQ("eq", 2),
	NE("ne", 2),
	LT("lt", 2),
	LE("le", 2),
	GT("gt", 2),
	GE("ge", 2),
	NOT("not", 1);

	private final String tag;
	private final int arity;

	Operator(String tag, int arity)
	{
		this.tag = tag;
		this.arity = arity;
	}

	public String getTag()
	{
		return tag;
	}

	public boolean isUnary()
	{
		return arity == 1;
	}

	public boolean isComparison()
	{
		return switch (this)
		{
			case EQ, NE, LT, LE, GT, GE -> true;
			default -> false;
		};
	}
}
