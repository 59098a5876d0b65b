package org.metalift.ir;

/**
 * {@code break} or {@code continue}.
 */
public final class Branch implements Stmt
{
	public enum Kind
	{
		BREAK,
		CONTINUE
	}

	public static final Branch BREAK = new Branch(Kind.BREAK);
	public static final Branch CONTINUE = new Branch(Kind.CONTINUE);

	private final Kind kind;

	private Branch(Kind kind)
	{
		this.kind = kind;
	}

	public static Branch of(Kind kind)
	{
		return kind == Kind.BREAK ? BREAK : CONTINUE;
	}

	public Kind getKind()
	{
		return kind;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitBranch(this);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
