package org.metalift.error;

public class SyntaxDumpException extends MetaliftException
{
	private final int line;
	private final int column;

	public SyntaxDumpException(int line, int column, String message)
	{
		super(ErrorKind.MALFORMED_DUMP, String.format("[Syntax Error] line %d:%d - %s", line, column, message));
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	private static final long serialVersionUID = 1L;
}
