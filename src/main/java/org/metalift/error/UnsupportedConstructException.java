package org.metalift.error;

import org.metalift.syntax.SyntaxNode;

/**
 * A syntax-tree node shape with no lowering rule.
 */
public class UnsupportedConstructException extends MetaliftException
{
	public UnsupportedConstructException(String message)
	{
		super(ErrorKind.UNSUPPORTED_CONSTRUCT, message);
	}

	public static UnsupportedConstructException of(SyntaxNode node)
	{
		return new UnsupportedConstructException("NYI: " + node.describe());
	}

	public static UnsupportedConstructException of(String what, SyntaxNode node)
	{
		return new UnsupportedConstructException("NYI: " + what + ": " + node.describe());
	}

	private static final long serialVersionUID = 1L;
}
