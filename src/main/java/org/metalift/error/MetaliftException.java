package org.metalift.error;

/**
 * Root of all terminal errors. Any of these aborts the whole translation, compilation
 * or sampling call that raised it; there is no partial result.
 */
public abstract class MetaliftException extends RuntimeException
{
	private final ErrorKind kind;

	protected MetaliftException(ErrorKind kind, String message)
	{
		super(message);
		this.kind = kind;
	}

	protected MetaliftException(ErrorKind kind, String message, Throwable cause)
	{
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	private static final long serialVersionUID = 1L;
}
