package org.metalift.error;

import org.metalift.semantic.type.Type;

/**
 * A type descriptor with no sampling or marshaling rule.
 */
public class UnsupportedTypeException extends MetaliftException
{
	private final Type type;

	public UnsupportedTypeException(Type type, String purpose)
	{
		super(ErrorKind.UNSUPPORTED_TYPE, "No " + purpose + " rule for type " + type.getName());
		this.type = type;
	}

	/**
	 * For a type name that could not be resolved to a descriptor at all.
	 */
	public UnsupportedTypeException(String typeName, String purpose, Throwable cause)
	{
		super(ErrorKind.UNSUPPORTED_TYPE, "No " + purpose + " rule for type " + typeName, cause);
		this.type = null;
	}

	/**
	 * @return The rejected descriptor, or {@code null} when the type name itself was unknown.
	 */
	public Type getType()
	{
		return type;
	}

	private static final long serialVersionUID = 1L;
}
