package org.metalift.error;

/**
 * The low-level module could not be parsed, verified, loaded, or does not expose
 * an entry point matching the analysis descriptor.
 */
public class NativeCompilationException extends MetaliftException
{
	public NativeCompilationException(String message)
	{
		super(ErrorKind.NATIVE_COMPILATION, message);
	}

	private static final long serialVersionUID = 1L;
}
