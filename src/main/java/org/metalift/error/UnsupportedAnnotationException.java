package org.metalift.error;

import org.metalift.syntax.SyntaxNode;

/**
 * A type annotation the type resolver cannot interpret, or that names a type
 * missing from the type environment.
 */
public class UnsupportedAnnotationException extends MetaliftException
{
	public UnsupportedAnnotationException(String message)
	{
		super(ErrorKind.UNSUPPORTED_ANNOTATION, message);
	}

	public static UnsupportedAnnotationException of(SyntaxNode annotation)
	{
		String shape = annotation == null ? "<missing annotation>" : annotation.describe();
		return new UnsupportedAnnotationException("Unsupported type annotation: " + shape);
	}

	private static final long serialVersionUID = 1L;
}
