package org.metalift.error;

import org.metalift.syntax.SyntaxNode;

public class MultiTargetAssignmentException extends MetaliftException
{
	public MultiTargetAssignmentException(SyntaxNode assignment)
	{
		super(ErrorKind.MULTI_TARGET_ASSIGNMENT, "multi-assign NYI: " + assignment.describe());
	}

	private static final long serialVersionUID = 1L;
}
