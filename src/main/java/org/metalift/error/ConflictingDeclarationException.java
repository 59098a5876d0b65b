package org.metalift.error;

import org.metalift.semantic.type.Type;

public class ConflictingDeclarationException extends MetaliftException
{
	public ConflictingDeclarationException(String name, Type existing, Type redeclared)
	{
		super(ErrorKind.CONFLICTING_DECLARATION, "Variable " + name + " is already declared as "
				+ existing.getName() + " and cannot be redeclared as " + redeclared.getName());
	}

	private static final long serialVersionUID = 1L;
}
