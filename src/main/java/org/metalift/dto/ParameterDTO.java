package org.metalift.dto;

public class ParameterDTO
{
	// The name of the argument (e.g., "x")
	public String name;

	// The unresolved type name (e.g., "Int")
	public String type;
}
