package org.metalift.error;

public class UndeclaredVariableException extends MetaliftException
{
	private final String variableName;

	public UndeclaredVariableException(String variableName, String functionName)
	{
		super(ErrorKind.UNDECLARED_VARIABLE, "No variable called " + variableName
				+ " was declared before use in function " + functionName + ".");
		this.variableName = variableName;
	}

	public String getVariableName()
	{
		return variableName;
	}

	private static final long serialVersionUID = 1L;
}
