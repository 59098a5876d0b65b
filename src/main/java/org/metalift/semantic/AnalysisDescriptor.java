package org.metalift.semantic;

import org.metalift.ir.FnDecl;
import org.metalift.ir.Var;
import org.metalift.semantic.type.Type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Signature metadata needed to compile and call a native function: its name, its ordered
 * arguments and its return type.
 */
public final class AnalysisDescriptor
{
	private final String name;
	private final List<Var> arguments;
	private final Type returnType;

	public AnalysisDescriptor(String name, List<Var> arguments, Type returnType)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.arguments = List.copyOf(arguments);
		this.returnType = Objects.requireNonNull(returnType, "returnType");
	}

	/**
	 * Builds the descriptor of a translated function.
	 */
	public static AnalysisDescriptor of(FnDecl fn)
	{
		return new AnalysisDescriptor(fn.getName(), fn.getParameters(), fn.getReturnType());
	}

	public String getName()
	{
		return name;
	}

	public List<Var> getArguments()
	{
		return arguments;
	}

	public List<Type> getArgumentTypes()
	{
		return arguments.stream().map(Var::getType).collect(Collectors.toList());
	}

	public int getArity()
	{
		return arguments.size();
	}

	public Type getReturnType()
	{
		return returnType;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		AnalysisDescriptor that = (AnalysisDescriptor) o;
		return name.equals(that.name) && arguments.equals(that.arguments) && returnType.equals(that.returnType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, arguments, returnType);
	}

	@Override
	public String toString()
	{
		String args = arguments.stream()
				.map(a -> a.getName() + ": " + a.getType().getName())
				.collect(Collectors.joining(", "));
		return name + "(" + args + ") -> " + returnType.getName();
	}
}
