package org.metalift.semantic.type;

import org.metalift.error.UnsupportedAnnotationException;

import java.util.List;

/**
 * Builds a type descriptor from a resolved name and its resolved type arguments.
 * A bare name is constructed with no arguments; {@code Base[Arg]} with exactly one.
 */
@FunctionalInterface
public interface TypeConstructor
{
	Type construct(String name, List<Type> arguments);

	/**
	 * A constructor for a primitive that takes no type arguments.
	 */
	static TypeConstructor primitive(PrimitiveType type)
	{
		return (name, arguments) ->
		{
			if (!arguments.isEmpty())
			{
				throw new UnsupportedAnnotationException("Type " + name + " does not take type arguments, got " + arguments);
			}
			return type;
		};
	}

	/**
	 * A constructor for a parametric type such as {@code List[Int]}. The name written in the
	 * annotation is kept as the base name unless {@code baseName} is given.
	 */
	static TypeConstructor parametric(String baseName)
	{
		return (name, arguments) ->
		{
			if (arguments.size() != 1)
			{
				throw new UnsupportedAnnotationException("Type " + name + " requires exactly one type argument, got " + arguments.size());
			}
			return new GenericType(baseName == null ? name : baseName, arguments);
		};
	}

	/**
	 * A constructor that turns {@code Tuple[A, B]} into the product type {@code (A, B)} itself.
	 */
	static TypeConstructor product()
	{
		return (name, arguments) ->
		{
			if (arguments.size() != 1)
			{
				throw new UnsupportedAnnotationException("Type " + name + " requires a bracketed list of element types");
			}
			Type argument = arguments.get(0);
			if (argument instanceof TupleType tuple)
			{
				return tuple;
			}
			return new TupleType(List.of(argument));
		};
	}
}
