package org.metalift.semantic.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A fixed-arity product of types, positionally typed. Used for list- and tuple-shaped annotations.
 */
public final class TupleType implements Type
{
	private final List<Type> elements;

	public TupleType(List<Type> elements)
	{
		this.elements = List.copyOf(elements);
	}

	public List<Type> getElements()
	{
		return elements;
	}

	public int getArity()
	{
		return elements.size();
	}

	@Override
	public String getName()
	{
		// Generates a string representation like "(Int, Bool)"
		return "(" + elements.stream()
				.map(Type::getName)
				.collect(Collectors.joining(", ")) + ")";
	}

	@Override
	public boolean isTuple()
	{
		return true;
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
		TupleType tupleType = (TupleType) o;
		return Objects.equals(elements, tupleType.elements);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(elements);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
