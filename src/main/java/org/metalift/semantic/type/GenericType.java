package org.metalift.semantic.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An instantiated parametric type, such as 'List[Int]'.
 * Holds the base name (e.g. List) and the resolved type arguments (e.g. [Int]).
 */
public final class GenericType implements Type
{
	private final String baseName;
	private final List<Type> typeArguments;

	public GenericType(String baseName, List<Type> typeArguments)
	{
		this.baseName = Objects.requireNonNull(baseName, "baseName");
		this.typeArguments = List.copyOf(typeArguments);
	}

	public String getBaseName()
	{
		return baseName;
	}

	public List<Type> getTypeArguments()
	{
		return typeArguments;
	}

	@Override
	public String getName()
	{
		// Generates a name like "List[Int]"
		String args = typeArguments.stream()
				.map(Type::getName)
				.collect(Collectors.joining(", "));
		return baseName + "[" + args + "]";
	}

	@Override
	public boolean isGeneric()
	{
		return true;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (obj == null || getClass() != obj.getClass())
		{
			return false;
		}
		GenericType that = (GenericType) obj;
		return baseName.equals(that.baseName) && typeArguments.equals(that.typeArguments);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(baseName, typeArguments);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
