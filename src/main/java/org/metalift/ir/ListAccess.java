package org.metalift.ir;

import org.metalift.semantic.type.Type;

import java.util.Objects;
import java.util.Optional;

/**
 * Element access {@code collection[index]}. The element type slot is reserved and is
 * always empty when produced by the translator.
 */
public final class ListAccess implements Expr
{
	private final Expr collection;
	private final Expr index;
	private final Type elementType;

	public ListAccess(Expr collection, Expr index)
	{
		this(collection, index, null);
	}

	public ListAccess(Expr collection, Expr index, Type elementType)
	{
		this.collection = Objects.requireNonNull(collection, "collection");
		this.index = Objects.requireNonNull(index, "index");
		this.elementType = elementType;
	}

	public Expr getCollection()
	{
		return collection;
	}

	public Expr getIndex()
	{
		return index;
	}

	public Optional<Type> getElementType()
	{
		return Optional.ofNullable(elementType);
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitListAccess(this);
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
		ListAccess that = (ListAccess) o;
		return collection.equals(that.collection) && index.equals(that.index) && Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(collection, index, elementType);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
