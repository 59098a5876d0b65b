package org.metalift.semantic.symbol;

import org.metalift.semantic.type.Type;

public interface Symbol
{
	String getName();

	Type getType();
}
