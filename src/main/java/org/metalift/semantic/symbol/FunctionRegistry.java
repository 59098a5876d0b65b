package org.metalift.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Whole-program view collected before any function body is translated: the declared
 * function names and the imported module names, both in declaration order.
 * Read-only once built.
 */
public class FunctionRegistry
{
	private final Set<String> functionNames;
	private final List<String> imports;

	public FunctionRegistry(List<String> functionNames, List<String> imports)
	{
		this.functionNames = Collections.unmodifiableSet(new LinkedHashSet<>(functionNames));
		this.imports = List.copyOf(imports);
	}

	public static FunctionRegistry empty()
	{
		return new FunctionRegistry(List.of(), List.of());
	}

	public boolean isFunction(String name)
	{
		return functionNames.contains(name);
	}

	public Set<String> getFunctionNames()
	{
		return functionNames;
	}

	public List<String> getImports()
	{
		return imports;
	}
}
