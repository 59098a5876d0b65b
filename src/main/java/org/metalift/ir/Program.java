package org.metalift.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a translated module: imports and function declarations, both in declaration order.
 */
public final class Program implements Node
{
	private final List<String> imports;
	private final List<FnDecl> functions;

	public Program(List<String> imports, List<FnDecl> functions)
	{
		this.imports = List.copyOf(imports);
		this.functions = List.copyOf(functions);
	}

	public List<String> getImports()
	{
		return imports;
	}

	public List<FnDecl> getFunctions()
	{
		return functions;
	}

	/**
	 * @return The last declaration named {@code name}, matching how a later definition shadows an earlier one.
	 */
	public Optional<FnDecl> findFunction(String name)
	{
		FnDecl found = null;
		for (FnDecl fn : functions)
		{
			if (fn.getName().equals(name))
			{
				found = fn;
			}
		}
		return Optional.ofNullable(found);
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
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
		Program program = (Program) o;
		return imports.equals(program.imports) && functions.equals(program.functions);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(imports, functions);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
