package org.metalift.semantic.symbol;

import org.metalift.error.ConflictingDeclarationException;
import org.metalift.error.UndeclaredVariableException;
import org.metalift.ir.Var;
import org.metalift.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The symbol table of one function. Created empty for every function that is translated;
 * parameters are defined first, in declaration order, then body declarations as they appear.
 */
public class Scope
{
	private final String functionName;
	private final Map<String, Var> symbols = new LinkedHashMap<>();

	public Scope(String functionName)
	{
		this.functionName = functionName;
	}

	public String getFunctionName()
	{
		return functionName;
	}

	/**
	 * Registers a variable. Declaring a name again with the same type returns the existing Var,
	 * so every reference points at a single entry; a different type is rejected.
	 */
	public Var define(String name, Type type)
	{
		Var existing = symbols.get(name);
		if (existing != null)
		{
			if (!existing.getType().equals(type))
			{
				throw new ConflictingDeclarationException(name, existing.getType(), type);
			}
			return existing;
		}
		Var var = new Var(name, type);
		symbols.put(name, var);
		return var;
	}

	public Optional<Var> resolveLocally(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	/**
	 * @throws UndeclaredVariableException if {@code name} was never registered in this function.
	 */
	public Var resolve(String name)
	{
		return resolveLocally(name).orElseThrow(() -> new UndeclaredVariableException(name, functionName));
	}

	public boolean isDefined(String name)
	{
		return symbols.containsKey(name);
	}

	public List<Var> getSymbols()
	{
		return Collections.unmodifiableList(new ArrayList<>(symbols.values()));
	}
}
