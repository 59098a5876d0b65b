package org.metalift.semantic.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The names a type annotation may refer to, each bound to the constructor that builds its descriptor.
 * New container or record types are added with {@link #define} without touching the resolver.
 */
public class TypeEnvironment
{
	private final Map<String, TypeConstructor> constructors = new LinkedHashMap<>();

	/**
	 * @return A fresh environment with the built-in scalar and container types.
	 */
	public static TypeEnvironment standard()
	{
		TypeEnvironment env = new TypeEnvironment();
		env.define("Int", TypeConstructor.primitive(PrimitiveType.INT));
		env.define("int", TypeConstructor.primitive(PrimitiveType.INT));
		env.define("Bool", TypeConstructor.primitive(PrimitiveType.BOOL));
		env.define("bool", TypeConstructor.primitive(PrimitiveType.BOOL));

		env.define("List", TypeConstructor.parametric("List"));
		env.define("list", TypeConstructor.parametric("List"));
		env.define("Set", TypeConstructor.parametric("Set"));
		env.define("set", TypeConstructor.parametric("Set"));
		env.define("Dict", TypeConstructor.parametric("Dict"));
		env.define("dict", TypeConstructor.parametric("Dict"));

		env.define("Tuple", TypeConstructor.product());
		env.define("tuple", TypeConstructor.product());
		return env;
	}

	public TypeEnvironment define(String name, TypeConstructor constructor)
	{
		constructors.put(name, constructor);
		return this;
	}

	public Optional<TypeConstructor> lookup(String name)
	{
		return Optional.ofNullable(constructors.get(name));
	}

	public boolean isDefined(String name)
	{
		return constructors.containsKey(name);
	}

	public Map<String, TypeConstructor> getConstructors()
	{
		return Collections.unmodifiableMap(constructors);
	}
}
