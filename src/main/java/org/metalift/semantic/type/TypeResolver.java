package org.metalift.semantic.type;

import org.metalift.error.UnsupportedAnnotationException;
import org.metalift.syntax.SyntaxKind;
import org.metalift.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves annotation sub-trees into type descriptors against a {@link TypeEnvironment}.
 * <p>
 * Accepted shapes:
 * <ul>
 *     <li>{@code Name} - a type with no arguments, e.g. {@code int}</li>
 *     <li>{@code Subscript} - {@code Base[Arg]}, a parametric type with one resolved argument</li>
 *     <li>{@code List} or {@code Tuple} of annotations - a product type of the same arity</li>
 * </ul>
 * {@code Index} wrappers produced by older parsers are transparent. Every other shape fails.
 */
public class TypeResolver
{
	private final TypeEnvironment environment;

	public TypeResolver(TypeEnvironment environment)
	{
		this.environment = environment;
	}

	public TypeEnvironment getEnvironment()
	{
		return environment;
	}

	public Type resolve(SyntaxNode annotation)
	{
		if (annotation == null)
		{
			throw UnsupportedAnnotationException.of(null);
		}

		switch (annotation.getKind())
		{
			case NAME:
				return resolveName(annotation.string("id"));
			case INDEX:
				return resolve(annotation.node("value"));
			case SUBSCRIPT:
			{
				SyntaxNode base = annotation.node("value");
				if (base == null || !base.is(SyntaxKind.NAME))
				{
					throw UnsupportedAnnotationException.of(annotation);
				}
				String baseName = base.string("id");
				Type argument = resolve(annotation.node("slice"));
				return constructorFor(baseName).construct(baseName, List.of(argument));
			}
			case LIST:
			case TUPLE:
			{
				List<Type> elements = new ArrayList<>();
				for (SyntaxNode element : annotation.nodes("elts"))
				{
					elements.add(resolve(element));
				}
				return new TupleType(elements);
			}
			default:
				throw UnsupportedAnnotationException.of(annotation);
		}
	}

	/**
	 * Resolves a bare type name, e.g. "Int".
	 */
	public Type resolveName(String name)
	{
		return constructorFor(name).construct(name, List.of());
	}

	private TypeConstructor constructorFor(String name)
	{
		return environment.lookup(name)
				.orElseThrow(() -> new UnsupportedAnnotationException("Unknown type name: " + name));
	}
}
