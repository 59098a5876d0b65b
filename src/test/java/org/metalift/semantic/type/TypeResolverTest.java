package org.metalift.semantic.type;

import org.metalift.error.UnsupportedAnnotationException;
import org.metalift.syntax.SyntaxNode;
import org.metalift.syntax.SyntaxTreeReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeResolverTest
{
	private final TypeResolver resolver = new TypeResolver(TypeEnvironment.standard());

	private Type resolve(String dump)
	{
		return resolver.resolve(SyntaxTreeReader.read(dump));
	}

	@Test
	void resolvesPrimitiveNames()
	{
		assertSame(PrimitiveType.INT, resolve("Name(id='int', ctx=Load())"));
		assertSame(PrimitiveType.INT, resolve("Name(id='Int', ctx=Load())"));
		assertSame(PrimitiveType.BOOL, resolve("Name(id='bool', ctx=Load())"));
	}

	@Test
	void resolvesParametricTypes()
	{
		Type type = resolve("Subscript(value=Name(id='list', ctx=Load()), slice=Name(id='int', ctx=Load()), ctx=Load())");

		assertEquals(new GenericType("List", List.of(PrimitiveType.INT)), type);
		assertEquals("List[Int]", type.getName());
	}

	@Test
	void resolvesNestedParametricTypes()
	{
		Type type = resolve("Subscript(value=Name(id='Set', ctx=Load()), slice=Subscript(value=Name(id='List', ctx=Load()), "
				+ "slice=Name(id='bool', ctx=Load()), ctx=Load()), ctx=Load())");

		assertEquals("Set[List[Bool]]", type.getName());
	}

	@Test
	void resolvesProductTypes()
	{
		TupleType tuple = (TupleType) resolve("Tuple(elts=[Name(id='int', ctx=Load()), Name(id='bool', ctx=Load())], ctx=Load())");

		assertEquals(2, tuple.getArity());
		assertEquals(List.of(PrimitiveType.INT, PrimitiveType.BOOL), tuple.getElements());
		assertEquals(tuple, resolve("List(elts=[Name(id='int', ctx=Load()), Name(id='bool', ctx=Load())], ctx=Load())"));
	}

	@Test
	void tupleConstructorYieldsTheProductItself()
	{
		Type type = resolve("Subscript(value=Name(id='Tuple', ctx=Load()), "
				+ "slice=Tuple(elts=[Name(id='int', ctx=Load()), Name(id='int', ctx=Load())], ctx=Load()), ctx=Load())");

		assertEquals(new TupleType(List.of(PrimitiveType.INT, PrimitiveType.INT)), type);
	}

	@Test
	void indexWrapperIsTransparent()
	{
		Type type = resolve("Subscript(value=Name(id='Dict', ctx=Load()), slice=Index(value=Name(id='int', ctx=Load())), ctx=Load())");
		assertEquals(new GenericType("Dict", List.of(PrimitiveType.INT)), type);
	}

	@Test
	void rejectsUnknownNamesAndShapes()
	{
		assertThrows(UnsupportedAnnotationException.class, () -> resolve("Name(id='float', ctx=Load())"));
		assertThrows(UnsupportedAnnotationException.class, () -> resolve("Constant(value='int')"));
		assertThrows(UnsupportedAnnotationException.class,
				() -> resolve("Subscript(value=Attribute(value=Name(id='t', ctx=Load()), attr='List', ctx=Load()), "
						+ "slice=Name(id='int', ctx=Load()), ctx=Load())"));
		assertThrows(UnsupportedAnnotationException.class, () -> resolver.resolve(null));
	}

	@Test
	void rejectsWrongTypeArgumentCounts()
	{
		assertThrows(UnsupportedAnnotationException.class, () -> resolve("Name(id='List', ctx=Load())"));
		assertThrows(UnsupportedAnnotationException.class,
				() -> resolve("Subscript(value=Name(id='int', ctx=Load()), slice=Name(id='int', ctx=Load()), ctx=Load())"));
	}

	@Test
	void environmentIsExtensible()
	{
		TypeEnvironment env = TypeEnvironment.standard().define("Vec", TypeConstructor.parametric("Vec"));
		TypeResolver custom = new TypeResolver(env);

		Type type = custom.resolve(SyntaxNode.of("Subscript",
				"value", SyntaxNode.of("Name", "id", "Vec"),
				"slice", SyntaxNode.of("Name", "id", "int")));
		assertEquals("Vec[Int]", type.getName());
		assertFalse(resolver.getEnvironment().isDefined("Vec"));
	}
}
