package org.metalift.ir;

import org.metalift.semantic.type.GenericType;
import org.metalift.semantic.type.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IRPrinterTest
{
	private final Var x = new Var("x", PrimitiveType.INT);
	private final Var xs = new Var("xs", new GenericType("List", List.of(PrimitiveType.INT)));

	@Test
	void printsLiterals()
	{
		assertEquals("Lit(1, Int)", IRPrinter.print(Lit.of(1)));
		assertEquals("Lit(True, Bool)", IRPrinter.print(Lit.TRUE));
		assertEquals("Lit(None, None)", IRPrinter.print(Lit.NONE));
	}

	@Test
	void printsControlFlow()
	{
		While loop = new While(new BinaryOp(Operator.LT, x, Lit.of(10)), List.of(
				new If(new UnaryOp(Operator.NOT, Lit.FALSE), new Block(List.of(Branch.CONTINUE)), Block.EMPTY),
				new Assign(x, new BinaryOp(Operator.MUL, x, Lit.of(2))),
				Branch.BREAK));

		assertEquals("While(BinaryOp(lt, Var(\"x\"), Lit(10, Int)), ["
				+ "If(UnaryOp(not, Lit(False, Bool)), Block(Branch(Continue)), Block()), "
				+ "Assign(Var(\"x\"), BinaryOp(mul, Var(\"x\"), Lit(2, Int))), "
				+ "Branch(Break)])", IRPrinter.print(loop));
	}

	@Test
	void printsDeclarationsWithTheirType()
	{
		Block block = new Block(List.of(xs, new Return(new ListAccess(xs, Lit.of(0)))));

		assertEquals("Block(Var(\"xs\", List[Int]), Return(ListAccess(Var(\"xs\"), Lit(0, Int))))", IRPrinter.print(block));
	}

	@Test
	void printsCallsAndHoles()
	{
		Expr call = new Call("math.gcd", List.of(x, new Field(x, "size"), new Unpack(xs)));
		Expr hole = new Choose(List.of(x, Lit.of(1)));

		assertEquals("Call(\"math.gcd\", [Var(\"x\"), Field(Var(\"x\"), \"size\"), Unpack(Var(\"xs\"))])", IRPrinter.print(call));
		assertEquals("Choose(Var(\"x\"), Lit(1, Int))", IRPrinter.print(hole));
	}

	@Test
	void callArgumentsInsideBlocksPrintAsReferences()
	{
		Block block = new Block(List.of(x, new Assign(x, new Call("f", List.of(x))), new Return(new Choose(List.of(x, x)))));

		assertEquals("Block(Var(\"x\", Int), Assign(Var(\"x\"), Call(\"f\", [Var(\"x\")])), "
				+ "Return(Choose(Var(\"x\"), Var(\"x\"))))", IRPrinter.print(block));
	}

	@Test
	void printsPrograms()
	{
		FnDecl fn = new FnDecl("id", List.of(x), PrimitiveType.INT, new Block(List.of(new Return(x))));
		Program program = new Program(List.of("os"), List.of(fn));

		assertEquals("Program([\"os\"], [FnDecl(\"id\", [Var(\"x\", Int)], Int, Block(Return(Var(\"x\"))))])",
				program.toString());
		assertEquals("Return()", IRPrinter.print(Return.empty()));
	}

	@Test
	void operatorArityIsChecked()
	{
		assertThrows(IllegalArgumentException.class, () -> new BinaryOp(Operator.NOT, x, x));
		assertThrows(IllegalArgumentException.class, () -> new UnaryOp(Operator.ADD, x));
	}

	@Test
	void laterDeclarationWinsLookup()
	{
		FnDecl first = new FnDecl("f", List.of(), PrimitiveType.INT, new Block(List.of(new Return(Lit.of(1)))));
		FnDecl second = new FnDecl("f", List.of(), PrimitiveType.INT, new Block(List.of(new Return(Lit.of(2)))));

		assertSame(second, new Program(List.of(), List.of(first, second)).findFunction("f").orElseThrow());
	}
}
