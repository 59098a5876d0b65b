package org.metalift.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders IR into a stable, single-line textual form, e.g.
 * {@code FnDecl("f", [Var("x", Int)], Int, Block(Return(BinaryOp(add, Var("x"), Lit(1, Int)))))}.
 * <p>
 * Var references print by name only; parameters and declarations also print their type.
 */
public class IRPrinter implements IRVisitor<String>
{
	private static final IRPrinter INSTANCE = new IRPrinter();

	public static String print(Node node)
	{
		return node.accept(INSTANCE);
	}

	private String printAll(List<? extends Node> nodes)
	{
		return nodes.stream()
				.map(this::printStatement)
				.collect(Collectors.joining(", "));
	}

	private String printExpressions(List<? extends Node> nodes)
	{
		return nodes.stream()
				.map(node -> node.accept(this))
				.collect(Collectors.joining(", "));
	}

	private String printStatement(Node node)
	{
		// A Var standing alone in a statement list is a declaration
		if (node instanceof Var var)
		{
			return declaration(var);
		}
		return node.accept(this);
	}

	private static String declaration(Var var)
	{
		return "Var(" + quote(var.getName()) + ", " + var.getType().getName() + ")";
	}

	private static String quote(String s)
	{
		return "\"" + s + "\"";
	}

	@Override
	public String visitProgram(Program program)
	{
		String imports = program.getImports().stream()
				.map(IRPrinter::quote)
				.collect(Collectors.joining(", "));
		return "Program([" + imports + "], [" + printAll(program.getFunctions()) + "])";
	}

	@Override
	public String visitFnDecl(FnDecl fnDecl)
	{
		String params = fnDecl.getParameters().stream()
				.map(IRPrinter::declaration)
				.collect(Collectors.joining(", "));
		return "FnDecl(" + quote(fnDecl.getName()) + ", [" + params + "], "
				+ fnDecl.getReturnType().getName() + ", " + fnDecl.getBody().accept(this) + ")";
	}

	@Override
	public String visitBlock(Block block)
	{
		return "Block(" + printAll(block.getStatements()) + ")";
	}

	@Override
	public String visitAssign(Assign assign)
	{
		return "Assign(" + assign.getTarget().accept(this) + ", " + assign.getValue().accept(this) + ")";
	}

	@Override
	public String visitIf(If ifStmt)
	{
		return "If(" + ifStmt.getCondition().accept(this) + ", " + ifStmt.getThenBlock().accept(this)
				+ ", " + ifStmt.getElseBlock().accept(this) + ")";
	}

	@Override
	public String visitWhile(While whileStmt)
	{
		return "While(" + whileStmt.getCondition().accept(this) + ", [" + printAll(whileStmt.getBody()) + "])";
	}

	@Override
	public String visitReturn(Return returnStmt)
	{
		return "Return(" + returnStmt.getValue().map(v -> v.accept(this)).orElse("") + ")";
	}

	@Override
	public String visitBranch(Branch branch)
	{
		return branch.getKind() == Branch.Kind.BREAK ? "Branch(Break)" : "Branch(Continue)";
	}

	@Override
	public String visitBinaryOp(BinaryOp binaryOp)
	{
		return "BinaryOp(" + binaryOp.getOperator().getTag() + ", " + binaryOp.getLeft().accept(this)
				+ ", " + binaryOp.getRight().accept(this) + ")";
	}

	@Override
	public String visitUnaryOp(UnaryOp unaryOp)
	{
		return "UnaryOp(" + unaryOp.getOperator().getTag() + ", " + unaryOp.getOperand().accept(this) + ")";
	}

	@Override
	public String visitCall(Call call)
	{
		return "Call(" + quote(call.getCallee()) + ", [" + printExpressions(call.getArguments()) + "])";
	}

	@Override
	public String visitChoose(Choose choose)
	{
		return "Choose(" + printExpressions(choose.getAlternatives()) + ")";
	}

	@Override
	public String visitField(Field field)
	{
		return "Field(" + field.getTarget().accept(this) + ", " + quote(field.getName()) + ")";
	}

	@Override
	public String visitListAccess(ListAccess listAccess)
	{
		return "ListAccess(" + listAccess.getCollection().accept(this) + ", " + listAccess.getIndex().accept(this) + ")";
	}

	@Override
	public String visitUnpack(Unpack unpack)
	{
		return "Unpack(" + unpack.getValue().accept(this) + ")";
	}

	@Override
	public String visitLit(Lit lit)
	{
		Object value = lit.getValue();
		String text;
		if (value == null)
		{
			text = "None";
		}
		else if (value instanceof Boolean b)
		{
			text = b ? "True" : "False";
		}
		else
		{
			text = value.toString();
		}
		return "Lit(" + text + ", " + lit.getType().getName() + ")";
	}

	@Override
	public String visitVar(Var var)
	{
		return "Var(" + quote(var.getName()) + ")";
	}
}
