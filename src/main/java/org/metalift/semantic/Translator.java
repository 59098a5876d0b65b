package org.metalift.semantic;

import org.metalift.error.MultiTargetAssignmentException;
import org.metalift.error.UnsupportedConstructException;
import org.metalift.ir.*;
import org.metalift.semantic.symbol.FunctionRegistry;
import org.metalift.semantic.symbol.Scope;
import org.metalift.semantic.type.Type;
import org.metalift.semantic.type.TypeEnvironment;
import org.metalift.semantic.type.TypeResolver;
import org.metalift.syntax.SyntaxKind;
import org.metalift.syntax.SyntaxNode;
import org.metalift.util.Debug;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lowers the external syntax tree into IR in a single top-down pass.
 * <p>
 * Module translation runs in two phases: first every function name and import is collected
 * into a {@link FunctionRegistry}, then each function body is lowered with a fresh
 * {@link Scope}. Calls keep their callee by name, so forward references and recursion need
 * no special handling. Any node shape without a lowering rule aborts the whole translation.
 */
public class Translator
{
	/**
	 * Callee name that marks a synthesis hole, either bare or as the last segment of an attribute path.
	 */
	public static final String SYNTHESIS_HOLE = "Choose";

	private final TypeResolver typeResolver;

	public Translator()
	{
		this(new TypeResolver(TypeEnvironment.standard()));
	}

	public Translator(TypeResolver typeResolver)
	{
		this.typeResolver = typeResolver;
	}

	/**
	 * Translates a single function definition.
	 */
	public FnDecl translate(SyntaxNode functionDef)
	{
		if (functionDef == null || !functionDef.is(SyntaxKind.FUNCTION_DEF))
		{
			throw UnsupportedConstructException.of("expected a function definition", orPlaceholder(functionDef));
		}
		return new FunctionTranslator(FunctionRegistry.empty(), functionDef.string("name")).translate(functionDef);
	}

	/**
	 * Translates a whole module into a {@link Program}.
	 */
	public Program translateModule(SyntaxNode module)
	{
		if (module == null || !module.is(SyntaxKind.MODULE))
		{
			throw UnsupportedConstructException.of("expected a module", orPlaceholder(module));
		}

		// Pass 1: collect function names and imports
		FunctionRegistry registry = collectDeclarations(module);
		Debug.logDebug("Registered " + registry.getFunctionNames().size() + " function(s) and "
				+ registry.getImports().size() + " import(s).");

		// Pass 2: lower every function body
		List<FnDecl> functions = new ArrayList<>();
		for (SyntaxNode statement : module.nodes("body"))
		{
			if (statement.is(SyntaxKind.FUNCTION_DEF))
			{
				functions.add(new FunctionTranslator(registry, statement.string("name")).translate(statement));
			}
		}
		return new Program(registry.getImports(), functions);
	}

	private FunctionRegistry collectDeclarations(SyntaxNode module)
	{
		List<String> functionNames = new ArrayList<>();
		List<String> imports = new ArrayList<>();
		for (SyntaxNode statement : module.nodes("body"))
		{
			switch (statement.getKind())
			{
				case FUNCTION_DEF -> functionNames.add(statement.string("name"));
				case IMPORT ->
				{
					for (SyntaxNode alias : statement.nodes("names"))
					{
						imports.add(alias.string("name"));
					}
				}
				case IMPORT_FROM -> imports.add(importedModule(statement));
				default -> Debug.logDebug("Skipping top-level statement: " + statement.getNodeName());
			}
		}
		return new FunctionRegistry(functionNames, imports);
	}

	/**
	 * Relative imports keep their leading dots, so {@code from . import x} records {@code "."}
	 * and {@code from ..pkg import y} records {@code "..pkg"}.
	 */
	private static String importedModule(SyntaxNode importFrom)
	{
		String module = importFrom.string("module");
		int level = importFrom.get("level") instanceof Number number ? number.intValue() : 0;
		return ".".repeat(Math.max(level, 0)) + (module != null ? module : "");
	}

	private static SyntaxNode orPlaceholder(SyntaxNode node)
	{
		return node != null ? node : SyntaxNode.of("<none>");
	}

	/**
	 * Lowers one function. Holds the function's symbol table; discarded afterwards.
	 */
	private class FunctionTranslator
	{
		private final FunctionRegistry registry;
		private final Scope scope;

		FunctionTranslator(FunctionRegistry registry, String functionName)
		{
			this.registry = registry;
			this.scope = new Scope(functionName);
		}

		FnDecl translate(SyntaxNode def)
		{
			if (!def.nodes("decorator_list").isEmpty())
			{
				throw UnsupportedConstructException.of("decorators", def);
			}

			List<Var> parameters = lowerParameters(required(def, "args"));
			List<Node> body = lowerStatements(def.nodes("body"));
			Type returnType = typeResolver.resolve(def.node("returns"));

			Debug.logDebug("Translated function " + scope.getFunctionName() + " with "
					+ parameters.size() + " parameter(s) and " + scope.getSymbols().size() + " variable(s).");
			return new FnDecl(scope.getFunctionName(), parameters, returnType, new Block(body));
		}

		// --- Parameters ---

		private List<Var> lowerParameters(SyntaxNode arguments)
		{
			if (!arguments.is(SyntaxKind.ARGUMENTS))
			{
				throw UnsupportedConstructException.of("parameter list", arguments);
			}
			if (!arguments.nodes("posonlyargs").isEmpty() || !arguments.nodes("kwonlyargs").isEmpty()
					|| arguments.node("vararg") != null || arguments.node("kwarg") != null)
			{
				throw UnsupportedConstructException.of("non-positional parameters", arguments);
			}
			if (!arguments.nodes("defaults").isEmpty())
			{
				throw UnsupportedConstructException.of("parameter defaults", arguments);
			}

			List<Var> parameters = new ArrayList<>();
			for (SyntaxNode arg : arguments.nodes("args"))
			{
				Type type = typeResolver.resolve(arg.node("annotation"));
				parameters.add(scope.define(arg.string("arg"), type));
			}
			return parameters;
		}

		// --- Statements ---

		private List<Node> lowerStatements(List<SyntaxNode> statements)
		{
			List<Node> out = new ArrayList<>(statements.size());
			for (SyntaxNode statement : statements)
			{
				out.add(lowerStatement(statement));
			}
			return out;
		}

		private Node lowerStatement(SyntaxNode s)
		{
			return switch (s.getKind())
			{
				case EXPR -> lowerExpr(required(s, "value"));
				case ASSIGN -> lowerAssign(s);
				case ANN_ASSIGN -> lowerAnnAssign(s);
				case IF -> new If(lowerExpr(required(s, "test")),
						new Block(lowerStatements(s.nodes("body"))),
						new Block(lowerStatements(s.nodes("orelse"))));
				case WHILE -> lowerWhile(s);
				case RETURN -> lowerReturn(s);
				case BREAK -> Branch.BREAK;
				case CONTINUE -> Branch.CONTINUE;
				default -> throw UnsupportedConstructException.of(s);
			};
		}

		private Assign lowerAssign(SyntaxNode s)
		{
			List<SyntaxNode> targets = s.nodes("targets");
			if (targets.size() > 1)
			{
				throw new MultiTargetAssignmentException(s);
			}
			Expr value = lowerExpr(required(s, "value"));
			if (targets.isEmpty() || !targets.get(0).is(SyntaxKind.NAME))
			{
				throw UnsupportedConstructException.of("assignment target", s);
			}
			Var target = scope.resolve(targets.get(0).string("id"));
			return new Assign(target, value);
		}

		/**
		 * {@code v: t = e} registers v and yields an Assign; {@code v: t} only registers v
		 * and yields the Var itself as a declaration.
		 */
		private Node lowerAnnAssign(SyntaxNode s)
		{
			SyntaxNode target = required(s, "target");
			if (!target.is(SyntaxKind.NAME))
			{
				throw UnsupportedConstructException.of("annotated assignment target", s);
			}
			Type type = typeResolver.resolve(s.node("annotation"));
			SyntaxNode valueNode = s.node("value");
			Expr value = valueNode != null ? lowerExpr(valueNode) : null;

			Var var = scope.define(target.string("id"), type);
			return value != null ? new Assign(var, value) : var;
		}

		private While lowerWhile(SyntaxNode s)
		{
			if (!s.nodes("orelse").isEmpty())
			{
				throw UnsupportedConstructException.of("while-else", s);
			}
			return new While(lowerExpr(required(s, "test")), lowerStatements(s.nodes("body")));
		}

		private Return lowerReturn(SyntaxNode s)
		{
			SyntaxNode value = s.node("value");
			return value == null ? Return.empty() : new Return(lowerExpr(value));
		}

		// --- Expressions ---

		/**
		 * Lowers a node in value position. A bare identifier here is always a variable and
		 * must already be registered.
		 */
		private Expr lowerExpr(SyntaxNode e)
		{
			return switch (e.getKind())
			{
				case NAME -> scope.resolve(e.string("id"));
				case CONSTANT, NAME_CONSTANT -> lowerConstant(e, e.get("value"));
				case NUM -> lowerConstant(e, e.get("n"));
				case BIN_OP -> new BinaryOp(binaryOperator(required(e, "op")),
						lowerExpr(required(e, "left")),
						lowerExpr(required(e, "right")));
				case UNARY_OP -> new UnaryOp(unaryOperator(required(e, "op")), lowerExpr(required(e, "operand")));
				case COMPARE -> lowerCompare(e);
				case CALL -> lowerCall(e);
				case ATTRIBUTE -> new Field(lowerExpr(required(e, "value")), e.string("attr"));
				case SUBSCRIPT -> new ListAccess(lowerExpr(required(e, "value")), lowerExpr(required(e, "slice")));
				case INDEX -> lowerExpr(required(e, "value"));
				case STARRED -> new Unpack(lowerExpr(required(e, "value")));
				default -> throw UnsupportedConstructException.of(e);
			};
		}

		private Lit lowerConstant(SyntaxNode e, Object value)
		{
			// Boolean first: a boolean is also representable as an integer
			if (value instanceof Boolean b)
			{
				return Lit.of(b);
			}
			if (value instanceof BigInteger i)
			{
				return Lit.of(i);
			}
			if (value == null)
			{
				return Lit.NONE;
			}
			throw UnsupportedConstructException.of("constant", e);
		}

		private BinaryOp lowerCompare(SyntaxNode e)
		{
			List<SyntaxNode> ops = e.nodes("ops");
			List<SyntaxNode> comparators = e.nodes("comparators");
			if (ops.size() != 1 || comparators.size() != 1)
			{
				throw UnsupportedConstructException.of("chained comparison", e);
			}
			return new BinaryOp(comparisonOperator(ops.get(0)), lowerExpr(required(e, "left")), lowerExpr(comparators.get(0)));
		}

		private Expr lowerCall(SyntaxNode e)
		{
			if (!e.nodes("keywords").isEmpty())
			{
				throw UnsupportedConstructException.of("keyword arguments", e);
			}
			List<Expr> arguments = new ArrayList<>();
			for (SyntaxNode arg : e.nodes("args"))
			{
				arguments.add(lowerExpr(arg));
			}

			SyntaxNode func = required(e, "func");
			if (isSynthesisHole(func))
			{
				return new Choose(arguments);
			}
			String callee = calleeName(func, e);
			if (!registry.isFunction(callee))
			{
				Debug.logDebug("Call to " + callee + " does not name a function of this module.");
			}
			return new Call(callee, arguments);
		}

		/**
		 * A callee is an opaque function reference: a name, or a dotted attribute path.
		 * It is not checked against the symbol table.
		 */
		private String calleeName(SyntaxNode func, SyntaxNode call)
		{
			return switch (func.getKind())
			{
				case NAME -> func.string("id");
				case ATTRIBUTE -> calleeName(required(func, "value"), call) + "." + func.string("attr");
				default -> throw UnsupportedConstructException.of("callee", call);
			};
		}

		private boolean isSynthesisHole(SyntaxNode func)
		{
			return switch (func.getKind())
			{
				case NAME -> SYNTHESIS_HOLE.equals(func.string("id"));
				case ATTRIBUTE -> SYNTHESIS_HOLE.equals(func.string("attr"));
				default -> false;
			};
		}

		// --- Operators ---

		private Operator binaryOperator(SyntaxNode op)
		{
			return switch (op.getKind())
			{
				case ADD -> Operator.ADD;
				case SUB -> Operator.SUB;
				case MULT -> Operator.MUL;
				case DIV, FLOOR_DIV -> Operator.FLOOR_DIV;
				default -> throw UnsupportedConstructException.of("binary operator", op);
			};
		}

		private Operator unaryOperator(SyntaxNode op)
		{
			if (op.is(SyntaxKind.NOT))
			{
				return Operator.NOT;
			}
			throw UnsupportedConstructException.of("unary operator", op);
		}

		private Operator comparisonOperator(SyntaxNode op)
		{
			return switch (op.getKind())
			{
				case EQ -> Operator.EQ;
				case NOT_EQ -> Operator.NE;
				case LT -> Operator.LT;
				case LT_E -> Operator.LE;
				case GT -> Operator.GT;
				case GT_E -> Operator.GE;
				default -> throw UnsupportedConstructException.of("comparison operator", op);
			};
		}

		private SyntaxNode required(SyntaxNode parent, String field)
		{
			SyntaxNode child = parent.node(field);
			if (child == null)
			{
				throw UnsupportedConstructException.of("missing '" + field + "'", parent);
			}
			return child;
		}
	}
}
