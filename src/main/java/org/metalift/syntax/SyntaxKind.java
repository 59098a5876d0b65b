package org.metalift.syntax;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of syntax-tree node kinds the translator knows about.
 * Every other node name read from a dump maps to {@link #UNKNOWN} and is rejected
 * wherever it appears.
 */
public enum SyntaxKind
{
	// --- Module level ---
	MODULE("Module"),
	FUNCTION_DEF("FunctionDef"),
	ARGUMENTS("arguments"),
	ARG("arg"),
	IMPORT("Import"),
	IMPORT_FROM("ImportFrom"),
	ALIAS("alias"),

	// --- Statements ---
	EXPR("Expr"),
	ASSIGN("Assign"),
	ANN_ASSIGN("AnnAssign"),
	IF("If"),
	WHILE("While"),
	RETURN("Return"),
	BREAK("Break"),
	CONTINUE("Continue"),

	// --- Expressions ---
	NAME("Name"),
	ATTRIBUTE("Attribute"),
	BIN_OP("BinOp"),
	UNARY_OP("UnaryOp"),
	COMPARE("Compare"),
	CALL("Call"),
	CONSTANT("Constant"),
	NUM("Num"),
	NAME_CONSTANT("NameConstant"),
	STARRED("Starred"),
	SUBSCRIPT("Subscript"),
	INDEX("Index"),
	LIST("List"),
	TUPLE("Tuple"),

	// --- Operator tokens ---
	ADD("Add"),
	SUB("Sub"),
	MULT("Mult"),
	DIV("Div"),
	FLOOR_DIV("FloorDiv"),
	NOT("Not"),
	EQ("Eq"),
	NOT_EQ("NotEq"),
	LT("Lt"),
	LT_E("LtE"),
	GT("Gt"),
	GT_E("GtE"),

	// --- Expression contexts ---
	LOAD("Load"),
	STORE("Store"),

	UNKNOWN("<unknown>");

	private static final Map<String, SyntaxKind> BY_NAME;

	static
	{
		Map<String, SyntaxKind> map = new HashMap<>();
		for (SyntaxKind kind : values())
		{
			if (kind != UNKNOWN)
			{
				map.put(kind.nodeName, kind);
			}
		}
		BY_NAME = Collections.unmodifiableMap(map);
	}

	private final String nodeName;

	SyntaxKind(String nodeName)
	{
		this.nodeName = nodeName;
	}

	/**
	 * @return The node name as it appears in a tree dump, e.g. "BinOp".
	 */
	public String getNodeName()
	{
		return nodeName;
	}

	public static SyntaxKind fromNodeName(String nodeName)
	{
		return BY_NAME.getOrDefault(nodeName, UNKNOWN);
	}
}
