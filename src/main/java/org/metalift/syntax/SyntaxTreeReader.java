package org.metalift.syntax;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.metalift.error.SyntaxDumpException;
import org.metalift.parser.AstDumpBaseVisitor;
import org.metalift.parser.AstDumpLexer;
import org.metalift.parser.AstDumpParser;
import org.metalift.util.Debug;
import org.metalift.util.SyntaxErrorListener;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the textual dump of a source syntax tree into {@link SyntaxNode}s.
 * <p>
 * The dump is what the external parser prints for a module, e.g.
 * {@code Module(body=[Return(value=Name(id='x', ctx=Load()))], type_ignores=[])}.
 */
public class SyntaxTreeReader
{
	public static SyntaxNode read(Path file) throws IOException
	{
		Debug.logDebug("Reading syntax tree dump: " + file);
		return read(CharStreams.fromPath(file));
	}

	public static SyntaxNode read(String dump)
	{
		return read(CharStreams.fromString(dump));
	}

	private static SyntaxNode read(CharStream input)
	{
		AstDumpLexer lexer = new AstDumpLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

		AstDumpParser parser = new AstDumpParser(new CommonTokenStream(lexer));
		parser.removeErrorListeners();
		parser.addErrorListener(SyntaxErrorListener.INSTANCE);

		AstDumpParser.DumpContext dump = parser.dump();
		Object root = new TreeBuilder().visit(dump.value());
		if (!(root instanceof SyntaxNode node))
		{
			Token start = dump.getStart();
			throw new SyntaxDumpException(start.getLine(), start.getCharPositionInLine() + 1, "The dump root must be a node");
		}
		return node;
	}

	private static class TreeBuilder extends AstDumpBaseVisitor<Object>
	{
		@Override
		public Object visitNodeValue(AstDumpParser.NodeValueContext ctx)
		{
			AstDumpParser.NodeContext node = ctx.node();
			Map<String, Object> fields = new LinkedHashMap<>();
			for (AstDumpParser.FieldContext field : node.field())
			{
				fields.put(field.ID().getText(), visit(field.value()));
			}
			return new SyntaxNode(node.ID().getText(), fields);
		}

		@Override
		public Object visitListValue(AstDumpParser.ListValueContext ctx)
		{
			List<Object> elements = new ArrayList<>();
			for (AstDumpParser.ValueContext value : ctx.list().value())
			{
				elements.add(visit(value));
			}
			return Collections.unmodifiableList(elements);
		}

		@Override
		public Object visitStringValue(AstDumpParser.StringValueContext ctx)
		{
			Token token = ctx.STRING().getSymbol();
			String text = token.getText();
			// Columns are 1-based and the body starts after the opening quote
			return unescape(text.substring(1, text.length() - 1), token.getLine(), token.getCharPositionInLine() + 2);
		}

		@Override
		public Object visitIntegerValue(AstDumpParser.IntegerValueContext ctx)
		{
			return new BigInteger(ctx.INTEGER().getText());
		}

		@Override
		public Object visitFloatValue(AstDumpParser.FloatValueContext ctx)
		{
			return Double.valueOf(ctx.FLOAT().getText());
		}

		@Override
		public Object visitConstantValue(AstDumpParser.ConstantValueContext ctx)
		{
			String text = ctx.ID().getText();
			return switch (text)
			{
				case "True" -> Boolean.TRUE;
				case "False" -> Boolean.FALSE;
				case "None" -> null;
				default ->
				{
					Token token = ctx.ID().getSymbol();
					throw new SyntaxDumpException(token.getLine(), token.getCharPositionInLine() + 1, "Unknown constant '" + text + "'");
				}
			};
		}
	}

	/**
	 * Resolves backslash escapes in the body of a quoted string.
	 *
	 * @param line   Line of the string token, for error reporting.
	 * @param column 1-based column of the first character of {@code body}.
	 * @throws SyntaxDumpException if a {@code \\x}, {@code \\u} or {@code \\U} escape is truncated or not hex.
	 */
	static String unescape(String body, int line, int column)
	{
		StringBuilder sb = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++)
		{
			char c = body.charAt(i);
			if (c != '\\' || i + 1 == body.length())
			{
				sb.append(c);
				continue;
			}
			int escapeColumn = column + i;
			char next = body.charAt(++i);
			switch (next)
			{
				case 'n' -> sb.append('\n');
				case 't' -> sb.append('\t');
				case 'r' -> sb.append('\r');
				case '0' -> sb.append('\0');
				case 'x' ->
				{
					sb.append((char) hexEscape(body, i + 1, 2, line, escapeColumn));
					i += 2;
				}
				case 'u' ->
				{
					sb.append((char) hexEscape(body, i + 1, 4, line, escapeColumn));
					i += 4;
				}
				case 'U' ->
				{
					int codePoint = hexEscape(body, i + 1, 8, line, escapeColumn);
					if (!Character.isValidCodePoint(codePoint))
					{
						throw new SyntaxDumpException(line, escapeColumn, "Invalid code point in escape \\U" + body.substring(i + 1, i + 9));
					}
					sb.appendCodePoint(codePoint);
					i += 8;
				}
				default -> sb.append(next);
			}
		}
		return sb.toString();
	}

	private static int hexEscape(String body, int start, int digits, int line, int column)
	{
		if (start + digits > body.length())
		{
			throw new SyntaxDumpException(line, column, "Truncated escape \\" + body.substring(start - 1));
		}
		int value = 0;
		for (int i = start; i < start + digits; i++)
		{
			int digit = Character.digit(body.charAt(i), 16);
			if (digit < 0)
			{
				throw new SyntaxDumpException(line, column, "Invalid hex digit in escape \\" + body.substring(start - 1, start + digits));
			}
			// Eight hex digits may exceed int range; the code point check rejects those values
			value = (int) Math.min(((long) value << 4) | digit, Integer.MAX_VALUE);
		}
		return value;
	}
}
