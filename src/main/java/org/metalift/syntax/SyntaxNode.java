package org.metalift.syntax;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the generic source syntax tree handed over by the external parser.
 * <p>
 * A node has a kind name (e.g. "BinOp") and ordered, named fields. A field value is one of:
 * another {@code SyntaxNode}, a {@code List} of field values, a {@code String}, a {@code Boolean},
 * a {@code BigInteger}, a {@code Double}, or {@code null} for the absence-of-value constant.
 * A field that is not present at all reads as {@code null} or as an empty list.
 */
public class SyntaxNode
{
	private final String nodeName;
	private final SyntaxKind kind;
	private final Map<String, Object> fields;

	public SyntaxNode(String nodeName, Map<String, Object> fields)
	{
		this.nodeName = Objects.requireNonNull(nodeName, "nodeName");
		this.kind = SyntaxKind.fromNodeName(nodeName);
		this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	/**
	 * Builds a node from alternating field names and values, e.g.
	 * {@code SyntaxNode.of("Name", "id", "x", "ctx", SyntaxNode.of("Load"))}.
	 */
	public static SyntaxNode of(String nodeName, Object... namesAndValues)
	{
		if (namesAndValues.length % 2 != 0)
		{
			throw new IllegalArgumentException("Field names and values must come in pairs for node " + nodeName);
		}
		Map<String, Object> fields = new LinkedHashMap<>();
		for (int i = 0; i < namesAndValues.length; i += 2)
		{
			fields.put((String) namesAndValues[i], normalize(namesAndValues[i + 1]));
		}
		return new SyntaxNode(nodeName, fields);
	}

	private static Object normalize(Object value)
	{
		if (value instanceof Integer || value instanceof Long)
		{
			return BigInteger.valueOf(((Number) value).longValue());
		}
		if (value instanceof List<?> list)
		{
			List<Object> copy = new ArrayList<>(list.size());
			for (Object element : list)
			{
				copy.add(normalize(element));
			}
			return Collections.unmodifiableList(copy);
		}
		return value;
	}

	public String getNodeName()
	{
		return nodeName;
	}

	public SyntaxKind getKind()
	{
		return kind;
	}

	public boolean is(SyntaxKind other)
	{
		return kind == other;
	}

	public boolean hasField(String name)
	{
		return fields.containsKey(name);
	}

	public Map<String, Object> getFields()
	{
		return fields;
	}

	/**
	 * @return The raw field value; {@code null} if the field is absent or holds the absence-of-value constant.
	 */
	public Object get(String name)
	{
		return fields.get(name);
	}

	/**
	 * @return The child node stored in {@code name}, or {@code null} if the field is absent or empty.
	 */
	public SyntaxNode node(String name)
	{
		Object value = fields.get(name);
		if (value == null)
		{
			return null;
		}
		if (value instanceof SyntaxNode child)
		{
			return child;
		}
		throw new IllegalStateException("Field '" + name + "' of " + nodeName + " is not a node: " + format(value));
	}

	/**
	 * @return The child nodes stored in list field {@code name}; an empty list if the field is absent.
	 */
	public List<SyntaxNode> nodes(String name)
	{
		Object value = fields.get(name);
		if (value == null)
		{
			return List.of();
		}
		if (!(value instanceof List<?> list))
		{
			throw new IllegalStateException("Field '" + name + "' of " + nodeName + " is not a list: " + format(value));
		}
		List<SyntaxNode> out = new ArrayList<>(list.size());
		for (Object element : list)
		{
			if (!(element instanceof SyntaxNode child))
			{
				throw new IllegalStateException("Field '" + name + "' of " + nodeName + " holds a non-node element: " + format(element));
			}
			out.add(child);
		}
		return out;
	}

	public String string(String name)
	{
		Object value = fields.get(name);
		if (value == null)
		{
			return null;
		}
		if (value instanceof String s)
		{
			return s;
		}
		throw new IllegalStateException("Field '" + name + "' of " + nodeName + " is not a string: " + format(value));
	}

	/**
	 * Renders the node in the same textual form the reader accepts. Used in error messages.
	 */
	public String describe()
	{
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return sb.toString();
	}

	private void appendTo(StringBuilder sb)
	{
		sb.append(nodeName).append('(');
		boolean first = true;
		for (Map.Entry<String, Object> entry : fields.entrySet())
		{
			if (!first)
			{
				sb.append(", ");
			}
			first = false;
			sb.append(entry.getKey()).append('=');
			appendValue(sb, entry.getValue());
		}
		sb.append(')');
	}

	private static void appendValue(StringBuilder sb, Object value)
	{
		if (value instanceof SyntaxNode node)
		{
			node.appendTo(sb);
		}
		else if (value instanceof List<?> list)
		{
			sb.append('[');
			for (int i = 0; i < list.size(); i++)
			{
				if (i > 0)
				{
					sb.append(", ");
				}
				appendValue(sb, list.get(i));
			}
			sb.append(']');
		}
		else
		{
			sb.append(formatScalar(value));
		}
	}

	private static String format(Object value)
	{
		StringBuilder sb = new StringBuilder();
		appendValue(sb, value);
		return sb.toString();
	}

	private static String formatScalar(Object value)
	{
		if (value == null)
		{
			return "None";
		}
		if (value instanceof Boolean b)
		{
			return b ? "True" : "False";
		}
		if (value instanceof String s)
		{
			return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
		}
		return value.toString();
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
		SyntaxNode that = (SyntaxNode) o;
		return nodeName.equals(that.nodeName) && fields.equals(that.fields);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(nodeName, fields);
	}

	@Override
	public String toString()
	{
		return describe();
	}
}
