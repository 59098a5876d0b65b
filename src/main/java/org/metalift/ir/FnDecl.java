package org.metalift.ir;

import org.metalift.semantic.type.Type;

import java.util.List;
import java.util.Objects;

public final class FnDecl implements Node
{
	private final String name;
	private final List<Var> parameters;
	private final Type returnType;
	private final Block body;

	public FnDecl(String name, List<Var> parameters, Type returnType, Block body)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.parameters = List.copyOf(parameters);
		this.returnType = Objects.requireNonNull(returnType, "returnType");
		this.body = Objects.requireNonNull(body, "body");
	}

	public String getName()
	{
		return name;
	}

	public List<Var> getParameters()
	{
		return parameters;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public Block getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitFnDecl(this);
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
		FnDecl fnDecl = (FnDecl) o;
		return name.equals(fnDecl.name) && parameters.equals(fnDecl.parameters)
				&& returnType.equals(fnDecl.returnType) && body.equals(fnDecl.body);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, parameters, returnType, body);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
