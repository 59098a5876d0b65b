package org.metalift.concrete;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One observed execution: the value returned for a list of inputs.
 */
public final class Trace
{
	private final Object output;
	private final List<Object> inputs;

	public Trace(Object output, List<Object> inputs)
	{
		this.output = output;
		this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
	}

	public Object getOutput()
	{
		return output;
	}

	public List<Object> getInputs()
	{
		return inputs;
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
		Trace trace = (Trace) o;
		return Objects.equals(output, trace.output) && inputs.equals(trace.inputs);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(output, inputs);
	}

	@Override
	public String toString()
	{
		return "(" + output + ", " + inputs + ")";
	}
}
