package org.metalift.concrete;

import org.metalift.codegen.NativeFunction;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Executes a compiled function on sampled arguments and records what it returns.
 */
public class TraceGenerator
{
	private TraceGenerator()
	{
	}

	/**
	 * @return {@code count} traces, in the order they were produced.
	 * @throws IllegalArgumentException if {@code count} is negative.
	 */
	public static List<Trace> generate(NativeFunction function, AnalysisDescriptor descriptor, int count, Random random)
	{
		if (count < 0)
		{
			throw new IllegalArgumentException("Trace count must not be negative: " + count);
		}

		ArgumentSampler sampler = new ArgumentSampler(random);
		List<Trace> traces = new ArrayList<>(count);
		for (int i = 0; i < count; i++)
		{
			List<Object> inputs = sampler.sampleArguments(descriptor);
			Object output = function.invoke(inputs.toArray());
			traces.add(new Trace(output, inputs));
		}
		Debug.logDebug("Generated " + traces.size() + " trace(s) for " + descriptor.getName());
		return traces;
	}
}
