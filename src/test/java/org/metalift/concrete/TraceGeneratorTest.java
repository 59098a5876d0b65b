package org.metalift.concrete;

import org.metalift.codegen.NativeFunction;
import org.metalift.error.UnsupportedTypeException;
import org.metalift.ir.Var;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.semantic.type.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TraceGeneratorTest
{
	private static final AnalysisDescriptor ADD = new AnalysisDescriptor("add",
			List.of(new Var("a", PrimitiveType.INT), new Var("b", PrimitiveType.INT)), PrimitiveType.INT);

	private static final NativeFunction ADD_FN = args -> (Integer) args[0] + (Integer) args[1];

	@Test
	void zeroCountYieldsNoTraces()
	{
		assertTrue(TraceGenerator.generate(ADD_FN, ADD, 0, new Random(0)).isEmpty());
	}

	@Test
	void recordsOutputForEachSampledInput()
	{
		List<Trace> traces = TraceGenerator.generate(ADD_FN, ADD, 5, new Random(1));

		assertEquals(5, traces.size());
		for (Trace trace : traces)
		{
			assertEquals(2, trace.getInputs().size());
			int a = (Integer) trace.getInputs().get(0);
			int b = (Integer) trace.getInputs().get(1);
			assertEquals(a + b, trace.getOutput());
		}
	}

	@Test
	void tracesKeepInvocationOrder()
	{
		List<List<Object>> calls = new ArrayList<>();
		NativeFunction recording = args ->
		{
			calls.add(List.of(args));
			return calls.size();
		};

		List<Trace> traces = TraceGenerator.generate(recording, ADD, 4, new Random(9));

		for (int i = 0; i < traces.size(); i++)
		{
			assertEquals(i + 1, traces.get(i).getOutput());
			assertEquals(calls.get(i), traces.get(i).getInputs());
		}
	}

	@Test
	void sameSeedReproducesTraces()
	{
		assertEquals(TraceGenerator.generate(ADD_FN, ADD, 8, new Random(5)),
				TraceGenerator.generate(ADD_FN, ADD, 8, new Random(5)));
	}

	@Test
	void negativeCountIsRejected()
	{
		assertThrows(IllegalArgumentException.class, () -> TraceGenerator.generate(ADD_FN, ADD, -1, new Random(0)));
	}

	@Test
	void unsupportedArgumentTypeFailsBeforeInvocation()
	{
		AnalysisDescriptor flag = new AnalysisDescriptor("flag", List.of(new Var("b", PrimitiveType.BOOL)), PrimitiveType.INT);
		NativeFunction never = args ->
		{
			throw new AssertionError("must not be called");
		};

		assertThrows(UnsupportedTypeException.class, () -> TraceGenerator.generate(never, flag, 1, new Random(0)));
	}
}
