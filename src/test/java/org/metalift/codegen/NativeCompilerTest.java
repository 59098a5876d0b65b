package org.metalift.codegen;

import org.metalift.concrete.Trace;
import org.metalift.concrete.TraceGenerator;
import org.metalift.error.NativeCompilationException;
import org.metalift.error.UnsupportedTypeException;
import org.metalift.ir.Var;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.semantic.type.PrimitiveType;
import org.metalift.semantic.type.Type;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles small modules through the JIT. Symbols are global to an engine, so every module
 * loaded into the shared engine uses its own function names.
 */
class NativeCompilerTest
{
	private final NativeCompiler compiler = new NativeCompiler();

	private static AnalysisDescriptor ints(String name, int arity)
	{
		List<Var> args = new ArrayList<>();
		for (int i = 0; i < arity; i++)
		{
			args.add(new Var("a" + i, PrimitiveType.INT));
		}
		return new AnalysisDescriptor(name, args, PrimitiveType.INT);
	}

	private static String increment(String name)
	{
		return "define i32 @" + name + "(i32 %x) {\n"
				+ "entry:\n"
				+ "  %r = add i32 %x, 1\n"
				+ "  ret i32 %r\n"
				+ "}\n";
	}

	@Test
	void compilesAndCallsIncrement()
	{
		NativeFunction inc = compiler.compile(increment("inc_basic"), ints("inc_basic", 1));

		assertEquals(42, inc.invoke(41));
		assertEquals(0, inc.invoke(-1));
		assertEquals(Integer.MIN_VALUE, inc.invoke(Integer.MAX_VALUE));
	}

	@Test
	void marshalsArgumentsPositionally()
	{
		String module = "define i32 @mix3(i32 %a, i32 %b, i32 %c) {\n"
				+ "  %p = mul i32 %a, %b\n"
				+ "  %r = sub i32 %p, %c\n"
				+ "  ret i32 %r\n"
				+ "}\n";
		NativeFunction mix = compiler.compile(module, ints("mix3", 3));

		assertEquals(2 * 3 - 4, mix.invoke(2, 3, 4));
		assertEquals(4 * 3 - 2, mix.invoke(4, 3, 2));
	}

	@Test
	void compilesNullaryFunctions()
	{
		NativeFunction answer = compiler.compile("define i32 @answer0() {\n  ret i32 42\n}\n", ints("answer0", 0));
		assertEquals(42, answer.invoke());
	}

	@Test
	void callsHelpersAndLoopsInTheSameModule()
	{
		String module = "define internal i32 @square_helper(i32 %v) {\n"
				+ "  %r = mul i32 %v, %v\n"
				+ "  ret i32 %r\n"
				+ "}\n"
				+ "define i32 @sum_squares(i32 %n) {\n"
				+ "entry:\n"
				+ "  br label %loop\n"
				+ "loop:\n"
				+ "  %i = phi i32 [ 0, %entry ], [ %next, %loop ]\n"
				+ "  %acc = phi i32 [ 0, %entry ], [ %sum, %loop ]\n"
				+ "  %sq = call i32 @square_helper(i32 %i)\n"
				+ "  %sum = add i32 %acc, %sq\n"
				+ "  %next = add i32 %i, 1\n"
				+ "  %done = icmp sgt i32 %next, %n\n"
				+ "  br i1 %done, label %exit, label %loop\n"
				+ "exit:\n"
				+ "  ret i32 %sum\n"
				+ "}\n";
		NativeFunction sumSquares = compiler.compile(module, ints("sum_squares", 1));

		assertEquals(0 + 1 + 4 + 9, sumSquares.invoke(3));
	}

	@Test
	void feedsTheTraceGenerator()
	{
		String module = "define i32 @neg_trace(i32 %x) {\n  %r = sub i32 0, %x\n  ret i32 %r\n}\n";
		AnalysisDescriptor descriptor = ints("neg_trace", 1);
		NativeFunction neg = compiler.compile(module, descriptor);

		List<Trace> traces = TraceGenerator.generate(neg, descriptor, 20, new Random(0));

		assertEquals(20, traces.size());
		for (Trace trace : traces)
		{
			assertEquals(-(Integer) trace.getInputs().get(0), trace.getOutput());
		}
	}

	@Test
	void unsupportedTypesFailAtCompileTime()
	{
		AnalysisDescriptor floats = new AnalysisDescriptor("fadd",
				List.of(new Var("x", PrimitiveType.INT)), new FloatType());

		// The module is never looked at
		assertThrows(UnsupportedTypeException.class, () -> compiler.compile("not a module", floats));
	}

	@Test
	void wrongCallArityIsRejected()
	{
		NativeFunction inc = compiler.compile(increment("inc_arity"), ints("inc_arity", 1));

		assertThrows(IllegalArgumentException.class, () -> inc.invoke());
		assertThrows(IllegalArgumentException.class, () -> inc.invoke(1, 2));
	}

	@Test
	void malformedModulesFail()
	{
		NativeCompilationException e = assertThrows(NativeCompilationException.class,
				() -> compiler.compile("define i32 @broken(i32 %x) {\n  ret i32 %y\n}\n", ints("broken", 1)));
		assertTrue(e.getMessage().startsWith("Failed to parse module"));
	}

	@Test
	void missingEntryFunctionFails()
	{
		assertThrows(NativeCompilationException.class,
				() -> compiler.compile(increment("present_fn"), ints("absent_fn", 1)));
	}

	@Test
	void signatureMismatchFails()
	{
		assertThrows(NativeCompilationException.class,
				() -> compiler.compile(increment("inc_mismatch_a"), ints("inc_mismatch_a", 2)));
		assertThrows(NativeCompilationException.class,
				() -> compiler.compile("define i64 @wide_ret(i32 %x) {\n  %r = sext i32 %x to i64\n  ret i64 %r\n}\n",
						ints("wide_ret", 1)));
	}

	@Test
	void redefiningALoadedFunctionFails()
	{
		compiler.compile(increment("inc_once"), ints("inc_once", 1));
		assertThrows(NativeCompilationException.class, () -> compiler.compile(increment("inc_once"), ints("inc_once", 1)));
	}

	@Test
	void sharedEngineIsCreatedOnce()
	{
		assertSame(ExecutionEngineContext.shared(), ExecutionEngineContext.shared());
		ExecutionEngineContext.shared().close();
		assertFalse(ExecutionEngineContext.shared().isClosed());
	}

	@Test
	void privateEnginesAreIndependentAndClosable()
	{
		NativeFunction inc;
		try (ExecutionEngineContext engine = ExecutionEngineContext.create())
		{
			NativeCompiler local = new NativeCompiler(engine);
			// Same name as in the shared engine: the engines do not share symbols
			inc = local.compile(increment("inc_basic"), ints("inc_basic", 1));
			assertEquals(8, inc.invoke(7));
		}

		assertThrows(IllegalStateException.class, () -> inc.invoke(1));
	}

	@Test
	void closedEngineRejectsCompilation()
	{
		ExecutionEngineContext engine = ExecutionEngineContext.create();
		engine.close();

		assertTrue(engine.isClosed());
		assertThrows(IllegalStateException.class,
				() -> new NativeCompiler(engine).compile(increment("inc_closed"), ints("inc_closed", 1)));
	}

	@Test
	void compilesModuleFiles(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("inc.ll");
		Files.writeString(file, increment("inc_file"));

		assertEquals(3, compiler.compileFile(file, ints("inc_file", 1)).invoke(2));
	}

	private static final class FloatType implements Type
	{
		@Override
		public String getName()
		{
			return "Float";
		}
	}
}
