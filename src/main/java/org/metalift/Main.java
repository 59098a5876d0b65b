package org.metalift;

import org.metalift.codegen.NativeCompiler;
import org.metalift.codegen.NativeFunction;
import org.metalift.concrete.Trace;
import org.metalift.concrete.TraceGenerator;
import org.metalift.error.MetaliftException;
import org.metalift.ir.IRPrinter;
import org.metalift.ir.Node;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.semantic.Translator;
import org.metalift.semantic.type.TypeEnvironment;
import org.metalift.semantic.type.TypeResolver;
import org.metalift.syntax.SyntaxKind;
import org.metalift.syntax.SyntaxNode;
import org.metalift.syntax.SyntaxTreeReader;
import org.metalift.util.AnalysisDTOConverter;
import org.metalift.util.CompilerArguments;
import org.metalift.util.Debug;
import org.metalift.util.TraceWriter;

import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * Command-line orchestration: parses arguments and delegates to 'translate' or 'trace'.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * @return The process exit status.
	 */
	public static int run(String[] args)
	{
		CompilerArguments arguments = CompilerArguments.parse(args);

		if (arguments.getErrorMessage() != null)
		{
			Debug.logError(arguments.getErrorMessage());
			CompilerArguments.printUsage();
			return 2;
		}
		if (arguments.isHelpFlag())
		{
			CompilerArguments.printUsage();
			return 0;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("metalift " + VERSION);
			return 0;
		}

		try
		{
			if (!Files.exists(arguments.getInputFile()))
			{
				Debug.logError("The specified file does not exist: " + arguments.getInputFile());
				return 1;
			}

			switch (arguments.getCommand())
			{
				case TRANSLATE -> translate(arguments);
				case TRACE -> trace(arguments);
			}
			return 0;
		}
		catch (MetaliftException e)
		{
			Debug.logError(e.getKind() + ": " + e.getMessage());
		}
		catch (IllegalArgumentException | IllegalStateException | JsonParseException e)
		{
			Debug.logError("Invalid input: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
		}
		return 1;
	}

	/**
	 * Lowers a syntax-tree dump (a whole module or a single function definition) and prints the IR.
	 */
	private static void translate(CompilerArguments args) throws IOException
	{
		SyntaxNode tree = SyntaxTreeReader.read(args.getInputFile());
		Translator translator = new Translator();

		Node result;
		if (tree.is(SyntaxKind.FUNCTION_DEF))
		{
			result = translator.translate(tree);
		}
		else
		{
			result = translator.translateModule(tree);
		}
		Debug.logDebug("Translation finished.");
		emit(args.getOutputPath(), IRPrinter.print(result));
	}

	/**
	 * Compiles a textual LLVM module and prints traces sampled from the described function.
	 */
	private static void trace(CompilerArguments args) throws IOException
	{
		TypeResolver resolver = new TypeResolver(TypeEnvironment.standard());
		AnalysisDescriptor descriptor = AnalysisDTOConverter.load(args.getAnalysisFile(), resolver);
		Debug.logDebug("Tracing " + descriptor);

		NativeCompiler compiler = new NativeCompiler();
		NativeFunction function = compiler.compileFile(args.getInputFile(), descriptor);
		List<Trace> traces = TraceGenerator.generate(function, descriptor, args.getTraceCount(), new Random(args.getSeed()));

		if (args.getOutputPath() != null)
		{
			TraceWriter.write(traces, args.getOutputPath());
		}
		else
		{
			System.out.println(TraceWriter.toJson(traces));
		}
	}

	private static void emit(Path output, String text) throws IOException
	{
		if (output == null)
		{
			System.out.println(text);
			return;
		}
		Files.writeString(output, text + System.lineSeparator(), StandardCharsets.UTF_8);
		Debug.logInfo("Wrote " + output);
	}
}
