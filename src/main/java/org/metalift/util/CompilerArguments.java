package org.metalift.util;

import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command-line arguments of the metalift front end.
 * <p>
 * {@code translate <tree.ast>} lowers a syntax-tree dump to IR;
 * {@code trace <module.ll> -a <analysis.json>} compiles a module and samples traces from it.
 */
public class CompilerArguments
{
	public enum Command
	{
		TRANSLATE,
		TRACE
	}

	public static final int DEFAULT_TRACE_COUNT = 10;
	public static final long DEFAULT_SEED = 0L;

	private Command command = null;
	private Path inputFile = null;
	private Path analysisFile = null;
	private Path outputPath = null;
	private int traceCount = DEFAULT_TRACE_COUNT;
	private long seed = DEFAULT_SEED;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private String errorMessage = null;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-a") || arg.equals("--analysis"))
				{
					parsedArgs.analysisFile = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-n") || arg.equals("--count"))
				{
					parsedArgs.traceCount = parseNumber(getNextArg(args, ++i, arg), arg).intValueExact();
					if (parsedArgs.traceCount < 0)
					{
						throw new IllegalArgumentException("Trace count must not be negative: " + parsedArgs.traceCount);
					}
					continue;
				}
				if (arg.equals("-s") || arg.equals("--seed"))
				{
					// Seeds may be negative, so the value is taken as-is
					if (i + 1 >= args.length)
					{
						throw new IllegalArgumentException("Missing argument after " + arg);
					}
					parsedArgs.seed = parseNumber(args[++i], arg).longValueExact();
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// --- Positionals: the command, then its input file ---
				if (parsedArgs.command == null)
				{
					parsedArgs.command = parseCommand(arg);
				}
				else if (parsedArgs.inputFile == null)
				{
					parsedArgs.inputFile = Paths.get(arg);
				}
				else
				{
					throw new IllegalArgumentException("Unexpected argument: " + arg);
				}
			}

			parsedArgs.validate();
		}
		catch (IllegalArgumentException | ArithmeticException e)
		{
			parsedArgs.errorMessage = e.getMessage();
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private void validate()
	{
		if (command == null)
		{
			throw new IllegalArgumentException("No command given. Expected 'translate' or 'trace'.");
		}
		if (inputFile == null)
		{
			throw new IllegalArgumentException("No input file given for '" + command.name().toLowerCase() + "'.");
		}
		if (command == Command.TRACE && analysisFile == null)
		{
			throw new IllegalArgumentException("'trace' requires an analysis descriptor (-a <file.json>).");
		}
	}

	private static Command parseCommand(String arg)
	{
		return switch (arg)
		{
			case "translate" -> Command.TRANSLATE;
			case "trace" -> Command.TRACE;
			default -> throw new IllegalArgumentException("Unknown command: " + arg);
		};
	}

	private static BigInteger parseNumber(String value, String flag)
	{
		try
		{
			return new BigInteger(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid number for " + flag + ": " + value);
		}
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Front end of the metalift synthesis toolchain.");
		System.out.println("\nUSAGE: metalift [options] translate <tree.ast>");
		System.out.println("       metalift [options] trace <module.ll> -a <analysis.json> [-n N] [-s SEED] [-o file]");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -a, --analysis <file>     Analysis descriptor (JSON) of the function to trace.");
		System.out.println("  -n, --count <N>           Number of traces to generate (default " + DEFAULT_TRACE_COUNT + ").");
		System.out.println("  -s, --seed <S>            Seed of the argument sampler (default " + DEFAULT_SEED + ").");
		System.out.println("  -o, --output <file>       Write the result to a file instead of stdout.");
	}

	// --- Getters ---

	public Command getCommand()
	{
		return command;
	}

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getAnalysisFile()
	{
		return analysisFile;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public int getTraceCount()
	{
		return traceCount;
	}

	public long getSeed()
	{
		return seed;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	/**
	 * @return Why parsing failed, or {@code null} if the arguments were valid.
	 */
	public String getErrorMessage()
	{
		return errorMessage;
	}
}
