package org.metalift.util;

import java.io.PrintStream;

public class Debug {
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v/--verbose. Controls logDebug only.
	public static boolean ENABLE_DEBUG = false;

	// Colors are only emitted when attached to a terminal
	private static final boolean COLORS = System.console() != null;

	// Traces are written to stdout, so diagnostics go to stderr
	private static PrintStream out = System.err;

	public static void setOutput(PrintStream stream) {
		out = stream;
	}

	public static void log(String log) {
		out.println(log);
	}

	public static void logInfo(String log) {
		out.println(colored(ANSI_GREEN, log));
	}

	public static void logDebug(String log) {
		if (ENABLE_DEBUG) {
			out.println("[debug] " + log);
		}
	}

	public static void logWarning(String log) {
		out.println(colored(ANSI_YELLOW, log));
	}

	public static void logError(String log) {
		out.println(colored(ANSI_RED, log));
	}

	private static String colored(String color, String log) {
		return COLORS ? color + log + ANSI_RESET : log;
	}
}
