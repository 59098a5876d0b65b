package org.metalift.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.metalift.error.SyntaxDumpException;

/**
 * ANTLR error listener that aborts reading a tree dump at the first lexical or syntax error.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	public static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		throw new SyntaxDumpException(line, charPositionInLine + 1, msg);
	}
}
