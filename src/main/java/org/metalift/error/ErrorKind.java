package org.metalift.error;

/**
 * Classification of every failure the translator, the sampler and the native bridge can raise.
 */
public enum ErrorKind
{
	UNSUPPORTED_CONSTRUCT,
	UNDECLARED_VARIABLE,
	UNSUPPORTED_ANNOTATION,
	MULTI_TARGET_ASSIGNMENT,
	UNSUPPORTED_TYPE,
	CONFLICTING_DECLARATION,
	NATIVE_COMPILATION,
	MALFORMED_DUMP
}
