package org.metalift.ir;

/**
 * A node that produces a value.
 */
public interface Expr extends Node
{
}
