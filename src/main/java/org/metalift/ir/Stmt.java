package org.metalift.ir;

/**
 * A node that only appears in statement position.
 */
public interface Stmt extends Node
{
}
