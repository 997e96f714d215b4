package com.docgen.structure.layout;

/**
 * Indentation change at an indentation-bearing line, relative to the previous such line:
 * {@code +1} opens a level, {@code 0} stays in the block, a negative value closes levels.
 */
public record IndentEvent(int line, int delta) {}
