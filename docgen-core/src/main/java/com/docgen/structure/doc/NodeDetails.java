package com.docgen.structure.doc;

/**
 * Text facts read back from a node's source slice.
 *
 * @param header logical declaration line without comments, whitespace collapsed; empty for a
 *     module
 * @param parameters parenthesised parameter or base list following the name, if any
 * @param value assigned expression of an assignment, whitespace collapsed
 * @param docstring cleaned documentation string, if the body starts with one
 */
public record NodeDetails(String header, String parameters, String value, String docstring) {}
