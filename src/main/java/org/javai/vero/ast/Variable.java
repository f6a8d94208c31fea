package org.javai.vero.ast;

/**
 * A page-level variable, e.g. {@code text greeting = "Hello"}.
 */
public record Variable(VarType type, String name, Expression value, int line) {
}
