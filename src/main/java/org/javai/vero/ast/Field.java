package org.javai.vero.ast;

public record Field(String name, Selector selector, int line) {
}
