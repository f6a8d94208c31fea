package org.javai.vero.validate;

public enum Severity {
	ERROR,
	WARNING
}
