package org.javai.vero.config;

/**
 * Thrown when a configuration source cannot be read or holds invalid values.
 */
public class VeroConfigException extends RuntimeException {

	public VeroConfigException(String message) {
		super(message);
	}

	public VeroConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
