package org.javai.vero.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.javai.vero.ast.Program;
import org.javai.vero.lexer.TokenizeResult;
import org.javai.vero.lexer.VeroTokenizer;
import org.javai.vero.parser.ParseResult;
import org.javai.vero.parser.VeroParser;

/**
 * Loads sample programs from {@code src/test/resources/vero} and parses inline sources.
 */
public final class VeroSources {

	private VeroSources() {
	}

	public static String load(String name) {
		String resource = "vero/" + name;
		try (InputStream in = VeroSources.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalArgumentException("Missing test resource: " + resource);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static ParseResult parse(String source) {
		TokenizeResult tokens = VeroTokenizer.tokenize(source);
		if (tokens.hasErrors()) {
			throw new IllegalArgumentException("Lex errors: " + tokens.errors());
		}
		return new VeroParser(tokens.tokens()).parse();
	}

	/**
	 * Parses a source that is expected to be syntactically valid.
	 */
	public static Program program(String source) {
		ParseResult result = parse(source);
		if (result.hasErrors()) {
			throw new IllegalArgumentException("Parse errors: " + result.errors());
		}
		return result.program();
	}
}
