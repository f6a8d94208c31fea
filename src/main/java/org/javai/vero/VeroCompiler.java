package org.javai.vero;

import java.util.List;
import java.util.Objects;
import org.javai.vero.CompilationResult.Stage;
import org.javai.vero.config.VeroConfig;
import org.javai.vero.lexer.TokenizeResult;
import org.javai.vero.lexer.VeroTokenizer;
import org.javai.vero.parser.ParseResult;
import org.javai.vero.parser.VeroParser;
import org.javai.vero.transpile.TranspileResult;
import org.javai.vero.transpile.Transpiler;
import org.javai.vero.validate.SemanticValidator;
import org.javai.vero.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs lex, parse, validate and transpile in order. Lexical and syntax errors stop the pipeline
 * before validation; validation errors stop it before transpiling.
 * <p>
 * Not thread-safe, since the validator keeps the last symbol table. Use one compiler per thread.
 */
public class VeroCompiler {

	private static final Logger logger = LoggerFactory.getLogger(VeroCompiler.class);

	private final SemanticValidator validator;
	private final Transpiler transpiler;

	public VeroCompiler() {
		this(VeroConfig.defaults());
	}

	public VeroCompiler(VeroConfig config) {
		this(new SemanticValidator(config.suggestionEngine()), new Transpiler(config.transpiler()));
	}

	public VeroCompiler(SemanticValidator validator, Transpiler transpiler) {
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.transpiler = Objects.requireNonNull(transpiler, "transpiler must not be null");
	}

	public CompilationResult compile(String source) {
		Objects.requireNonNull(source, "source must not be null");

		TokenizeResult tokens = VeroTokenizer.tokenize(source);
		logger.debug("Lexed {} token(s), {} lex error(s)", tokens.tokens().size(), tokens.errors().size());
		ParseResult parsed = new VeroParser(tokens.tokens()).parse();
		logger.debug("Parsed {} page(s), {} feature(s), {} syntax error(s)", parsed.program().pages().size(),
				parsed.program().features().size(), parsed.errors().size());

		if (tokens.hasErrors()) {
			logger.warn("Compilation halted after lexing: {} lex error(s)", tokens.errors().size());
			return new CompilationResult(tokens.errors(), parsed.errors(), null, null, Stage.LEX);
		}
		if (parsed.hasErrors()) {
			logger.warn("Compilation halted after parsing: {} syntax error(s)", parsed.errors().size());
			return new CompilationResult(List.of(), parsed.errors(), null, null, Stage.PARSE);
		}

		ValidationResult validation = validator.validate(parsed.program());
		if (!validation.valid()) {
			logger.warn("Compilation halted after validation: {} error(s)", validation.errorCount());
			return new CompilationResult(List.of(), List.of(), validation, null, Stage.VALIDATE);
		}

		TranspileResult output = transpiler.transpile(parsed.program(), validator.getSymbolTable());
		logger.info("Transpiled {} page object(s), {} page actions class(es), {} test file(s)",
				output.pages().size(), output.pageActions().size(), output.tests().size());
		return new CompilationResult(List.of(), List.of(), validation, output, Stage.TRANSPILE);
	}
}
