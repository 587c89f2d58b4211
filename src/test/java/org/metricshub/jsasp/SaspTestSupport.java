package org.metricshub.jsasp;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.metricshub.jsasp.frontend.SourcePosition;
import org.metricshub.jsasp.frontend.Token;
import org.metricshub.jsasp.frontend.TokenKind;
import org.metricshub.jsasp.frontend.ast.Diagnostic;
import org.metricshub.jsasp.program.Program;
import org.metricshub.jsasp.program.Term;
import org.metricshub.jsasp.util.ParserSettings;

/**
 * Reusable helpers for the parser tests.
 * <p>
 * The real lexer lives outside of this project, so {@link #tokenize(String)}
 * provides a small one that is just good enough to write test programs as
 * text. {@link #parseTest(String)} is a fluent builder that parses a
 * program and asserts its rendering and error count.
 */
public final class SaspTestSupport {

	/** Source name given to tokens produced by {@link #tokenize(String)}. */
	public static final String SOURCE = "test.lp";

	private static final Set<String> KEYWORDS = new HashSet<String>(
			Arrays.asList("not", "is", "mod", "rem", "div", "xor"));

	// longest first
	private static final List<String> SYMBOLS = Arrays
			.asList(
					".<>.", ".=<.", ".>=.",
					".=.", ".<.", ".>.", "=:=", "=\\=", "\\==", "@=<", "@>=",
					":-", "?-", "==", "\\=", "=<", ">=", "@<", "@>", "//", "**", "<<", ">>", "/\\", "\\/",
					".", ",", "(", ")", "[", "]", "{", "}", "|", "#", "=", "<", ">", "+", "-", "*", "/", "^");

	private SaspTestSupport() {}

	/**
	 * Tokenizes program text, with {@code %} line comments.
	 *
	 * @param text the program
	 * @return the tokens, positioned in {@link #SOURCE}
	 */
	public static List<Token> tokenize(String text) {
		return tokenize(SOURCE, text, Collections.<String>emptySet());
	}

	/**
	 * Tokenizes program text.
	 *
	 * @param source source name of the tokens
	 * @param text the program
	 * @param builtins identifiers to tag as built-ins
	 * @return the tokens
	 */
	public static List<Token> tokenize(String source, String text, Set<String> builtins) {
		List<Token> tokens = new ArrayList<Token>();
		int line = 1;
		int lineStart = 0;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\n') {
				line++;
				lineStart = ++i;
				continue;
			}
			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}
			if (c == '%') {
				while (i < text.length() && text.charAt(i) != '\n') {
					i++;
				}
				continue;
			}
			SourcePosition position = new SourcePosition(source, line, i - lineStart + 1);
			int start = i;
			if (Character.isDigit(c)) {
				TokenKind kind = TokenKind.INTEGER;
				while (i < text.length() && Character.isDigit(text.charAt(i))) {
					i++;
				}
				if (i + 1 < text.length() && Character.isDigit(text.charAt(i + 1))) {
					if (text.charAt(i) == '.') {
						kind = TokenKind.FLOAT;
					} else if (text.charAt(i) == 'r') {
						kind = TokenKind.RATIONAL;
					}
					if (kind != TokenKind.INTEGER) {
						i++;
						while (i < text.length() && Character.isDigit(text.charAt(i))) {
							i++;
						}
					}
				}
				tokens.add(new Token(kind, text.substring(start, i), position));
			} else if (Character.isLetter(c) || c == '_') {
				while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
					i++;
				}
				String word = text.substring(start, i);
				tokens.add(new Token(wordKind(word, builtins), word, position));
			} else if (c == '"' || c == '\'') {
				i++;
				while (i < text.length() && text.charAt(i) != c) {
					i++;
				}
				i++;
				tokens.add(new Token(TokenKind.STRING, text.substring(start, Math.min(i, text.length())), position));
			} else {
				String symbol = null;
				for (String candidate : SYMBOLS) {
					if (text.startsWith(candidate, i)) {
						symbol = candidate;
						break;
					}
				}
				if (symbol == null) {
					throw new IllegalArgumentException("Unexpected character '" + c + "' at " + position);
				}
				i += symbol.length();
				tokens.add(Token.keyword(symbol, position));
			}
		}
		return tokens;
	}

	private static TokenKind wordKind(String word, Set<String> builtins) {
		if ("_".equals(word) || KEYWORDS.contains(word)) {
			return TokenKind.KEYWORD;
		}
		if (builtins.contains(word)) {
			return TokenKind.BUILTIN;
		}
		char first = word.charAt(0);
		if (Character.isUpperCase(first) || (first == '_' && !Character.isLowerCase(word.charAt(1)))) {
			return TokenKind.VARIABLE;
		}
		return TokenKind.IDENTIFIER;
	}

	/**
	 * Reads a test resource as text.
	 *
	 * @param resource resource path
	 * @return the resource content
	 * @throws IOException when the resource is missing
	 */
	public static String resource(String resource) throws IOException {
		try (InputStream stream = SaspTestSupport.class.getResourceAsStream(resource)) {
			if (stream == null) {
				throw new IOException("Resource not found: " + resource);
			}
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	/**
	 * Renders terms the way the assertions of these tests spell them.
	 *
	 * @param terms terms
	 * @return the terms separated by {@code ", "}
	 */
	public static String render(List<? extends Term> terms) {
		return terms.stream().map(Term::toString).collect(Collectors.joining(", "));
	}

	/**
	 * Creates a builder for a parse test.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static ParseTestBuilder parseTest(String description) {
		return new ParseTestBuilder(description);
	}

	/**
	 * Describes a program, the settings to parse it with and the expected
	 * outcome.
	 */
	public static final class ParseTestBuilder {

		private final String description;
		private String program = "";
		private Set<String> builtins = Collections.emptySet();
		private ParserSettings settings = new ParserSettings();
		private final List<String> expectedStatements = new ArrayList<String>();
		private final List<String> expectedDirectives = new ArrayList<String>();
		private int expectedErrors;

		private ParseTestBuilder(String description) {
			this.description = description;
		}

		public ParseTestBuilder program(String text) {
			this.program = text;
			return this;
		}

		public ParseTestBuilder builtins(String... names) {
			this.builtins = new HashSet<String>(Arrays.asList(names));
			return this;
		}

		public ParseTestBuilder settings(ParserSettings parserSettings) {
			this.settings = parserSettings;
			return this;
		}

		public ParseTestBuilder expectStatement(String rendered) {
			expectedStatements.add(rendered);
			return this;
		}

		public ParseTestBuilder expectDirective(String rendered) {
			expectedDirectives.add(rendered);
			return this;
		}

		public ParseTestBuilder expectErrors(int count) {
			this.expectedErrors = count;
			return this;
		}

		/**
		 * Parses the program without asserting anything.
		 *
		 * @return the parsed program
		 */
		public Program run() {
			return new Sasp(settings).parseProgram(tokenize(SOURCE, program, builtins));
		}

		/**
		 * Parses the program and asserts the statements, directives and error
		 * count.
		 *
		 * @return the parsed program, for further assertions
		 */
		public Program runAndAssert() {
			Program result = run();
			assertEquals(
					description + ": statements",
					expectedStatements,
					result.getStatements().stream().map(Object::toString).collect(Collectors.toList()));
			assertEquals(
					description + ": directives",
					expectedDirectives,
					result.getDirectives().stream().map(Object::toString).collect(Collectors.toList()));
			assertEquals(
					description + ": errors " + result
							.getDiagnostics()
							.stream()
							.map(Diagnostic::format)
							.collect(Collectors.toList()),
					expectedErrors,
					result.getErrorCount());
			return result;
		}
	}
}
