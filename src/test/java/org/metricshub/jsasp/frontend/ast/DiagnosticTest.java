package org.metricshub.jsasp.frontend.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.jsasp.frontend.SourcePosition;
import org.metricshub.jsasp.frontend.Token;
import org.metricshub.jsasp.frontend.TokenKind;

public class DiagnosticTest {

	@Test
	public void testFormatAtToken() {
		Token token = new Token(TokenKind.IDENTIFIER, "foo", new SourcePosition("prog.lp", 3, 12));
		Diagnostic diagnostic = Diagnostic.at(SyntaxErrorKind.STRUCTURAL, token, Expectation.DIRECTIVE);
		assertEquals(
				"ERROR: prog.lp:3:12: Syntax error at \"foo\". "
						+ "Invalid directive. Expected include, table, show, pred, compute or abducible.",
				diagnostic.format());
		assertEquals(diagnostic.format(), diagnostic.toString());
	}

	@Test
	public void testFormatAtEndOfInput() {
		Diagnostic diagnostic = Diagnostic.endOfInput(Expectation.CLOSE_BRACKET);
		assertEquals(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, diagnostic.getKind());
		assertEquals("ERROR: Unexpected end of file. Expected \"]\".", diagnostic.format());
	}

	@Test
	public void testValueEquality() {
		SourcePosition position = new SourcePosition("a.lp", 1, 1);
		Token token = Token.keyword(".", position);
		assertEquals(
				Diagnostic.at(SyntaxErrorKind.STRUCTURAL, token, Expectation.STATEMENT),
				Diagnostic.at(SyntaxErrorKind.STRUCTURAL, Token.keyword(".", position), Expectation.STATEMENT));
		assertFalse(
				Diagnostic
						.at(SyntaxErrorKind.STRUCTURAL, token, Expectation.STATEMENT)
						.equals(Diagnostic.at(SyntaxErrorKind.TOKEN_MISMATCH, token, Expectation.STATEMENT)));
	}

	@Test
	public void testExpectationTable() {
		assertSame(Expectation.RULE, Expectation.token("rule"));
		assertSame(Expectation.CLOSE_BRACE, Expectation.token("}"));
		assertTrue(Expectation.RULE.isSpecific());
		assertEquals("Invalid token in rule. Expected \":-\" or \".\"", Expectation.RULE.getMessage());

		Expectation generic = Expectation.token("?-");
		assertFalse(generic.isSpecific());
		assertEquals("Expected \"?-\"", generic.getMessage());
		assertEquals(generic, Expectation.token("?-"));
		assertFalse(Expectation.knownExpectations().containsKey("?-"));
		assertTrue(Expectation.knownExpectations().containsKey("negated_lit"));
	}
}
