package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jsasp.SaspTestSupport.tokenize;

import org.junit.Test;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.ParserException;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;

public class TokenCursorTest {

	@Test
	public void testReading() {
		TokenCursor cursor = new TokenCursor(tokenize("p :- q."));
		assertFalse(cursor.peekIs("p"));
		assertEquals("p", cursor.next().getText());
		assertTrue(cursor.accept(":-"));
		assertFalse(cursor.accept(":-"));
		assertEquals("q", cursor.peek().getText());
		int mark = cursor.position();
		cursor.next();
		cursor.expect(".");
		assertTrue(cursor.atEnd());
		assertNull(cursor.peek());
		cursor.reset(mark);
		assertEquals("q", cursor.peek().getText());
		assertThrows(IllegalArgumentException.class, () -> cursor.reset(42));
	}

	@Test
	public void testExpectFailsAtTheNextToken() {
		TokenCursor cursor = new TokenCursor(tokenize("p q"));
		cursor.next();
		ParserException e = assertThrows(ParserException.class, () -> cursor.expect(".", Expectation.BODY));
		assertEquals(SyntaxErrorKind.TOKEN_MISMATCH, e.getDiagnostic().getKind());
		assertEquals("q", e.getDiagnostic().getTokenText());
		assertEquals(Expectation.BODY, e.getDiagnostic().getExpectation());
		// nothing was consumed
		assertEquals(1, cursor.position());
	}

	@Test
	public void testEndOfInput() {
		TokenCursor cursor = new TokenCursor(tokenize("p"));
		cursor.next();
		ParserException e = assertThrows(ParserException.class, cursor::next);
		assertEquals(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, e.getDiagnostic().getKind());
		e = assertThrows(ParserException.class, () -> cursor.expect(")"));
		assertEquals(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, e.getDiagnostic().getKind());
		assertEquals(Expectation.CLOSE_PAREN, e.getDiagnostic().getExpectation());
		assertNull(e.getDiagnostic().getPosition());
	}
}
