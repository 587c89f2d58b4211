package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jsasp.SaspTestSupport.tokenize;

import org.junit.Test;
import org.metricshub.jsasp.frontend.ast.Diagnostic;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.util.SaspLogger;

public class ErrorReporterTest {

	@Test
	public void testRecoverSkipsThroughTheNextDot() {
		TokenCursor cursor = new TokenCursor(tokenize("p q(1, 2). r."));
		cursor.next();
		cursor.next();
		ErrorReporter reporter = new ErrorReporter();
		assertEquals(8, reporter.recover(cursor, 0));
		assertEquals("r", cursor.peek().getText());
	}

	@Test
	public void testRecoverStopsAtEndOfInput() {
		TokenCursor cursor = new TokenCursor(tokenize("p :- q"));
		ErrorReporter reporter = new ErrorReporter();
		assertEquals(3, reporter.recover(cursor, 0));
		assertTrue(cursor.atEnd());
	}

	@Test
	public void testReport() {
		ErrorReporter reporter = new ErrorReporter();
		Diagnostic diagnostic = Diagnostic.endOfInput(Expectation.BODY);
		reporter.report(diagnostic);
		assertEquals(1, reporter.getErrorCount());
		assertEquals(diagnostic, reporter.getDiagnostics().get(0));
		assertThrows(UnsupportedOperationException.class, () -> reporter.getDiagnostics().clear());
	}

	@Test
	public void testDiagnosticsHaveTheirOwnLogger() {
		assertEquals("org.metricshub.jsasp.diagnostics", SaspLogger.getDiagnosticsLogger().getName());
		assertEquals(ErrorReporter.class.getName(), SaspLogger.getLogger(ErrorReporter.class).getName());
	}
}
