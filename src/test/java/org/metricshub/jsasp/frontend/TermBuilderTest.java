package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jsasp.SaspTestSupport.parseTest;
import static org.metricshub.jsasp.SaspTestSupport.tokenize;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;
import org.metricshub.jsasp.program.BuiltinCall;
import org.metricshub.jsasp.program.Predicate;
import org.metricshub.jsasp.program.Program;
import org.metricshub.jsasp.program.Rule;
import org.metricshub.jsasp.program.Variable;
import org.metricshub.jsasp.util.ParserSettings;

public class TermBuilderTest {

	@Test
	public void testArityIsPartOfTheName() {
		Program program = parseTest("arity")
				.program("p. p(1). p(1, 2).")
				.expectStatement("p_0.")
				.expectStatement("p_1(1).")
				.expectStatement("p_2(1,2).")
				.runAndAssert();
		Predicate p0 = (Predicate) program.getStatements().get(0).getHead();
		Predicate p1 = (Predicate) program.getStatements().get(1).getHead();
		assertEquals("p_0", p0.getCanonicalName());
		assertEquals("p_1", p1.getCanonicalName());
		assertNotEquals(p0.getKey(), p1.getKey());
	}

	@Test
	public void testArgumentsArePredicatesToo() {
		parseTest("compound arguments")
				.program("init(loaded(gun1), [0, 0]).")
				.expectStatement("init_2(loaded_1(gun1_0),[0,0]).")
				.runAndAssert();
	}

	@Test
	public void testClassicalNegation() {
		Program program = parseTest("classical negation")
				.program("-p(a). p(a). q :- -p(X).")
				.expectStatement("c_p_1(a_0).")
				.expectStatement("p_1(a_0).")
				.expectStatement("q_0 :- c_p_1(X).")
				.runAndAssert();
		Predicate negated = (Predicate) program.getStatements().get(0).getHead();
		assertTrue(negated.getKey().isClassicallyNegated());
		assertEquals(((Predicate) program.getStatements().get(1).getHead()).getKey().negate(), negated.getKey());
	}

	@Test
	public void testReservedNamesAreDisambiguated() {
		parseTest("reserved names")
				.program("_hidden(X). c_foo. d_bar. nmr_check. plain.")
				.expectStatement("d__hidden_1(X).")
				.expectStatement("d_c_foo_0.")
				.expectStatement("d_d_bar_0.")
				.expectStatement("d_nmr_check_0.")
				.expectStatement("plain_0.")
				.runAndAssert();
	}

	@Test
	public void testDisambiguationComesBeforeNegation() {
		Program program = parseTest("negated hidden atom")
				.program("-_x(1).")
				.expectStatement("c_d__x_1(1).")
				.runAndAssert();
		Predicate head = (Predicate) program.getStatements().get(0).getHead();
		assertTrue(head.getKey().isHidden());
		assertTrue(head.getKey().isDisambiguated());
	}

	@Test
	public void testConfiguredPrefixes() {
		ParserSettings settings = new ParserSettings();
		settings.setInternalPrefixes(Arrays.asList("gen_"));
		settings.setReservedPrefixes(Arrays.asList("solver"));
		parseTest("configured prefixes")
				.settings(settings)
				.program("gen_a. solver_b. c_c.")
				.expectStatement("d_gen_a_0.")
				.expectStatement("d_solver_b_0.")
				.expectStatement("c_c_0.")
				.runAndAssert();
	}

	@Test
	public void testBuiltinsAreNotRenamed() {
		Program program = parseTest("builtins")
				.builtins("write", "_sys")
				.program("p(X) :- q(X), write(X), _sys.")
				.expectStatement("p_1(X) :- q_1(X), write(X), _sys.")
				.runAndAssert();
		Rule rule = program.getStatements().get(0);
		assertEquals(new BuiltinCall("write", Arrays.asList(new Variable("X"))), rule.getBody().get(1));
	}

	@Test
	public void testNegationAsFailure() {
		parseTest("not")
				.program("p :- not q, not -r(1).")
				.expectStatement("p_0 :- not q_0, not c_r_1(1).")
				.runAndAssert();
	}

	@Test
	public void testDoubleNotIsRejected() {
		Program program = parseTest("not not")
				.program("p :- not not q. r.")
				.expectStatement("r_0.")
				.expectErrors(1)
				.runAndAssert();
		assertEquals(Expectation.NEGATED_LITERAL, program.getDiagnostics().get(0).getExpectation());
	}

	@Test
	public void testNegationOfNonAtomIsRejected() {
		Program program = parseTest("negated variable")
				.program("p :- -X. r.")
				.expectStatement("r_0.")
				.expectErrors(1)
				.runAndAssert();
		assertEquals(Expectation.NEGATED_LITERAL, program.getDiagnostics().get(0).getExpectation());
		assertEquals("X", program.getDiagnostics().get(0).getTokenText());
	}

	@Test
	public void testDoubleClassicalNegationIsRejectedByDefault() {
		Program program = parseTest("double negation")
				.program("p :- - - q. r.")
				.expectStatement("r_0.")
				.expectErrors(1)
				.runAndAssert();
		assertEquals(SyntaxErrorKind.DOUBLE_NEGATION, program.getDiagnostics().get(0).getKind());
		assertEquals(Expectation.DOUBLE_NEGATION, program.getDiagnostics().get(0).getExpectation());
		assertEquals(8, program.getDiagnostics().get(0).getPosition().getColumn());
	}

	@Test
	public void testDoubleClassicalNegationCancelsWhenAllowed() {
		ParserSettings settings = new ParserSettings();
		settings.setRejectDoubleNegation(false);
		parseTest("double negation cancels")
				.settings(settings)
				.program("p :- - - q, - - - r.")
				.expectStatement("p_0 :- q_0, c_r_0.")
				.runAndAssert();
	}

	@Test
	public void testNumbers() {
		parseTest("numbers")
				.program("n(42, 3.25, 2r3, 123456789012345678901234567890).")
				.expectStatement("n_4(42,3.25,2r3,123456789012345678901234567890).")
				.runAndAssert();
	}

	@Test
	public void testStartsPredicate() {
		TermBuilder builder = new TermBuilder(new TokenCursor(tokenize("")), new ParserSettings());
		assertTrue(builder.startsPredicate(tokenize("p").get(0)));
		assertTrue(builder.startsPredicate(tokenize("-").get(0)));
		assertTrue(builder.startsPredicate(tokenize("\"s\"").get(0)));
		assertFalse(builder.startsPredicate(tokenize("X").get(0)));
		assertFalse(builder.startsPredicate(tokenize("not").get(0)));
		assertFalse(builder.startsPredicate(null));
	}

	@Test
	public void testArgumentListErrors() {
		Program program = parseTest("bad argument list")
				.program("p(a b). q(). r.")
				.expectStatement("r_0.")
				.expectErrors(2)
				.runAndAssert();
		assertEquals(Expectation.TERMS, program.getDiagnostics().get(0).getExpectation());
		assertEquals(Expectation.TERM, program.getDiagnostics().get(1).getExpectation());
	}
}
