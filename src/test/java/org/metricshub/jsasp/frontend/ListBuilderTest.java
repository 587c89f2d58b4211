package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.metricshub.jsasp.SaspTestSupport.parseTest;
import static org.metricshub.jsasp.SaspTestSupport.tokenize;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jsasp.Sasp;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.program.IntegerTerm;
import org.metricshub.jsasp.program.ListCons;
import org.metricshub.jsasp.program.ListEmpty;
import org.metricshub.jsasp.program.Operation;
import org.metricshub.jsasp.program.Program;
import org.metricshub.jsasp.program.Term;
import org.metricshub.jsasp.program.Variable;

public class ListBuilderTest {

	private static final Sasp SASP = new Sasp();

	private static Term rightOf(String query) {
		List<Term> goals = SASP.parseQuery(tokenize(query));
		assertEquals(1, goals.size());
		return ((Operation) goals.get(0)).getRight();
	}

	@Test
	public void testConsWithTail() {
		Term list = rightOf("L = [1,2|X].");
		assertEquals(new ListCons(new IntegerTerm(1), new ListCons(new IntegerTerm(2), new Variable("X"))), list);
		assertEquals(Arrays.asList(new IntegerTerm(1), new IntegerTerm(2)), ((ListCons) list).elements());
	}

	@Test
	public void testEmptyList() {
		assertSame(ListEmpty.INSTANCE, rightOf("L = []."));
	}

	@Test
	public void testProperList() {
		assertEquals(
				new ListCons(new IntegerTerm(1), new ListCons(new IntegerTerm(2), ListEmpty.INSTANCE)),
				rightOf("L = [1, 2]."));
	}

	@Test
	public void testListRendering() {
		parseTest("lists in arguments")
				.program("p([]). p([a, b]). p([H|T]). p([[1], [2, 3]]). p([X + 1, Y]).")
				.expectStatement("p_1([]).")
				.expectStatement("p_1([a_0,b_0]).")
				.expectStatement("p_1([H|T]).")
				.expectStatement("p_1([[1],[2,3]]).")
				.expectStatement("p_1([+(X,1),Y]).")
				.runAndAssert();
	}

	@Test
	public void testConjunctionTailIsRejected() {
		Program program = parseTest("conjunction tail")
				.program("p([1|a, b]). q.")
				.expectStatement("q_0.")
				.expectErrors(1)
				.runAndAssert();
		assertEquals(Expectation.LIST, program.getDiagnostics().get(0).getExpectation());
		assertEquals("|", program.getDiagnostics().get(0).getTokenText());
	}

	@Test
	public void testParenthesizedTailIsStillAConjunction() {
		parseTest("parenthesized conjunction tail")
				.program("p([1|(a, b)]).")
				.expectErrors(1)
				.runAndAssert();
	}

	@Test
	public void testUnclosedList() {
		Program program = parseTest("unclosed list")
				.program("p([1, 2). q.")
				.expectStatement("q_0.")
				.expectErrors(1)
				.runAndAssert();
		assertEquals(Expectation.LIST, program.getDiagnostics().get(0).getExpectation());
		assertEquals(")", program.getDiagnostics().get(0).getTokenText());
	}
}
