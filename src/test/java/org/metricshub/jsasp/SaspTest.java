package org.metricshub.jsasp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.metricshub.jsasp.SaspTestSupport.render;
import static org.metricshub.jsasp.SaspTestSupport.tokenize;

import java.util.List;
import org.junit.Test;
import org.metricshub.jsasp.frontend.Associativity;
import org.metricshub.jsasp.frontend.OperatorTable;
import org.metricshub.jsasp.frontend.ast.ParserException;
import org.metricshub.jsasp.program.Program;
import org.metricshub.jsasp.program.Term;
import org.metricshub.jsasp.util.ParserSettings;

public class SaspTest {

	@Test
	public void testParseProgram() {
		Program program = new Sasp().parseProgram(tokenize("p(X) :- X is 1 + 2 * 3. #show p/1."));
		assertEquals("p_1(X) :- is(X,+(1,*(2,3))).", program.getStatements().get(0).toString());
		assertEquals("#show [/(p_0,1)].", program.getDirectives().get(0).toString());
		assertEquals(0, program.getErrorCount());
	}

	@Test
	public void testInstancesCanBeReused() {
		Sasp sasp = new Sasp();
		assertEquals(1, sasp.parseProgram(tokenize("p q.")).getErrorCount());
		assertEquals(0, sasp.parseProgram(tokenize("p.")).getErrorCount());
	}

	@Test
	public void testSettingsApply() {
		ParserSettings settings = new ParserSettings();
		settings
				.setOperatorTable(
						OperatorTable.standard().toBuilder().add("=", Associativity.RIGHT_ASSOC, 700).build());
		List<Term> goals = new Sasp(settings).parseQuery(tokenize("X = Y = Z."));
		assertEquals("=(X,=(Y,Z))", render(goals));
		assertThrows(ParserException.class, () -> new Sasp().parseQuery(tokenize("X = Y = Z.")));
	}
}
