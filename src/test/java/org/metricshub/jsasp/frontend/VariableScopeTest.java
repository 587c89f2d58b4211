package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.metricshub.jsasp.program.Variable;

public class VariableScopeTest {

	@Test
	public void testFreshNamesAreNumberedFromOne() {
		VariableScope scope = new VariableScope();
		assertEquals(new Variable("_V1"), scope.fresh());
		assertEquals(new Variable("_V2"), scope.fresh());
		assertEquals(2, scope.count());
		assertEquals(new Variable("_V1"), new VariableScope().fresh());
	}
}
