package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jsasp.SaspTestSupport.render;
import static org.metricshub.jsasp.SaspTestSupport.tokenize;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.jsasp.Sasp;

@RunWith(Parameterized.class)
public class ExpressionEngineTest {

	private static final Sasp SASP = new Sasp();

	@Parameter(0)
	public String query;

	@Parameter(1)
	public String expected;

	@Parameters(name = "{0}")
	public static Collection<Object[]> cases() {
		return Arrays
				.asList(
						new Object[][] {
								{ "1+2*3.", "+(1,*(2,3))" },
								{ "1*2+3.", "+(*(1,2),3)" },
								{ "1-2-3.", "-(-(1,2),3)" },
								{ "1+2-3.", "-(+(1,2),3)" },
								{ "2^3^4.", "^(2,^(3,4))" },
								{ "(1+2)*3.", "*(+(1,2),3)" },
								{ "2-(3-4).", "-(2,-(3,4))" },
								{ "((1)).", "1" },
								{ "2^3*4.", "*(^(2,3),4)" },
								{ "X is 2**3.", "is(X,**(2,3))" },
								{ "X = 1+2.", "=(X,+(1,2))" },
								{ "T1 .=. T0 + D.", ".=.(T1,+(T0,D))" },
								{ "X mod 2 =:= 0.", "=:=(mod(X,2),0)" },
								{ "a, b, c.", "a_0, b_0, c_0" },
								{ "(a, b), c.", "a_0, b_0, c_0" },
								{ "p(X+1, Y).", "p_2(+(X,1),Y)" },
								{ "p((a, b)).", "p_1(,(a_0,b_0))" },
								{ "X = -a.", "=(X,c_a_0)" },
								{ "not p, q.", "not p_0, q_0" },
								{ "X = 1.5, Y = 1r3.", "=(X,1.5), =(Y,1r3)" } });
	}

	@Test
	public void testResolvesExpression() {
		assertEquals(query, expected, render(SASP.parseQuery(tokenize(query))));
	}

	@Test
	public void testExpressionIsStable() {
		// parsing the same tokens twice gives the same tree
		assertEquals(SASP.parseQuery(tokenize(query)), SASP.parseQuery(tokenize(query)));
	}
}
