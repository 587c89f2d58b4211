package org.metricshub.jsasp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class OperatorTableTest {

	private static final SourcePosition POS = new SourcePosition("test.lp", 1, 1);

	@Test
	public void testStandardPriorities() {
		OperatorTable table = OperatorTable.standard();
		assertEquals(1000, table.lookup(",").getPriority());
		assertEquals(Associativity.RIGHT_ASSOC, table.lookup(",").getAssociativity());
		assertEquals(700, table.lookup(".=<.").getPriority());
		assertEquals(Associativity.NON_ASSOC, table.lookup("is").getAssociativity());
		assertEquals(500, table.lookup("xor").getPriority());
		assertEquals(400, table.lookup("mod").getPriority());
		assertEquals(Associativity.LEFT_ASSOC, table.lookup("//").getAssociativity());
		assertEquals(200, table.lookup("^").getPriority());
		assertEquals(Associativity.RIGHT_ASSOC, table.lookup("^").getAssociativity());
		assertNull(table.lookup(":-"));
	}

	@Test
	public void testOnlyKeywordTokensAreOperators() {
		OperatorTable table = OperatorTable.standard();
		assertSame(table.lookup("mod"), table.lookup(Token.keyword("mod", POS)));
		assertNull(table.lookup(new Token(TokenKind.IDENTIFIER, "mod", POS)));
		assertNull(table.lookup(new Token(TokenKind.STRING, "\"+\"", POS)));
	}

	@Test
	public void testBuilderDoesNotChangeTheStandardTable() {
		OperatorTable custom = OperatorTable
				.standard()
				.toBuilder()
				.remove("xor")
				.add("-->", Associativity.RIGHT_ASSOC, 1100)
				.add("+", Associativity.RIGHT_ASSOC, 500, ReductionPolicy.PRIORITY_ONLY)
				.build();
		assertNull(custom.lookup("xor"));
		assertEquals(1100, custom.lookup("-->").getPriority());
		assertEquals(ReductionPolicy.PRIORITY_ONLY, custom.lookup("+").getPolicy());
		assertEquals(500, OperatorTable.standard().lookup("xor").getPriority());
		assertEquals(ReductionPolicy.ASSOCIATIVITY_AWARE, OperatorTable.standard().lookup("+").getPolicy());
		assertEquals(OperatorTable.standard().entries().size(), custom.entries().size());
	}

	@Test
	public void testEntries() {
		assertEquals("op(700, xfx, =)", new OperatorEntry("=", Associativity.NON_ASSOC, 700).toString());
		assertEquals(Associativity.LEFT_ASSOC, Associativity.fromSpecifier("yfx"));
		assertThrows(IllegalArgumentException.class, () -> Associativity.fromSpecifier("fy"));
		assertThrows(IllegalArgumentException.class, () -> new OperatorEntry("+", Associativity.LEFT_ASSOC, 0));
	}
}
