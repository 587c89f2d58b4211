package org.metricshub.jsasp.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jsasp
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;
import org.metricshub.jsasp.program.Operation;
import org.metricshub.jsasp.program.Term;

/**
 * Operator precedence parser for infix expressions.
 * <p>
 * Parsing happens in two passes:
 * <ol>
 * <li>the tokens are read into a flat run of operands, operators and
 * parenthesis markers (operands are built by the {@link TermBuilder});</li>
 * <li>the run, wrapped in a pair of sentinel parentheses, is reduced with
 * an operand stack and an operator stack (shunting-yard).</li>
 * </ol>
 * When an operator arrives, the operators on top of the stack are reduced
 * first as long as its {@link ReductionPolicy} says so.
 */
public final class ExpressionEngine {

	/** Element kinds of the flattened run. */
	enum ItemType {
		OPERAND,
		OPERATOR,
		OPEN,
		CLOSE
	}

	/** One element of the flattened run. */
	static final class Item {

		private static final Item OPEN = new Item(ItemType.OPEN, null, null, null);
		private static final Item CLOSE = new Item(ItemType.CLOSE, null, null, null);

		private final ItemType type;
		private final Term operand;
		private final OperatorEntry operator;
		private final Token token;

		private Item(ItemType type, Term operand, OperatorEntry operator, Token token) {
			this.type = type;
			this.operand = operand;
			this.operator = operator;
			this.token = token;
		}

		static Item operand(Term term) {
			return new Item(ItemType.OPERAND, term, null, null);
		}

		static Item operator(OperatorEntry entry, Token token) {
			return new Item(ItemType.OPERATOR, null, entry, token);
		}

		@Override
		public String toString() {
			switch (type) {
			case OPERAND:
				return operand.toString();
			case OPERATOR:
				return operator.getSymbol();
			case OPEN:
				return "(";
			default:
				return ")";
			}
		}
	}

	private final TokenCursor cursor;
	private final OperatorTable operators;
	private final TermBuilder terms;

	ExpressionEngine(TokenCursor cursor, OperatorTable operators, TermBuilder terms) {
		this.cursor = cursor;
		this.operators = operators;
		this.terms = terms;
	}

	// CHECKSTYLE.OFF: MethodName

	// EXPRESSION : UNIT { operator UNIT }
	/**
	 * Reads one infix expression and resolves it into a term.
	 *
	 * @param scope the statement's variable scope
	 * @param allowConjunction whether a top level {@code ,} is an operator
	 *        (body) or a separator the caller handles (arguments)
	 * @return the expression tree
	 */
	public Term EXPRESSION(VariableScope scope, boolean allowConjunction) {
		List<Item> run = new ArrayList<Item>();
		flatten(scope, run, allowConjunction);
		return reduce(run);
	}

	// CHECKSTYLE.ON: MethodName

	void flatten(VariableScope scope, List<Item> run, boolean allowConjunction) {
		unit(scope, run);
		OperatorEntry entry = nextOperator(allowConjunction);
		while (entry != null) {
			run.add(Item.operator(entry, cursor.next()));
			unit(scope, run);
			entry = nextOperator(allowConjunction);
		}
	}

	// UNIT : ( EXPRESSION ) | TERM
	private void unit(VariableScope scope, List<Item> run) {
		if (cursor.accept("(")) {
			run.add(Item.OPEN);
			// inside parentheses, a comma is a conjunction again
			flatten(scope, run, true);
			cursor.expect(")", Expectation.CLOSE_PAREN);
			run.add(Item.CLOSE);
		} else {
			run.add(Item.operand(terms.TERM(scope)));
		}
	}

	private OperatorEntry nextOperator(boolean allowConjunction) {
		Token token = cursor.peek();
		if (token == null) {
			return null;
		}
		OperatorEntry entry = operators.lookup(token);
		if (entry == null || (!allowConjunction && Operation.CONJUNCTION.equals(entry.getSymbol()))) {
			return null;
		}
		return entry;
	}

	/**
	 * Reduces a flattened run into a single term.
	 *
	 * @param run operands, operators and parenthesis markers, as produced by
	 *        the flattening pass
	 * @return the expression tree
	 */
	Term reduce(List<Item> run) {
		Deque<Term> operands = new ArrayDeque<Term>();
		Deque<Item> stack = new ArrayDeque<Item>();

		stack.push(Item.OPEN);
		for (Item item : run) {
			process(item, operands, stack);
		}
		process(Item.CLOSE, operands, stack);

		if (!stack.isEmpty()) {
			throw new IllegalStateException("Unbalanced operator stack after reduction: " + stack);
		}
		if (operands.size() != 1) {
			throw new IllegalStateException("Expected exactly one operand after reduction, got " + operands);
		}
		return operands.pop();
	}

	private void process(Item item, Deque<Term> operands, Deque<Item> stack) {
		switch (item.type) {
		case OPERAND:
			operands.push(item.operand);
			break;
		case OPERATOR:
			while (!stack.isEmpty() && stack.peek().type == ItemType.OPERATOR && reducesFirst(stack.peek(), item)) {
				combine(stack.pop(), operands);
			}
			stack.push(item);
			break;
		case OPEN:
			stack.push(item);
			break;
		case CLOSE:
			while (!stack.isEmpty() && stack.peek().type == ItemType.OPERATOR) {
				combine(stack.pop(), operands);
			}
			if (stack.isEmpty()) {
				throw new IllegalStateException("Closing parenthesis without opening marker");
			}
			stack.pop();
			break;
		default:
			throw new IllegalStateException("Unknown item " + item);
		}
	}

	/**
	 * Whether the operator on top of the stack must be reduced before
	 * {@code incoming} is pushed.
	 */
	private boolean reducesFirst(Item top, Item incoming) {
		OperatorEntry stacked = top.operator;
		OperatorEntry arriving = incoming.operator;
		if (arriving.getPolicy() == ReductionPolicy.PRIORITY_ONLY) {
			return stacked.getPriority() <= arriving.getPriority();
		}
		if (stacked.getPriority() != arriving.getPriority()) {
			return stacked.getPriority() < arriving.getPriority();
		}
		Associativity left = stacked.getAssociativity();
		Associativity right = arriving.getAssociativity();
		if (left == Associativity.LEFT_ASSOC && right == Associativity.LEFT_ASSOC) {
			return true;
		}
		if (left == Associativity.RIGHT_ASSOC && right == Associativity.RIGHT_ASSOC) {
			return false;
		}
		// non-associative, or mixed classes at the same priority
		throw cursor.syntaxError(incoming.token, SyntaxErrorKind.STRUCTURAL, Expectation.OPERATOR);
	}

	private static void combine(Item operator, Deque<Term> operands) {
		if (operands.size() < 2) {
			throw new IllegalStateException("Operator " + operator + " is missing operands: " + operands);
		}
		Term right = operands.pop();
		Term left = operands.pop();
		operands.push(new Operation(operator.operator.getSymbol(), left, right));
	}
}
