package org.javai.cdlexport.expr;

import java.util.Arrays;
import java.util.Optional;

public enum BinaryOperator {
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	POWER("^"),
	EQUAL("=="),
	NOT_EQUAL("<>"),
	LESS("<"),
	LESS_EQUAL("<="),
	GREATER(">"),
	GREATER_EQUAL(">="),
	AND("and"),
	OR("or");

	private final String symbol;

	BinaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public boolean isArithmetic() {
		return ordinal() <= POWER.ordinal();
	}

	public boolean isRelational() {
		return ordinal() >= EQUAL.ordinal() && ordinal() <= GREATER_EQUAL.ordinal();
	}

	public static Optional<BinaryOperator> fromSymbol(String symbol) {
		return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
	}
}
