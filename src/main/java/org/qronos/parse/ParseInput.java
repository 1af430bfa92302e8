package org.qronos.parse;

import java.math.BigDecimal;
import java.util.Objects;

/** A value to parse an instant from: either {@link Text text} or a {@link Numeric number} */
public abstract class ParseInput {
	private ParseInput() {
	}

	/**
	 * @param text The text to parse
	 * @return The input
	 */
	public static Text text(String text) {
		return new Text(text);
	}

	/**
	 * @param value The number to parse
	 * @return The input
	 */
	public static Numeric numeric(double value) {
		return new Numeric(value);
	}

	/** @return Whether this input is a number */
	public abstract boolean isNumeric();

	/** @return The text of this input. For numbers, the shortest plain decimal form, without a fraction if the number is integral. */
	public abstract String getText();

	@Override
	public String toString() {
		return getText();
	}

	/** Textual input */
	public static final class Text extends ParseInput {
		private final String theText;

		Text(String text) {
			theText = Objects.requireNonNull(text, "No text to parse");
		}

		@Override
		public boolean isNumeric() {
			return false;
		}

		@Override
		public String getText() {
			return theText;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Text && theText.equals(((Text) obj).theText);
		}

		@Override
		public int hashCode() {
			return theText.hashCode();
		}
	}

	/** Numeric input */
	public static final class Numeric extends ParseInput {
		private final double theValue;

		Numeric(double value) {
			if (Double.isNaN(value) || Double.isInfinite(value))
				throw new IllegalArgumentException("Not a finite number: " + value);
			theValue = value;
		}

		/** @return The number */
		public double getValue() {
			return theValue;
		}

		@Override
		public boolean isNumeric() {
			return true;
		}

		@Override
		public String getText() {
			BigDecimal value = BigDecimal.valueOf(theValue);
			if (value.signum() == 0)
				return "0";
			return value.stripTrailingZeros().toPlainString();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Numeric && Double.compare(theValue, ((Numeric) obj).theValue) == 0;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(theValue);
		}
	}
}
