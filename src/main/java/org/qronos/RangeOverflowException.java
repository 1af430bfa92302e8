package org.qronos;

/** Thrown when an operation would produce an instant outside of the years {@value TimeUtils#MIN_YEAR}..{@value TimeUtils#MAX_YEAR} */
public class RangeOverflowException extends ArithmeticException {
	/** @param message The description of the overflow */
	public RangeOverflowException(String message) {
		super(message);
	}
}
