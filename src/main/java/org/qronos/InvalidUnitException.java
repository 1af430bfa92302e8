package org.qronos;

/** Thrown when a unit name is not recognized or a unit is not supported for an operation */
public class InvalidUnitException extends IllegalArgumentException {
	private final String theUnit;

	/**
	 * @param unit The unit name as given
	 * @param message The description of the problem
	 */
	public InvalidUnitException(String unit, String message) {
		super(message);
		theUnit = unit;
	}

	/** @return The unit name as given */
	public String getUnit() {
		return theUnit;
	}
}
