package org.qronos;

import java.text.ParseException;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a value cannot be parsed by any of the formats or grammars it was tried against. The message names the offending value
 * and every attempt, in order, with the reason it failed.
 */
public class TimeParseException extends ParseException {
	private final String theValue;
	private final List<ParseAttempt> theAttempts;

	/**
	 * @param value The value that could not be parsed
	 * @param attempts The attempts made to parse the value, in order
	 */
	public TimeParseException(String value, List<ParseAttempt> attempts) {
		super(buildMessage(value, attempts), 0);
		theValue = value;
		theAttempts = ImmutableList.copyOf(attempts);
	}

	/**
	 * @param value The value that could not be parsed
	 * @param message The description of the problem
	 * @param errorOffset The position in the value where the problem was found
	 */
	public TimeParseException(String value, String message, int errorOffset) {
		super(message, errorOffset);
		theValue = value;
		theAttempts = Collections.emptyList();
	}

	/** @return The value that could not be parsed */
	public String getValue() {
		return theValue;
	}

	/** @return Every attempt made to parse the value, in the order they were made */
	public List<ParseAttempt> getAttempts() {
		return theAttempts;
	}

	private static String buildMessage(String value, List<ParseAttempt> attempts) {
		StringBuilder str = new StringBuilder("Value \"").append(value).append("\" does not match any format in [");
		for (int i = 0; i < attempts.size(); i++) {
			if (i > 0)
				str.append(", ");
			str.append(attempts.get(i));
		}
		return str.append(']').toString();
	}
}
