package org.qronos;

/** Thrown when a pattern contains a directive or letter token that has no mapping in the requested mode */
public class UnsupportedTokenException extends IllegalArgumentException {
	private final String thePattern;
	private final String theToken;

	/**
	 * @param pattern The pattern being compiled
	 * @param token The offending token
	 * @param message The description of the problem
	 */
	public UnsupportedTokenException(String pattern, String token, String message) {
		super(message + ": \"" + token + "\" in \"" + pattern + "\"");
		thePattern = pattern;
		theToken = token;
	}

	/** @return The pattern that could not be compiled */
	public String getPattern() {
		return thePattern;
	}

	/** @return The token that could not be mapped */
	public String getToken() {
		return theToken;
	}
}
