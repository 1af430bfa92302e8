package org.qronos.format;

import java.util.List;

/** The result of {@link TokenTranslator#compile(String, TokenTranslator.Mode) compiling} a pattern */
public abstract class CompiledPlan {
	private final String thePattern;
	private final List<PatternSegment> theSegments;

	CompiledPlan(String pattern, List<PatternSegment> segments) {
		thePattern = pattern;
		theSegments = segments;
	}

	/** @return The pattern this plan was compiled from */
	public String getPattern() {
		return thePattern;
	}

	/** @return The literal and token segments of the pattern, in order */
	public List<PatternSegment> getSegments() {
		return theSegments;
	}

	/** @return What this plan was compiled for */
	public abstract TokenTranslator.Mode getMode();

	@Override
	public String toString() {
		return thePattern;
	}
}
