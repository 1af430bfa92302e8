package org.qronos;

import org.qronos.parse.DurationGrammar;
import org.qronos.parse.FormatSpec;
import org.qronos.parse.MultiFormatParser;
import org.qronos.parse.ParseInput;
import org.qronos.span.SpanBoundary;
import org.qronos.span.SpanEngine;

/** Shortcuts to the most common operations of the library */
public class Qronos {
	private Qronos() {
	}

	/** @return The current instant */
	public static UtcInstant now() {
		return UtcInstant.now();
	}

	/**
	 * @param text The text to parse, ISO-8601 or a POSIX timestamp
	 * @return The parsed instant
	 * @throws TimeParseException If the text could not be parsed
	 */
	public static UtcInstant parse(String text) throws TimeParseException {
		return UtcInstant.parse(text);
	}

	/**
	 * @param text The text to parse
	 * @param defaultZone The zone for text without a UTC offset, e.g. "America/Denver" or "local"
	 * @param formats The patterns and keywords to try, in order. If none are given, ISO-8601 and timestamps are tried.
	 * @return The parsed instant
	 * @throws TimeParseException If the text could not be parsed
	 * @throws IllegalArgumentException If the zone is not recognized
	 */
	public static UtcInstant parse(String text, String defaultZone, String... formats) throws TimeParseException, IllegalArgumentException {
		FormatSpec spec = formats.length == 0 ? FormatSpec.DEFAULT : FormatSpec.of(formats);
		return MultiFormatParser.getDefault().parse(ParseInput.text(text), spec, ZoneRef.of(defaultZone));
	}

	/**
	 * @param timestamp The POSIX timestamp
	 * @return The instant
	 * @throws RangeOverflowException If the timestamp is outside the supported years
	 */
	public static UtcInstant parse(double timestamp) throws RangeOverflowException {
		return UtcInstant.ofEpochSecond(timestamp);
	}

	/**
	 * @param text The duration text
	 * @return The parsed duration
	 * @throws TimeParseException If the text could not be parsed
	 * @see DurationGrammar
	 */
	public static ElapsedTime parseDuration(String text) throws TimeParseException {
		return DurationGrammar.parse(text);
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param start The first instant
	 * @param end The instant to stop before
	 * @return One instant per unit from <code>start</code> toward <code>end</code>
	 * @throws InvalidUnitException If the unit name is not recognized
	 */
	public static Iterable<UtcInstant> range(String unit, UtcInstant start, UtcInstant end) throws InvalidUnitException {
		return SpanEngine.range(unit, start, end, 1);
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param start The instant in the first span
	 * @param end The instant to stop before
	 * @return One span per unit from the unit containing <code>start</code> toward <code>end</code>
	 * @throws InvalidUnitException If the unit name is not recognized
	 */
	public static Iterable<SpanBoundary> spanRange(String unit, UtcInstant start, UtcInstant end) throws InvalidUnitException {
		return SpanEngine.spanRange(unit, start, end, 1);
	}
}
