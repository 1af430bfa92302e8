package org.qronos.parse;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.qronos.ElapsedTime;
import org.qronos.ParseAttempt;
import org.qronos.SpanUnit;
import org.qronos.TimeParseException;
import org.qronos.TimeUtils;

import com.google.common.collect.ImmutableMap;

/**
 * Parses free-form duration text into an {@link ElapsedTime}. Two grammars are understood:
 * <ul>
 * <li><b>Clock</b> text, which contains a colon:
 * <ul>
 * <li><code>[D:]H:MM:SS[.ffffff]</code>, e.g. "2:04:13:02.266" is 2 days, 4 hours, 13 minutes and 2.266 seconds</li>
 * <li><code>M:SS[.ffffff]</code>, e.g. "4:13"</li>
 * <li><code>N day[s], H:MM:SS[.ffffff]</code>, the form {@link ElapsedTime#toString()} prints</li>
 * </ul>
 * </li>
 * <li><b>Unit</b> text: a sequence of quantities, each followed by a unit, e.g. "1w 3d 2h 32m", "2 days, 5 hours and 34 minutes" or
 * "1.5hrs". Quantities may be fractional, with either '.' or ',' as the decimal point, and may be individually signed. Commas, "and"
 * and whitespace between quantities are ignored. A single bare number is a number of seconds.</li>
 * </ul>
 * A leading '-' negates the whole duration.
 * <p>
 * The unit names are:
 * <ul>
 * <li>week: w, wk, wk., wks, week, weeks</li>
 * <li>day: d, dy, dys, day, days</li>
 * <li>hour: h, hr, hr., hrs, hour, hours</li>
 * <li>minute: m, min, min., mins, minute, minutes</li>
 * <li>second: s, sec, sec., secs, second, seconds</li>
 * </ul>
 * Unit names are not case-sensitive.
 * </p>
 */
public class DurationGrammar {
	/** The name the clock grammar is reported under in parse failures */
	public static final String CLOCK_GRAMMAR = "clock";
	/** The name the unit grammar is reported under in parse failures */
	public static final String UNIT_GRAMMAR = "units";

	private static final Map<String, SpanUnit> UNIT_ALIASES;

	private static final Pattern VERBOSE_CLOCK = Pattern.compile("(\\d+)\\s*days?\\s*,\\s*(\\d+):(\\d\\d):(\\d\\d(?:\\.\\d+)?)",
		Pattern.CASE_INSENSITIVE);
	private static final Pattern LONG_CLOCK = Pattern.compile("(?:(\\d+):)?(\\d+):(\\d\\d):(\\d\\d(?:\\.\\d+)?)");
	private static final Pattern SHORT_CLOCK = Pattern.compile("(\\d+):(\\d\\d(?:\\.\\d+)?)");

	static {
		ImmutableMap.Builder<String, SpanUnit> aliases = ImmutableMap.builder();
		for (String alias : new String[] { "w", "wk", "wk.", "wks", "week", "weeks" })
			aliases.put(alias, SpanUnit.WEEK);
		for (String alias : new String[] { "d", "dy", "dys", "day", "days" })
			aliases.put(alias, SpanUnit.DAY);
		for (String alias : new String[] { "h", "hr", "hr.", "hrs", "hour", "hours" })
			aliases.put(alias, SpanUnit.HOUR);
		for (String alias : new String[] { "m", "min", "min.", "mins", "minute", "minutes" })
			aliases.put(alias, SpanUnit.MINUTE);
		for (String alias : new String[] { "s", "sec", "sec.", "secs", "second", "seconds" })
			aliases.put(alias, SpanUnit.SECOND);
		UNIT_ALIASES = aliases.build();
	}

	private DurationGrammar() {
	}

	/**
	 * @param seconds The number of seconds
	 * @return The elapsed time, rounded half-even to the microsecond
	 * @throws ArithmeticException If the seconds are not finite or too large
	 */
	public static ElapsedTime parse(double seconds) throws ArithmeticException {
		return ElapsedTime.ofSeconds(seconds);
	}

	/**
	 * @param text The text to parse
	 * @return The parsed elapsed time
	 * @throws TimeParseException If the text matches neither grammar. The exception's attempts give the reason each grammar failed.
	 */
	public static ElapsedTime parse(String text) throws TimeParseException {
		if (text == null)
			throw new TimeParseException(null, "No duration to parse", 0);
		String trimmed = text.trim();
		int c = 0;
		boolean neg = false;
		if (c < trimmed.length() && (trimmed.charAt(c) == '-' || trimmed.charAt(c) == '+')) {
			neg = trimmed.charAt(c) == '-';
			c++;
			while (c < trimmed.length() && Character.isWhitespace(trimmed.charAt(c)))
				c++;
		}
		String body = trimmed.substring(c);
		if (body.isEmpty())
			throw new TimeParseException(text, "Empty duration", c);
		List<ParseAttempt> attempts = new ArrayList<>(2);
		long micros;
		try {
			if (body.indexOf(':') >= 0)
				micros = parseClock(body);
			else
				micros = parseUnits(body);
		} catch (IllegalArgumentException e) {
			attempts.add(new ParseAttempt(body.indexOf(':') >= 0 ? CLOCK_GRAMMAR : UNIT_GRAMMAR, null, e.getMessage()));
			throw new TimeParseException(text, attempts);
		}
		return ElapsedTime.ofMicros(neg ? -micros : micros);
	}

	private static long parseClock(String text) throws IllegalArgumentException {
		Matcher m = VERBOSE_CLOCK.matcher(text);
		if (m.matches())
			return clockMicros(m.group(1), m.group(2), m.group(3), m.group(4));
		m = LONG_CLOCK.matcher(text);
		if (m.matches())
			return clockMicros(m.group(1), m.group(2), m.group(3), m.group(4));
		m = SHORT_CLOCK.matcher(text);
		if (m.matches())
			return clockMicros(null, null, m.group(1), m.group(2));
		throw new IllegalArgumentException("expected [D:]H:MM:SS[.f], M:SS[.f] or \"N days, H:MM:SS[.f]\"");
	}

	private static long clockMicros(String days, String hours, String minutes, String seconds) throws IllegalArgumentException {
		try {
			long total = 0;
			if (days != null)
				total = Math.multiplyExact(Long.parseLong(days), TimeUtils.MICROS_PER_DAY);
			if (hours != null)
				total = Math.addExact(total, Math.multiplyExact(Long.parseLong(hours), TimeUtils.MICROS_PER_HOUR));
			long min = Long.parseLong(minutes);
			if (hours != null && min > 59)
				throw new IllegalArgumentException("minutes must be in 0..59, not " + minutes);
			total = Math.addExact(total, Math.multiplyExact(min, TimeUtils.MICROS_PER_MINUTE));
			BigDecimal sec = new BigDecimal(seconds);
			if (sec.compareTo(BigDecimal.valueOf(60)) >= 0)
				throw new IllegalArgumentException("seconds must be less than 60, not " + seconds);
			return Math.addExact(total, sec.movePointRight(6).setScale(0, RoundingMode.HALF_EVEN).longValueExact());
		} catch (NumberFormatException | ArithmeticException e) {
			throw new IllegalArgumentException("duration is too large", e);
		}
	}

	private static long parseUnits(String text) throws IllegalArgumentException {
		double total = 0;
		int quantities = 0;
		StringBuilder number = new StringBuilder();
		StringBuilder unit = new StringBuilder();
		int c = 0;
		while (true) {
			c = skipSeparators(text, c);
			if (c == text.length())
				break;
			int start = c;
			double sign = 1;
			if (text.charAt(c) == '-' || text.charAt(c) == '+') {
				sign = text.charAt(c) == '-' ? -1 : 1;
				c++;
			}
			number.setLength(0);
			boolean hadDecimal = false;
			while (c < text.length()) {
				char ch = text.charAt(c);
				if (ch >= '0' && ch <= '9')
					number.append(ch);
				else if ((ch == '.' || ch == ',') && !hadDecimal && c + 1 < text.length() && Character.isDigit(text.charAt(c + 1))) {
					hadDecimal = true;
					number.append('.');
				} else
					break;
				c++;
			}
			if (number.length() == 0)
				throw new IllegalArgumentException("quantity expected at position " + start);
			while (c < text.length() && Character.isWhitespace(text.charAt(c)))
				c++;

			int unitStart = c;
			unit.setLength(0);
			while (c < text.length() && Character.isLetter(text.charAt(c))) {
				unit.append(Character.toLowerCase(text.charAt(c)));
				c++;
			}
			if (c < text.length() && text.charAt(c) == '.' && UNIT_ALIASES.containsKey(unit + ".")) {
				unit.append('.');
				c++;
			}
			double value = sign * Double.parseDouble(number.toString());
			quantities++;
			if (unit.length() == 0) {
				// A bare number is only allowed alone
				if (quantities > 1 || skipSeparators(text, c) < text.length())
					throw new IllegalArgumentException("unit expected at position " + unitStart);
				total += value * TimeUtils.MICROS_PER_SECOND;
				continue;
			}
			SpanUnit spanUnit = UNIT_ALIASES.get(unit.toString());
			if (spanUnit == null)
				throw new IllegalArgumentException("unrecognized unit \"" + unit + "\" at position " + unitStart);
			total += value * spanUnit.getMicros();
		}
		if (quantities == 0)
			throw new IllegalArgumentException("no quantities");
		double rounded = Math.rint(total);
		if (Math.abs(rounded) >= Long.MAX_VALUE)
			throw new IllegalArgumentException("duration is too large");
		return (long) rounded;
	}

	private static int skipSeparators(String text, int c) {
		while (c < text.length()) {
			char ch = text.charAt(c);
			if (Character.isWhitespace(ch) || ch == ',')
				c++;
			else if (text.regionMatches(true, c, "and", 0, 3) && (c + 3 == text.length() || !Character.isLetter(text.charAt(c + 3)))
				&& (c == 0 || !Character.isLetter(text.charAt(c - 1))))
				c += 3;
			else
				break;
		}
		return c;
	}
}
