package org.qronos.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.qronos.TimeUtils;
import org.qronos.UnsupportedTokenException;
import org.qronos.locale.LocaleData;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * A {@link CompiledPlan} that extracts date fields from text. The whole text must match the pattern; each numeric field is checked
 * against its valid range.
 * <p>
 * Numeric fields accept fewer digits than their formatted width (e.g. <code>MM</code> and <code>%m</code> both accept "3" and "03"),
 * except for the year fields, which require exactly 4 or 2 digits. Fractions accept 1 to 6 digits regardless of width. Names and AM/PM
 * markers are matched without regard to case. Fields not in the pattern default to 1900-01-01T00:00:00.
 * </p>
 */
public class ParsePlan extends CompiledPlan {
	/** The year given to parsed fields when the pattern has no year */
	public static final int DEFAULT_YEAR = 1900;
	/** Two-digit years at or above this are in the 1900s, those below are in the 2000s */
	public static final int TWO_DIGIT_YEAR_PIVOT = 69;
	/** The number of locales whose regular expressions each plan keeps */
	public static final int MAX_CACHED_LOCALES = 8;

	private static final String OFFSET_REGEX = "(Z|z|[+-]\\d{2}(?::?\\d{2}(?::?\\d{2})?)?)";
	private static final String TIMESTAMP_REGEX = "([+-]?\\d+(?:\\.\\d+)?)";

	private final List<PatternSegment> theTokens;
	private final boolean isNumericCapable;
	private final Cache<Locale, Pattern> theRegexes;

	ParsePlan(String pattern, List<PatternSegment> segments) throws UnsupportedTokenException {
		super(pattern, segments);
		theTokens = new ArrayList<>();
		EnumSet<TokenKind> fields = EnumSet.noneOf(TokenKind.class);
		boolean numeric = true;
		for (PatternSegment segment : segments) {
			if (segment.isLiteral()) {
				if (!segment.getLiteral().equals("."))
					numeric = false;
				continue;
			}
			if (segment.isFormatOnly())
				throw new UnsupportedTokenException(pattern, segment.getSource(), "Token cannot be used for parsing");
			if (!fields.add(segment.getKind().getField()))
				throw new UnsupportedTokenException(pattern, segment.getSource(), "Redefinition of a field already in the pattern");
			if (!segment.getKind().isNumeric())
				numeric = false;
			theTokens.add(segment);
		}
		isNumericCapable = numeric;
		theRegexes = CacheBuilder.newBuilder().maximumSize(MAX_CACHED_LOCALES).build();
	}

	@Override
	public TokenTranslator.Mode getMode() {
		return TokenTranslator.Mode.PARSE;
	}

	/**
	 * @return Whether this plan consists only of numeric fields (with at most a decimal point between them), so that a number's text may
	 *         be parsed by it
	 */
	public boolean isNumericCapable() {
		return isNumericCapable;
	}

	/**
	 * @param locale The locale to get the regular expression for
	 * @param data The locale data for month names, weekday names and AM/PM markers
	 * @return The regular expression this plan uses to match text in the locale
	 */
	public Pattern getRegex(Locale locale, LocaleData data) {
		Pattern regex = theRegexes.getIfPresent(locale);
		if (regex == null) {
			regex = buildRegex(data);
			theRegexes.put(locale, regex);
		}
		return regex;
	}

	private Pattern buildRegex(LocaleData data) {
		StringBuilder regex = new StringBuilder();
		for (PatternSegment segment : getSegments()) {
			if (segment.isLiteral())
				appendLiteral(regex, segment.getLiteral());
			else
				appendToken(regex, segment, data);
		}
		return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
	}

	private static void appendLiteral(StringBuilder regex, String literal) {
		int c = 0;
		while (c < literal.length()) {
			int start = c;
			if (Character.isWhitespace(literal.charAt(c))) {
				while (c < literal.length() && Character.isWhitespace(literal.charAt(c)))
					c++;
				regex.append("\\s+");
			} else {
				while (c < literal.length() && !Character.isWhitespace(literal.charAt(c)))
					c++;
				regex.append(Pattern.quote(literal.substring(start, c)));
			}
		}
	}

	private static void appendToken(StringBuilder regex, PatternSegment token, LocaleData data) {
		switch (token.getKind()) {
		case YEAR:
			regex.append("(\\d{4})");
			break;
		case YEAR_OF_CENTURY:
			regex.append("(\\d{2})");
			break;
		case MONTH_NAME:
			appendNames(regex, data.getMonthNames(false));
			break;
		case MONTH_ABBREVIATION:
			appendNames(regex, data.getMonthNames(true));
			break;
		case WEEKDAY_NAME:
			appendNames(regex, data.getWeekdayNames(false));
			break;
		case WEEKDAY_ABBREVIATION:
			appendNames(regex, data.getWeekdayNames(true));
			break;
		case AM_PM:
			appendNames(regex, data.getAmPmMarkers());
			break;
		case DAY_OF_YEAR:
			regex.append("(\\d{1,3})");
			break;
		case WEEKDAY_ISO:
			regex.append("(0?[1-7])");
			break;
		case WEEKDAY_SUNDAY_ZERO:
			regex.append("([0-6])");
			break;
		case FRACTION:
			regex.append("(\\d{1,6})");
			break;
		case OFFSET:
		case OFFSET_COLON:
			regex.append(OFFSET_REGEX);
			break;
		case TIMESTAMP:
			regex.append(TIMESTAMP_REGEX);
			break;
		default:
			regex.append("(\\d{1,2})");
			break;
		}
	}

	private static void appendNames(StringBuilder regex, List<String> names) {
		List<String> sorted = new ArrayList<>(names);
		// Longest first, so that e.g. "June" is not matched as "Jun" followed by unconverted text
		sorted.sort(Comparator.comparingInt(String::length).reversed());
		regex.append('(');
		boolean first = true;
		for (String name : sorted) {
			if (name.isEmpty())
				continue;
			if (!first)
				regex.append('|');
			first = false;
			regex.append(Pattern.quote(name));
		}
		regex.append(')');
	}

	/**
	 * @param text The text to parse
	 * @param data The locale data for month names, weekday names and AM/PM markers
	 * @return The fields parsed from the text
	 * @throws ParseException If the text does not match this pattern or a field is out of range
	 */
	public ParsedFields match(CharSequence text, LocaleData data) throws ParseException {
		Matcher matcher = getRegex(data.getLocale(), data).matcher(text);
		if (!matcher.matches()) {
			if (matcher.lookingAt())
				throw new ParseException("unconverted data remains: " + text.subSequence(matcher.end(), text.length()), matcher.end());
			throw new ParseException("time data \"" + text + "\" does not match format \"" + getPattern() + "\"", 0);
		}

		int year = DEFAULT_YEAR, month = 1, day = 1, hour = 0, minute = 0, second = 0, micro = 0;
		int dayOfYear = -1, hour12 = -1;
		Boolean pm = null;
		Integer offset = null;
		Long timestamp = null;
		for (int i = 0; i < theTokens.size(); i++) {
			PatternSegment token = theTokens.get(i);
			String value = matcher.group(i + 1);
			int position = matcher.start(i + 1);
			switch (token.getKind()) {
			case YEAR:
				year = Integer.parseInt(value);
				if (year < TimeUtils.MIN_YEAR)
					throw new ParseException("year " + year + " is out of range", position);
				break;
			case YEAR_OF_CENTURY:
				year = Integer.parseInt(value);
				year += year >= TWO_DIGIT_YEAR_PIVOT ? 1900 : 2000;
				break;
			case MONTH_NAME:
				month = indexOf(data.getMonthNames(false), value) + 1;
				break;
			case MONTH_ABBREVIATION:
				month = indexOf(data.getMonthNames(true), value) + 1;
				break;
			case MONTH_NUMBER:
				month = checkRange("month", value, 1, 12, position);
				break;
			case DAY_OF_MONTH:
				day = checkRange("day", value, 1, 31, position);
				break;
			case DAY_OF_YEAR:
				dayOfYear = checkRange("day of year", value, 1, 366, position);
				break;
			case WEEKDAY_NAME:
			case WEEKDAY_ABBREVIATION:
			case WEEKDAY_ISO:
			case WEEKDAY_SUNDAY_ZERO:
				// The weekday is implied by the date, so it is matched but not used
				break;
			case HOUR_OF_DAY:
				hour = checkRange("hour", value, 0, 23, position);
				break;
			case HOUR_OF_AM_PM:
				hour12 = checkRange("hour", value, 1, 12, position);
				break;
			case AM_PM:
				pm = indexOf(data.getAmPmMarkers(), value) == 1;
				break;
			case MINUTE:
				minute = checkRange("minute", value, 0, 59, position);
				break;
			case SECOND:
				second = checkRange("second", value, 0, 59, position);
				break;
			case FRACTION:
				micro = Integer.parseInt(value);
				for (int d = value.length(); d < 6; d++)
					micro *= 10;
				break;
			case OFFSET:
			case OFFSET_COLON:
				offset = parseOffset(value, position);
				break;
			case TIMESTAMP:
				try {
					timestamp = new BigDecimal(value).movePointRight(6).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
				} catch (ArithmeticException e) {
					throw new ParseException("timestamp " + value + " is out of range", position);
				}
				break;
			}
		}
		if (timestamp != null)
			return new ParsedFields(0, 0, 0, 0, 0, 0, 0, null, timestamp);
		if (hour12 >= 0) {
			hour = hour12 % 12;
			if (Boolean.TRUE.equals(pm))
				hour += 12;
		}
		if (dayOfYear > 0) {
			if (dayOfYear > TimeUtils.getDaysInYear(year))
				throw new ParseException("day of year " + dayOfYear + " is out of range for " + year, 0);
			long[] date = TimeUtils.fromEpochDay(TimeUtils.toEpochDay(year, 1, 1) + dayOfYear - 1);
			month = (int) date[1];
			day = (int) date[2];
		} else if (day > TimeUtils.getDaysInMonth(year, month))
			throw new ParseException("day is out of range for month", 0);
		return new ParsedFields(year, month, day, hour, minute, second, micro, offset, null);
	}

	private static int checkRange(String field, String value, int min, int max, int position) throws ParseException {
		int v = Integer.parseInt(value);
		if (v < min || v > max)
			throw new ParseException(field + " must be in " + min + ".." + max + ", not " + value, position);
		return v;
	}

	private static int indexOf(List<String> names, String value) {
		for (int i = 0; i < names.size(); i++) {
			if (names.get(i).equalsIgnoreCase(value))
				return i;
		}
		throw new IllegalStateException("Matched name " + value + " is not in " + names);
	}

	private static int parseOffset(String value, int position) throws ParseException {
		if (value.equalsIgnoreCase("Z"))
			return 0;
		String digits = value.substring(1).replace(":", "");
		int hours = Integer.parseInt(digits.substring(0, 2));
		int minutes = digits.length() > 2 ? Integer.parseInt(digits.substring(2, 4)) : 0;
		int seconds = digits.length() > 4 ? Integer.parseInt(digits.substring(4, 6)) : 0;
		if (minutes > 59 || seconds > 59)
			throw new ParseException("Inconsistent UTC offset: " + value, position);
		int offset = hours * 3600 + minutes * 60 + seconds;
		if (offset >= TimeUtils.SECONDS_PER_DAY)
			throw new ParseException("Timezone offset must be strictly between -24/+24 hours, not " + value, position);
		return value.charAt(0) == '-' ? -offset : offset;
	}
}
