package org.qronos.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.qronos.UnsupportedTokenException;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * Translates date patterns into {@link ParsePlan parse plans} and {@link RenderPlan render plans}.
 * <p>
 * Two grammars are understood. A pattern containing a <code>%</code> is a <b>directive pattern</b>: each <code>%</code> introduces a
 * one- or two-character directive as in strftime/strptime (e.g. <code>%Y-%m-%d</code>, <code>%-d</code>, <code>%:z</code>) and every
 * other character is literal. Any other pattern is a <b>letter pattern</b> in the style of Unicode date field symbols: a run of one of
 * the letters <code>yYMDdEeHhmsSazZ</code> is a token whose length selects its variant (e.g. <code>MMM</code> is the abbreviated month
 * name, <code>MM</code> the padded month number), text between single quotes is literal and <code>''</code> is a literal apostrophe.
 * Because the grammar is chosen for the whole pattern, letters are never ambiguous between the two.
 * </p>
 * <p>
 * The most recently used compiled plans are cached, so repeated compilation of the same pattern is cheap.
 * </p>
 */
public class TokenTranslator {
	/** What a pattern is compiled for */
	public enum Mode {
		/** Compiles to a {@link ParsePlan} */
		PARSE,
		/** Compiles to a {@link RenderPlan} */
		FORMAT
	}

	/** The letters that form tokens in a letter pattern */
	public static final String PATTERN_LETTERS = "yYMDdEeHhmsSazZ";

	/** The number of compiled plans cached for each mode */
	public static final int MAX_CACHED_PLANS = 256;

	private static final Map<Mode, Cache<String, CompiledPlan>> PLANS;

	static {
		PLANS = new EnumMap<>(Mode.class);
		for (Mode mode : Mode.values())
			PLANS.put(mode, CacheBuilder.newBuilder().maximumSize(MAX_CACHED_PLANS).<String, CompiledPlan> build());
	}

	private TokenTranslator() {
	}

	/**
	 * @param pattern The pattern to compile
	 * @param mode Whether to compile for parsing or formatting
	 * @return The compiled plan: a {@link ParsePlan} for {@link Mode#PARSE} or a {@link RenderPlan} for {@link Mode#FORMAT}
	 * @throws UnsupportedTokenException If the pattern contains a token that has no mapping in the given mode
	 */
	public static CompiledPlan compile(String pattern, Mode mode) throws UnsupportedTokenException {
		Cache<String, CompiledPlan> cache = PLANS.get(mode);
		CompiledPlan plan = cache.getIfPresent(pattern);
		if (plan == null) {
			List<PatternSegment> segments = tokenize(pattern);
			switch (mode) {
			case PARSE:
				plan = new ParsePlan(pattern, segments);
				break;
			case FORMAT:
				plan = new RenderPlan(pattern, segments);
				break;
			default:
				throw new IllegalStateException("Unrecognized mode: " + mode);
			}
			CompiledPlan previous = cache.asMap().putIfAbsent(pattern, plan);
			if (previous != null)
				plan = previous;
		}
		return plan;
	}

	static long getCachedPlanCount(Mode mode) {
		return PLANS.get(mode).size();
	}

	/**
	 * @param pattern The pattern to compile
	 * @return The plan to parse text with the pattern
	 * @throws UnsupportedTokenException If the pattern contains a token that cannot be parsed
	 */
	public static ParsePlan compileParser(String pattern) throws UnsupportedTokenException {
		return (ParsePlan) compile(pattern, Mode.PARSE);
	}

	/**
	 * @param pattern The pattern to compile
	 * @return The plan to format instants with the pattern
	 * @throws UnsupportedTokenException If the pattern contains a token that cannot be formatted
	 */
	public static RenderPlan compileRenderer(String pattern) throws UnsupportedTokenException {
		return (RenderPlan) compile(pattern, Mode.FORMAT);
	}

	/**
	 * Splits a pattern into literal and token segments, without regard to whether it will be used for parsing or formatting
	 *
	 * @param pattern The pattern to split
	 * @return The segments of the pattern, with adjacent literals merged
	 * @throws UnsupportedTokenException If the pattern contains an unrecognized token
	 */
	public static List<PatternSegment> tokenize(String pattern) throws UnsupportedTokenException {
		if (pattern == null || pattern.isEmpty())
			throw new UnsupportedTokenException(String.valueOf(pattern), "", "Empty pattern");
		List<PatternSegment> segments = new ArrayList<>();
		StringBuilder literal = new StringBuilder();
		if (pattern.indexOf('%') >= 0)
			tokenizeDirectives(pattern, segments, literal);
		else
			tokenizeLetters(pattern, segments, literal);
		flushLiteral(segments, literal);
		return Collections.unmodifiableList(segments);
	}

	private static void flushLiteral(List<PatternSegment> segments, StringBuilder literal) {
		if (literal.length() > 0) {
			segments.add(PatternSegment.literal(literal.toString()));
			literal.setLength(0);
		}
	}

	private static void tokenizeDirectives(String pattern, List<PatternSegment> segments, StringBuilder literal) {
		int c = 0;
		while (c < pattern.length()) {
			char ch = pattern.charAt(c);
			if (ch != '%') {
				literal.append(ch);
				c++;
				continue;
			}
			if (c + 1 >= pattern.length())
				throw new UnsupportedTokenException(pattern, "%", "Stray % at the end of the pattern");
			char d = pattern.charAt(c + 1);
			if (d == '%') {
				literal.append('%');
				c += 2;
				continue;
			}
			PatternSegment token;
			if (d == '-' || d == ':') {
				if (c + 2 >= pattern.length())
					throw new UnsupportedTokenException(pattern, pattern.substring(c), "Incomplete directive");
				String source = pattern.substring(c, c + 3);
				token = twoCharDirective(pattern, source, d, pattern.charAt(c + 2));
				c += 3;
			} else {
				String source = pattern.substring(c, c + 2);
				token = directive(pattern, source, d);
				c += 2;
			}
			flushLiteral(segments, literal);
			segments.add(token);
		}
	}

	private static PatternSegment directive(String pattern, String source, char d) {
		switch (d) {
		case 'Y':
			return PatternSegment.token(source, TokenKind.YEAR, 4, false);
		case 'y':
			return PatternSegment.token(source, TokenKind.YEAR_OF_CENTURY, 2, false);
		case 'B':
			return PatternSegment.token(source, TokenKind.MONTH_NAME, 0, false);
		case 'b':
		case 'h':
			return PatternSegment.token(source, TokenKind.MONTH_ABBREVIATION, 0, false);
		case 'm':
			return PatternSegment.token(source, TokenKind.MONTH_NUMBER, 2, false);
		case 'd':
			return PatternSegment.token(source, TokenKind.DAY_OF_MONTH, 2, false);
		case 'j':
			return PatternSegment.token(source, TokenKind.DAY_OF_YEAR, 3, false);
		case 'A':
			return PatternSegment.token(source, TokenKind.WEEKDAY_NAME, 0, false);
		case 'a':
			return PatternSegment.token(source, TokenKind.WEEKDAY_ABBREVIATION, 0, false);
		case 'w':
			return PatternSegment.token(source, TokenKind.WEEKDAY_SUNDAY_ZERO, 1, false);
		case 'u':
			return PatternSegment.token(source, TokenKind.WEEKDAY_ISO, 1, false);
		case 'H':
			return PatternSegment.token(source, TokenKind.HOUR_OF_DAY, 2, false);
		case 'I':
			return PatternSegment.token(source, TokenKind.HOUR_OF_AM_PM, 2, false);
		case 'p':
			return PatternSegment.token(source, TokenKind.AM_PM, 0, false);
		case 'M':
			return PatternSegment.token(source, TokenKind.MINUTE, 2, false);
		case 'S':
			return PatternSegment.token(source, TokenKind.SECOND, 2, false);
		case 'f':
			return PatternSegment.token(source, TokenKind.FRACTION, 6, false);
		case 'z':
			return PatternSegment.token(source, TokenKind.OFFSET, 0, false);
		case 's':
			return PatternSegment.token(source, TokenKind.TIMESTAMP, 0, false);
		default:
			throw new UnsupportedTokenException(pattern, source, "Unrecognized directive");
		}
	}

	private static PatternSegment twoCharDirective(String pattern, String source, char flag, char d) {
		if (flag == ':') {
			if (d == 'z')
				return PatternSegment.token(source, TokenKind.OFFSET_COLON, 0, false);
			throw new UnsupportedTokenException(pattern, source, "Unrecognized directive");
		}
		// The '-' flag suppresses padding, which only has meaning when formatting
		TokenKind kind;
		switch (d) {
		case 'm':
			kind = TokenKind.MONTH_NUMBER;
			break;
		case 'd':
			kind = TokenKind.DAY_OF_MONTH;
			break;
		case 'j':
			kind = TokenKind.DAY_OF_YEAR;
			break;
		case 'H':
			kind = TokenKind.HOUR_OF_DAY;
			break;
		case 'I':
			kind = TokenKind.HOUR_OF_AM_PM;
			break;
		case 'M':
			kind = TokenKind.MINUTE;
			break;
		case 'S':
			kind = TokenKind.SECOND;
			break;
		default:
			throw new UnsupportedTokenException(pattern, source, "Unrecognized directive");
		}
		return PatternSegment.token(source, kind, 1, true);
	}

	private static void tokenizeLetters(String pattern, List<PatternSegment> segments, StringBuilder literal) {
		int c = 0;
		while (c < pattern.length()) {
			char ch = pattern.charAt(c);
			if (ch == '\'') {
				if (c + 1 < pattern.length() && pattern.charAt(c + 1) == '\'') {
					literal.append('\'');
					c += 2;
					continue;
				}
				int end = c + 1;
				while (true) {
					if (end == pattern.length())
						throw new UnsupportedTokenException(pattern, pattern.substring(c), "Unterminated quote");
					else if (pattern.charAt(end) != '\'')
						literal.append(pattern.charAt(end++));
					else if (end + 1 < pattern.length() && pattern.charAt(end + 1) == '\'') {
						literal.append('\'');
						end += 2;
					} else
						break;
				}
				c = end + 1;
				continue;
			} else if (PATTERN_LETTERS.indexOf(ch) < 0) {
				literal.append(ch);
				c++;
				continue;
			}
			int end = c + 1;
			while (end < pattern.length() && pattern.charAt(end) == ch)
				end++;
			flushLiteral(segments, literal);
			segments.add(letterToken(pattern, pattern.substring(c, end), ch, end - c));
			c = end;
		}
	}

	private static PatternSegment letterToken(String pattern, String source, char letter, int length) {
		switch (letter) {
		case 'y':
		case 'Y':
			if (length == 4)
				return PatternSegment.token(source, TokenKind.YEAR, 4, false);
			else if (length == 2)
				return PatternSegment.token(source, TokenKind.YEAR_OF_CENTURY, 2, false);
			break;
		case 'M':
			if (length == 4)
				return PatternSegment.token(source, TokenKind.MONTH_NAME, 0, false);
			else if (length == 3)
				return PatternSegment.token(source, TokenKind.MONTH_ABBREVIATION, 0, false);
			else if (length <= 2)
				return PatternSegment.token(source, TokenKind.MONTH_NUMBER, length, false);
			break;
		case 'D':
			if (length <= 3)
				return PatternSegment.token(source, TokenKind.DAY_OF_YEAR, length, false);
			break;
		case 'd':
			if (length <= 2)
				return PatternSegment.token(source, TokenKind.DAY_OF_MONTH, length, false);
			break;
		case 'E':
			if (length == 4)
				return PatternSegment.token(source, TokenKind.WEEKDAY_NAME, 0, false);
			else if (length <= 3)
				return PatternSegment.token(source, TokenKind.WEEKDAY_ABBREVIATION, 0, false);
			break;
		case 'e':
			if (length == 4)
				return PatternSegment.token(source, TokenKind.WEEKDAY_NAME, 0, false);
			else if (length == 3)
				return PatternSegment.token(source, TokenKind.WEEKDAY_ABBREVIATION, 0, false);
			else if (length <= 2)
				return PatternSegment.token(source, TokenKind.WEEKDAY_ISO, length, false);
			break;
		case 'H':
			if (length <= 2)
				return PatternSegment.token(source, TokenKind.HOUR_OF_DAY, length, false);
			break;
		case 'h':
			if (length <= 2)
				return PatternSegment.token(source, TokenKind.HOUR_OF_AM_PM, length, false);
			break;
		case 'm':
			if (length <= 2)
				return PatternSegment.token(source, TokenKind.MINUTE, length, false);
			break;
		case 's':
			if (length <= 2)
				return PatternSegment.token(source, TokenKind.SECOND, length, false);
			break;
		case 'S':
			if (length <= 6)
				return PatternSegment.token(source, TokenKind.FRACTION, length, false);
			break;
		case 'a':
			if (length == 1)
				return PatternSegment.token(source, TokenKind.AM_PM, 0, false);
			break;
		case 'z':
			if (length <= 3)
				return PatternSegment.token(source, TokenKind.OFFSET, 0, false);
			break;
		case 'Z':
			if (length <= 3)
				return PatternSegment.token(source, TokenKind.OFFSET, 0, false);
			else if (length == 5)
				return PatternSegment.token(source, TokenKind.OFFSET_COLON, 0, false);
			break;
		default:
			break;
		}
		throw new UnsupportedTokenException(pattern, source, "Unsupported pattern token");
	}
}
