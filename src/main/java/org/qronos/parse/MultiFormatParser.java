package org.qronos.parse;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.log4j.Logger;
import org.qronos.ParseAttempt;
import org.qronos.RangeOverflowException;
import org.qronos.TimeParseException;
import org.qronos.UnsupportedTokenException;
import org.qronos.UtcInstant;
import org.qronos.ZoneRef;
import org.qronos.format.ParsePlan;
import org.qronos.format.ParsedFields;
import org.qronos.format.TokenTranslator;
import org.qronos.locale.LocaleData;
import org.qronos.locale.LocaleDataProvider;
import org.qronos.locale.TimezoneOffsetProvider;

/**
 * Parses an instant from a value by trying each candidate of a {@link FormatSpec} in order.
 * <p>
 * Keywords are expanded to their concrete patterns and every pattern is tried until one matches. The first match wins. If none match,
 * every failed attempt is reported together in a {@link TimeParseException}, so the caller can see why each candidate was rejected.
 * </p>
 * <p>
 * Numbers are only tried against {@link FormatSpec#TIMESTAMP timestamp} candidates and against explicit patterns made only of numeric
 * fields; every other pattern is reported as a failed attempt without being matched. A pattern that cannot be compiled is likewise
 * reported as a failed attempt, and the candidates after it are still tried.
 * Fields parsed without an explicit UTC offset are interpreted in the default zone, or in UTC if there is none.
 * </p>
 */
public class MultiFormatParser {
	private static final Logger log = Logger.getLogger(MultiFormatParser.class);

	private static final String TIMESTAMP_PATTERN = "%s";
	private static final String NOT_NUMERIC = "a number can only be parsed as a timestamp or with a pattern of numeric fields";

	private static final MultiFormatParser DEFAULT = new MultiFormatParser(LocaleDataProvider.getDefault(),
		TimezoneOffsetProvider.getDefault(), null);

	private final LocaleDataProvider theLocales;
	private final TimezoneOffsetProvider theZones;
	private final Locale theLocale;

	/**
	 * @param locales The provider of month names, weekday names and AM/PM markers
	 * @param zones The provider of offsets for default zones
	 * @param locale The locale to parse names in, or null to use the default FORMAT locale at the time of each parse
	 */
	public MultiFormatParser(LocaleDataProvider locales, TimezoneOffsetProvider zones, Locale locale) {
		theLocales = locales;
		theZones = zones;
		theLocale = locale;
	}

	/** @return The parser using the default locale-data and offset providers in the default locale */
	public static MultiFormatParser getDefault() {
		return DEFAULT;
	}

	/**
	 * @param locale The locale to parse names in
	 * @return A parser like this one, but for the given locale
	 */
	public MultiFormatParser withLocale(Locale locale) {
		return new MultiFormatParser(theLocales, theZones, locale);
	}

	/** @return The locale this parser parses names in */
	public Locale getLocale() {
		return theLocale != null ? theLocale : Locale.getDefault(Locale.Category.FORMAT);
	}

	/**
	 * @param input The value to parse
	 * @param formats The candidates to try, in order
	 * @param defaultZone The zone to interpret fields in when the value has no UTC offset, or null for UTC
	 * @return The instant parsed by the first candidate that matched
	 * @throws TimeParseException If no candidate matched the value
	 * @throws IllegalArgumentException If the default zone is not recognized
	 */
	public UtcInstant parse(ParseInput input, FormatSpec formats, ZoneRef defaultZone)
		throws TimeParseException, IllegalArgumentException {
		return tryParse(input, formats, defaultZone).getOrThrow();
	}

	/**
	 * @param text The text to parse
	 * @param formats The patterns and keywords to try, in order
	 * @return The instant parsed by the first format that matched, with fields interpreted in UTC
	 * @throws TimeParseException If no format matched the text
	 */
	public UtcInstant parse(String text, String... formats) throws TimeParseException {
		return parse(ParseInput.text(text), formats.length == 0 ? FormatSpec.DEFAULT : FormatSpec.of(formats), ZoneRef.UTC);
	}

	/**
	 * Like {@link #parse(ParseInput, FormatSpec, ZoneRef)}, but reports failure in the returned outcome instead of throwing
	 *
	 * @param input The value to parse
	 * @param formats The candidates to try, in order
	 * @param defaultZone The zone to interpret fields in when the value has no UTC offset, or null for UTC
	 * @return The outcome of the parse
	 * @throws IllegalArgumentException If the default zone is not recognized
	 */
	public ParseOutcome tryParse(ParseInput input, FormatSpec formats, ZoneRef defaultZone) throws IllegalArgumentException {
		if (defaultZone != null && !defaultZone.isUtc() && !theZones.isValid(defaultZone))
			throw new IllegalArgumentException("Unrecognized timezone: " + defaultZone);
		String value = input.getText().trim();
		LocaleData data = theLocales.resolve(getLocale());
		List<ParseAttempt> attempts = new ArrayList<>();
		for (FormatCandidate candidate : formats) {
			if (candidate.getKind() == FormatCandidate.Kind.TIMESTAMP) {
				try {
					UtcInstant instant;
					if (input instanceof ParseInput.Numeric)
						instant = UtcInstant.ofEpochSecond(((ParseInput.Numeric) input).getValue());
					else
						instant = TokenTranslator.compileParser(TIMESTAMP_PATTERN).match(value, data).toInstant(ZoneRef.UTC, theZones);
					return success(value, instant, candidate, candidate.getText(), attempts);
				} catch (ParseException e) {
					fail(value, attempts, candidate, candidate.getText(), e.getMessage());
				} catch (RangeOverflowException e) {
					fail(value, attempts, candidate, candidate.getText(), e.getMessage());
				}
				continue;
			}
			for (String pattern : candidate.getPatterns()) {
				try {
					ParsePlan plan = TokenTranslator.compileParser(pattern);
					if (input.isNumeric() && (candidate.getKind() != FormatCandidate.Kind.PATTERN || !plan.isNumericCapable())) {
						fail(value, attempts, candidate, pattern, NOT_NUMERIC);
						continue;
					}
					ParsedFields fields = plan.match(value, data);
					return success(value, fields.toInstant(defaultZone, theZones), candidate, pattern, attempts);
				} catch (ParseException | RangeOverflowException | UnsupportedTokenException e) {
					fail(value, attempts, candidate, pattern, e.getMessage());
				}
			}
		}
		if (log.isDebugEnabled())
			log.debug("Could not parse \"" + value + "\" with any of " + formats);
		return ParseOutcome.failure(value, attempts);
	}

	private static ParseOutcome success(String value, UtcInstant instant, FormatCandidate candidate, String pattern,
		List<ParseAttempt> attempts) {
		if (log.isDebugEnabled())
			log.debug("Parsed \"" + value + "\" as " + instant + " with \"" + pattern + "\"");
		return ParseOutcome.success(value, instant, candidate, pattern, attempts);
	}

	private static void fail(String value, List<ParseAttempt> attempts, FormatCandidate candidate, String pattern, String reason) {
		if (log.isDebugEnabled())
			log.debug("\"" + value + "\" does not match \"" + pattern + "\": " + reason);
		attempts.add(new ParseAttempt(candidate.getText(), pattern, reason));
	}
}
