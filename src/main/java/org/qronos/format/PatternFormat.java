package org.qronos.format;

import java.text.ParseException;
import java.util.Locale;

import org.qronos.RangeOverflowException;
import org.qronos.UnsupportedTokenException;
import org.qronos.UtcInstant;
import org.qronos.ZoneRef;
import org.qronos.locale.LocaleData;
import org.qronos.locale.LocaleDataProvider;
import org.qronos.locale.TimezoneOffsetProvider;

/** A {@link Format} that prints and parses instants with a single directive or letter pattern in a zone and locale */
public class PatternFormat implements Format<UtcInstant> {
	private final String thePattern;
	private final ZoneRef theZone;
	private final Locale theLocale;
	private final LocaleDataProvider theLocales;
	private final TimezoneOffsetProvider theZones;

	/**
	 * @param pattern The pattern
	 * @param zone The zone to print fields in and to interpret parsed fields in when the text has no UTC offset
	 * @param locale The locale for month and weekday names and AM/PM markers
	 * @param locales The locale data provider
	 * @param zones The timezone offset provider
	 * @throws UnsupportedTokenException If the pattern contains an unrecognized token
	 * @throws IllegalArgumentException If the zone is not recognized
	 */
	public PatternFormat(String pattern, ZoneRef zone, Locale locale, LocaleDataProvider locales, TimezoneOffsetProvider zones)
		throws UnsupportedTokenException, IllegalArgumentException {
		TokenTranslator.tokenize(pattern);
		if (zone != null && !zone.isUtc() && !zones.isValid(zone))
			throw new IllegalArgumentException("Unrecognized timezone: " + zone);
		thePattern = pattern;
		theZone = zone == null ? ZoneRef.UTC : zone;
		theLocale = locale == null ? Locale.getDefault(Locale.Category.FORMAT) : locale;
		theLocales = locales;
		theZones = zones;
	}

	/** @return The pattern */
	public String getPattern() {
		return thePattern;
	}

	/** @return The zone instants are printed and parsed in */
	public ZoneRef getZone() {
		return theZone;
	}

	/** @return The locale for names */
	public Locale getLocale() {
		return theLocale;
	}

	/**
	 * @param zone The zone to print and parse in
	 * @return A format like this one, but in the given zone
	 */
	public PatternFormat withZone(ZoneRef zone) {
		return new PatternFormat(thePattern, zone, theLocale, theLocales, theZones);
	}

	/**
	 * @param locale The locale for names
	 * @return A format like this one, but in the given locale
	 */
	public PatternFormat withLocale(Locale locale) {
		return new PatternFormat(thePattern, theZone, locale, theLocales, theZones);
	}

	@Override
	public void append(StringBuilder text, UtcInstant value) {
		if (value == null)
			return;
		int offset = theZone.isUtc() ? 0 : theZones.getOffsetSeconds(theZone, value.getEpochMicros());
		TokenTranslator.compileRenderer(thePattern).append(text, value, offset, getData());
	}

	@Override
	public UtcInstant parse(CharSequence text) throws ParseException {
		ParsedFields fields = TokenTranslator.compileParser(thePattern).match(text, getData());
		try {
			return fields.toInstant(theZone, theZones);
		} catch (RangeOverflowException e) {
			throw new ParseException(e.getMessage(), 0);
		}
	}

	private LocaleData getData() {
		return theLocales.resolve(theLocale);
	}

	@Override
	public String toString() {
		return thePattern + " (" + theZone + ", " + theLocale + ")";
	}
}
