package org.qronos.format;

import java.text.ParseException;
import java.util.Locale;

import org.qronos.ElapsedTime;
import org.qronos.TimeUtils;
import org.qronos.UtcInstant;
import org.qronos.ZoneRef;
import org.qronos.locale.LocaleDataProvider;
import org.qronos.locale.TimezoneOffsetProvider;
import org.qronos.parse.DurationGrammar;
import org.qronos.parse.FormatSpec;
import org.qronos.parse.MultiFormatParser;
import org.qronos.parse.ParseInput;

/**
 * Knows how to parse a type of value from text and to print a type of value into text
 *
 * @param <T> The type of object that this object can parse and format
 */
public interface Format<T> {
	/**
	 * Appends a value into a StringBuilder in this format
	 *
	 * @param text The text to append the value into
	 * @param value The value to append to the text
	 */
	void append(StringBuilder text, T value);

	/**
	 * Formats a value to a String
	 *
	 * @param value The value to format
	 * @return The formatted value
	 */
	default String format(T value) {
		StringBuilder s = new StringBuilder();
		append(s, value);
		return s.toString();
	}

	/**
	 * @param text The text to parse
	 * @return The parsed value
	 * @throws ParseException If a value of this type was not recognized in the text
	 */
	T parse(CharSequence text) throws ParseException;

	/** Formats instants as ISO-8601 with a UTC offset, e.g. "2016-07-25T19:33:18+00:00", and parses any ISO-8601 form */
	public static final Format<UtcInstant> ISO_8601 = new Format<UtcInstant>() {
		@Override
		public void append(StringBuilder text, UtcInstant value) {
			if (value != null)
				value.appendIso(text);
		}

		@Override
		public UtcInstant parse(CharSequence text) throws ParseException {
			return MultiFormatParser.getDefault().parse(ParseInput.text(text.toString()), FormatSpec.of(FormatSpec.ISO_8601), ZoneRef.UTC);
		}

		@Override
		public String toString() {
			return "ISO_8601";
		}
	};

	/** Formats instants as POSIX seconds, e.g. "1469475198.5", and parses integer or fractional POSIX seconds */
	public static final Format<UtcInstant> TIMESTAMP = new Format<UtcInstant>() {
		@Override
		public void append(StringBuilder text, UtcInstant value) {
			if (value == null)
				return;
			long micros = value.getEpochMicros();
			if (micros < 0) {
				text.append('-');
				micros = -micros;
			}
			text.append(micros / TimeUtils.MICROS_PER_SECOND);
			long fraction = micros % TimeUtils.MICROS_PER_SECOND;
			if (fraction != 0) {
				int start = text.length();
				TimeUtils.printInt(fraction, 6, text.append('.'));
				while (text.charAt(text.length() - 1) == '0' && text.length() > start + 2)
					text.setLength(text.length() - 1);
			}
		}

		@Override
		public UtcInstant parse(CharSequence text) throws ParseException {
			return MultiFormatParser.getDefault().parse(ParseInput.text(text.toString()), FormatSpec.of(FormatSpec.TIMESTAMP), ZoneRef.UTC);
		}

		@Override
		public String toString() {
			return "TIMESTAMP";
		}
	};

	/** Formats elapsed times in clock form, e.g. "10 days, 2:32:00", and parses any duration the {@link DurationGrammar} accepts */
	public static final Format<ElapsedTime> DURATION = new Format<ElapsedTime>() {
		@Override
		public void append(StringBuilder text, ElapsedTime value) {
			if (value != null)
				text.append(value);
		}

		@Override
		public ElapsedTime parse(CharSequence text) throws ParseException {
			return DurationGrammar.parse(text.toString());
		}

		@Override
		public String toString() {
			return "DURATION";
		}
	};

	/**
	 * @param pattern The directive or letter pattern, see {@link TokenTranslator}
	 * @param zone The zone to print fields in and to interpret parsed fields in when the text has no offset
	 * @param locale The locale for month and weekday names and AM/PM markers
	 * @return A format that prints and parses instants with the given pattern
	 */
	public static PatternFormat pattern(String pattern, ZoneRef zone, Locale locale) {
		return new PatternFormat(pattern, zone, locale, LocaleDataProvider.getDefault(), TimezoneOffsetProvider.getDefault());
	}
}
