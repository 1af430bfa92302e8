package org.qronos.locale;

import java.text.DateFormatSymbols;
import java.util.Arrays;
import java.util.Calendar;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.log4j.Logger;
import org.qronos.SpanUnit;
import org.qronos.humanize.HumanizeStyle;

import com.google.common.collect.ImmutableList;

/**
 * The default {@link LocaleDataProvider}. Month names, weekday names and AM/PM markers come from the JDK's {@link DateFormatSymbols}.
 * The plural rule and the unit and relative-time phrases come from the <code>org/qronos/locale/Phrases*.properties</code> bundles.
 * <p>
 * Each locale's data is loaded on first use and cached for the life of the provider.
 * </p>
 */
public class ResourceLocaleDataProvider implements LocaleDataProvider {
	private static final Logger log = Logger.getLogger(ResourceLocaleDataProvider.class);

	/** The base name of the phrase bundles */
	public static final String PHRASE_BUNDLE = "org.qronos.locale.Phrases";

	/** The shared instance */
	public static final ResourceLocaleDataProvider INSTANCE = new ResourceLocaleDataProvider();

	private static final int[] WEEKDAY_ORDER = new int[] { Calendar.MONDAY, Calendar.TUESDAY, Calendar.WEDNESDAY, Calendar.THURSDAY,
		Calendar.FRIDAY, Calendar.SATURDAY, Calendar.SUNDAY };

	private final ConcurrentHashMap<Locale, LocaleData> theCache;

	/** Creates the provider */
	public ResourceLocaleDataProvider() {
		theCache = new ConcurrentHashMap<>();
	}

	@Override
	public LocaleData resolve(Locale locale) {
		return theCache.computeIfAbsent(locale, ResourceLocaleDataProvider::load);
	}

	private static LocaleData load(Locale locale) {
		DateFormatSymbols symbols = DateFormatSymbols.getInstance(locale);
		ResourceBundle phrases;
		try {
			phrases = ResourceBundle.getBundle(PHRASE_BUNDLE, locale,
				ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
		} catch (MissingResourceException e) {
			throw new IllegalStateException("Phrase bundle " + PHRASE_BUNDLE + " is missing from the class path", e);
		}
		if (log.isDebugEnabled())
			log.debug("Loaded locale data for " + locale + " (phrases from \"" + phrases.getLocale() + "\")");
		return new BundleLocaleData(locale, symbols, phrases);
	}

	static class BundleLocaleData implements LocaleData {
		private final Locale theLocale;
		private final List<String> theMonths;
		private final List<String> theShortMonths;
		private final List<String> theWeekdays;
		private final List<String> theShortWeekdays;
		private final List<String> theAmPm;
		private final PluralRule thePluralRule;
		private final ResourceBundle thePhrases;

		BundleLocaleData(Locale locale, DateFormatSymbols symbols, ResourceBundle phrases) {
			theLocale = locale;
			// DateFormatSymbols pads the month arrays with an empty 13th month
			theMonths = ImmutableList.copyOf(Arrays.copyOf(symbols.getMonths(), 12));
			theShortMonths = ImmutableList.copyOf(Arrays.copyOf(symbols.getShortMonths(), 12));
			theWeekdays = orderWeekdays(symbols.getWeekdays());
			theShortWeekdays = orderWeekdays(symbols.getShortWeekdays());
			theAmPm = ImmutableList.copyOf(symbols.getAmPmStrings());
			thePluralRule = PluralRule.parse(phrases.getString("plural.rule"));
			thePhrases = phrases;
		}

		private static List<String> orderWeekdays(String[] days) {
			ImmutableList.Builder<String> ordered = ImmutableList.builder();
			for (int day : WEEKDAY_ORDER)
				ordered.add(days[day]);
			return ordered.build();
		}

		@Override
		public Locale getLocale() {
			return theLocale;
		}

		@Override
		public List<String> getMonthNames(boolean abbreviated) {
			return abbreviated ? theShortMonths : theMonths;
		}

		@Override
		public List<String> getWeekdayNames(boolean abbreviated) {
			return abbreviated ? theShortWeekdays : theWeekdays;
		}

		@Override
		public List<String> getAmPmMarkers() {
			return theAmPm;
		}

		@Override
		public PluralCategory getPluralCategory(long count) {
			return thePluralRule.select(Math.abs(count));
		}

		@Override
		public String getUnitPattern(SpanUnit unit, HumanizeStyle style, PluralCategory category) {
			return getPhrase("unit." + unit.getName() + "." + style.getName(), category);
		}

		@Override
		public String getRelativePattern(SpanUnit unit, HumanizeStyle style, boolean future, PluralCategory category) {
			return getPhrase("relative." + unit.getName() + "." + style.getName() + (future ? ".future" : ".past"), category);
		}

		private String getPhrase(String prefix, PluralCategory category) {
			String key = prefix + "." + category.getKey();
			if (category != PluralCategory.OTHER && !thePhrases.containsKey(key))
				key = prefix + "." + PluralCategory.OTHER.getKey();
			try {
				return thePhrases.getString(key);
			} catch (MissingResourceException e) {
				throw new IllegalStateException("No phrase " + key + " for locale " + theLocale, e);
			}
		}

		@Override
		public String toString() {
			return "Locale data for " + theLocale;
		}
	}
}
