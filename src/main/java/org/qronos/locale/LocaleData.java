package org.qronos.locale;

import java.util.List;
import java.util.Locale;

import org.qronos.SpanUnit;
import org.qronos.humanize.HumanizeStyle;

/** Read-only calendar names and phrase templates for one locale */
public interface LocaleData {
	/** @return The locale this data is for */
	Locale getLocale();

	/**
	 * @param abbreviated Whether to get the abbreviated names
	 * @return The twelve month names, January first
	 */
	List<String> getMonthNames(boolean abbreviated);

	/**
	 * @param abbreviated Whether to get the abbreviated names
	 * @return The seven weekday names, Monday first
	 */
	List<String> getWeekdayNames(boolean abbreviated);

	/** @return The ante-meridiem and post-meridiem markers, in that order */
	List<String> getAmPmMarkers();

	/**
	 * @param count The count to categorize
	 * @return The plural category this locale uses for the count
	 */
	PluralCategory getPluralCategory(long count);

	/**
	 * @param unit The unit to get the pattern for
	 * @param style The width of the unit name
	 * @param category The plural category of the count
	 * @return The pattern, with <code>{0}</code> where the count goes, e.g. "{0} hours"
	 */
	String getUnitPattern(SpanUnit unit, HumanizeStyle style, PluralCategory category);

	/**
	 * @param unit The unit to get the pattern for
	 * @param style The width of the unit name
	 * @param future Whether the pattern is for time in the future (e.g. "in {0} hours") or the past (e.g. "{0} hours ago")
	 * @param category The plural category of the count
	 * @return The pattern, with <code>{0}</code> where the count goes
	 */
	String getRelativePattern(SpanUnit unit, HumanizeStyle style, boolean future, PluralCategory category);
}
