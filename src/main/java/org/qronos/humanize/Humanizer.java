package org.qronos.humanize;

import java.util.List;

import org.qronos.ElapsedTime;
import org.qronos.SpanUnit;
import org.qronos.TimeUtils;
import org.qronos.locale.LocaleData;
import org.qronos.locale.LocaleDataProvider;

import com.google.common.collect.ImmutableList;

/**
 * Phrases a duration as a single, rounded number of a unit, e.g. "3 hours", "2 wk" or "in 5 minutes".
 * <p>
 * Unless a {@link HumanizeConfig#getGranularity() granularity} is configured, the unit is selected by walking the units from years down
 * to seconds and taking the first one that the duration is at least {@link HumanizeConfig#getThreshold() threshold} of. Months are
 * taken as 30 days and years as 365. If no unit qualifies, seconds are used. The count is rounded half-even.
 * </p>
 */
public class Humanizer {
	/** The units durations may be expressed in, largest first */
	public static final List<SpanUnit> UNIT_LADDER = ImmutableList.of(SpanUnit.YEAR, SpanUnit.MONTH, SpanUnit.WEEK, SpanUnit.DAY,
		SpanUnit.HOUR, SpanUnit.MINUTE, SpanUnit.SECOND);

	private Humanizer() {
	}

	/**
	 * @param duration The duration to phrase
	 * @param config The humanization options
	 * @return The phrase, using the default locale data
	 */
	public static String humanize(ElapsedTime duration, HumanizeConfig config) {
		return humanize(duration, config, LocaleDataProvider.getDefault());
	}

	/**
	 * @param duration The duration to phrase
	 * @param config The humanization options
	 * @param locales The source of plural rules and phrase templates
	 * @return The phrase
	 */
	public static String humanize(ElapsedTime duration, HumanizeConfig config, LocaleDataProvider locales) {
		double magnitude = Math.abs((double) duration.getTotalMicros());
		SpanUnit unit = config.getGranularity();
		double value;
		if (unit != null) {
			value = magnitude / unitMicros(unit);
			if (value > 0)
				value = Math.max(1, value);
		} else {
			unit = SpanUnit.SECOND;
			value = magnitude / unitMicros(unit);
			for (SpanUnit u : UNIT_LADDER) {
				double v = magnitude / unitMicros(u);
				if (v >= config.getThreshold()) {
					unit = u;
					value = v;
					break;
				}
			}
		}
		long count = (long) Math.rint(value);

		LocaleData data = locales.resolve(config.getLocale());
		String pattern;
		if (config.isDirectionAdded())
			pattern = data.getRelativePattern(unit, config.getStyle(), !duration.isNegative(), data.getPluralCategory(count));
		else
			pattern = data.getUnitPattern(unit, config.getStyle(), data.getPluralCategory(count));
		return pattern.replace("{0}", Long.toString(count));
	}

	private static double unitMicros(SpanUnit unit) {
		return unit.getNominalSeconds() * (double) TimeUtils.MICROS_PER_SECOND;
	}
}
