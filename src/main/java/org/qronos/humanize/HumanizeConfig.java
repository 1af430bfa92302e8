package org.qronos.humanize;

import java.util.Locale;
import java.util.Objects;

import org.qronos.InvalidUnitException;
import org.qronos.SpanUnit;

import com.google.common.base.Preconditions;

/**
 * Immutable options for {@link Humanizer humanizing} a duration. Each <code>withX</code> method returns a copy with one option changed.
 * <p>
 * The defaults are a threshold of {@value #DEFAULT_THRESHOLD}, {@link HumanizeStyle#LONG long} unit names, no direction, automatic unit
 * selection and the default FORMAT locale.
 * </p>
 */
public final class HumanizeConfig {
	/** The default threshold */
	public static final double DEFAULT_THRESHOLD = 0.85;

	/** The default configuration */
	public static final HumanizeConfig DEFAULT = new HumanizeConfig(null, false, null, DEFAULT_THRESHOLD, HumanizeStyle.LONG);

	private final Locale theLocale;
	private final boolean isDirectionAdded;
	private final SpanUnit theGranularity;
	private final double theThreshold;
	private final HumanizeStyle theStyle;

	private HumanizeConfig(Locale locale, boolean addDirection, SpanUnit granularity, double threshold, HumanizeStyle style) {
		theLocale = locale;
		isDirectionAdded = addDirection;
		theGranularity = granularity;
		theThreshold = threshold;
		theStyle = style;
	}

	/** @return The locale to humanize in. If none was set, the default FORMAT locale at the time of the call. */
	public Locale getLocale() {
		return theLocale != null ? theLocale : Locale.getDefault(Locale.Category.FORMAT);
	}

	/** @return Whether durations are phrased as relative to now, e.g. "in 3 hours" or "3 hours ago" */
	public boolean isDirectionAdded() {
		return isDirectionAdded;
	}

	/** @return The unit durations are always expressed in, or null to select the unit by the {@link #getThreshold() threshold} */
	public SpanUnit getGranularity() {
		return theGranularity;
	}

	/**
	 * @return The smallest number of a unit a duration must be to be expressed in that unit. The largest unit that the duration is at
	 *         least this many of is selected.
	 */
	public double getThreshold() {
		return theThreshold;
	}

	/** @return The width of the unit names */
	public HumanizeStyle getStyle() {
		return theStyle;
	}

	/**
	 * @param locale The locale to humanize in, or null for the default FORMAT locale
	 * @return A copy of this config with the given locale
	 */
	public HumanizeConfig withLocale(Locale locale) {
		return new HumanizeConfig(locale, isDirectionAdded, theGranularity, theThreshold, theStyle);
	}

	/**
	 * @param addDirection Whether to phrase durations as relative to now
	 * @return A copy of this config with the given direction option
	 */
	public HumanizeConfig withDirection(boolean addDirection) {
		if (addDirection == isDirectionAdded)
			return this;
		return new HumanizeConfig(theLocale, addDirection, theGranularity, theThreshold, theStyle);
	}

	/**
	 * @param granularity The unit to always express durations in, or null to select the unit automatically
	 * @return A copy of this config with the given granularity
	 * @throws InvalidUnitException If the unit is a decade or century
	 */
	public HumanizeConfig withGranularity(SpanUnit granularity) throws InvalidUnitException {
		if (granularity != null && !Humanizer.UNIT_LADDER.contains(granularity))
			throw new InvalidUnitException(granularity.getName(), "Granularity must be one of year|month|week|day|hour|minute|second, not "
				+ granularity);
		return new HumanizeConfig(theLocale, isDirectionAdded, granularity, theThreshold, theStyle);
	}

	/**
	 * @param granularity The name of the unit to always express durations in
	 * @return A copy of this config with the given granularity
	 * @throws InvalidUnitException If the unit is not recognized, or is a decade or century
	 */
	public HumanizeConfig withGranularity(String granularity) throws InvalidUnitException {
		return withGranularity(SpanUnit.parse(granularity));
	}

	/**
	 * @param threshold The threshold for unit selection. Zero always selects years.
	 * @return A copy of this config with the given threshold
	 * @throws IllegalArgumentException If the threshold is negative or not a number
	 */
	public HumanizeConfig withThreshold(double threshold) throws IllegalArgumentException {
		Preconditions.checkArgument(threshold >= 0, "Threshold must be a non-negative number, not %s", threshold);
		return new HumanizeConfig(theLocale, isDirectionAdded, theGranularity, threshold, theStyle);
	}

	/**
	 * @param style The width of the unit names
	 * @return A copy of this config with the given style
	 */
	public HumanizeConfig withStyle(HumanizeStyle style) {
		return new HumanizeConfig(theLocale, isDirectionAdded, theGranularity, theThreshold, Objects.requireNonNull(style));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof HumanizeConfig))
			return false;
		HumanizeConfig other = (HumanizeConfig) obj;
		return Objects.equals(theLocale, other.theLocale) && isDirectionAdded == other.isDirectionAdded
			&& theGranularity == other.theGranularity && Double.compare(theThreshold, other.theThreshold) == 0 && theStyle == other.theStyle;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theLocale, isDirectionAdded, theGranularity, theThreshold, theStyle);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("humanize(").append(theStyle.getName()).append(", threshold=").append(theThreshold);
		if (theGranularity != null)
			str.append(", granularity=").append(theGranularity);
		if (isDirectionAdded)
			str.append(", directed");
		if (theLocale != null)
			str.append(", ").append(theLocale);
		return str.append(')').toString();
	}
}
