package org.qronos.format;

import java.util.List;

import org.qronos.TimeUtils;
import org.qronos.UtcInstant;
import org.qronos.locale.LocaleData;

/**
 * A {@link CompiledPlan} that prints an instant. Literal segments are copied as-is; token segments print the instant's fields as seen
 * from a UTC offset. Fractions narrower than 6 digits are truncated, not rounded.
 */
public class RenderPlan extends CompiledPlan {
	RenderPlan(String pattern, List<PatternSegment> segments) {
		super(pattern, segments);
	}

	@Override
	public TokenTranslator.Mode getMode() {
		return TokenTranslator.Mode.FORMAT;
	}

	/**
	 * @param instant The instant to render
	 * @param offsetSeconds The UTC offset, in seconds, of the zone to render the instant's fields in
	 * @param data The locale data for month names, weekday names and AM/PM markers
	 * @return The rendered text
	 */
	public String render(UtcInstant instant, int offsetSeconds, LocaleData data) {
		StringBuilder str = new StringBuilder();
		append(str, instant, offsetSeconds, data);
		return str.toString();
	}

	/**
	 * @param str The StringBuilder to append to
	 * @param instant The instant to render
	 * @param offsetSeconds The UTC offset, in seconds, of the zone to render the instant's fields in
	 * @param data The locale data for month names, weekday names and AM/PM markers
	 * @return The StringBuilder
	 */
	public StringBuilder append(StringBuilder str, UtcInstant instant, int offsetSeconds, LocaleData data) {
		long local = instant.getEpochMicros() + offsetSeconds * TimeUtils.MICROS_PER_SECOND;
		long epochDay = Math.floorDiv(local, TimeUtils.MICROS_PER_DAY);
		long timeOfDay = Math.floorMod(local, TimeUtils.MICROS_PER_DAY);
		long[] date = TimeUtils.fromEpochDay(epochDay);
		int year = (int) date[0], month = (int) date[1], day = (int) date[2];
		int hour = (int) (timeOfDay / TimeUtils.MICROS_PER_HOUR);
		int weekday = TimeUtils.getDayOfWeek(epochDay);
		for (PatternSegment segment : getSegments()) {
			if (segment.isLiteral()) {
				str.append(segment.getLiteral());
				continue;
			}
			switch (segment.getKind()) {
			case YEAR:
				TimeUtils.printInt(year, segment.getWidth(), str);
				break;
			case YEAR_OF_CENTURY:
				TimeUtils.printInt(year % 100, 2, str);
				break;
			case MONTH_NAME:
				str.append(data.getMonthNames(false).get(month - 1));
				break;
			case MONTH_ABBREVIATION:
				str.append(data.getMonthNames(true).get(month - 1));
				break;
			case MONTH_NUMBER:
				TimeUtils.printInt(month, segment.getWidth(), str);
				break;
			case DAY_OF_MONTH:
				TimeUtils.printInt(day, segment.getWidth(), str);
				break;
			case DAY_OF_YEAR:
				TimeUtils.printInt(TimeUtils.getDayOfYear(year, month, day), segment.getWidth(), str);
				break;
			case WEEKDAY_NAME:
				str.append(data.getWeekdayNames(false).get(weekday - 1));
				break;
			case WEEKDAY_ABBREVIATION:
				str.append(data.getWeekdayNames(true).get(weekday - 1));
				break;
			case WEEKDAY_ISO:
				TimeUtils.printInt(weekday, segment.getWidth(), str);
				break;
			case WEEKDAY_SUNDAY_ZERO:
				str.append(weekday % 7);
				break;
			case HOUR_OF_DAY:
				TimeUtils.printInt(hour, segment.getWidth(), str);
				break;
			case HOUR_OF_AM_PM:
				TimeUtils.printInt(hour % 12 == 0 ? 12 : hour % 12, segment.getWidth(), str);
				break;
			case AM_PM:
				str.append(data.getAmPmMarkers().get(hour < 12 ? 0 : 1));
				break;
			case MINUTE:
				TimeUtils.printInt((timeOfDay / TimeUtils.MICROS_PER_MINUTE) % 60, segment.getWidth(), str);
				break;
			case SECOND:
				TimeUtils.printInt((timeOfDay / TimeUtils.MICROS_PER_SECOND) % 60, segment.getWidth(), str);
				break;
			case FRACTION:
				int start = str.length();
				TimeUtils.printInt(timeOfDay % TimeUtils.MICROS_PER_SECOND, 6, str);
				str.setLength(start + segment.getWidth());
				break;
			case OFFSET:
				TimeUtils.printOffset(offsetSeconds, false, str);
				break;
			case OFFSET_COLON:
				TimeUtils.printOffset(offsetSeconds, true, str);
				break;
			case TIMESTAMP:
				str.append(Math.floorDiv(instant.getEpochMicros(), TimeUtils.MICROS_PER_SECOND));
				break;
			}
		}
		return str;
	}
}
