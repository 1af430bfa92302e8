package org.qronos.humanize;

import java.util.Locale;

/** The width of the unit names used when humanizing a duration */
public enum HumanizeStyle {
	/** Full unit names, e.g. "3 hours" */
	LONG,
	/** Abbreviated unit names, e.g. "3 hr" */
	SHORT,
	/** The shortest unit names available, e.g. "3h" */
	NARROW;

	/** @return The lower-case name of this style */
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * @param name The name of the style, in any case
	 * @return The style with the given name
	 * @throws IllegalArgumentException If the name does not name a style
	 */
	public static HumanizeStyle parse(String name) throws IllegalArgumentException {
		for (HumanizeStyle style : values()) {
			if (style.name().equalsIgnoreCase(name))
				return style;
		}
		throw new IllegalArgumentException("Time delta format must be one of \"long\", \"short\", \"narrow\", not \"" + name + "\"");
	}
}
