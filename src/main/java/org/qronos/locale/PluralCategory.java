package org.qronos.locale;

import java.util.Locale;

/** The plural categories a locale may distinguish counts by */
public enum PluralCategory {
	/** Used for zero in some languages */
	ZERO,
	/** Used for one, and in some languages for other small values */
	ONE,
	/** Used for two in some languages */
	TWO,
	/** Used for small counts in some languages */
	FEW,
	/** Used for large counts in some languages */
	MANY,
	/** Used for everything not covered by another category */
	OTHER;

	/** @return The lower-case name of this category, as used in phrase bundle keys */
	public String getKey() {
		return name().toLowerCase(Locale.ROOT);
	}
}
