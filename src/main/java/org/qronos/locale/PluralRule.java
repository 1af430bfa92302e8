package org.qronos.locale;

import java.util.Locale;

/** Selects the {@link PluralCategory} for a count, as a locale's phrase bundle specifies with its <code>plural.rule</code> key */
public enum PluralRule {
	/** "one" for exactly 1, "other" for everything else (English, German, ...) */
	ONE_OTHER {
		@Override
		public PluralCategory select(long count) {
			return count == 1 ? PluralCategory.ONE : PluralCategory.OTHER;
		}
	},
	/** "one" for 0 and 1, "other" for everything else (French, ...) */
	ZERO_ONE_OTHER {
		@Override
		public PluralCategory select(long count) {
			return (count == 0 || count == 1) ? PluralCategory.ONE : PluralCategory.OTHER;
		}
	},
	/** No plural distinction (Japanese, Chinese, ...) */
	OTHER {
		@Override
		public PluralCategory select(long count) {
			return PluralCategory.OTHER;
		}
	};

	/**
	 * @param count The count to categorize. The sign is ignored.
	 * @return The plural category to use for the count
	 */
	public abstract PluralCategory select(long count);

	/**
	 * @param name The name of the rule, e.g. "one-other"
	 * @return The rule with the given name
	 * @throws IllegalArgumentException If no rule has the given name
	 */
	public static PluralRule parse(String name) throws IllegalArgumentException {
		String upper = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
		for (PluralRule rule : values()) {
			if (rule.name().equals(upper))
				return rule;
		}
		throw new IllegalArgumentException("Unrecognized plural rule: " + name);
	}
}
