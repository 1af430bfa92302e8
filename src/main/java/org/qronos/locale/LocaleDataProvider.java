package org.qronos.locale;

import java.util.Locale;

/** Resolves the {@link LocaleData} for a locale. Implementations must be safe to call from multiple threads. */
public interface LocaleDataProvider {
	/**
	 * @param locale The locale to get the data for
	 * @return The data for the locale, or for the closest locale available
	 */
	LocaleData resolve(Locale locale);

	/** @return The default provider, which takes names from the JDK and phrases from bundled resources */
	static LocaleDataProvider getDefault() {
		return ResourceLocaleDataProvider.INSTANCE;
	}
}
