package org.qronos.locale;

import java.util.Locale;

import org.junit.Assert;
import org.junit.Test;
import org.qronos.SpanUnit;
import org.qronos.humanize.HumanizeStyle;

/** Tests for {@link ResourceLocaleDataProvider} */
public class ResourceLocaleDataProviderTest {
	private final ResourceLocaleDataProvider theProvider = new ResourceLocaleDataProvider();

	/** Tests the calendar names */
	@Test
	public void testNames() {
		LocaleData us = theProvider.resolve(Locale.US);
		Assert.assertSame(us, theProvider.resolve(Locale.US));
		Assert.assertEquals(Locale.US, us.getLocale());
		Assert.assertEquals(12, us.getMonthNames(false).size());
		Assert.assertEquals("January", us.getMonthNames(false).get(0));
		Assert.assertEquals("Dec", us.getMonthNames(true).get(11));
		Assert.assertEquals(7, us.getWeekdayNames(false).size());
		Assert.assertEquals("Monday", us.getWeekdayNames(false).get(0));
		Assert.assertEquals("Sun", us.getWeekdayNames(true).get(6));
		Assert.assertEquals(2, us.getAmPmMarkers().size());

		LocaleData german = theProvider.resolve(Locale.GERMAN);
		Assert.assertEquals("Juli", german.getMonthNames(false).get(6));
		Assert.assertEquals("Sonntag", german.getWeekdayNames(false).get(6));
	}

	/** Tests plural selection and phrase lookup */
	@Test
	public void testPhrases() {
		LocaleData us = theProvider.resolve(Locale.US);
		Assert.assertEquals(PluralCategory.ONE, us.getPluralCategory(1));
		Assert.assertEquals(PluralCategory.ONE, us.getPluralCategory(-1));
		Assert.assertEquals(PluralCategory.OTHER, us.getPluralCategory(0));
		Assert.assertEquals("{0} hours", us.getUnitPattern(SpanUnit.HOUR, HumanizeStyle.LONG, PluralCategory.OTHER));
		Assert.assertEquals("{0} hr", us.getUnitPattern(SpanUnit.HOUR, HumanizeStyle.SHORT, PluralCategory.ONE));
		Assert.assertEquals("{0} days ago", us.getRelativePattern(SpanUnit.DAY, HumanizeStyle.LONG, false, PluralCategory.OTHER));

		LocaleData french = theProvider.resolve(Locale.FRANCE);
		Assert.assertEquals(PluralCategory.ONE, french.getPluralCategory(0));
		Assert.assertEquals("dans {0} minutes", french.getRelativePattern(SpanUnit.MINUTE, HumanizeStyle.LONG, true, PluralCategory.OTHER));

		// Locales without phrases of their own use the base phrases
		LocaleData japanese = theProvider.resolve(Locale.JAPANESE);
		Assert.assertEquals("{0} weeks", japanese.getUnitPattern(SpanUnit.WEEK, HumanizeStyle.LONG, PluralCategory.OTHER));
	}

	/** Tests plural rule names */
	@Test
	public void testPluralRules() {
		Assert.assertEquals(PluralRule.ONE_OTHER, PluralRule.parse("one-other"));
		Assert.assertEquals(PluralRule.ZERO_ONE_OTHER, PluralRule.parse(" zero-one-other "));
		Assert.assertEquals(PluralCategory.OTHER, PluralRule.OTHER.select(1));
		try {
			PluralRule.parse("two-few-many");
			Assert.fail("Not a rule");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		Assert.assertNotNull(LocaleDataProvider.getDefault());
	}
}
