package org.qronos.format;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qronos.UnsupportedTokenException;

/** Tests for {@link TokenTranslator} */
public class TokenTranslatorTest {
	/** Tests splitting letter patterns into segments */
	@Test
	public void testLetterPatterns() {
		List<PatternSegment> segments = TokenTranslator.tokenize("yyyy-MM-dd'T'HH");
		Assert.assertEquals(7, segments.size());
		Assert.assertEquals(TokenKind.YEAR, segments.get(0).getKind());
		Assert.assertEquals("-", segments.get(1).getLiteral());
		Assert.assertEquals(TokenKind.MONTH_NUMBER, segments.get(2).getKind());
		Assert.assertEquals(2, segments.get(2).getWidth());
		Assert.assertEquals(TokenKind.DAY_OF_MONTH, segments.get(4).getKind());
		Assert.assertEquals("T", segments.get(5).getLiteral());
		Assert.assertEquals(TokenKind.HOUR_OF_DAY, segments.get(6).getKind());

		segments = TokenTranslator.tokenize("'o''clock' h a");
		Assert.assertEquals("o'clock ", segments.get(0).getLiteral());
		Assert.assertEquals(TokenKind.HOUR_OF_AM_PM, segments.get(1).getKind());
		Assert.assertEquals(TokenKind.AM_PM, segments.get(3).getKind());

		Assert.assertEquals(TokenKind.MONTH_NAME, TokenTranslator.tokenize("MMMM").get(0).getKind());
		Assert.assertEquals(TokenKind.MONTH_ABBREVIATION, TokenTranslator.tokenize("MMM").get(0).getKind());
		Assert.assertEquals(TokenKind.WEEKDAY_NAME, TokenTranslator.tokenize("EEEE").get(0).getKind());
		Assert.assertEquals(TokenKind.OFFSET_COLON, TokenTranslator.tokenize("ZZZZZ").get(0).getKind());
		Assert.assertEquals(3, TokenTranslator.tokenize("SSS").get(0).getWidth());
	}

	/** Tests splitting directive patterns into segments */
	@Test
	public void testDirectivePatterns() {
		List<PatternSegment> segments = TokenTranslator.tokenize("%Y-%m-%dT%H:%M:%S.%f%:z");
		Assert.assertEquals(TokenKind.YEAR, segments.get(0).getKind());
		Assert.assertEquals(TokenKind.FRACTION, segments.get(12).getKind());
		Assert.assertEquals(TokenKind.OFFSET_COLON, segments.get(13).getKind());

		// Letters are literal in a directive pattern
		segments = TokenTranslator.tokenize("%d de %B");
		Assert.assertEquals(" de ", segments.get(1).getLiteral());

		segments = TokenTranslator.tokenize("100%% %j");
		Assert.assertEquals("100% ", segments.get(0).getLiteral());
		Assert.assertEquals(TokenKind.DAY_OF_YEAR, segments.get(1).getKind());

		PatternSegment unpadded = TokenTranslator.tokenize("%-d").get(0);
		Assert.assertEquals(TokenKind.DAY_OF_MONTH, unpadded.getKind());
		Assert.assertTrue(unpadded.isFormatOnly());
	}

	/** Tests the errors for unrecognized tokens */
	@Test
	public void testUnsupportedTokens() {
		assertUnsupported("%Y-%Q", "%Q");
		assertUnsupported("yyy", "yyy");
		assertUnsupported("MMMMM", "MMMMM");
		assertUnsupported("%Y%", "%");
		assertUnsupported("%-Q", "%-Q");
		assertUnsupported("%:Y", "%:Y");
		assertUnsupported("yyyy 'T", "'T");
		try {
			TokenTranslator.tokenize("");
			Assert.fail("Empty patterns are invalid");
		} catch (UnsupportedTokenException e) {
			// Expected
		}
	}

	private static void assertUnsupported(String pattern, String token) {
		try {
			TokenTranslator.tokenize(pattern);
			Assert.fail("Expected " + token + " to be rejected in " + pattern);
		} catch (UnsupportedTokenException e) {
			Assert.assertEquals(pattern, e.getPattern());
			Assert.assertEquals(token, e.getToken());
		}
	}

	/** Tests the checks made only when compiling for parsing */
	@Test
	public void testParseOnlyChecks() {
		Assert.assertNotNull(TokenTranslator.compileRenderer("%-m/%-d"));
		try {
			TokenTranslator.compileParser("%-m/%-d");
			Assert.fail("Unpadded directives cannot be parsed");
		} catch (UnsupportedTokenException e) {
			Assert.assertEquals("%-m", e.getToken());
		}

		Assert.assertNotNull(TokenTranslator.compileRenderer("yyyy yy"));
		try {
			TokenTranslator.compileParser("yyyy yy");
			Assert.fail("A field may only be parsed once");
		} catch (UnsupportedTokenException e) {
			Assert.assertEquals("yy", e.getToken());
		}
	}

	/** Tests compiled plans */
	@Test
	public void testCompile() {
		ParsePlan plan = TokenTranslator.compileParser("yyyyMMdd");
		Assert.assertSame(plan, TokenTranslator.compileParser("yyyyMMdd"));
		Assert.assertEquals(TokenTranslator.Mode.PARSE, plan.getMode());
		Assert.assertEquals(TokenTranslator.Mode.FORMAT, TokenTranslator.compile("yyyyMMdd", TokenTranslator.Mode.FORMAT).getMode());

		Assert.assertTrue(plan.isNumericCapable());
		Assert.assertTrue(TokenTranslator.compileParser("%s").isNumericCapable());
		Assert.assertTrue(TokenTranslator.compileParser("yyyyMMddHHmmss.SSS").isNumericCapable());
		Assert.assertFalse(TokenTranslator.compileParser("yyyy-MM-dd").isNumericCapable());
		Assert.assertFalse(TokenTranslator.compileParser("yyyyMMM").isNumericCapable());
	}

	/** Tests that the plan cache stays bounded when many distinct patterns are compiled */
	@Test
	public void testCacheBound() {
		for (int i = 0; i < TokenTranslator.MAX_CACHED_PLANS * 2; i++) {
			String pattern = "'#" + i + "' yyyy";
			Assert.assertEquals(pattern, TokenTranslator.compileParser(pattern).getPattern());
			Assert.assertTrue(TokenTranslator.getCachedPlanCount(TokenTranslator.Mode.PARSE) <= TokenTranslator.MAX_CACHED_PLANS);
		}
		ParsePlan plan = TokenTranslator.compileParser("'#0' yyyy");
		Assert.assertSame(plan, TokenTranslator.compileParser("'#0' yyyy"));
	}
}
