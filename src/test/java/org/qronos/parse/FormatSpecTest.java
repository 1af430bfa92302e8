package org.qronos.parse;

import org.junit.Assert;
import org.junit.Test;

/** Tests for {@link FormatSpec}, {@link FormatCandidate} and {@link ParseInput} */
public class FormatSpecTest {
	/** Tests keyword recognition */
	@Test
	public void testCandidates() {
		Assert.assertEquals(FormatCandidate.Kind.ISO_8601, FormatCandidate.of("ISO8601").getKind());
		Assert.assertEquals(FormatCandidate.Kind.ISO_8601, FormatCandidate.of("iso8601").getKind());
		Assert.assertEquals(FormatCandidate.Kind.TIMESTAMP, FormatCandidate.of("timestamp").getKind());
		Assert.assertEquals(FormatCandidate.Kind.TIMESTAMP, FormatCandidate.of("X").getKind());
		Assert.assertEquals(FormatCandidate.Kind.PATTERN, FormatCandidate.of("%Y").getKind());

		Assert.assertEquals(FormatSpec.ISO_8601_PATTERNS, FormatCandidate.of("ISO8601").getPatterns());
		Assert.assertEquals(19, FormatSpec.ISO_8601_PATTERNS.size());
		Assert.assertTrue(FormatCandidate.of("timestamp").getPatterns().isEmpty());
		Assert.assertEquals("%Y", FormatCandidate.of("%Y").getPatterns().get(0));
		try {
			FormatCandidate.of("");
			Assert.fail("Empty candidates are invalid");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}

	/** Tests building specs */
	@Test
	public void testSpec() {
		Assert.assertEquals(2, FormatSpec.DEFAULT.getCandidates().size());
		FormatSpec spec = FormatSpec.DEFAULT.with("MM/dd/yyyy");
		Assert.assertEquals(3, spec.getCandidates().size());
		Assert.assertEquals("MM/dd/yyyy", spec.getCandidates().get(2).getText());
		Assert.assertEquals(2, FormatSpec.DEFAULT.getCandidates().size());
		Assert.assertEquals(FormatSpec.of("ISO8601", "timestamp"), FormatSpec.DEFAULT);
		try {
			FormatSpec.of();
			Assert.fail("At least one format is required");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}

	/** Tests the text of parse inputs */
	@Test
	public void testInput() {
		Assert.assertEquals("1469475198", ParseInput.numeric(1469475198.0).getText());
		Assert.assertEquals("1469475198.5", ParseInput.numeric(1469475198.5).getText());
		Assert.assertEquals("20160725", ParseInput.numeric(20160725).getText());
		Assert.assertEquals("0", ParseInput.numeric(0).getText());
		Assert.assertTrue(ParseInput.numeric(1).isNumeric());
		Assert.assertFalse(ParseInput.text("1").isNumeric());
		try {
			ParseInput.numeric(Double.POSITIVE_INFINITY);
			Assert.fail("Infinity is not a time");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}
}
