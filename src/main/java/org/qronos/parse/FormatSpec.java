package org.qronos.parse;

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** An immutable, ordered list of {@link FormatCandidate}s to try against a value */
public final class FormatSpec implements Iterable<FormatCandidate> {
	/** The keyword for the ISO-8601 family of patterns */
	public static final String ISO_8601 = "ISO8601";
	/** The keyword for POSIX timestamps */
	public static final String TIMESTAMP = "timestamp";

	/**
	 * The patterns the {@link #ISO_8601} keyword expands to, most specific first. The extended forms may separate date and time with
	 * <code>T</code> or a space and may use a comma for the decimal point; the basic form (e.g. "20160725T193318Z") is accepted with seconds.
	 * Offsets may be <code>Z</code>, hours only or hours and minutes, with or without a colon.
	 */
	public static final List<String> ISO_8601_PATTERNS = ImmutableList.of(//
		"yyyy-MM-dd'T'HH:mm:ss.SSSSSSZZZZZ", //
		"yyyy-MM-dd'T'HH:mm:ss,SSSSSSZZZZZ", //
		"yyyy-MM-dd'T'HH:mm:ssZZZZZ", //
		"yyyy-MM-dd'T'HH:mmZZZZZ", //
		"yyyy-MM-dd'T'HH:mm:ss.SSSSSS", //
		"yyyy-MM-dd'T'HH:mm:ss,SSSSSS", //
		"yyyy-MM-dd'T'HH:mm:ss", //
		"yyyy-MM-dd'T'HH:mm", //
		"yyyy-MM-dd HH:mm:ss.SSSSSSZZZZZ", //
		"yyyy-MM-dd HH:mm:ssZZZZZ", //
		"yyyy-MM-dd HH:mmZZZZZ", //
		"yyyy-MM-dd HH:mm:ss.SSSSSS", //
		"yyyy-MM-dd HH:mm:ss", //
		"yyyy-MM-dd HH:mm", //
		"yyyyMMdd'T'HHmmssZZZZZ", //
		"yyyyMMdd'T'HHmmss", //
		"yyyy-MM-dd", //
		"yyyy-MM", //
		"yyyy");

	/** ISO-8601, then POSIX timestamps */
	public static final FormatSpec DEFAULT = of(ISO_8601, TIMESTAMP);

	private final List<FormatCandidate> theCandidates;

	private FormatSpec(List<FormatCandidate> candidates) {
		theCandidates = candidates;
	}

	/**
	 * @param formats The patterns and keywords to try, in order
	 * @return The format spec
	 * @throws IllegalArgumentException If no formats are given or any is empty
	 */
	public static FormatSpec of(String... formats) throws IllegalArgumentException {
		Preconditions.checkArgument(formats.length > 0, "At least one format is required");
		ImmutableList.Builder<FormatCandidate> candidates = ImmutableList.builder();
		for (String format : formats)
			candidates.add(FormatCandidate.of(format));
		return new FormatSpec(candidates.build());
	}

	/**
	 * @param format The pattern or keyword to try after the ones in this spec
	 * @return A new spec with the given format at the end
	 */
	public FormatSpec with(String format) {
		return new FormatSpec(ImmutableList.<FormatCandidate> builder().addAll(theCandidates).add(FormatCandidate.of(format)).build());
	}

	/** @return The candidates in this spec, in order */
	public List<FormatCandidate> getCandidates() {
		return theCandidates;
	}

	@Override
	public Iterator<FormatCandidate> iterator() {
		return theCandidates.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FormatSpec && theCandidates.equals(((FormatSpec) obj).theCandidates);
	}

	@Override
	public int hashCode() {
		return theCandidates.hashCode();
	}

	@Override
	public String toString() {
		return theCandidates.toString();
	}
}
