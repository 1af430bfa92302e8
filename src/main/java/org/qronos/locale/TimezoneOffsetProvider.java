package org.qronos.locale;

import org.qronos.ZoneRef;

/**
 * Supplies UTC offsets for time zones. This is only consulted at the boundary where local wall-clock fields are converted to or from UTC;
 * instants themselves are always UTC.
 */
public interface TimezoneOffsetProvider {
	/**
	 * @param zone The zone to check
	 * @return Whether this provider can supply offsets for the zone
	 */
	boolean isValid(ZoneRef zone);

	/**
	 * @param zone The zone to get the offset for
	 * @param epochMicros The UTC instant, in microseconds since 1970-01-01T00:00:00Z
	 * @return The offset of the zone from UTC, in seconds, at the given instant, including any daylight-saving adjustment
	 * @throws IllegalArgumentException If the zone is not {@link #isValid(ZoneRef) valid}
	 */
	int getOffsetSeconds(ZoneRef zone, long epochMicros) throws IllegalArgumentException;

	/**
	 * Gets the offset to use to convert local wall-clock fields in a zone to UTC. Where the local time is ambiguous (e.g. during the hour
	 * repeated when daylight-saving time ends) or skipped, the offset in effect before the transition is used.
	 *
	 * @param zone The zone the fields are local to
	 * @param localEpochMicros The local fields, expressed as microseconds since 1970-01-01T00:00:00 local time
	 * @return The offset of the zone from UTC, in seconds, for the local time
	 * @throws IllegalArgumentException If the zone is not {@link #isValid(ZoneRef) valid}
	 */
	int getLocalOffsetSeconds(ZoneRef zone, long localEpochMicros) throws IllegalArgumentException;

	/** @return The default provider, backed by the JDK's time-zone rules */
	static TimezoneOffsetProvider getDefault() {
		return JdkTimezoneOffsets.INSTANCE;
	}
}
