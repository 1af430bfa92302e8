package org.qronos;

import java.util.Objects;

/**
 * Names the time zone that local wall-clock fields are interpreted or rendered in. A zone is either UTC, the {@link #LOCAL local system
 * zone}, or an identifier for the {@link org.qronos.locale.TimezoneOffsetProvider timezone-offset provider} to resolve.
 */
public final class ZoneRef {
	/** The identifier that refers to the local system zone */
	public static final String LOCAL_ID = "local";

	/** Coordinated Universal Time */
	public static final ZoneRef UTC = new ZoneRef("UTC");
	/** The zone of the system the code is running on */
	public static final ZoneRef LOCAL = new ZoneRef(LOCAL_ID);

	private final String theId;

	private ZoneRef(String id) {
		theId = id;
	}

	/**
	 * @param id The zone identifier, e.g. "America/New_York", "+05:30", {@value #LOCAL_ID}, or null for UTC
	 * @return The zone reference
	 */
	public static ZoneRef of(String id) {
		if (id == null || id.equalsIgnoreCase("UTC") || id.equals("Z"))
			return UTC;
		else if (id.equals(LOCAL_ID))
			return LOCAL;
		return new ZoneRef(id);
	}

	/** @return The zone identifier */
	public String getId() {
		return theId;
	}

	/** @return Whether this is {@link #UTC} */
	public boolean isUtc() {
		return this == UTC;
	}

	/** @return Whether this is the {@link #LOCAL local system zone} */
	public boolean isLocal() {
		return this == LOCAL;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ZoneRef && theId.equals(((ZoneRef) obj).theId);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(theId);
	}

	@Override
	public String toString() {
		return theId;
	}
}
