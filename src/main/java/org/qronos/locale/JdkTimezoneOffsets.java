package org.qronos.locale;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.log4j.Logger;
import org.qronos.TimeUtils;
import org.qronos.ZoneRef;

/** A {@link TimezoneOffsetProvider} backed by the JDK's {@link ZoneRules} */
public class JdkTimezoneOffsets implements TimezoneOffsetProvider {
	private static final Logger log = Logger.getLogger(JdkTimezoneOffsets.class);

	/** The shared instance */
	public static final JdkTimezoneOffsets INSTANCE = new JdkTimezoneOffsets();

	private final ConcurrentHashMap<String, ZoneRules> theRules;

	/** Creates the provider */
	public JdkTimezoneOffsets() {
		theRules = new ConcurrentHashMap<>();
	}

	@Override
	public boolean isValid(ZoneRef zone) {
		try {
			getRules(zone);
			return true;
		} catch (IllegalArgumentException e) {
			return false;
		}
	}

	@Override
	public int getOffsetSeconds(ZoneRef zone, long epochMicros) throws IllegalArgumentException {
		if (zone.isUtc())
			return 0;
		Instant instant = Instant.ofEpochSecond(Math.floorDiv(epochMicros, TimeUtils.MICROS_PER_SECOND));
		return getRules(zone).getOffset(instant).getTotalSeconds();
	}

	@Override
	public int getLocalOffsetSeconds(ZoneRef zone, long localEpochMicros) throws IllegalArgumentException {
		if (zone.isUtc())
			return 0;
		ZoneRules rules = getRules(zone);
		LocalDateTime local = LocalDateTime.ofEpochSecond(Math.floorDiv(localEpochMicros, TimeUtils.MICROS_PER_SECOND),
			(int) Math.floorMod(localEpochMicros, TimeUtils.MICROS_PER_SECOND) * 1000, ZoneOffset.UTC);
		List<ZoneOffset> valid = rules.getValidOffsets(local);
		if (!valid.isEmpty())
			return valid.get(0).getTotalSeconds();
		ZoneOffsetTransition gap = rules.getTransition(local);
		return gap.getOffsetBefore().getTotalSeconds();
	}

	private ZoneRules getRules(ZoneRef zone) throws IllegalArgumentException {
		if (zone.isLocal()) // Not cached, the system zone may be changed at runtime
			return ZoneId.systemDefault().getRules();
		ZoneRules rules = theRules.get(zone.getId());
		if (rules != null)
			return rules;
		try {
			rules = ZoneId.of(zone.getId()).getRules();
		} catch (DateTimeException e) {
			throw new IllegalArgumentException("Unrecognized timezone: " + zone.getId(), e);
		}
		if (log.isDebugEnabled())
			log.debug("Loaded zone rules for " + zone.getId());
		ZoneRules previous = theRules.putIfAbsent(zone.getId(), rules);
		return previous != null ? previous : rules;
	}
}
