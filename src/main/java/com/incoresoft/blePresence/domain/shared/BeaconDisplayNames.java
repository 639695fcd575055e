package com.incoresoft.blePresence.domain.shared;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Turns firmware names like "ESP-C3-7" into "Beacon #7". */
public final class BeaconDisplayNames {
    public static final String UNKNOWN = "Unknown beacon";

    private BeaconDisplayNames() {
    }

    public static String displayName(String beaconName, String taggedPrefix) {
        if (beaconName == null || beaconName.isBlank()) return UNKNOWN;
        if (taggedPrefix == null || taggedPrefix.isEmpty()) return beaconName;
        Matcher m = Pattern.compile(Pattern.quote(taggedPrefix) + "(\\d+)").matcher(beaconName);
        return m.find() ? "Beacon #" + m.group(1) : beaconName;
    }
}
