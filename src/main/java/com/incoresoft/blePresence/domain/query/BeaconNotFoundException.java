package com.incoresoft.blePresence.domain.query;

/** No beacon matches the given MAC or name. */
public class BeaconNotFoundException extends RuntimeException {
    private final String identity;

    public BeaconNotFoundException(String identity) {
        super("Beacon not found: " + identity);
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
