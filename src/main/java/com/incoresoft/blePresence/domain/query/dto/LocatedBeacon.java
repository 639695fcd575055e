package com.incoresoft.blePresence.domain.query.dto;

import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;

/** A beacon copy together with the MAC it is stored under. */
public record LocatedBeacon(String mac, BeaconDto beacon) {
}
