package com.incoresoft.blePresence.domain.registry.dto;

/** Attributes a report carries about its receiver. */
public record ReceiverAttributes(String name, String type, int batch, int totalBatches) {
}
