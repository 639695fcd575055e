package com.incoresoft.blePresence.domain.registry.dto;

public record ReapResult(int receiversRemoved, int detectionsRemoved, int beaconsRemoved) {

    public int total() {
        return receiversRemoved + detectionsRemoved + beaconsRemoved;
    }
}
