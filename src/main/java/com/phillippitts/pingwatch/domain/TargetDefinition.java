package com.phillippitts.pingwatch.domain;

/**
 * Endpoint to monitor, as supplied by the presentation layer or loaded from an address file.
 *
 * @param sequence display order, 1-based; non-positive values are renumbered on start
 * @param address IP address or host name to probe
 * @param hostLabel free-form label shown next to the address (may be empty)
 * @param traceSelected whether the target takes part in the next trace run
 */
public record TargetDefinition(int sequence, String address, String hostLabel, boolean traceSelected) {

    public TargetDefinition {
        address = address == null ? "" : address.trim();
        hostLabel = hostLabel == null ? "" : hostLabel.trim();
    }

    public TargetDefinition(int sequence, String address, String hostLabel) {
        this(sequence, address, hostLabel, false);
    }

    public boolean hasAddress() {
        return !address.isEmpty();
    }

    public TargetDefinition withSequence(int newSequence) {
        return new TargetDefinition(newSequence, address, hostLabel, traceSelected);
    }
}
