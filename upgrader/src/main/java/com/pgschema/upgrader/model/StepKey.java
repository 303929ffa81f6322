package com.pgschema.upgrader.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Identity of a step: its file id and its id inside that file.
 * Natural order is the global apply order.
 */
@Value(staticConstructor = "of")
public class StepKey implements Comparable<StepKey> {

    private static final Comparator<StepKey> ORDER = Comparator
        .comparingInt(StepKey::getFileId)
        .thenComparingInt(StepKey::getUpgraderId);

    int fileId;
    int upgraderId;

    @Override
    public int compareTo(StepKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return fileId + ":" + upgraderId;
    }
}
