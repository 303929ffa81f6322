package com.pgschema.upgrader.model;

import lombok.Value;

import java.util.List;

/**
 * A migration file and the steps parsed out of it, in step id order.
 */
@Value
public class MigrationFile {

    int fileId;
    String fileName;
    List<UpgraderStep> steps;

    public MigrationFile(int fileId, String fileName, List<UpgraderStep> steps) {
        this.fileId = fileId;
        this.fileName = fileName;
        this.steps = List.copyOf(steps);
    }
}
