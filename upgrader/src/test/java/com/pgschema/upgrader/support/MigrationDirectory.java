package com.pgschema.upgrader.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes migration files into a test directory.
 */
public final class MigrationDirectory {

    private final Path root;

    private MigrationDirectory(Path root) {
        this.root = root;
    }

    public static MigrationDirectory at(Path root) {
        return new MigrationDirectory(root);
    }

    public MigrationDirectory file(String name, String content) {
        try {
            Files.writeString(root.resolve(name), content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public MigrationDirectory delete(String name) {
        try {
            Files.delete(root.resolve(name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public Path path() {
        return root;
    }
}
