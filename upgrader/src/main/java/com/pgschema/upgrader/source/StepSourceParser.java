package com.pgschema.upgrader.source;

import com.pgschema.upgrader.exception.DirectoryLayoutException;
import com.pgschema.upgrader.exception.FileNamingException;
import com.pgschema.upgrader.exception.FileSequenceException;
import com.pgschema.upgrader.exception.StepHeaderException;
import com.pgschema.upgrader.exception.StepSequenceException;
import com.pgschema.upgrader.exception.StepSourceException;
import com.pgschema.upgrader.model.MigrationFile;
import com.pgschema.upgrader.model.UpgraderStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns a flat directory of migration files into the ordered step sequence.
 *
 * <p>Migration files are {@code .sql} or {@code .ddl} files named {@code <id>_<anything>}.
 * Inside a file every step opens with a header line {@code --- <id>: <description>}
 * and owns all text up to the next header.
 */
@Component
@Slf4j
public class StepSourceParser {

    private static final Set<String> MIGRATION_EXTENSIONS = Set.of("sql", "ddl");
    private static final Pattern FILE_NAME_PATTERN = Pattern.compile("^(\\d+)_.*$");
    private static final String HEADER_PREFIX = "--- ";
    private static final Pattern HEADER_PATTERN = Pattern.compile("^--- (\\d+):(.*)$");

    /**
     * Parse the directory into the full step sequence, ordered by file id then step id.
     */
    public List<UpgraderStep> parse(Path directory) {
        List<UpgraderStep> sequence = new ArrayList<>();
        for (MigrationFile file : parseFiles(directory)) {
            sequence.addAll(file.getSteps());
        }
        log.debug("Loaded {} steps from {}", sequence.size(), directory);
        return sequence;
    }

    /**
     * Parse the directory into migration files ordered by file id.
     */
    public List<MigrationFile> parseFiles(Path directory) {
        List<NumberedFile> files = listMigrationFiles(directory);
        files.sort(Comparator.comparingInt(NumberedFile::id).thenComparing(f -> f.path().getFileName().toString()));
        verifyFileSequence(files);

        List<MigrationFile> result = new ArrayList<>(files.size());
        for (NumberedFile file : files) {
            result.add(parseFile(file));
        }
        return result;
    }

    private List<NumberedFile> listMigrationFiles(Path directory) {
        if (!Files.exists(directory)) {
            throw new StepSourceException("Folder does not exist: " + directory, directory.toString());
        }
        if (!Files.isDirectory(directory)) {
            throw new StepSourceException("Path is not a directory: " + directory, directory.toString());
        }

        List<NumberedFile> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();

                if (Files.isDirectory(entry)) {
                    throw new DirectoryLayoutException("Nested directory found: " + entry, name);
                }
                if (name.startsWith(".") || !hasMigrationExtension(name)) {
                    log.trace("Ignoring non-migration entry: {}", name);
                    continue;
                }

                files.add(new NumberedFile(parseFileId(name), entry));
            }
        } catch (IOException e) {
            throw new StepSourceException("Failed to list folder " + directory + ": " + e.getMessage(),
                directory.toString(), e);
        }
        return files;
    }

    private static boolean hasMigrationExtension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return MIGRATION_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static int parseFileId(String name) {
        Matcher matcher = FILE_NAME_PATTERN.matcher(name);
        if (!matcher.matches()) {
            throw new FileNamingException("File name must start with a number followed by '_': " + name, name);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new FileNamingException("File id is out of range: " + name, name);
        }
    }

    /**
     * File ids must be exactly 0..N-1 once sorted.
     */
    private static void verifyFileSequence(List<NumberedFile> files) {
        for (int idx = 0; idx < files.size(); idx++) {
            NumberedFile file = files.get(idx);
            String name = file.path().getFileName().toString();

            if (file.id() < idx) {
                throw new FileSequenceException("Duplicate file ID " + file.id() + " found: " + name, name);
            }
            if (file.id() > idx) {
                throw new FileSequenceException(
                    "Missing file ID " + idx + ". Found " + file.id() + " at " + name, name);
            }
        }
    }

    private MigrationFile parseFile(NumberedFile file) {
        String name = file.path().getFileName().toString();
        String content;
        try {
            content = Files.readString(file.path(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StepSourceException("Failed to read file " + name + ": " + e.getMessage(), name, e);
        }

        List<UpgraderStep> steps = new ArrayList<>();
        StepBuilder current = null;

        for (String line : (Iterable<String>) content.lines()::iterator) {
            if (line.startsWith(HEADER_PREFIX)) {
                if (current != null) {
                    steps.add(current.finish(name));
                }
                current = openStep(file.id(), name, line, steps.size());
            } else if (current != null) {
                current.body.append(line).append('\n');
            } else if (!line.isBlank()) {
                throw new StepHeaderException(
                    "SQL found before the first step header in file " + name + ": " + line, name);
            }
        }
        if (current != null) {
            steps.add(current.finish(name));
        }

        log.debug("Parsed {} steps from {}", steps.size(), name);
        return new MigrationFile(file.id(), name, steps);
    }

    private static StepBuilder openStep(int fileId, String fileName, String line, int expectedId) {
        Matcher matcher = HEADER_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new StepHeaderException(
                "Invalid step header format in file " + fileName + ": " + line, fileName);
        }

        int upgraderId;
        try {
            upgraderId = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new StepHeaderException("Step id is out of range in file " + fileName + ": " + line, fileName);
        }

        if (upgraderId != expectedId) {
            throw new StepSequenceException(String.format(
                "Invalid step sequence in file %s. Expected ID %d, found %d", fileName, expectedId, upgraderId),
                fileName);
        }
        return new StepBuilder(fileId, upgraderId, matcher.group(2).strip());
    }

    private record NumberedFile(int id, Path path) {
    }

    private static final class StepBuilder {

        private final int fileId;
        private final int upgraderId;
        private final String description;
        private final StringBuilder body = new StringBuilder();

        private StepBuilder(int fileId, int upgraderId, String description) {
            this.fileId = fileId;
            this.upgraderId = upgraderId;
            this.description = description;
        }

        private UpgraderStep finish(String fileName) {
            String sql = body.toString().strip();
            if (sql.isEmpty()) {
                throw new StepHeaderException(String.format(
                    "Step %d:%d in file %s has no SQL body", fileId, upgraderId, fileName), fileName);
            }
            return UpgraderStep.builder()
                .fileId(fileId)
                .upgraderId(upgraderId)
                .description(description)
                .sqlText(sql)
                .build();
        }
    }
}
