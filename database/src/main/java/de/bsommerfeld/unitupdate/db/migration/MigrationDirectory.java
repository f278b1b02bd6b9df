package de.bsommerfeld.unitupdate.db.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Discovers {@link SqlScriptMigration}s in a directory. Every
 * {@code <name>.up.sql} file defines one migration; an optional sibling
 * {@code <name>.down.sql} reverts it.
 */
public final class MigrationDirectory {

    private static final String UP_SUFFIX = ".up.sql";
    private static final String DOWN_SUFFIX = ".down.sql";

    private MigrationDirectory() {
    }

    /**
     * Scans {@code directory} non-recursively. A missing directory yields no
     * migrations.
     */
    public static List<Migration> scan(Path directory) throws IOException {
        if (!Files.isDirectory(directory))
            return List.of();

        List<Path> upScripts;
        try (Stream<Path> files = Files.list(directory)) {
            upScripts = files
                    .filter(p -> p.getFileName().toString().endsWith(UP_SUFFIX))
                    .sorted()
                    .toList();
        }

        List<Migration> migrations = new ArrayList<>();
        for (Path up : upScripts) {
            String fileName = up.getFileName().toString();
            String name = fileName.substring(0, fileName.length() - UP_SUFFIX.length());
            Path down = directory.resolve(name + DOWN_SUFFIX);
            migrations.add(new SqlScriptMigration(
                    name,
                    Files.readString(up, StandardCharsets.UTF_8),
                    Files.exists(down) ? Files.readString(down, StandardCharsets.UTF_8) : null));
        }
        return migrations;
    }
}
