package org.migrata.cli.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.migrata.unit.MigrationUnit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads migration units from a directory, one unit per {@code .yaml}, {@code .yml} or {@code .json} file.
 */
public class MigrationUnitLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final ObjectMapper jsonMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * @return units sorted by id; empty when the directory does not exist
     * @throws IOException              if a file cannot be read or parsed
     * @throws IllegalArgumentException if two files declare the same id
     */
    public List<MigrationUnit> loadAll(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<Path> files;
        try (var stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> isUnitFile(p.getFileName().toString()))
                    .sorted()
                    .toList();
        }

        Map<Long, Path> seen = new HashMap<>();
        List<MigrationUnit> units = new ArrayList<>();
        for (Path file : files) {
            MigrationUnit unit = load(file);
            Path previous = seen.putIfAbsent(unit.id(), file);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate unit id " + unit.id() + " in "
                        + previous.getFileName() + " and " + file.getFileName());
            }
            units.add(unit);
        }
        units.sort(Comparator.comparingLong(MigrationUnit::id));
        return units;
    }

    public MigrationUnit load(Path file) throws IOException {
        ObjectMapper mapper = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? jsonMapper : yamlMapper;
        return mapper.readValue(file.toFile(), MigrationUnit.class);
    }

    private static boolean isUnitFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") || lower.endsWith(".json");
    }
}
