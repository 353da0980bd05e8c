package org.migrata.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.migrata.execution.ExecutionResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps the latest {@link ExecutionResult} of each unit as {@code unit-<id>.json} in one directory.
 */
public class JsonFileExecutionHistory implements ExecutionHistory {

    private static final Pattern FILE_PATTERN = Pattern.compile("unit-(\\d+)\\.json");

    private final Path historyDir;
    private final ObjectMapper objectMapper;

    public JsonFileExecutionHistory(Path historyDir) {
        this.historyDir = historyDir;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void record(ExecutionResult result) throws IOException {
        Files.createDirectories(historyDir);
        objectMapper.writeValue(fileFor(result.getUnitId()).toFile(), result);
    }

    @Override
    public Optional<ExecutionResult> find(long unitId) throws IOException {
        Path file = fileFor(unitId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), ExecutionResult.class));
    }

    /**
     * @return recorded results ordered by unit id; empty when the directory does not exist yet
     */
    @Override
    public List<ExecutionResult> findAll() throws IOException {
        if (!Files.isDirectory(historyDir)) {
            return List.of();
        }
        List<ExecutionResult> results = new ArrayList<>();
        try (var stream = Files.list(historyDir)) {
            for (Path path : stream.toList()) {
                Matcher m = FILE_PATTERN.matcher(path.getFileName().toString());
                if (m.matches()) {
                    results.add(objectMapper.readValue(path.toFile(), ExecutionResult.class));
                }
            }
        }
        results.sort(Comparator.comparingLong(ExecutionResult::getUnitId));
        return results;
    }

    private Path fileFor(long unitId) {
        return historyDir.resolve("unit-" + unitId + ".json");
    }
}
