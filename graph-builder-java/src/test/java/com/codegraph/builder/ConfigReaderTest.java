package com.codegraph.builder;

import com.codegraph.builder.adapter.SourceFilter;
import com.codegraph.builder.config.ConfigReader;
import com.codegraph.builder.config.ConfigReader.ConfigReadException;
import com.codegraph.builder.config.GraphBuilderConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigReaderTest {

    @TempDir
    Path projectRoot;

    private final ConfigReader reader = new ConfigReader();

    @Test
    void missingConfigGivesDefaults() {
        GraphBuilderConfig config = reader.readProject(projectRoot);

        assertTrue(config.getLanguages().isEmpty());
        assertEquals(0, config.getLimit());
        assertEquals(0, config.getTimeoutSeconds());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getParallelism());
        assertEquals(GraphBuilderConfig.DEFAULT_MAX_LOCATIONS_PER_EDGE, config.getMaxLocationsPerEdge());
        assertTrue(config.getAdapters().isEmpty());
        assertEquals(SourceFilter.DEFAULT_EXCLUSIONS, config.sourceFilter().excludedDirectories());
    }

    @Test
    void readsEveryField() throws IOException {
        Files.writeString(projectRoot.resolve(GraphBuilderConfig.FILE_NAME), "{\n"
            + "  \"languages\": [\"java\", \"python\"],\n"
            + "  \"exclude_dirs\": [\"generated\"],\n"
            + "  \"limit\": 50,\n"
            + "  \"parallelism\": 3,\n"
            + "  \"timeout_seconds\": 120,\n"
            + "  \"max_locations_per_edge\": 10,\n"
            + "  \"adapters\": [{\"language\": \"python\", \"extensions\": [\".py\"], \"command\": [\"py-graph\", \"--json\"]}]\n"
            + "}\n");

        GraphBuilderConfig config = reader.readProject(projectRoot);

        assertEquals(List.of("java", "python"), config.getLanguages());
        assertEquals(50, config.getLimit());
        assertEquals(3, config.getParallelism());
        assertEquals(120, config.getTimeoutSeconds());
        assertEquals(10, config.getMaxLocationsPerEdge());
        assertEquals("python", config.getAdapters().get(0).language);
        assertEquals(List.of("py-graph", "--json"), config.getAdapters().get(0).getCommand());

        SourceFilter filter = config.sourceFilter();
        assertTrue(filter.excludedDirectories().contains("generated"));
        assertTrue(filter.excludedDirectories().contains("node_modules"));
        assertEquals(50, filter.limit());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Files.writeString(projectRoot.resolve(GraphBuilderConfig.FILE_NAME),
            "{\"limit\": -4, \"parallelism\": 0, \"max_locations_per_edge\": 0}");

        GraphBuilderConfig config = reader.readProject(projectRoot);
        assertEquals(0, config.getLimit());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getParallelism());
        assertEquals(GraphBuilderConfig.DEFAULT_MAX_LOCATIONS_PER_EDGE, config.getMaxLocationsPerEdge());
    }

    @Test
    void malformedConfigFails() throws IOException {
        Files.writeString(projectRoot.resolve(GraphBuilderConfig.FILE_NAME), "{\"limit\": [1, 2");
        assertThrows(ConfigReadException.class, () -> reader.readProject(projectRoot));
    }

    @Test
    void emptyConfigFails() throws IOException {
        Files.writeString(projectRoot.resolve(GraphBuilderConfig.FILE_NAME), "");
        assertThrows(ConfigReadException.class, () -> reader.readProject(projectRoot));
    }

    @Test
    void explicitPathMustExist() {
        assertThrows(ConfigReadException.class, () -> reader.read(projectRoot.resolve("nope.json")));
    }
}
