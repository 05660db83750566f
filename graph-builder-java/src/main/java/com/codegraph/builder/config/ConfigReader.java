package com.codegraph.builder.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads {@value GraphBuilderConfig#FILE_NAME} from the project root, or returns
     * defaults when the project has none.
     *
     * @throws ConfigReadException if the file exists but is malformed
     */
    public GraphBuilderConfig readProject(Path projectRoot) {
        Path configPath = projectRoot.resolve(GraphBuilderConfig.FILE_NAME);
        if (!Files.exists(configPath)) {
            return new GraphBuilderConfig();
        }
        return read(configPath);
    }

    /**
     * Reads and deserializes a config file at an explicit path.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public GraphBuilderConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            GraphBuilderConfig config = GSON.fromJson(reader, GraphBuilderConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
