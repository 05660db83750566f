package com.codegraph.builder.adapter;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Parser adapter that delegates to an external command, one process per file.
 *
 * The command is run in the project root with the file's absolute path appended and
 * must print a single {@link ParsedFile} JSON document on stdout. Its stderr is
 * forwarded to ours.
 */
public class ProcessParserAdapter implements ParserAdapter {

    static final int PARSE_TIMEOUT_SECONDS = 60;

    private static final Gson GSON = new Gson();

    private final String language;
    private final Set<String> extensions;
    private final List<String> command;
    private final int timeoutSeconds;

    public ProcessParserAdapter(String language, Set<String> extensions, List<String> command) {
        this(language, extensions, command, PARSE_TIMEOUT_SECONDS);
    }

    ProcessParserAdapter(String language, Set<String> extensions, List<String> command, int timeoutSeconds) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Parser command for " + language + " is empty");
        }
        this.language = language;
        this.extensions = Set.copyOf(extensions);
        this.command = List.copyOf(command);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public void checkAvailable(Path projectRoot) {
        String executable = command.get(0);
        if (!isExecutableFound(executable, projectRoot)) {
            throw new AdapterUnavailableException(
                "Parser executable for " + language + " not found: " + executable);
        }
    }

    @Override
    public List<Path> listSourceFiles(Path projectRoot, SourceFilter filter) {
        return SourceFileWalker.collect(projectRoot, extensions, filter);
    }

    @Override
    public ParsedFile parse(Path projectRoot, Path file) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add(file.toAbsolutePath().toString());

        Process process;
        try {
            process = new ProcessBuilder(cmd).directory(projectRoot.toFile()).start();
        } catch (IOException e) {
            throw new ParseException("Failed to start " + language + " parser: " + e.getMessage(), e);
        }

        StringBuilder stdout = new StringBuilder();
        Thread outThread = pump(process.getInputStream(), line -> stdout.append(line).append('\n'));
        Thread errThread = pump(process.getErrorStream(), line -> System.err.println("[" + language + "-parser] " + line));

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ParseException(language + " parser did not finish within " + timeoutSeconds + "s: " + file);
            }
            outThread.join();
            errThread.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ParseException("Interrupted while parsing " + file, e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ParseException(language + " parser exited with code " + exitCode + ": " + file);
        }

        ParsedFile parsed;
        try {
            parsed = GSON.fromJson(stdout.toString(), ParsedFile.class);
        } catch (JsonParseException e) {
            throw new ParseException(language + " parser printed malformed JSON for " + file + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            throw new ParseException(language + " parser printed nothing for " + file);
        }
        // the path is always ours, whatever the command reported
        parsed.path = SourceFileWalker.relativize(projectRoot, file);
        return parsed;
    }

    private static Thread pump(InputStream stream, Consumer<String> sink) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                System.err.println("[graph-builder] WARNING: lost parser output: " + e.getMessage());
            }
        });
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    static boolean isExecutableFound(String executable, Path projectRoot) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            Path p = projectRoot.resolve(executable);
            return Files.isRegularFile(p) && Files.isExecutable(p);
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) return false;
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            Path candidate = Paths.get(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) return true;
        }
        return false;
    }
}
