package com.codegraph.builder.vcs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link ChangeSource} backed by the {@code git} command line.
 */
public class GitChangeSource implements ChangeSource {

    static final int GIT_TIMEOUT_SECONDS = 30;

    private final String gitExecutable;
    private final int timeoutSeconds;

    public GitChangeSource() {
        this("git");
    }

    public GitChangeSource(String gitExecutable) {
        this(gitExecutable, GIT_TIMEOUT_SECONDS);
    }

    public GitChangeSource(String gitExecutable, int timeoutSeconds) {
        this.gitExecutable = gitExecutable;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public List<String> changedFiles(Path projectRoot, String ref) {
        List<String> files = new ArrayList<>();
        for (String line : run(projectRoot, List.of(gitExecutable, "diff", "--name-only", "--relative", ref))) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) files.add(trimmed.replace('\\', '/'));
        }
        return files;
    }

    @Override
    public String headCommit(Path projectRoot) {
        List<String> out = run(projectRoot, List.of(gitExecutable, "rev-parse", "HEAD"));
        if (out.isEmpty() || out.get(0).isBlank()) {
            throw new VcsException("git rev-parse HEAD printed nothing in " + projectRoot);
        }
        return out.get(0).trim();
    }

    private List<String> run(Path workDir, List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);

        List<String> output = Collections.synchronizedList(new ArrayList<>());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new VcsException("Failed to run git: " + e.getMessage(), e);
        }
        // drained off-thread so a hung git cannot block past the timeout
        Thread reader = pump(process.getInputStream(), output::add);
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new VcsException("'" + String.join(" ", command) + "' did not finish within " + timeoutSeconds + "s");
            }
            reader.join(TimeUnit.SECONDS.toMillis(timeoutSeconds));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new VcsException("Interrupted while running git", e);
        }
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new VcsException("'" + String.join(" ", command) + "' failed (exit " + exitCode + "):\n"
                    + String.join("\n", output));
        }
        synchronized (output) {
            return new ArrayList<>(output);
        }
    }

    private static Thread pump(InputStream stream, Consumer<String> sink) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                System.err.println("[graph-builder] WARNING: lost git output: " + e.getMessage());
            }
        });
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
