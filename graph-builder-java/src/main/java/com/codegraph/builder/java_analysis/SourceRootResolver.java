package com.codegraph.builder.java_analysis;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves Java source roots and dependency JARs of a Maven, Gradle or plain project.
 *
 * Maven: sourceDirectory and testSourceDirectory of the pom (defaults when absent),
 * recursing into {@code <modules>}. Gradle or anything else: {@code src/main/java} and
 * {@code src/test/java} when present. The project root when no source root exists.
 */
public class SourceRootResolver {

    static final String MAIN_JAVA = "src/main/java";
    static final String TEST_JAVA = "src/test/java";

    public SourceRoots resolve(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Set<Path> sources = new LinkedHashSet<>();
        List<Path> jars = new ArrayList<>();

        if (Files.isRegularFile(root.resolve("pom.xml"))) {
            resolveMaven(root, sources, jars, new LinkedHashSet<>());
        } else {
            // Gradle and plain projects share the conventional layout
            addIfDirectory(sources, root.resolve(MAIN_JAVA));
            addIfDirectory(sources, root.resolve(TEST_JAVA));
        }

        if (sources.isEmpty()) {
            sources.add(root);
        }
        return new SourceRoots(new ArrayList<>(sources), jars);
    }

    private void resolveMaven(Path moduleRoot, Set<Path> sources, List<Path> jars, Set<Path> visited) {
        if (!visited.add(moduleRoot)) return;

        String sourceDir = MAIN_JAVA;
        String testSourceDir = TEST_JAVA;
        List<String> modules = Collections.emptyList();

        try (Reader reader = Files.newBufferedReader(moduleRoot.resolve("pom.xml"), StandardCharsets.UTF_8)) {
            Model model = new MavenXpp3Reader().read(reader);
            Build build = model.getBuild();
            if (build != null && build.getSourceDirectory() != null) {
                sourceDir = build.getSourceDirectory();
            }
            if (build != null && build.getTestSourceDirectory() != null) {
                testSourceDir = build.getTestSourceDirectory();
            }
            modules = model.getModules();
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[graph-builder] WARNING: could not parse " + moduleRoot.resolve("pom.xml")
                + ", using default source roots: " + e.getMessage());
        }

        addIfDirectory(sources, moduleRoot.resolve(stripBasedir(sourceDir)));
        addIfDirectory(sources, moduleRoot.resolve(stripBasedir(testSourceDir)));
        jars.addAll(collectJarsInDir(moduleRoot.resolve("target/dependency")));

        for (String module : modules) {
            Path child = moduleRoot.resolve(module).normalize();
            if (Files.isRegularFile(child.resolve("pom.xml"))) {
                resolveMaven(child, sources, jars, visited);
            }
        }
    }

    private static String stripBasedir(String dir) {
        return dir.replace("${project.basedir}/", "").replace("${basedir}/", "");
    }

    private static void addIfDirectory(Set<Path> sources, Path dir) {
        Path abs = dir.toAbsolutePath().normalize();
        if (Files.isDirectory(abs)) sources.add(abs);
    }

    /**
     * JARs copied by {@code mvn dependency:copy-dependencies}, when that was run.
     */
    private List<Path> collectJarsInDir(Path dir) {
        if (!Files.isDirectory(dir)) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(p -> p.toString().endsWith(".jar"))
                .filter(p -> !p.toString().contains("-sources"))
                .filter(p -> !p.toString().contains("-tests"))
                .map(Path::toAbsolutePath)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[graph-builder] WARNING: could not scan dependency dir: " + e.getMessage());
            return Collections.emptyList();
        }
    }
}
