package com.codegraph.builder.java_analysis;

import com.codegraph.builder.adapter.ParseException;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Wrapper around JavaParser with the symbol solver attached.
 * Types are resolved against the JDK, every source root and the dependency JARs.
 */
public class JavaSourceParser {

    private final JavaParser parser;

    public JavaSourceParser(SourceRoots sourceRoots) {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());

        ParserConfiguration sourceConfig = baseConfiguration();
        for (Path root : sourceRoots.sourceRoots()) {
            typeSolver.add(new JavaParserTypeSolver(root, sourceConfig));
        }
        for (Path jar : sourceRoots.classpathJars()) {
            try {
                typeSolver.add(new JarTypeSolver(jar));
            } catch (IOException e) {
                System.err.println("[graph-builder] WARNING: skipping unreadable jar " + jar + ": " + e.getMessage());
            }
        }

        ParserConfiguration config = baseConfiguration()
            .setSymbolResolver(new JavaSymbolSolver(typeSolver));
        this.parser = new JavaParser(config);
    }

    /**
     * @throws ParseException if the file cannot be read or has syntax errors
     */
    public CompilationUnit parse(Path file) {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(file);
        } catch (IOException e) {
            throw new ParseException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<Problem> problems = result.getProblems();
            String first = problems.isEmpty() ? "unknown error" : problems.get(0).getVerboseMessage();
            throw new ParseException("Syntax error in " + file.getFileName() + " (" + problems.size() + " problem(s)): " + first);
        }
        return result.getResult().get();
    }

    private static ParserConfiguration baseConfiguration() {
        return new ParserConfiguration()
            .setLanguageLevel(LanguageLevel.JAVA_17)
            .setCharacterEncoding(StandardCharsets.UTF_8);
    }
}
