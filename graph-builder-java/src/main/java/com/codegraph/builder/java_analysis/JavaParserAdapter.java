package com.codegraph.builder.java_analysis;

import com.codegraph.builder.adapter.AdapterUnavailableException;
import com.codegraph.builder.adapter.ParsedFile;
import com.codegraph.builder.adapter.ParsedFile.RawImport;
import com.codegraph.builder.adapter.ParserAdapter;
import com.codegraph.builder.adapter.SourceFileWalker;
import com.codegraph.builder.adapter.SourceFilter;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Java parser adapter backed by JavaParser and its symbol solver.
 *
 * The solver is built once per project root. Its caches are not safe for
 * concurrent use, so {@link #parse} is serialized.
 */
public class JavaParserAdapter implements ParserAdapter {

    public static final String LANGUAGE = "java";

    private static final Set<String> EXTENSIONS = Set.of(".java");

    private final SourceRootResolver resolver;
    private Path parserRoot;
    private JavaSourceParser parser;

    public JavaParserAdapter() {
        this(new SourceRootResolver());
    }

    public JavaParserAdapter(SourceRootResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public void checkAvailable(Path projectRoot) {
        if (!Files.isDirectory(projectRoot)) {
            throw new AdapterUnavailableException("Project root is not a directory: " + projectRoot);
        }
    }

    @Override
    public List<Path> listSourceFiles(Path projectRoot, SourceFilter filter) {
        return SourceFileWalker.collect(projectRoot, EXTENSIONS, filter);
    }

    @Override
    public synchronized ParsedFile parse(Path projectRoot, Path file) {
        CompilationUnit cu = parserFor(projectRoot).parse(file);

        DeclarationExtractor declarations = new DeclarationExtractor(cu);
        declarations.extract();

        CallSiteExtractor calls = new CallSiteExtractor();
        calls.extract(declarations.getCallableBodies());

        ParsedFile parsed = new ParsedFile();
        parsed.path = SourceFileWalker.relativize(projectRoot, file);
        parsed.declarations = declarations.getDeclarations();
        parsed.calls = calls.getCalls();
        parsed.imports = importsOf(cu);
        return parsed;
    }

    private JavaSourceParser parserFor(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (parser == null || !root.equals(parserRoot)) {
            SourceRoots roots = resolver.resolve(root);
            System.err.println("[graph-builder] Java source roots: " + roots.sourceRoots()
                + " (" + roots.classpathJars().size() + " dependency jars)");
            parser = new JavaSourceParser(roots);
            parserRoot = root;
        }
        return parser;
    }

    /**
     * Single-type and static imports, keyed by the imported type. On-demand package
     * imports name no single file and are left out.
     */
    static List<RawImport> importsOf(CompilationUnit cu) {
        List<RawImport> imports = new ArrayList<>();
        for (ImportDeclaration decl : cu.getImports()) {
            String name = decl.getNameAsString();
            String typeName;
            if (decl.isStatic()) {
                typeName = decl.isAsterisk() ? name : qualifierOf(name);
            } else if (decl.isAsterisk()) {
                continue;
            } else {
                typeName = name;
            }
            if (typeName.isEmpty()) continue;

            RawImport imp = new RawImport();
            imp.specifier = name;
            imp.line = decl.getBegin().map(p -> p.line).orElse(0);
            imp.targetSymbol = SymbolKeys.forType(typeName);
            imports.add(imp);
        }
        return imports;
    }

    private static String qualifierOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }
}
