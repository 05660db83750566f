package com.codegraph.builder.java_analysis;

import com.codegraph.builder.adapter.ParsedFile.RawDeclaration;
import com.codegraph.builder.adapter.ParsedFile.RawParameter;
import com.codegraph.builder.adapter.ParsedFile.RawSupertype;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.JavadocComment;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.resolution.types.ResolvedType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts type, method and constructor declarations of one compilation unit.
 *
 * Declarations are collected by walking type members, so local and anonymous
 * classes inside method bodies never become declarations of their own.
 */
public class DeclarationExtractor {

    private final CompilationUnit cu;
    private final List<RawDeclaration> declarations = new ArrayList<>();
    private final Map<String, Node> callableBodies = new LinkedHashMap<>();

    public DeclarationExtractor(CompilationUnit cu) {
        this.cu = cu;
    }

    public List<RawDeclaration> getDeclarations() { return declarations; }

    /** Symbol key of each method/constructor with a body, in declaration order. */
    public Map<String, Node> getCallableBodies() { return callableBodies; }

    public void extract() {
        String packageName = cu.getPackageDeclaration().map(PackageDeclaration::getNameAsString).orElse("");
        for (TypeDeclaration<?> type : cu.getTypes()) {
            collectType(type, null, packageName);
        }
    }

    // --- Type declarations ---

    private void collectType(TypeDeclaration<?> type, String parentSymbol, String qualifier) {
        String typeName = type.getNameAsString();
        String fqcn = qualifier.isEmpty() ? typeName : qualifier + "." + typeName;
        String symbol = SymbolKeys.forType(fqcn);

        RawDeclaration decl = baseDeclaration(type, symbol, parentSymbol);
        decl.kind = kindOf(type);
        decl.name = typeName;
        decl.supertypes = supertypesOf(type);
        declarations.add(decl);

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration) {
                collectType((TypeDeclaration<?>) member, symbol, fqcn);
            } else if (member instanceof CallableDeclaration) {
                collectCallable((CallableDeclaration<?>) member, symbol, fqcn, typeName);
            }
        }
    }

    private String kindOf(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration) {
            return ((ClassOrInterfaceDeclaration) type).isInterface() ? "interface" : "class";
        }
        if (type instanceof EnumDeclaration) return "enum";
        if (type instanceof RecordDeclaration) return "record";
        if (type instanceof AnnotationDeclaration) return "interface";
        return "class";
    }

    private List<RawSupertype> supertypesOf(TypeDeclaration<?> type) {
        List<RawSupertype> result = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration) {
            ClassOrInterfaceDeclaration c = (ClassOrInterfaceDeclaration) type;
            for (ClassOrInterfaceType t : c.getExtendedTypes()) result.add(supertype("extends", t));
            for (ClassOrInterfaceType t : c.getImplementedTypes()) result.add(supertype("implements", t));
        } else if (type instanceof EnumDeclaration) {
            for (ClassOrInterfaceType t : ((EnumDeclaration) type).getImplementedTypes()) result.add(supertype("implements", t));
        } else if (type instanceof RecordDeclaration) {
            for (ClassOrInterfaceType t : ((RecordDeclaration) type).getImplementedTypes()) result.add(supertype("implements", t));
        }
        return result;
    }

    private RawSupertype supertype(String relation, ClassOrInterfaceType type) {
        RawSupertype s = new RawSupertype();
        s.relation = relation;
        s.name = type.getNameWithScope();
        s.symbol = resolveTypeSymbol(type);
        return s;
    }

    /** Null when the solver cannot see the type's declaration. */
    static String resolveTypeSymbol(ClassOrInterfaceType type) {
        try {
            ResolvedType resolved = type.resolve();
            return resolved.isReferenceType() ? SymbolKeys.forType(resolved.asReferenceType().getQualifiedName()) : null;
        } catch (RuntimeException e) {
            // the solver reports unknown or unsupported types by throwing; the reference stays unresolved
            return null;
        }
    }

    // --- Methods and constructors ---

    private void collectCallable(CallableDeclaration<?> callable, String parentSymbol, String fqcn, String typeName) {
        boolean constructor = callable instanceof ConstructorDeclaration;
        List<RawParameter> params = new ArrayList<>();
        List<String> paramTypes = new ArrayList<>();
        for (Parameter p : callable.getParameters()) {
            String type = p.getType().asString() + (p.isVarArgs() ? "..." : "");
            params.add(new RawParameter(p.getNameAsString(), type));
            paramTypes.add(type);
        }

        String symbol = SymbolKeys.forMethod(fqcn, constructor ? SymbolKeys.CONSTRUCTOR : callable.getNameAsString(), paramTypes);
        RawDeclaration decl = baseDeclaration(callable, symbol, parentSymbol);
        decl.kind = constructor ? "constructor" : "method";
        decl.name = callable.getNameAsString();
        decl.params = params;

        Optional<? extends Node> body;
        if (constructor) {
            decl.returnType = typeName;
            body = Optional.of(((ConstructorDeclaration) callable).getBody());
        } else {
            MethodDeclaration method = (MethodDeclaration) callable;
            decl.returnType = method.getType().asString();
            body = method.getBody();
        }
        decl.complexity = JavaComplexity.count(body.orElse(null));
        body.ifPresent(b -> callableBodies.put(symbol, b));

        declarations.add(decl);
    }

    // --- Helpers ---

    private RawDeclaration baseDeclaration(Node node, String symbol, String parentSymbol) {
        RawDeclaration decl = new RawDeclaration();
        decl.symbol = symbol;
        decl.parent = parentSymbol;
        decl.doc = javadocOf(node);
        decl.startLine = node.getBegin().map(p -> p.line).orElse(0);
        decl.endLine = node.getEnd().map(p -> p.line).orElse(decl.startLine);
        decl.body = node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
        return decl;
    }

    private static String javadocOf(Node node) {
        Optional<Comment> comment = node.getComment();
        if (comment.isPresent() && comment.get() instanceof JavadocComment) {
            return comment.get().getContent();
        }
        return null;
    }
}
