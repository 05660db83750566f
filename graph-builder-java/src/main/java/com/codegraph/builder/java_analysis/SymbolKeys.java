package com.codegraph.builder.java_analysis;

import com.github.javaparser.resolution.declarations.ResolvedConstructorDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedParameterDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Generates the Java adapter's symbol keys following the convention:
 *   java::<fully-qualified-type-name>                              (class/interface/enum/record)
 *   java::<fully-qualified-type-name>::<method>(<param-types>)     (method)
 *   java::<fully-qualified-type-name>::&lt;init&gt;(<param-types>) (constructor)
 *
 * Parameter types are erased and stripped of package qualifiers, so a key built from
 * declaration source text equals the key built from a resolved call target.
 */
public final class SymbolKeys {

    public static final String CONSTRUCTOR = "<init>";

    private static final Pattern GENERIC_ARGS = Pattern.compile("<[^<>]*>");
    private static final Pattern PACKAGE_QUALIFIER = Pattern.compile("\\b[a-z_][a-z0-9_]*\\.");

    private SymbolKeys() {}

    public static String forType(String fullyQualifiedName) {
        return "java::" + fullyQualifiedName;
    }

    public static String forMethod(String fullyQualifiedTypeName, String methodName, List<String> paramTypes) {
        List<String> simple = new ArrayList<>(paramTypes.size());
        for (String t : paramTypes) {
            simple.add(simpleTypeName(t));
        }
        return "java::" + fullyQualifiedTypeName + "::" + methodName + "(" + String.join(", ", simple) + ")";
    }

    /**
     * Key of a resolved method call target.
     */
    public static String forResolvedMethod(ResolvedMethodDeclaration method) {
        return forMethod(method.declaringType().getQualifiedName(), method.getName(), paramTypes(method.getNumberOfParams(), method::getParam));
    }

    /**
     * Key of a resolved explicit constructor invocation ({@code this(...)}, {@code super(...)}).
     */
    public static String forResolvedConstructor(ResolvedConstructorDeclaration ctor) {
        return forMethod(ctor.declaringType().getQualifiedName(), CONSTRUCTOR, paramTypes(ctor.getNumberOfParams(), ctor::getParam));
    }

    /**
     * Erased, package-free form of a type as written in source or described by the solver:
     * {@code java.util.Map<K, java.util.List<V>>} becomes {@code Map}, varargs become arrays.
     */
    static String simpleTypeName(String type) {
        String t = type.trim();
        String previous;
        do {
            previous = t;
            t = GENERIC_ARGS.matcher(t).replaceAll("");
        } while (!t.equals(previous));
        t = PACKAGE_QUALIFIER.matcher(t).replaceAll("");
        t = t.replace("...", "[]").replace(" ", "");
        return t;
    }

    private static List<String> paramTypes(int count, java.util.function.IntFunction<ResolvedParameterDeclaration> param) {
        List<String> types = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ResolvedParameterDeclaration p = param.apply(i);
            String described = p.describeType();
            types.add(p.isVariadic() && !described.endsWith("...") && !described.endsWith("[]") ? described + "[]" : described);
        }
        return types;
    }
}
