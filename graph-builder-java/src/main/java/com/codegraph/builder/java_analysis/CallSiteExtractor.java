package com.codegraph.builder.java_analysis;

import com.codegraph.builder.adapter.ParsedFile.RawCall;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts call sites from callable bodies, resolving targets through the symbol solver.
 *
 * Method calls and {@code this(...)}/{@code super(...)} resolve to the invoked
 * method's key; {@code new T(...)} resolves to the type T. A call whose target the
 * solver cannot find is kept with a null callee.
 */
public class CallSiteExtractor {

    private final List<RawCall> calls = new ArrayList<>();

    public List<RawCall> getCalls() { return calls; }

    public void extract(Map<String, Node> callableBodies) {
        for (Map.Entry<String, Node> entry : callableBodies.entrySet()) {
            String caller = entry.getKey();
            entry.getValue().walk(Node.TreeTraversal.PREORDER, node -> visit(caller, node));
        }
    }

    private void visit(String caller, Node node) {
        if (node instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) node;
            record(caller, resolveMethod(call), lineOf(call.getName()));
        } else if (node instanceof ObjectCreationExpr) {
            ObjectCreationExpr creation = (ObjectCreationExpr) node;
            record(caller, DeclarationExtractor.resolveTypeSymbol(creation.getType()), lineOf(creation));
        } else if (node instanceof ExplicitConstructorInvocationStmt) {
            ExplicitConstructorInvocationStmt invocation = (ExplicitConstructorInvocationStmt) node;
            record(caller, resolveConstructor(invocation), lineOf(invocation));
        }
    }

    private static String resolveMethod(MethodCallExpr call) {
        try {
            return SymbolKeys.forResolvedMethod(call.resolve());
        } catch (RuntimeException e) {
            // unsolvable receiver or overload: the call stays unresolved
            return null;
        }
    }

    private static String resolveConstructor(ExplicitConstructorInvocationStmt invocation) {
        try {
            return SymbolKeys.forResolvedConstructor(invocation.resolve());
        } catch (RuntimeException e) {
            return null;
        }
    }

    private void record(String caller, String callee, int line) {
        RawCall call = new RawCall();
        call.caller = caller;
        call.callee = callee;
        call.line = line;
        calls.add(call);
    }

    private static int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }
}
