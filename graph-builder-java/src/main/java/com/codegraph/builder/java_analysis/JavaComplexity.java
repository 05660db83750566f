package com.codegraph.builder.java_analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * AST-derived cyclomatic complexity of a callable body.
 * Base 1, plus one per branch point, non-default switch label, catch clause and
 * short-circuit operator.
 */
final class JavaComplexity {

    private JavaComplexity() {}

    static int count(Node body) {
        if (body == null) return 1;
        int n = 1;
        n += body.findAll(IfStmt.class).size();
        n += body.findAll(ForStmt.class).size();
        n += body.findAll(ForEachStmt.class).size();
        n += body.findAll(WhileStmt.class).size();
        n += body.findAll(DoStmt.class).size();
        n += body.findAll(SwitchEntry.class, e -> !e.getLabels().isEmpty()).size();
        n += body.findAll(CatchClause.class).size();
        n += body.findAll(ConditionalExpr.class).size();
        n += body.findAll(BinaryExpr.class, b ->
            b.getOperator() == BinaryExpr.Operator.AND || b.getOperator() == BinaryExpr.Operator.OR).size();
        return n;
    }
}
