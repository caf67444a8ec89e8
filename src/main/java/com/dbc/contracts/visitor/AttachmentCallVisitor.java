package com.dbc.contracts.visitor;

import com.github.javaparser.Range;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;

import java.util.List;

/**
 * AST visitor collecting calls to a contract combinator (e.g. {@code requires}) whose source
 * range covers a given line.
 */
public class AttachmentCallVisitor extends VoidVisitorAdapter<List<MethodCallExpr>> {

    private final String combinator;
    private final int line;

    public AttachmentCallVisitor(String combinator, int line) {
        this.combinator = combinator;
        this.line = line;
    }

    @Override
    public void visit(MethodCallExpr call, List<MethodCallExpr> found) {
        if (call.getNameAsString().equals(combinator) && covers(call)) {
            found.add(call);
        }
        super.visit(call, found);
    }

    private boolean covers(MethodCallExpr call) {
        return call.getRange()
                .map(range -> range.begin.line <= line && line <= range.end.line)
                .orElse(false);
    }

    /**
     * Picks the call starting closest to the line, which is the innermost when calls nest.
     */
    public static MethodCallExpr closest(List<MethodCallExpr> calls) {
        MethodCallExpr best = null;
        for (MethodCallExpr call : calls) {
            Range range = call.getRange().orElseThrow();
            if (best == null || range.begin.isAfter(best.getRange().orElseThrow().begin)) {
                best = call;
            }
        }
        return best;
    }
}
