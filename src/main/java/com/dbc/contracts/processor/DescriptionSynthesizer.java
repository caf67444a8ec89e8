package com.dbc.contracts.processor;

import com.dbc.contracts.model.ConditionKind;
import com.dbc.contracts.visitor.AttachmentCallVisitor;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.*;

/**
 * Derives a description for a condition declared without one.
 *
 * For a predicate passed to a combinator, the description is the source text of the
 * combinator call, e.g. {@code requires(args -> args.getInt("x") > 0) failed}. For a
 * predicate named in an annotation, it is the returned expression of the predicate method.
 * When the source cannot be found or parsed, a generic form built from the predicate's
 * string representation is used instead. Best effort only: two combinator calls of the same
 * kind on one line cannot be told apart.
 */
public class DescriptionSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(DescriptionSynthesizer.class);

    static final String SUFFIX = " failed";

    private final SourceIndex sourceIndex;
    private final Set<Class<?>> entryPoints;
    private final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    /**
     * @param sourceIndex where to look for source files
     * @param entryPoints classes whose frames sit between the caller and this synthesizer
     */
    public DescriptionSynthesizer(SourceIndex sourceIndex, Set<Class<?>> entryPoints) {
        this.sourceIndex = sourceIndex;
        Set<Class<?>> skipped = new HashSet<>(entryPoints);
        skipped.add(DescriptionSynthesizer.class);
        this.entryPoints = Collections.unmodifiableSet(skipped);
    }

    /**
     * Describes a predicate from the call site that attached it.
     */
    public String describe(ConditionKind kind, Object predicate) {
        Optional<StackWalker.StackFrame> caller = walker.walk(frames -> frames
                .filter(frame -> !entryPoints.contains(frame.getDeclaringClass()))
                .findFirst());

        Optional<String> text = caller.flatMap(frame -> sliceCall(kind.combinator(), frame));
        if (text.isPresent()) {
            return text.get() + SUFFIX;
        }
        logger.debug("No source text for {} predicate {}, using generic description", kind, predicate);
        return fallback(kind.combinator(), predicate);
    }

    /**
     * Describes a predicate method named in an annotation.
     */
    public String describeMethod(ConditionKind kind, Method predicate) {
        String annotation = "@" + annotationName(kind);
        Optional<String> expression = sourceIndex.find(predicate.getDeclaringClass(), null)
                .flatMap(source -> returnedExpression(source, predicate));
        if (expression.isPresent()) {
            return annotation + "(" + expression.get() + ")" + SUFFIX;
        }
        logger.debug("No source text for predicate method {}, using generic description", predicate);
        return annotation + "(" + predicate.getDeclaringClass().getSimpleName() + "." + predicate.getName() + ")"
                + SUFFIX;
    }

    static String fallback(String combinator, Object predicate) {
        return combinator + "(" + predicate + ")" + SUFFIX;
    }

    private Optional<String> sliceCall(String combinator, StackWalker.StackFrame frame) {
        int line = frame.getLineNumber();
        if (line < 0) {
            return Optional.empty();
        }
        return sourceIndex.find(frame.getDeclaringClass(), frame.getFileName()).map(source -> {
            List<MethodCallExpr> calls = new ArrayList<>();
            source.getUnit().accept(new AttachmentCallVisitor(combinator, line), calls);
            if (calls.isEmpty()) {
                return null;
            }
            MethodCallExpr call = AttachmentCallVisitor.closest(calls);
            return source.slice(call.getName().getBegin().orElseThrow(), call.getEnd().orElseThrow());
        });
    }

    private Optional<String> returnedExpression(SourceIndex.ParsedSource source, Method predicate) {
        return source.getUnit().findAll(MethodDeclaration.class).stream()
                .filter(declaration -> declaration.getNameAsString().equals(predicate.getName()))
                .filter(declaration -> declaration.getParameters().size() == predicate.getParameterCount())
                .filter(declaration -> declaration.isStatic())
                .findFirst()
                .flatMap(MethodDeclaration::getBody)
                .filter(body -> body.getStatements().size() == 1)
                .map(body -> body.getStatement(0))
                .filter(Statement::isReturnStmt)
                .map(Statement::asReturnStmt)
                .flatMap(ReturnStmt::getExpression)
                .flatMap(expression -> expression.getRange()
                        .map(range -> source.slice(range.begin, range.end)));
    }

    private static String annotationName(ConditionKind kind) {
        switch (kind) {
            case PRECONDITION:
                return "Requires";
            case POSTCONDITION:
                return "Ensures";
            default:
                return "Invariant";
        }
    }
}
