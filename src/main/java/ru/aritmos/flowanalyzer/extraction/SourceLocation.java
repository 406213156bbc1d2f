package ru.aritmos.flowanalyzer.extraction;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

/**
 * Положение узла в исходнике; строки и колонки считаются с единицы.
 */
public record SourceLocation(int startLine, int startColumn, int endLine, int endColumn) {

    public static SourceLocation of(FlowSource source, Ast.Node node) {
        int start = node.span().start();
        int end = node.span().end();
        return new SourceLocation(
                source.lines().line(start), source.lines().column(start),
                source.lines().line(end), source.lines().column(end));
    }
}
