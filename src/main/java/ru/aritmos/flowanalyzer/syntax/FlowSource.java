package ru.aritmos.flowanalyzer.syntax;

/**
 * Исходный код flow вместе с разобранным деревом.
 * <p>
 * Неизменяемый; создаётся заново на каждый проход конвейера.
 */
public record FlowSource(String text, Ast.Program program, LineIndex lines) {

    /**
     * Разобрать исходный код.
     *
     * @throws FlowSyntaxException при синтаксической ошибке
     */
    public static FlowSource parse(String text) {
        return FlowParser.parse(text);
    }

    public String slice(Span span) {
        return text.substring(span.start(), span.end());
    }

    public String textOf(Ast.Node node) {
        return slice(node.span());
    }

    public int line(Ast.Node node) {
        return lines.line(node.span().start());
    }

    public int column(Ast.Node node) {
        return lines.column(node.span().start());
    }
}
