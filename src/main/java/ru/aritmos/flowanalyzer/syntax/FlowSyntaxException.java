package ru.aritmos.flowanalyzer.syntax;

/**
 * Синтаксическая ошибка разбора исходного кода flow.
 * <p>
 * Позиция хранится как смещение и как пара (строка, колонка), обе — с единицы.
 */
public class FlowSyntaxException extends RuntimeException {

    private final int offset;
    private final int line;
    private final int column;
    private final String reason;

    public FlowSyntaxException(String reason, int offset, int line, int column) {
        super("Line " + line + ", Column " + column + ": " + reason);
        this.reason = reason;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getReason() {
        return reason;
    }
}
