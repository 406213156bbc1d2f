package ru.aritmos.flowanalyzer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Индекс начал строк: перевод смещения в (строка, колонка) и получение отступа строки.
 */
public final class LineIndex {

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * @return номер строки (с единицы)
     */
    public int line(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    /**
     * @return номер колонки (с единицы)
     */
    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }

    public int lineStart(int offset) {
        return lineStarts[line(offset) - 1];
    }

    /**
     * Ведущие пробелы/табуляции строки, содержащей смещение.
     */
    public String indentAt(int offset) {
        int i = lineStart(offset);
        int j = i;
        while (j < text.length() && (text.charAt(j) == ' ' || text.charAt(j) == '\t')) {
            j++;
        }
        return text.substring(i, j);
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
