package ru.aritmos.flowanalyzer.normalize;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.AstWalker;
import ru.aritmos.flowanalyzer.syntax.FlowSource;
import ru.aritmos.flowanalyzer.syntax.FlowSyntaxException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Нормализация control-flow: однострочные тела {@code if/else/for/while/do} оборачиваются в блоки.
 * <p>
 * Нужна внешнему инструментированию, которое вставляет операторы перед/после каждого шага и
 * поэтому требует, чтобы у любого тела были фигурные скобки. Семантика кода не меняется:
 * исходный текст меняется только вставками, применяемыми с конца к началу.
 * <p>
 * Код, который не разбирается, возвращается без изменений.
 */
@Singleton
public class ControlFlowNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowNormalizer.class);

    private static final String STEP = "  ";

    /**
     * Вставка/замена текста: {@code [start, end)} заменяется на {@code text}.
     *
     * @param depth глубина вложенности продвигаемого тела; при равных позициях закрывающая скобка
     *              внешнего тела применяется раньше, чтобы в итоговом тексте оказаться после внутренней
     */
    private record Splice(int start, int end, String text, int depth) {
    }

    public String normalize(String code) {
        if (code == null || code.isBlank()) {
            return code;
        }
        FlowSource source;
        try {
            source = FlowSource.parse(code);
        } catch (FlowSyntaxException e) {
            log.debug("Нормализация пропущена, код не разбирается: {}", e.getMessage());
            return code;
        }

        List<Splice> splices = new ArrayList<>();
        Map<Ast.Statement, String> promotedIndent = new IdentityHashMap<>();
        Map<Ast.Statement, Integer> promotedDepth = new IdentityHashMap<>();

        AstWalker.walk(source.program(), (node, ancestors) -> {
            if (!(node instanceof Ast.Statement statement)) {
                return true;
            }
            String indent = promotedIndent.getOrDefault(statement, source.lines().indentAt(statement.span().start()));
            int depth = promotedDepth.getOrDefault(statement, 0);
            if (node instanceof Ast.IfStatement s) {
                promote(source, s.consequent(), s.consequentAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
                // else if не продвигается: цепочка остаётся плоской
                if (s.alternate() != null && !(s.alternate() instanceof Ast.IfStatement)) {
                    promote(source, s.alternate(), s.alternateAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
                } else if (s.alternate() instanceof Ast.IfStatement elseIf) {
                    promotedIndent.put(elseIf, indent);
                    promotedDepth.put(elseIf, depth);
                }
            } else if (node instanceof Ast.ForStatement s) {
                promote(source, s.body(), s.bodyAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
            } else if (node instanceof Ast.ForInStatement s) {
                promote(source, s.body(), s.bodyAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
            } else if (node instanceof Ast.ForOfStatement s) {
                promote(source, s.body(), s.bodyAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
            } else if (node instanceof Ast.WhileStatement s) {
                promote(source, s.body(), s.bodyAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
            } else if (node instanceof Ast.DoWhileStatement s) {
                promote(source, s.body(), s.bodyAnchor(), indent, depth, splices, promotedIndent, promotedDepth);
            }
            return true;
        });

        if (splices.isEmpty()) {
            return code;
        }
        splices.sort(Comparator.comparingInt(Splice::start).reversed()
                .thenComparingInt(Splice::depth));
        StringBuilder out = new StringBuilder(code);
        for (Splice splice : splices) {
            out.replace(splice.start(), splice.end(), splice.text());
        }
        log.debug("Нормализовано тел операторов: {}", splices.size() / 2);
        return out.toString();
    }

    private static void promote(FlowSource source,
                                Ast.Statement body,
                                int anchor,
                                String indent,
                                int depth,
                                List<Splice> splices,
                                Map<Ast.Statement, String> promotedIndent,
                                Map<Ast.Statement, Integer> promotedDepth) {
        if (body == null || body instanceof Ast.Block || body instanceof Ast.EmptyStatement || anchor < 0) {
            return;
        }
        String inner = indent + STEP;
        int bodyStart = body.span().start();
        String gap = source.text().substring(anchor, bodyStart);
        if (gap.isBlank()) {
            splices.add(new Splice(anchor, bodyStart, " {\n" + inner, depth));
        } else {
            // между заголовком и телом есть комментарий: скобка ставится сразу после заголовка
            splices.add(new Splice(anchor, anchor, " {", depth));
        }
        splices.add(new Splice(body.span().end(), body.span().end(), "\n" + indent + "}", depth));
        promotedIndent.put(body, inner);
        promotedDepth.put(body, depth + 1);
    }
}
