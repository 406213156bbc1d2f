package ru.aritmos.flowanalyzer.types;

import ru.aritmos.flowanalyzer.syntax.Ast;
import ru.aritmos.flowanalyzer.syntax.FlowSource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Структурная форма объектного типа: набор известных свойств.
 * <p>
 * Открытая форма ({@code open}) допускает любые свойства: индексная сигнатура, {@code any},
 * неразрешимый импортированный тип.
 *
 * @param displayName имя типа для текста диагностик
 * @param members     известные свойства в порядке объявления
 * @param open        допускаются ли необъявленные свойства
 */
public record TypeShape(String displayName, Map<String, TypeShape.Member> members, boolean open) {

    public TypeShape {
        members = members == null ? Map.of() : new LinkedHashMap<>(members);
    }

    /**
     * Свойство формы.
     *
     * @param type        объявленный тип ({@code null} для методов и свойств без аннотации)
     * @param origin      исходник, в котором объявлен тип (код flow или встроенные объявления)
     * @param description JSDoc-описание
     * @param builtin     унаследовано из встроенных типов событий
     */
    public record Member(String name,
                         Ast.TypeNode type,
                         FlowSource origin,
                         boolean optional,
                         String description,
                         boolean builtin) {

        Member withOptional(boolean value) {
            return new Member(name, type, origin, value, description, builtin);
        }
    }

    public static TypeShape open(String displayName) {
        return new TypeShape(displayName, Map.of(), true);
    }

    public boolean has(String name) {
        return open || members.containsKey(name);
    }

    public Member member(String name) {
        return members.get(name);
    }
}
