package ru.aritmos.flowanalyzer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Обход дерева в прямом порядке (родитель раньше детей, дети — в порядке исходного текста).
 */
public final class AstWalker {

    private AstWalker() {
        // утилитарный класс
    }

    /**
     * Посетитель. Стек предков передаётся так, что {@code ancestors.peek()} — непосредственный родитель.
     */
    @FunctionalInterface
    public interface Visitor {
        /**
         * @return {@code false}, чтобы не спускаться в детей узла
         */
        boolean visit(Ast.Node node, Deque<Ast.Node> ancestors);
    }

    public static void walk(Ast.Node root, Visitor visitor) {
        if (root == null) {
            return;
        }
        walk(root, visitor, new ArrayDeque<>());
    }

    private static void walk(Ast.Node node, Visitor visitor, Deque<Ast.Node> ancestors) {
        if (!visitor.visit(node, ancestors)) {
            return;
        }
        ancestors.push(node);
        for (Ast.Node child : node.children()) {
            walk(child, visitor, ancestors);
        }
        ancestors.pop();
    }

    /**
     * Все потомки узла (включая сам узел) заданного типа в порядке обхода.
     */
    public static <T extends Ast.Node> List<T> collect(Ast.Node root, Class<T> type) {
        List<T> out = new ArrayList<>();
        walk(root, (node, ancestors) -> {
            if (type.isInstance(node)) {
                out.add(type.cast(node));
            }
            return true;
        });
        return out;
    }

    /**
     * То же, что {@link #collect(Ast.Node, Class)}, но без спуска в узлы, для которых {@code stop} истинно
     * (сам узел-граница в результат тоже не попадает, если только это не корень).
     */
    public static <T extends Ast.Node> List<T> collect(Ast.Node root, Class<T> type, Predicate<Ast.Node> stop) {
        List<T> out = new ArrayList<>();
        walk(root, (node, ancestors) -> {
            if (node != root && stop.test(node)) {
                return false;
            }
            if (type.isInstance(node)) {
                out.add(type.cast(node));
            }
            return true;
        });
        return out;
    }

    /**
     * Граница функциональной области видимости: вложенные функции, стрелки, методы и классы.
     */
    public static boolean isFunctionBoundary(Ast.Node node) {
        return node instanceof Ast.FunctionDeclaration
                || node instanceof Ast.FunctionExpression
                || node instanceof Ast.ArrowFunction
                || node instanceof Ast.MethodDeclaration
                || node instanceof Ast.ClassDeclaration;
    }
}
