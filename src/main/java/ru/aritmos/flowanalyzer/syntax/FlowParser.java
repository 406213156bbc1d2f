package ru.aritmos.flowanalyzer.syntax;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Рекурсивный нисходящий парсер TypeScript-подмножества flow.
 * <p>
 * Неоднозначности грамматики (стрелочные функции против скобочных выражений, generic-вызовы против
 * сравнения, функциональные типы против скобочных) разрешаются пробным разбором с откатом.
 * Точки с запятой вставляются автоматически по правилам языка: перед переводом строки, {@code }} и концом
 * файла.
 */
public final class FlowParser {

    private static final Set<String> RESERVED = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
            "else", "enum", "export", "extends", "false", "finally", "for", "function", "if", "import", "in",
            "instanceof", "new", "null", "return", "super", "switch", "this", "throw", "true", "try", "typeof",
            "var", "void", "while", "with"
    );

    private static final Set<String> CLASS_MODIFIERS = Set.of(
            "public", "private", "protected", "static", "readonly", "abstract", "async", "override",
            "declare", "accessor"
    );

    private static final Set<String> PARAMETER_MODIFIERS = Set.of(
            "public", "private", "protected", "readonly", "override"
    );

    private static final Set<String> TYPE_KEYWORDS = Set.of(
            "any", "unknown", "string", "number", "boolean", "bigint", "symbol", "object", "void",
            "undefined", "null", "never", "intrinsic"
    );

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", "&=", "|=", "^=", "&&=", "||=", "??=", ">>=", ">>>="
    );

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("??", 1),
            Map.entry("||", 2),
            Map.entry("&&", 3),
            Map.entry("|", 4),
            Map.entry("^", 5),
            Map.entry("&", 6),
            Map.entry("==", 7), Map.entry("!=", 7), Map.entry("===", 7), Map.entry("!==", 7),
            Map.entry("<", 8), Map.entry("<=", 8), Map.entry(">", 8), Map.entry(">=", 8),
            Map.entry("instanceof", 8), Map.entry("in", 8), Map.entry("as", 8), Map.entry("satisfies", 8),
            Map.entry("<<", 9), Map.entry(">>", 9), Map.entry(">>>", 9),
            Map.entry("+", 10), Map.entry("-", 10),
            Map.entry("*", 11), Map.entry("/", 11), Map.entry("%", 11),
            Map.entry("**", 12)
    );

    private final String src;
    private final LineIndex lines;
    private final List<Token> tokens;
    private int pos;
    private boolean noIn;

    private FlowParser(String src) {
        this.src = src;
        this.lines = new LineIndex(src);
        this.tokens = new Lexer(src, lines).tokenize();
    }

    /**
     * Разобрать исходный текст в {@link FlowSource}.
     *
     * @throws FlowSyntaxException при синтаксической ошибке (с номером строки и колонки)
     */
    public static FlowSource parse(String text) {
        String source = text == null ? "" : text;
        FlowParser parser = new FlowParser(source);
        Ast.Program program = parser.parseProgram();
        return new FlowSource(source, program, parser.lines);
    }

    // ---------------------------------------------------------------- навигация по лексемам

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int n) {
        return tokens.get(Math.min(pos + n, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != TokenKind.EOF) {
            pos++;
        }
        return t;
    }

    private int lastEnd() {
        return pos == 0 ? 0 : tokens.get(pos - 1).end();
    }

    private Span spanFrom(int start) {
        return new Span(start, Math.max(start, lastEnd()));
    }

    private boolean atEof() {
        return peek().kind() == TokenKind.EOF;
    }

    private boolean atPunct(String p) {
        return peek().isPunct(p);
    }

    private boolean atWord(String w) {
        return peek().isWord(w);
    }

    private boolean eatPunct(String p) {
        if (atPunct(p)) {
            next();
            return true;
        }
        return false;
    }

    private boolean eatWord(String w) {
        if (atWord(w)) {
            next();
            return true;
        }
        return false;
    }

    private Token expectPunct(String p) {
        if (!atPunct(p)) {
            throw error("'" + p + "' expected.", peek());
        }
        return next();
    }

    private void expectWord(String w) {
        if (!atWord(w)) {
            throw error("'" + w + "' expected.", peek());
        }
        next();
    }

    private String expectIdentifier() {
        Token t = peek();
        if (t.kind() != TokenKind.IDENTIFIER || RESERVED.contains(t.text())) {
            throw error("Identifier expected.", t);
        }
        next();
        return t.text();
    }

    private boolean isIdentifierToken(Token t) {
        return t.kind() == TokenKind.IDENTIFIER && !RESERVED.contains(t.text());
    }

    private void consumeSemicolon() {
        if (eatPunct(";")) {
            return;
        }
        if (atPunct("}") || atEof() || peek().newlineBefore()) {
            return;
        }
        throw error("';' expected.", peek());
    }

    private FlowSyntaxException error(String message, Token at) {
        String msg = at.kind() == TokenKind.EOF && !message.endsWith("expected.")
                ? "Unexpected end of input."
                : message;
        return new FlowSyntaxException(msg, at.start(), lines.line(at.start()), lines.column(at.start()));
    }

    private FlowSyntaxException unexpected() {
        Token t = peek();
        if (t.kind() == TokenKind.EOF) {
            return error("Unexpected end of input.", t);
        }
        return error("Unexpected token '" + t.text() + "'.", t);
    }

    /**
     * Пробный разбор: при синтаксической ошибке позиция откатывается и возвращается {@code null}.
     */
    private <T> T tryParse(Supplier<T> attempt) {
        int savedPos = pos;
        boolean savedNoIn = noIn;
        try {
            return attempt.get();
        } catch (FlowSyntaxException e) {
            pos = savedPos;
            noIn = savedNoIn;
            return null;
        }
    }

    private <T> T allowIn(Supplier<T> body) {
        boolean saved = noIn;
        noIn = false;
        try {
            return body.get();
        } finally {
            noIn = saved;
        }
    }

    /** Проверка «токены стоят вплотную» — для сборки составных операторов из {@code >}. */
    private boolean adjacent(int offset) {
        return peek(offset - 1).end() == peek(offset).start();
    }

    /**
     * Оператор, начинающийся с {@code >}: лексер всегда выдаёт {@code >} отдельно.
     *
     * @return текст оператора или {@code null}
     */
    private String greaterOperator() {
        if (!atPunct(">")) {
            return null;
        }
        if (peek(1).isPunct(">") && adjacent(1)) {
            if (peek(2).isPunct(">") && adjacent(2)) {
                if (peek(3).isPunct("=") && adjacent(3)) {
                    return ">>>=";
                }
                return ">>>";
            }
            if (peek(2).isPunct("=") && adjacent(2)) {
                return ">>=";
            }
            return ">>";
        }
        if (peek(1).isPunct("=") && adjacent(1)) {
            return ">=";
        }
        return ">";
    }

    private static int greaterTokenCount(String op) {
        return switch (op) {
            case ">>>=" -> 4;
            case ">>>", ">>=" -> 3;
            case ">>", ">=" -> 2;
            default -> 1;
        };
    }

    // ---------------------------------------------------------------- программа

    private Ast.Program parseProgram() {
        List<Ast.Statement> body = new ArrayList<>();
        while (!atEof()) {
            body.add(parseStatement());
        }
        return new Ast.Program(new Span(0, src.length()), body);
    }

    // ---------------------------------------------------------------- операторы

    private Ast.Statement parseStatement() {
        Token t = peek();
        int start = t.start();

        if (t.kind() == TokenKind.PUNCTUATOR) {
            switch (t.text()) {
                case "{":
                    return parseBlock();
                case ";":
                    next();
                    return new Ast.EmptyStatement(spanFrom(start));
                case "@":
                    skipDecorators();
                    return parseStatement();
                default:
                    return parseExpressionStatement();
            }
        }
        if (t.kind() != TokenKind.IDENTIFIER) {
            return parseExpressionStatement();
        }

        switch (t.text()) {
            case "var":
            case "const":
                if (t.text().equals("const") && peek(1).isWord("enum")) {
                    next();
                    return parseEnum(start, false);
                }
                return parseVariableStatement(start, false, true);
            case "let":
                if (isIdentifierToken(peek(1)) || peek(1).isPunct("[") || peek(1).isPunct("{")) {
                    return parseVariableStatement(start, false, true);
                }
                return parseExpressionStatement();
            case "function":
                return parseFunctionDeclaration(start, false, false);
            case "async":
                if (peek(1).isWord("function") && !peek(1).newlineBefore()) {
                    next();
                    return parseFunctionDeclaration(start, true, false);
                }
                return parseExpressionStatement();
            case "class":
                return parseClass(start, false, new LinkedHashSet<>());
            case "abstract":
                if (peek(1).isWord("class")) {
                    next();
                    return parseClass(start, false, new LinkedHashSet<>(Set.of("abstract")));
                }
                return parseExpressionStatement();
            case "interface":
                if (isIdentifierToken(peek(1)) && !peek(1).newlineBefore()) {
                    return parseInterface(start, false);
                }
                return parseExpressionStatement();
            case "type":
                if (isIdentifierToken(peek(1)) && !peek(1).newlineBefore()
                        && (peek(2).isPunct("=") || peek(2).isPunct("<"))) {
                    return parseTypeAlias(start, false);
                }
                return parseExpressionStatement();
            case "enum":
                if (isIdentifierToken(peek(1))) {
                    return parseEnum(start, false);
                }
                return parseExpressionStatement();
            case "declare":
                if (!peek(1).newlineBefore() && peek(1).kind() == TokenKind.IDENTIFIER) {
                    next();
                    return parseStatement();
                }
                return parseExpressionStatement();
            case "namespace":
            case "module":
            case "global":
                if (!peek(1).newlineBefore()
                        && (isIdentifierToken(peek(1)) || peek(1).kind() == TokenKind.STRING || peek(1).isPunct("{"))) {
                    return parseNamespace(start);
                }
                return parseExpressionStatement();
            case "import":
                if (peek(1).isPunct("(") || peek(1).isPunct(".")) {
                    return parseExpressionStatement();
                }
                return parseImport(start);
            case "export":
                return parseExport(start);
            case "if":
                return parseIf(start);
            case "for":
                return parseFor(start);
            case "while":
                return parseWhile(start);
            case "do":
                return parseDoWhile(start);
            case "return":
                return parseReturn(start);
            case "throw":
                return parseThrow(start);
            case "try":
                return parseTry(start);
            case "switch":
                return parseSwitch(start);
            case "break":
            case "continue":
                return parseBreakOrContinue(start);
            case "debugger":
                next();
                consumeSemicolon();
                return new Ast.DebuggerStatement(spanFrom(start));
            case "with":
                throw error("'with' statements are not allowed in strict mode.", t);
            default:
                if (isIdentifierToken(t) && peek(1).isPunct(":")) {
                    next();
                    next();
                    Ast.Statement body = parseStatement();
                    return new Ast.LabeledStatement(spanFrom(start), t.text(), body);
                }
                return parseExpressionStatement();
        }
    }

    private Ast.Block parseBlock() {
        int start = expectPunct("{").start();
        List<Ast.Statement> statements = new ArrayList<>();
        while (!atPunct("}")) {
            if (atEof()) {
                throw error("'}' expected.", peek());
            }
            statements.add(parseStatement());
        }
        next();
        return new Ast.Block(spanFrom(start), statements);
    }

    private Ast.Statement parseExpressionStatement() {
        int start = peek().start();
        Ast.Expression expression = allowIn(this::parseExpression);
        consumeSemicolon();
        return new Ast.ExpressionStatement(spanFrom(start), expression);
    }

    private void skipDecorators() {
        while (eatPunct("@")) {
            parseLeftHandSide();
        }
    }

    private Ast.VariableStatement parseVariableStatement(int start, boolean exported, boolean terminated) {
        String kind = next().text();
        List<Ast.VariableDeclarator> declarations = new ArrayList<>();
        do {
            int declStart = peek().start();
            Ast.Pattern target = parseBindingTarget();
            eatPunct("!");
            Ast.TypeNode type = eatPunct(":") ? parseType() : null;
            Ast.Expression init = eatPunct("=") ? parseAssignment() : null;
            declarations.add(new Ast.VariableDeclarator(spanFrom(declStart), target, type, init));
        } while (eatPunct(","));
        if (terminated) {
            consumeSemicolon();
        }
        return new Ast.VariableStatement(spanFrom(start), kind, declarations, exported);
    }

    private Ast.IfStatement parseIf(int start) {
        next();
        expectPunct("(");
        Ast.Expression test = allowIn(this::parseExpression);
        expectPunct(")");
        int consequentAnchor = lastEnd();
        Ast.Statement consequent = parseStatement();
        Ast.Statement alternate = null;
        int alternateAnchor = -1;
        if (eatWord("else")) {
            alternateAnchor = lastEnd();
            alternate = parseStatement();
        }
        return new Ast.IfStatement(spanFrom(start), test, consequent, alternate, consequentAnchor, alternateAnchor);
    }

    private Ast.Statement parseFor(int start) {
        next();
        boolean isAwait = eatWord("await");
        expectPunct("(");

        Ast.Node init = null;
        if (!atPunct(";")) {
            boolean savedNoIn = noIn;
            noIn = true;
            try {
                boolean declaration = atWord("var") || atWord("const") || atWord("using")
                        || (atWord("let") && (isIdentifierToken(peek(1)) || peek(1).isPunct("[") || peek(1).isPunct("{")));
                if (declaration) {
                    init = parseVariableStatement(peek().start(), false, false);
                } else {
                    init = parseExpression();
                }
            } finally {
                noIn = savedNoIn;
            }
        }

        if (init != null && atWord("of")) {
            next();
            Ast.Expression right = allowIn(this::parseAssignment);
            expectPunct(")");
            int anchor = lastEnd();
            Ast.Statement body = parseStatement();
            return new Ast.ForOfStatement(spanFrom(start), init, right, body, isAwait, anchor);
        }
        if (init != null && atWord("in")) {
            next();
            Ast.Expression right = allowIn(this::parseExpression);
            expectPunct(")");
            int anchor = lastEnd();
            Ast.Statement body = parseStatement();
            return new Ast.ForInStatement(spanFrom(start), init, right, body, anchor);
        }

        expectPunct(";");
        Ast.Expression test = atPunct(";") ? null : allowIn(this::parseExpression);
        expectPunct(";");
        Ast.Expression update = atPunct(")") ? null : allowIn(this::parseExpression);
        expectPunct(")");
        int anchor = lastEnd();
        Ast.Statement body = parseStatement();
        return new Ast.ForStatement(spanFrom(start), init, test, update, body, anchor);
    }

    private Ast.WhileStatement parseWhile(int start) {
        next();
        expectPunct("(");
        Ast.Expression test = allowIn(this::parseExpression);
        expectPunct(")");
        int anchor = lastEnd();
        Ast.Statement body = parseStatement();
        return new Ast.WhileStatement(spanFrom(start), test, body, anchor);
    }

    private Ast.DoWhileStatement parseDoWhile(int start) {
        next();
        int anchor = lastEnd();
        Ast.Statement body = parseStatement();
        expectWord("while");
        expectPunct("(");
        Ast.Expression test = allowIn(this::parseExpression);
        expectPunct(")");
        eatPunct(";");
        return new Ast.DoWhileStatement(spanFrom(start), body, test, anchor);
    }

    private Ast.ReturnStatement parseReturn(int start) {
        next();
        Ast.Expression argument = null;
        if (!atPunct(";") && !atPunct("}") && !atEof() && !peek().newlineBefore()) {
            argument = allowIn(this::parseExpression);
        }
        consumeSemicolon();
        return new Ast.ReturnStatement(spanFrom(start), argument);
    }

    private Ast.ThrowStatement parseThrow(int start) {
        next();
        if (peek().newlineBefore()) {
            throw error("Line break not permitted here.", peek());
        }
        Ast.Expression argument = allowIn(this::parseExpression);
        consumeSemicolon();
        return new Ast.ThrowStatement(spanFrom(start), argument);
    }

    private Ast.TryStatement parseTry(int start) {
        next();
        Ast.Block block = parseBlock();
        Ast.CatchClause handler = null;
        Ast.Block finalizer = null;
        if (atWord("catch")) {
            int catchStart = next().start();
            Ast.Pattern param = null;
            Ast.TypeNode paramType = null;
            if (eatPunct("(")) {
                param = parseBindingTarget();
                if (eatPunct(":")) {
                    paramType = parseType();
                }
                expectPunct(")");
            }
            Ast.Block body = parseBlock();
            handler = new Ast.CatchClause(spanFrom(catchStart), param, paramType, body);
        }
        if (eatWord("finally")) {
            finalizer = parseBlock();
        }
        if (handler == null && finalizer == null) {
            throw error("'catch' or 'finally' expected.", peek());
        }
        return new Ast.TryStatement(spanFrom(start), block, handler, finalizer);
    }

    private Ast.SwitchStatement parseSwitch(int start) {
        next();
        expectPunct("(");
        Ast.Expression discriminant = allowIn(this::parseExpression);
        expectPunct(")");
        expectPunct("{");
        List<Ast.SwitchCase> cases = new ArrayList<>();
        while (!eatPunct("}")) {
            int caseStart = peek().start();
            Ast.Expression test = null;
            if (eatWord("case")) {
                test = allowIn(this::parseExpression);
            } else if (!eatWord("default")) {
                throw error("'case' or 'default' expected.", peek());
            }
            expectPunct(":");
            List<Ast.Statement> consequent = new ArrayList<>();
            while (!atWord("case") && !atWord("default") && !atPunct("}")) {
                if (atEof()) {
                    throw error("'}' expected.", peek());
                }
                consequent.add(parseStatement());
            }
            cases.add(new Ast.SwitchCase(spanFrom(caseStart), test, consequent));
        }
        return new Ast.SwitchStatement(spanFrom(start), discriminant, cases);
    }

    private Ast.Statement parseBreakOrContinue(int start) {
        boolean isBreak = next().text().equals("break");
        String label = null;
        if (isIdentifierToken(peek()) && !peek().newlineBefore()) {
            label = next().text();
        }
        consumeSemicolon();
        return isBreak
                ? new Ast.BreakStatement(spanFrom(start), label)
                : new Ast.ContinueStatement(spanFrom(start), label);
    }

    // ---------------------------------------------------------------- модули

    private Ast.Statement parseImport(int start) {
        next();
        boolean typeOnly = false;
        if (atWord("type") && !peek(1).isWord("from") && !peek(1).isPunct(",") && !peek(1).isPunct("=")) {
            next();
            typeOnly = true;
        }
        if (peek().kind() == TokenKind.STRING) {
            String module = next().stringValue();
            consumeSemicolon();
            return new Ast.ImportDeclaration(spanFrom(start), module, null, null, List.of(), typeOnly);
        }

        String defaultBinding = null;
        String namespaceBinding = null;
        List<Ast.ImportSpecifier> specifiers = new ArrayList<>();

        if (isIdentifierToken(peek())) {
            defaultBinding = next().text();
            if (eatPunct("=")) {
                // import x = require('m');
                expectWord("require");
                expectPunct("(");
                String module = next().stringValue();
                expectPunct(")");
                consumeSemicolon();
                return new Ast.ImportDeclaration(spanFrom(start), module, defaultBinding, null, List.of(), typeOnly);
            }
            if (!eatPunct(",")) {
                return finishImport(start, defaultBinding, null, specifiers, typeOnly);
            }
        }
        if (eatPunct("*")) {
            expectWord("as");
            namespaceBinding = expectIdentifier();
        } else if (eatPunct("{")) {
            while (!eatPunct("}")) {
                int specStart = peek().start();
                boolean specTypeOnly = false;
                if (atWord("type") && peek(1).kind() == TokenKind.IDENTIFIER && !peek(1).isWord("as")) {
                    next();
                    specTypeOnly = true;
                }
                Token imported = next();
                if (imported.kind() != TokenKind.IDENTIFIER && imported.kind() != TokenKind.STRING) {
                    throw error("Identifier expected.", imported);
                }
                String local = imported.stringValue();
                if (eatWord("as")) {
                    local = expectIdentifier();
                }
                specifiers.add(new Ast.ImportSpecifier(spanFrom(specStart), imported.stringValue(), local,
                        specTypeOnly || typeOnly));
                if (!atPunct("}")) {
                    expectPunct(",");
                }
            }
        } else {
            throw error("'{' expected.", peek());
        }
        return finishImport(start, defaultBinding, namespaceBinding, specifiers, typeOnly);
    }

    private Ast.ImportDeclaration finishImport(int start,
                                               String defaultBinding,
                                               String namespaceBinding,
                                               List<Ast.ImportSpecifier> specifiers,
                                               boolean typeOnly) {
        expectWord("from");
        Token module = next();
        if (module.kind() != TokenKind.STRING) {
            throw error("String literal expected.", module);
        }
        if (atWord("assert") || atWord("with")) {
            next();
            parseObjectLiteral();
        }
        consumeSemicolon();
        return new Ast.ImportDeclaration(spanFrom(start), module.stringValue(), defaultBinding, namespaceBinding,
                List.copyOf(specifiers), typeOnly);
    }

    private Ast.Statement parseExport(int start) {
        next();
        if (eatWord("default")) {
            Ast.Node declaration;
            int declStart = peek().start();
            if (atWord("class")) {
                declaration = parseClass(declStart, true, new LinkedHashSet<>());
            } else if (atWord("abstract") && peek(1).isWord("class")) {
                next();
                declaration = parseClass(declStart, true, new LinkedHashSet<>(Set.of("abstract")));
            } else if (atWord("function")) {
                declaration = parseFunctionDeclaration(declStart, false, true);
            } else if (atWord("async") && peek(1).isWord("function")) {
                next();
                declaration = parseFunctionDeclaration(declStart, true, true);
            } else if (atWord("interface")) {
                declaration = parseInterface(declStart, true);
            } else {
                declaration = allowIn(this::parseAssignment);
                consumeSemicolon();
            }
            return new Ast.ExportDefault(spanFrom(start), declaration);
        }
        if (eatPunct("=")) {
            Ast.Expression value = allowIn(this::parseAssignment);
            consumeSemicolon();
            return new Ast.ExportDefault(spanFrom(start), value);
        }
        if (atWord("as") && peek(1).isWord("namespace")) {
            next();
            next();
            expectIdentifier();
            consumeSemicolon();
            return new Ast.ExportNamed(spanFrom(start), List.of(), null);
        }
        if (atWord("type") && peek(1).isPunct("{")) {
            next();
        }
        if (eatPunct("*")) {
            List<String> names = new ArrayList<>();
            if (eatWord("as")) {
                names.add(next().stringValue());
            }
            expectWord("from");
            String module = next().stringValue();
            consumeSemicolon();
            return new Ast.ExportNamed(spanFrom(start), names, module);
        }
        if (eatPunct("{")) {
            List<String> names = new ArrayList<>();
            while (!eatPunct("}")) {
                eatWord("type");
                String name = next().stringValue();
                if (eatWord("as")) {
                    name = next().stringValue();
                }
                names.add(name);
                if (!atPunct("}")) {
                    expectPunct(",");
                }
            }
            String module = null;
            if (eatWord("from")) {
                module = next().stringValue();
            }
            consumeSemicolon();
            return new Ast.ExportNamed(spanFrom(start), names, module);
        }
        return parseExportedDeclaration(start);
    }

    private Ast.Statement parseExportedDeclaration(int start) {
        eatWord("declare");
        Token t = peek();
        switch (t.text()) {
            case "var":
            case "let":
                return parseVariableStatement(start, true, true);
            case "const":
                if (peek(1).isWord("enum")) {
                    next();
                    return parseEnum(start, true);
                }
                return parseVariableStatement(start, true, true);
            case "function":
                return parseFunctionDeclaration(start, false, true);
            case "async":
                next();
                return parseFunctionDeclaration(start, true, true);
            case "class":
                return parseClass(start, true, new LinkedHashSet<>());
            case "abstract":
                next();
                return parseClass(start, true, new LinkedHashSet<>(Set.of("abstract")));
            case "interface":
                return parseInterface(start, true);
            case "type":
                return parseTypeAlias(start, true);
            case "enum":
                return parseEnum(start, true);
            case "namespace":
            case "module":
                return parseNamespace(start);
            case "import":
                return parseImport(start);
            default:
                throw error("Declaration expected.", t);
        }
    }

    private Ast.NamespaceDeclaration parseNamespace(int start) {
        next();
        String name;
        if (atPunct("{")) {
            name = "global";
        } else if (peek().kind() == TokenKind.STRING) {
            name = next().stringValue();
        } else {
            StringBuilder qualified = new StringBuilder(expectIdentifier());
            while (eatPunct(".")) {
                qualified.append('.').append(expectIdentifier());
            }
            name = qualified.toString();
        }
        List<Ast.Statement> body = new ArrayList<>();
        if (eatPunct("{")) {
            while (!eatPunct("}")) {
                if (atEof()) {
                    throw error("'}' expected.", peek());
                }
                body.add(parseStatement());
            }
        } else {
            consumeSemicolon();
        }
        return new Ast.NamespaceDeclaration(spanFrom(start), name, body);
    }

    // ---------------------------------------------------------------- объявления

    private Ast.FunctionDeclaration parseFunctionDeclaration(int start, boolean async, boolean exported) {
        expectWord("function");
        boolean generator = eatPunct("*");
        String name = isIdentifierToken(peek()) ? next().text() : null;
        List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
        List<Ast.Parameter> parameters = parseParameters();
        Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
        Ast.Block body = null;
        if (atPunct("{")) {
            body = allowIn(this::parseBlock);
        } else {
            consumeSemicolon();
        }
        return new Ast.FunctionDeclaration(spanFrom(start), name, typeParameters, parameters, returnType, body,
                async, generator, exported);
    }

    private Ast.ClassDeclaration parseClass(int start, boolean exported, Set<String> modifiers) {
        expectWord("class");
        String name = null;
        if (isIdentifierToken(peek()) && !atWord("extends") && !atWord("implements")) {
            name = next().text();
        }
        List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
        Ast.Expression superClass = null;
        List<Ast.TypeNode> superTypeArguments = List.of();
        if (eatWord("extends")) {
            superClass = parseLeftHandSide();
            if (atPunct("<")) {
                superTypeArguments = parseTypeArguments();
            }
        }
        List<Ast.TypeNode> implementsTypes = new ArrayList<>();
        if (eatWord("implements")) {
            do {
                implementsTypes.add(parseTypeReference());
            } while (eatPunct(","));
        }
        expectPunct("{");
        List<Ast.ClassMember> members = new ArrayList<>();
        while (!eatPunct("}")) {
            if (atEof()) {
                throw error("'}' expected.", peek());
            }
            if (eatPunct(";")) {
                continue;
            }
            members.add(parseClassMember());
        }
        return new Ast.ClassDeclaration(spanFrom(start), name, typeParameters, superClass, superTypeArguments,
                implementsTypes, members, Set.copyOf(modifiers), exported);
    }

    private boolean canFollowModifier(Token t) {
        if (t.kind() == TokenKind.PUNCTUATOR) {
            return t.isPunct("[") || t.isPunct("{") || t.isPunct("*") || t.isPunct("@");
        }
        return t.kind() != TokenKind.EOF;
    }

    private Ast.ClassMember parseClassMember() {
        int start = peek().start();
        skipDecorators();

        if (atWord("static") && peek(1).isPunct("{")) {
            next();
            Ast.Block body = parseBlock();
            return new Ast.StaticBlock(spanFrom(start), body);
        }

        Set<String> modifiers = new LinkedHashSet<>();
        while (peek().kind() == TokenKind.IDENTIFIER && CLASS_MODIFIERS.contains(peek().text())
                && canFollowModifier(peek(1)) && !peek(1).newlineBefore()) {
            modifiers.add(next().text());
        }

        if (atPunct("[") && isIdentifierToken(peek(1)) && peek(2).isPunct(":")) {
            Ast.IndexSignature signature = parseIndexSignature(start);
            eatPunct(";");
            eatPunct(",");
            return signature;
        }

        boolean generator = eatPunct("*");
        String kind = "method";
        if ((atWord("get") || atWord("set")) && isPropertyNameStart(peek(1)) && !peek(1).newlineBefore()) {
            kind = next().text();
        }
        PropertyName key = parsePropertyName();
        if ("constructor".equals(key.name()) && key.computed() == null) {
            kind = "constructor";
        }
        boolean optional = eatPunct("?");
        eatPunct("!");

        if (atPunct("(") || atPunct("<")) {
            boolean async = modifiers.contains("async");
            List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
            List<Ast.Parameter> parameters = parseParameters();
            Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
            Ast.Block body = null;
            if (atPunct("{")) {
                body = allowIn(this::parseBlock);
            } else {
                consumeSemicolon();
            }
            return new Ast.MethodDeclaration(spanFrom(start), key.name(), key.computed(), Set.copyOf(modifiers),
                    kind, typeParameters, parameters, returnType, body, async, generator, optional);
        }

        Ast.TypeNode type = eatPunct(":") ? parseType() : null;
        Ast.Expression initializer = eatPunct("=") ? allowIn(this::parseAssignment) : null;
        consumeSemicolon();
        return new Ast.PropertyDeclaration(spanFrom(start), key.name(), key.computed(), Set.copyOf(modifiers),
                type, initializer, optional);
    }

    private Ast.InterfaceDeclaration parseInterface(int start, boolean exported) {
        expectWord("interface");
        String name = expectIdentifier();
        List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
        List<Ast.TypeNode> extendsTypes = new ArrayList<>();
        if (eatWord("extends")) {
            do {
                extendsTypes.add(parseTypeReference());
            } while (eatPunct(","));
        }
        List<Ast.TypeMember> members = parseTypeMembers();
        return new Ast.InterfaceDeclaration(spanFrom(start), name, typeParameters, extendsTypes, members, exported);
    }

    private Ast.TypeAliasDeclaration parseTypeAlias(int start, boolean exported) {
        expectWord("type");
        String name = expectIdentifier();
        List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
        expectPunct("=");
        Ast.TypeNode type = parseType();
        consumeSemicolon();
        return new Ast.TypeAliasDeclaration(spanFrom(start), name, typeParameters, type, exported);
    }

    private Ast.EnumDeclaration parseEnum(int start, boolean exported) {
        expectWord("enum");
        String name = expectIdentifier();
        expectPunct("{");
        List<Ast.EnumMember> members = new ArrayList<>();
        while (!eatPunct("}")) {
            int memberStart = peek().start();
            Token key = next();
            if (key.kind() != TokenKind.IDENTIFIER && key.kind() != TokenKind.STRING) {
                throw error("Enum member expected.", key);
            }
            Ast.Expression init = eatPunct("=") ? allowIn(this::parseAssignment) : null;
            members.add(new Ast.EnumMember(spanFrom(memberStart), key.stringValue(), init));
            if (!atPunct("}")) {
                expectPunct(",");
            }
        }
        return new Ast.EnumDeclaration(spanFrom(start), name, members, exported);
    }

    // ---------------------------------------------------------------- параметры и деструктуризация

    private List<Ast.TypeParameter> parseTypeParametersOpt() {
        if (!atPunct("<")) {
            return List.of();
        }
        next();
        List<Ast.TypeParameter> out = new ArrayList<>();
        while (!eatPunct(">")) {
            int start = peek().start();
            while ((atWord("const") || atWord("in") || atWord("out")) && isIdentifierOrWord(peek(1))
                    && !peek(1).isPunct(",") && !peek(1).isPunct(">")) {
                next();
            }
            String name = expectTypeName();
            Ast.TypeNode constraint = eatWord("extends") ? parseType() : null;
            Ast.TypeNode defaultType = eatPunct("=") ? parseType() : null;
            out.add(new Ast.TypeParameter(spanFrom(start), name, constraint, defaultType));
            if (!atPunct(">")) {
                expectPunct(",");
            }
        }
        return out;
    }

    private static boolean isIdentifierOrWord(Token t) {
        return t.kind() == TokenKind.IDENTIFIER;
    }

    private String expectTypeName() {
        Token t = peek();
        if (t.kind() != TokenKind.IDENTIFIER) {
            throw error("Type parameter name expected.", t);
        }
        next();
        return t.text();
    }

    private List<Ast.Parameter> parseParameters() {
        expectPunct("(");
        return allowIn(() -> {
            List<Ast.Parameter> out = new ArrayList<>();
            while (!eatPunct(")")) {
                out.add(parseParameter());
                if (!atPunct(")")) {
                    expectPunct(",");
                }
            }
            return out;
        });
    }

    private Ast.Parameter parseParameter() {
        int start = peek().start();
        skipDecorators();
        Set<String> modifiers = new LinkedHashSet<>();
        while (peek().kind() == TokenKind.IDENTIFIER && PARAMETER_MODIFIERS.contains(peek().text())
                && (peek(1).kind() == TokenKind.IDENTIFIER || peek(1).isPunct("{") || peek(1).isPunct("["))) {
            modifiers.add(next().text());
        }
        boolean rest = eatPunct("...");
        Ast.Pattern target;
        if (atWord("this")) {
            Token t = next();
            target = new Ast.Identifier(new Span(t.start(), t.end()), "this");
        } else {
            target = parseBindingTarget();
        }
        boolean optional = eatPunct("?");
        Ast.TypeNode type = eatPunct(":") ? parseType() : null;
        Ast.Expression defaultValue = eatPunct("=") ? parseAssignment() : null;
        return new Ast.Parameter(spanFrom(start), target, type, defaultValue, optional, rest, Set.copyOf(modifiers));
    }

    private Ast.Pattern parseBindingTarget() {
        Token t = peek();
        if (t.isPunct("{")) {
            return parseObjectPattern();
        }
        if (t.isPunct("[")) {
            return parseArrayPattern();
        }
        String name = expectIdentifier();
        return new Ast.Identifier(new Span(t.start(), t.end()), name);
    }

    private Ast.ObjectPattern parseObjectPattern() {
        int start = expectPunct("{").start();
        List<Ast.Node> properties = new ArrayList<>();
        while (!eatPunct("}")) {
            int propStart = peek().start();
            if (eatPunct("...")) {
                Ast.Pattern target = parseBindingTarget();
                properties.add(new Ast.RestElement(spanFrom(propStart), target));
            } else {
                Token keyToken = peek();
                PropertyName key = parsePropertyName();
                Ast.Pattern value;
                if (eatPunct(":")) {
                    value = parseBindingTarget();
                } else {
                    if (key.computed() != null || keyToken.kind() != TokenKind.IDENTIFIER) {
                        throw error("':' expected.", peek());
                    }
                    value = new Ast.Identifier(new Span(keyToken.start(), keyToken.end()), key.name());
                }
                Ast.Expression defaultValue = eatPunct("=") ? allowIn(this::parseAssignment) : null;
                properties.add(new Ast.BindingProperty(spanFrom(propStart), key.name(), key.computed(), value,
                        defaultValue));
            }
            if (!atPunct("}")) {
                expectPunct(",");
            }
        }
        return new Ast.ObjectPattern(spanFrom(start), properties);
    }

    private Ast.ArrayPattern parseArrayPattern() {
        int start = expectPunct("[").start();
        List<Ast.Node> elements = new ArrayList<>();
        while (!eatPunct("]")) {
            int elStart = peek().start();
            if (atPunct(",")) {
                next();
                elements.add(new Ast.OmittedExpression(spanFrom(elStart)));
                continue;
            }
            if (eatPunct("...")) {
                Ast.Pattern target = parseBindingTarget();
                elements.add(new Ast.RestElement(spanFrom(elStart), target));
            } else {
                Ast.Pattern target = parseBindingTarget();
                Ast.Expression defaultValue = eatPunct("=") ? allowIn(this::parseAssignment) : null;
                elements.add(new Ast.BindingElement(spanFrom(elStart), target, defaultValue));
            }
            if (!atPunct("]")) {
                expectPunct(",");
            }
        }
        return new Ast.ArrayPattern(spanFrom(start), elements);
    }

    private record PropertyName(String name, Ast.Expression computed) {
    }

    private boolean isPropertyNameStart(Token t) {
        return t.kind() == TokenKind.IDENTIFIER || t.kind() == TokenKind.STRING || t.kind() == TokenKind.NUMBER
                || t.kind() == TokenKind.PRIVATE_NAME || t.kind() == TokenKind.BIGINT || t.isPunct("[");
    }

    private PropertyName parsePropertyName() {
        Token t = peek();
        switch (t.kind()) {
            case IDENTIFIER, PRIVATE_NAME -> {
                next();
                return new PropertyName(t.text(), null);
            }
            case STRING -> {
                next();
                return new PropertyName(t.stringValue(), null);
            }
            case NUMBER, BIGINT -> {
                next();
                double d = (Double) t.value();
                String name = d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf((long) d) : String.valueOf(d);
                return new PropertyName(name, null);
            }
            default -> {
                if (eatPunct("[")) {
                    Ast.Expression computed = allowIn(this::parseAssignment);
                    expectPunct("]");
                    return new PropertyName(null, computed);
                }
                throw error("Property assignment expected.", t);
            }
        }
    }

    // ---------------------------------------------------------------- выражения

    private Ast.Expression parseExpression() {
        int start = peek().start();
        Ast.Expression first = parseAssignment();
        if (!atPunct(",")) {
            return first;
        }
        List<Ast.Expression> expressions = new ArrayList<>();
        expressions.add(first);
        while (eatPunct(",")) {
            expressions.add(parseAssignment());
        }
        return new Ast.SequenceExpression(spanFrom(start), expressions);
    }

    private Ast.Expression parseAssignment() {
        int start = peek().start();

        Ast.Expression arrow = tryArrowFunction(start);
        if (arrow != null) {
            return arrow;
        }
        if (atWord("yield")) {
            next();
            boolean delegate = eatPunct("*");
            Ast.Expression argument = null;
            if (!peek().newlineBefore() && isExpressionContinuationStart()) {
                argument = parseAssignment();
            }
            return new Ast.YieldExpression(spanFrom(start), argument, delegate);
        }

        Ast.Expression left = parseConditional();

        String op = null;
        int count = 1;
        String greater = greaterOperator();
        if (greater != null && ASSIGNMENT_OPERATORS.contains(greater)) {
            op = greater;
            count = greaterTokenCount(greater);
        } else if (peek().kind() == TokenKind.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(peek().text())) {
            op = peek().text();
        }
        if (op != null) {
            for (int i = 0; i < count; i++) {
                next();
            }
            Ast.Expression value = parseAssignment();
            return new Ast.AssignmentExpression(spanFrom(start), op, left, value);
        }
        return left;
    }

    private boolean isExpressionContinuationStart() {
        Token t = peek();
        if (t.kind() == TokenKind.EOF) {
            return false;
        }
        return !(t.isPunct(")") || t.isPunct("]") || t.isPunct("}") || t.isPunct(",") || t.isPunct(";")
                || t.isPunct(":"));
    }

    private record ArrowHead(List<Ast.TypeParameter> typeParameters, List<Ast.Parameter> parameters,
                             Ast.TypeNode returnType) {
    }

    private Ast.Expression tryArrowFunction(int start) {
        Token t = peek();
        boolean async = false;
        int offset = 0;
        if (t.isWord("async") && !peek(1).newlineBefore()
                && (peek(1).isPunct("(") || peek(1).isPunct("<") || (isIdentifierToken(peek(1)) && peek(2).isPunct("=>")))) {
            async = true;
            offset = 1;
        }
        Token head = peek(offset);

        if (isIdentifierToken(head) && peek(offset + 1).isPunct("=>") && !peek(offset + 1).newlineBefore()) {
            if (async) {
                next();
            }
            Token id = next();
            Ast.Identifier param = new Ast.Identifier(new Span(id.start(), id.end()), id.text());
            next();
            Ast.Parameter parameter = new Ast.Parameter(param.span(), param, null, null, false, false, Set.of());
            Ast.Node body = parseArrowBody();
            return new Ast.ArrowFunction(spanFrom(start), List.of(), List.of(parameter), null, body, async);
        }

        if (!head.isPunct("(") && !head.isPunct("<")) {
            return null;
        }
        final boolean isAsync = async;
        ArrowHead arrowHead = tryParse(() -> {
            if (isAsync) {
                next();
            }
            List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
            List<Ast.Parameter> parameters = parseParameters();
            Ast.TypeNode returnType = null;
            if (eatPunct(":")) {
                returnType = parseReturnType();
            }
            if (!atPunct("=>") || peek().newlineBefore()) {
                throw error("'=>' expected.", peek());
            }
            next();
            return new ArrowHead(typeParameters, parameters, returnType);
        });
        if (arrowHead == null) {
            return null;
        }
        Ast.Node body = parseArrowBody();
        return new Ast.ArrowFunction(spanFrom(start), arrowHead.typeParameters(), arrowHead.parameters(),
                arrowHead.returnType(), body, async);
    }

    private Ast.Node parseArrowBody() {
        if (atPunct("{")) {
            return allowIn(this::parseBlock);
        }
        return parseAssignment();
    }

    private Ast.Expression parseConditional() {
        int start = peek().start();
        Ast.Expression test = parseBinary(0);
        if (!atPunct("?")) {
            return test;
        }
        next();
        Ast.Expression consequent = allowIn(this::parseAssignment);
        expectPunct(":");
        Ast.Expression alternate = parseAssignment();
        return new Ast.ConditionalExpression(spanFrom(start), test, consequent, alternate);
    }

    private Ast.Expression parseBinary(int minPrecedence) {
        int start = peek().start();
        Ast.Expression left = parseUnary();
        while (true) {
            Token t = peek();
            String op;
            int count = 1;
            String greater = greaterOperator();
            if (greater != null) {
                if (ASSIGNMENT_OPERATORS.contains(greater)) {
                    return left;
                }
                op = greater;
                count = greaterTokenCount(greater);
            } else if (t.kind() == TokenKind.PUNCTUATOR) {
                op = t.text();
            } else if (t.kind() == TokenKind.IDENTIFIER) {
                op = t.text();
                if (op.equals("in") && noIn) {
                    return left;
                }
                if ((op.equals("as") || op.equals("satisfies")) && t.newlineBefore()) {
                    return left;
                }
                if (!op.equals("in") && !op.equals("instanceof") && !op.equals("as") && !op.equals("satisfies")) {
                    return left;
                }
            } else {
                return left;
            }
            Integer precedence = BINARY_PRECEDENCE.get(op);
            if (precedence == null || precedence <= minPrecedence) {
                return left;
            }
            for (int i = 0; i < count; i++) {
                next();
            }
            if (op.equals("as") || op.equals("satisfies")) {
                Ast.TypeNode type;
                if (atWord("const")) {
                    Token c = next();
                    type = new Ast.KeywordType(new Span(c.start(), c.end()), "const");
                } else {
                    type = parseType();
                }
                left = new Ast.AsExpression(spanFrom(start), left, type, op.equals("satisfies"));
                continue;
            }
            Ast.Expression right = op.equals("**") ? parseBinary(precedence - 1) : parseBinary(precedence);
            left = new Ast.BinaryExpression(spanFrom(start), op, left, right);
        }
    }

    private Ast.Expression parseUnary() {
        Token t = peek();
        int start = t.start();
        if (t.kind() == TokenKind.PUNCTUATOR) {
            switch (t.text()) {
                case "!", "-", "+", "~", "++", "--" -> {
                    next();
                    Ast.Expression argument = parseUnary();
                    return new Ast.UnaryExpression(spanFrom(start), t.text(), argument);
                }
                default -> {
                    // не унарный оператор
                }
            }
        } else if (t.kind() == TokenKind.IDENTIFIER) {
            switch (t.text()) {
                case "typeof", "void", "delete" -> {
                    next();
                    Ast.Expression argument = parseUnary();
                    return new Ast.UnaryExpression(spanFrom(start), t.text(), argument);
                }
                case "await" -> {
                    Token n = peek(1);
                    boolean operand = !(n.kind() == TokenKind.EOF || n.isPunct(")") || n.isPunct(";")
                            || n.isPunct(",") || n.isPunct("]") || n.isPunct("}") || n.isPunct("=")
                            || n.isPunct(".") || n.isPunct(":"));
                    if (operand) {
                        next();
                        Ast.Expression argument = parseUnary();
                        return new Ast.AwaitExpression(spanFrom(start), argument);
                    }
                }
                default -> {
                    // не унарный оператор
                }
            }
        }
        Ast.Expression expression = parseLeftHandSide();
        if ((atPunct("++") || atPunct("--")) && !peek().newlineBefore()) {
            String op = next().text();
            return new Ast.PostfixExpression(spanFrom(start), op, expression);
        }
        return expression;
    }

    private Ast.Expression parseLeftHandSide() {
        int start = peek().start();
        Ast.Expression expression = atWord("new") ? parseNew() : parsePrimary();
        return parseCallTail(start, expression, true);
    }

    private Ast.Expression parseNew() {
        int start = next().start();
        if (eatPunct(".")) {
            String property = next().text();
            Ast.Identifier meta = new Ast.Identifier(new Span(start, start + 3), "new");
            return new Ast.MemberExpression(spanFrom(start), meta, property, false);
        }
        int calleeStart = peek().start();
        Ast.Expression callee = atWord("new") ? parseNew() : parsePrimary();
        callee = parseCallTail(calleeStart, callee, false);
        List<Ast.TypeNode> typeArguments = List.of();
        if (atPunct("<")) {
            List<Ast.TypeNode> parsed = tryParse(this::parseTypeArguments);
            if (parsed != null) {
                typeArguments = parsed;
            }
        }
        List<Ast.Expression> arguments = atPunct("(") ? parseArguments() : List.of();
        return new Ast.NewExpression(spanFrom(start), callee, typeArguments, arguments);
    }

    private List<Ast.Expression> parseArguments() {
        expectPunct("(");
        return allowIn(() -> {
            List<Ast.Expression> out = new ArrayList<>();
            while (!eatPunct(")")) {
                int argStart = peek().start();
                if (eatPunct("...")) {
                    Ast.Expression argument = parseAssignment();
                    out.add(new Ast.SpreadElement(spanFrom(argStart), argument));
                } else {
                    out.add(parseAssignment());
                }
                if (!atPunct(")")) {
                    expectPunct(",");
                }
            }
            return out;
        });
    }

    private Ast.Expression parseCallTail(int start, Ast.Expression expression, boolean allowCalls) {
        Ast.Expression e = expression;
        while (true) {
            Token t = peek();
            if (t.isPunct(".")) {
                next();
                Token name = next();
                if (name.kind() != TokenKind.IDENTIFIER && name.kind() != TokenKind.PRIVATE_NAME) {
                    throw error("Identifier expected.", name);
                }
                e = new Ast.MemberExpression(spanFrom(start), e, name.text(), false);
            } else if (t.isPunct("?.")) {
                if (!allowCalls) {
                    return e;
                }
                next();
                if (atPunct("(")) {
                    List<Ast.Expression> args = parseArguments();
                    e = new Ast.CallExpression(spanFrom(start), e, List.of(), args, true);
                } else if (eatPunct("[")) {
                    Ast.Expression index = allowIn(this::parseExpression);
                    expectPunct("]");
                    e = new Ast.ElementAccess(spanFrom(start), e, index, true);
                } else {
                    Token name = next();
                    if (name.kind() != TokenKind.IDENTIFIER && name.kind() != TokenKind.PRIVATE_NAME) {
                        throw error("Identifier expected.", name);
                    }
                    e = new Ast.MemberExpression(spanFrom(start), e, name.text(), true);
                }
            } else if (t.isPunct("[")) {
                next();
                Ast.Expression index = allowIn(this::parseExpression);
                expectPunct("]");
                e = new Ast.ElementAccess(spanFrom(start), e, index, false);
            } else if (t.isPunct("!") && !t.newlineBefore()) {
                next();
                e = new Ast.NonNullExpression(spanFrom(start), e);
            } else if (allowCalls && t.isPunct("(")) {
                List<Ast.Expression> args = parseArguments();
                e = new Ast.CallExpression(spanFrom(start), e, List.of(), args, false);
            } else if (t.kind() == TokenKind.TEMPLATE || t.kind() == TokenKind.TEMPLATE_HEAD) {
                Ast.TemplateLiteral quasi = parseTemplate();
                e = new Ast.TaggedTemplate(spanFrom(start), e, List.of(), quasi);
            } else if (allowCalls && t.isPunct("<") && !t.newlineBefore()) {
                List<Ast.TypeNode> typeArguments = tryParse(() -> {
                    List<Ast.TypeNode> parsed = parseTypeArguments();
                    if (!atPunct("(") && peek().kind() != TokenKind.TEMPLATE && peek().kind() != TokenKind.TEMPLATE_HEAD) {
                        throw error("'(' expected.", peek());
                    }
                    return parsed;
                });
                if (typeArguments == null) {
                    return e;
                }
                if (atPunct("(")) {
                    List<Ast.Expression> args = parseArguments();
                    e = new Ast.CallExpression(spanFrom(start), e, typeArguments, args, false);
                } else {
                    Ast.TemplateLiteral quasi = parseTemplate();
                    e = new Ast.TaggedTemplate(spanFrom(start), e, typeArguments, quasi);
                }
            } else {
                return e;
            }
        }
    }

    private Ast.Expression parsePrimary() {
        Token t = peek();
        int start = t.start();
        switch (t.kind()) {
            case NUMBER -> {
                next();
                return new Ast.Literal(spanFrom(start), Ast.LiteralKind.NUMBER, t.value(), t.text());
            }
            case BIGINT -> {
                next();
                return new Ast.Literal(spanFrom(start), Ast.LiteralKind.BIGINT, t.value(), t.text());
            }
            case STRING -> {
                next();
                return new Ast.Literal(spanFrom(start), Ast.LiteralKind.STRING, t.value(), t.text());
            }
            case REGEX -> {
                next();
                return new Ast.Literal(spanFrom(start), Ast.LiteralKind.REGEX, t.value(), t.text());
            }
            case TEMPLATE, TEMPLATE_HEAD -> {
                return parseTemplate();
            }
            case PRIVATE_NAME -> {
                next();
                return new Ast.Identifier(spanFrom(start), t.text());
            }
            case PUNCTUATOR -> {
                return parsePunctuatorPrimary(t);
            }
            case IDENTIFIER -> {
                return parseWordPrimary(t);
            }
            default -> throw unexpected();
        }
    }

    private Ast.Expression parsePunctuatorPrimary(Token t) {
        int start = t.start();
        switch (t.text()) {
            case "(" -> {
                next();
                Ast.Expression inner = allowIn(this::parseExpression);
                expectPunct(")");
                return new Ast.ParenthesizedExpression(spanFrom(start), inner);
            }
            case "[" -> {
                return parseArrayLiteral();
            }
            case "{" -> {
                return parseObjectLiteral();
            }
            case "@" -> {
                skipDecorators();
                return parsePrimary();
            }
            default -> throw error("Expression expected.", t);
        }
    }

    private Ast.Expression parseWordPrimary(Token t) {
        int start = t.start();
        switch (t.text()) {
            case "this" -> {
                next();
                return new Ast.ThisExpression(spanFrom(start));
            }
            case "super" -> {
                next();
                return new Ast.SuperExpression(spanFrom(start));
            }
            case "null" -> {
                next();
                return new Ast.Literal(spanFrom(start), Ast.LiteralKind.NULL, null, "null");
            }
            case "true", "false" -> {
                next();
                return new Ast.Literal(spanFrom(start), Ast.LiteralKind.BOOLEAN, Boolean.valueOf(t.text()), t.text());
            }
            case "function" -> {
                return parseFunctionExpression(start, false);
            }
            case "async" -> {
                if (peek(1).isWord("function") && !peek(1).newlineBefore()) {
                    next();
                    return parseFunctionExpression(start, true);
                }
                next();
                return new Ast.Identifier(spanFrom(start), "async");
            }
            case "class" -> {
                return parseClass(start, false, new LinkedHashSet<>());
            }
            case "import" -> {
                next();
                if (eatPunct(".")) {
                    expectWord("meta");
                    return new Ast.ImportCall(spanFrom(start), List.of(), true);
                }
                List<Ast.Expression> args = parseArguments();
                return new Ast.ImportCall(spanFrom(start), args, false);
            }
            default -> {
                if (RESERVED.contains(t.text())) {
                    throw error("Expression expected.", t);
                }
                next();
                return new Ast.Identifier(spanFrom(start), t.text());
            }
        }
    }

    private Ast.FunctionExpression parseFunctionExpression(int start, boolean async) {
        expectWord("function");
        boolean generator = eatPunct("*");
        String name = isIdentifierToken(peek()) ? next().text() : null;
        List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
        List<Ast.Parameter> parameters = parseParameters();
        Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
        Ast.Block body = allowIn(this::parseBlock);
        return new Ast.FunctionExpression(spanFrom(start), name, typeParameters, parameters, returnType, body,
                async, generator);
    }

    private Ast.TemplateLiteral parseTemplate() {
        Token t = next();
        int start = t.start();
        List<String> quasis = new ArrayList<>();
        List<Ast.Expression> expressions = new ArrayList<>();
        quasis.add(t.stringValue());
        if (t.kind() == TokenKind.TEMPLATE) {
            return new Ast.TemplateLiteral(spanFrom(start), quasis, expressions);
        }
        while (true) {
            expressions.add(allowIn(this::parseExpression));
            Token part = next();
            if (part.kind() == TokenKind.TEMPLATE_MIDDLE) {
                quasis.add(part.stringValue());
            } else if (part.kind() == TokenKind.TEMPLATE_TAIL) {
                quasis.add(part.stringValue());
                return new Ast.TemplateLiteral(spanFrom(start), quasis, expressions);
            } else {
                throw error("'}' expected.", part);
            }
        }
    }

    private Ast.ArrayLiteral parseArrayLiteral() {
        int start = expectPunct("[").start();
        return allowIn(() -> {
            List<Ast.Expression> elements = new ArrayList<>();
            while (!eatPunct("]")) {
                int elStart = peek().start();
                if (atPunct(",")) {
                    next();
                    elements.add(new Ast.OmittedExpression(spanFrom(elStart)));
                    continue;
                }
                if (atEof()) {
                    throw error("']' expected.", peek());
                }
                if (eatPunct("...")) {
                    Ast.Expression argument = parseAssignment();
                    elements.add(new Ast.SpreadElement(spanFrom(elStart), argument));
                } else {
                    elements.add(parseAssignment());
                }
                if (!atPunct("]")) {
                    expectPunct(",");
                }
            }
            return new Ast.ArrayLiteral(spanFrom(start), elements);
        });
    }

    private Ast.ObjectLiteral parseObjectLiteral() {
        int start = expectPunct("{").start();
        return allowIn(() -> {
            List<Ast.Node> properties = new ArrayList<>();
            while (!eatPunct("}")) {
                if (atEof()) {
                    throw error("'}' expected.", peek());
                }
                properties.add(parseObjectMember());
                if (!atPunct("}")) {
                    expectPunct(",");
                }
            }
            return new Ast.ObjectLiteral(spanFrom(start), properties);
        });
    }

    private Ast.Node parseObjectMember() {
        int start = peek().start();
        if (eatPunct("...")) {
            Ast.Expression argument = parseAssignment();
            return new Ast.SpreadElement(spanFrom(start), argument);
        }

        boolean async = false;
        boolean generator = false;
        String kind = "method";
        if (atWord("async") && isPropertyNameStartOrStar(peek(1)) && !peek(1).newlineBefore()) {
            next();
            async = true;
        }
        if (eatPunct("*")) {
            generator = true;
        }
        if ((atWord("get") || atWord("set")) && isPropertyNameStart(peek(1))) {
            kind = next().text();
        }

        Token keyToken = peek();
        PropertyName key = parsePropertyName();

        if (atPunct("(") || atPunct("<")) {
            List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
            List<Ast.Parameter> parameters = parseParameters();
            Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
            Ast.Block body = parseBlock();
            return new Ast.MethodDeclaration(spanFrom(start), key.name(), key.computed(), Set.of(), kind,
                    typeParameters, parameters, returnType, body, async, generator, false);
        }
        if (eatPunct(":")) {
            Ast.Expression value = parseAssignment();
            return new Ast.PropertyAssignment(spanFrom(start), key.name(), key.computed(), value);
        }
        if (keyToken.kind() != TokenKind.IDENTIFIER || key.computed() != null) {
            throw error("':' expected.", peek());
        }
        Ast.Identifier name = new Ast.Identifier(new Span(keyToken.start(), keyToken.end()), key.name());
        Ast.Expression defaultValue = eatPunct("=") ? parseAssignment() : null;
        return new Ast.ShorthandProperty(spanFrom(start), name, defaultValue);
    }

    private boolean isPropertyNameStartOrStar(Token t) {
        return isPropertyNameStart(t) || t.isPunct("*");
    }

    // ---------------------------------------------------------------- типы

    private List<Ast.TypeNode> parseTypeArguments() {
        expectPunct("<");
        List<Ast.TypeNode> out = new ArrayList<>();
        while (!eatPunct(">")) {
            out.add(parseType());
            if (!atPunct(">")) {
                expectPunct(",");
            }
        }
        return out;
    }

    private Ast.TypeNode parseReturnType() {
        int start = peek().start();
        if (atWord("asserts") && (isIdentifierToken(peek(1)) || peek(1).isWord("this")) && !peek(1).newlineBefore()) {
            next();
            String name = next().text();
            Ast.TypeNode type = eatWord("is") ? parseType() : null;
            return new Ast.TypePredicate(spanFrom(start), name, type, true);
        }
        if ((isIdentifierToken(peek()) || atWord("this")) && peek(1).isWord("is") && !peek(1).newlineBefore()) {
            String name = next().text();
            next();
            Ast.TypeNode type = parseType();
            return new Ast.TypePredicate(spanFrom(start), name, type, false);
        }
        return parseType();
    }

    private Ast.TypeNode parseType() {
        int start = peek().start();
        if (atPunct("<")) {
            return parseFunctionType(start, false);
        }
        if (atWord("abstract") && peek(1).isWord("new")) {
            next();
        }
        if (atWord("new") && (peek(1).isPunct("(") || peek(1).isPunct("<"))) {
            next();
            return parseFunctionType(start, true);
        }
        if (atPunct("(")) {
            Ast.TypeNode fn = tryParse(() -> parseFunctionType(start, false));
            if (fn != null) {
                return fn;
            }
        }
        Ast.TypeNode type = parseUnionType();
        if (atWord("extends") && !peek().newlineBefore()) {
            next();
            Ast.TypeNode extendsType = parseUnionType();
            expectPunct("?");
            Ast.TypeNode trueType = parseType();
            expectPunct(":");
            Ast.TypeNode falseType = parseType();
            return new Ast.ConditionalType(spanFrom(start), type, extendsType, trueType, falseType);
        }
        return type;
    }

    private Ast.TypeNode parseFunctionType(int start, boolean construct) {
        List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
        List<Ast.Parameter> parameters = parseParameters();
        expectPunct("=>");
        Ast.TypeNode returnType = parseReturnType();
        return new Ast.FunctionType(spanFrom(start), typeParameters, parameters, returnType, construct);
    }

    private Ast.TypeNode parseUnionType() {
        int start = peek().start();
        eatPunct("|");
        Ast.TypeNode first = parseIntersectionType();
        if (!atPunct("|")) {
            return first;
        }
        List<Ast.TypeNode> types = new ArrayList<>();
        types.add(first);
        while (eatPunct("|")) {
            types.add(parseIntersectionType());
        }
        return new Ast.UnionType(spanFrom(start), types);
    }

    private Ast.TypeNode parseIntersectionType() {
        int start = peek().start();
        eatPunct("&");
        Ast.TypeNode first = parseTypeOperator();
        if (!atPunct("&")) {
            return first;
        }
        List<Ast.TypeNode> types = new ArrayList<>();
        types.add(first);
        while (eatPunct("&")) {
            types.add(parseTypeOperator());
        }
        return new Ast.IntersectionType(spanFrom(start), types);
    }

    private Ast.TypeNode parseTypeOperator() {
        int start = peek().start();
        if ((atWord("keyof") || atWord("unique") || atWord("readonly")) && !peek(1).isPunct(")")
                && !peek(1).isPunct(",") && !peek(1).isPunct(">") && !peek(1).isPunct(";")) {
            String op = next().text();
            Ast.TypeNode type = parseTypeOperator();
            return new Ast.TypeOperator(spanFrom(start), op, type);
        }
        if (atWord("infer") && peek(1).kind() == TokenKind.IDENTIFIER) {
            next();
            String name = next().text();
            return new Ast.InferType(spanFrom(start), name);
        }
        return parsePostfixType();
    }

    private Ast.TypeNode parsePostfixType() {
        int start = peek().start();
        Ast.TypeNode type = parsePrimaryType();
        while (atPunct("[") && !peek().newlineBefore()) {
            next();
            if (eatPunct("]")) {
                type = new Ast.ArrayType(spanFrom(start), type);
            } else {
                Ast.TypeNode index = parseType();
                expectPunct("]");
                type = new Ast.IndexedAccessType(spanFrom(start), type, index);
            }
        }
        return type;
    }

    private Ast.TypeNode parsePrimaryType() {
        Token t = peek();
        int start = t.start();
        switch (t.kind()) {
            case STRING -> {
                next();
                return new Ast.LiteralType(spanFrom(start), t.value(), t.text());
            }
            case NUMBER, BIGINT -> {
                next();
                return new Ast.LiteralType(spanFrom(start), t.value(), t.text());
            }
            case TEMPLATE -> {
                next();
                return new Ast.LiteralType(spanFrom(start), t.value(), t.text());
            }
            case TEMPLATE_HEAD -> {
                next();
                while (true) {
                    parseType();
                    Token part = next();
                    if (part.kind() == TokenKind.TEMPLATE_TAIL) {
                        break;
                    }
                    if (part.kind() != TokenKind.TEMPLATE_MIDDLE) {
                        throw error("'}' expected.", part);
                    }
                }
                return new Ast.TemplateLiteralType(spanFrom(start), src.substring(start, lastEnd()));
            }
            case PUNCTUATOR -> {
                return parsePunctuatorType(t);
            }
            case IDENTIFIER -> {
                return parseWordType(t);
            }
            default -> throw error("Type expected.", t);
        }
    }

    private Ast.TypeNode parsePunctuatorType(Token t) {
        int start = t.start();
        switch (t.text()) {
            case "(" -> {
                next();
                Ast.TypeNode inner = parseType();
                expectPunct(")");
                return inner;
            }
            case "{" -> {
                if (isMappedTypeStart()) {
                    return parseMappedType();
                }
                List<Ast.TypeMember> members = parseTypeMembers();
                return new Ast.TypeLiteral(spanFrom(start), members);
            }
            case "[" -> {
                return parseTupleType();
            }
            case "-" -> {
                next();
                Token n = next();
                if (n.kind() != TokenKind.NUMBER && n.kind() != TokenKind.BIGINT) {
                    throw error("Type expected.", n);
                }
                return new Ast.LiteralType(spanFrom(start), -((Double) n.value()), "-" + n.text());
            }
            default -> throw error("Type expected.", t);
        }
    }

    private Ast.TypeNode parseWordType(Token t) {
        int start = t.start();
        String word = t.text();
        if (word.equals("true") || word.equals("false")) {
            next();
            return new Ast.LiteralType(spanFrom(start), Boolean.valueOf(word), word);
        }
        if (TYPE_KEYWORDS.contains(word) && !peek(1).isPunct(".")) {
            next();
            return new Ast.KeywordType(spanFrom(start), word);
        }
        if (word.equals("this")) {
            next();
            return new Ast.KeywordType(spanFrom(start), "this");
        }
        if (word.equals("typeof")) {
            next();
            if (atWord("import")) {
                return parseImportType(start);
            }
            StringBuilder name = new StringBuilder(next().text());
            while (atPunct(".") && peek(1).kind() == TokenKind.IDENTIFIER) {
                next();
                name.append('.').append(next().text());
            }
            if (atPunct("<") && !peek().newlineBefore()) {
                parseTypeArguments();
            }
            return new Ast.TypeQuery(spanFrom(start), name.toString());
        }
        if (word.equals("import") && peek(1).isPunct("(")) {
            return parseImportType(start);
        }
        return parseTypeReference();
    }

    private Ast.TypeNode parseImportType(int start) {
        expectWord("import");
        expectPunct("(");
        String module = next().stringValue();
        expectPunct(")");
        StringBuilder qualifier = new StringBuilder();
        while (eatPunct(".")) {
            if (qualifier.length() > 0) {
                qualifier.append('.');
            }
            qualifier.append(next().text());
        }
        List<Ast.TypeNode> typeArguments = atPunct("<") ? parseTypeArguments() : List.of();
        return new Ast.ImportType(spanFrom(start), module, qualifier.length() == 0 ? null : qualifier.toString(),
                typeArguments);
    }

    private Ast.TypeReference parseTypeReference() {
        int start = peek().start();
        Token first = next();
        if (first.kind() != TokenKind.IDENTIFIER) {
            throw error("Type expected.", first);
        }
        StringBuilder name = new StringBuilder(first.text());
        while (atPunct(".") && peek(1).kind() == TokenKind.IDENTIFIER) {
            next();
            name.append('.').append(next().text());
        }
        List<Ast.TypeNode> typeArguments = List.of();
        if (atPunct("<") && !peek().newlineBefore()) {
            typeArguments = parseTypeArguments();
        }
        return new Ast.TypeReference(spanFrom(start), name.toString(), typeArguments);
    }

    private Ast.TypeNode parseTupleType() {
        int start = expectPunct("[").start();
        List<Ast.TypeNode> elements = new ArrayList<>();
        while (!eatPunct("]")) {
            eatPunct("...");
            if (peek().kind() == TokenKind.IDENTIFIER
                    && (peek(1).isPunct(":") || (peek(1).isPunct("?") && peek(2).isPunct(":")))) {
                next();
                eatPunct("?");
                next();
            }
            Ast.TypeNode element = parseType();
            eatPunct("?");
            elements.add(element);
            if (!atPunct("]")) {
                expectPunct(",");
            }
        }
        return new Ast.TupleType(spanFrom(start), elements);
    }

    private boolean isMappedTypeStart() {
        int i = 1;
        if (peek(i).isPunct("+") || peek(i).isPunct("-")) {
            i++;
        }
        if (peek(i).isWord("readonly")) {
            i++;
        }
        return peek(i).isPunct("[") && peek(i + 1).kind() == TokenKind.IDENTIFIER && peek(i + 2).isWord("in");
    }

    private Ast.TypeNode parseMappedType() {
        int start = expectPunct("{").start();
        if (!eatPunct("+")) {
            eatPunct("-");
        }
        eatWord("readonly");
        expectPunct("[");
        String key = next().text();
        expectWord("in");
        Ast.TypeNode constraint = parseType();
        if (eatWord("as")) {
            parseType();
        }
        expectPunct("]");
        if (!eatPunct("+")) {
            eatPunct("-");
        }
        eatPunct("?");
        Ast.TypeNode valueType = eatPunct(":") ? parseType() : null;
        eatPunct(";");
        eatPunct(",");
        expectPunct("}");
        return new Ast.MappedType(spanFrom(start), key, constraint, valueType);
    }

    private List<Ast.TypeMember> parseTypeMembers() {
        expectPunct("{");
        List<Ast.TypeMember> members = new ArrayList<>();
        while (!eatPunct("}")) {
            if (atEof()) {
                throw error("'}' expected.", peek());
            }
            members.add(parseTypeMember());
            if (!eatPunct(";") && !eatPunct(",") && !atPunct("}") && !peek().newlineBefore()) {
                throw error("';' expected.", peek());
            }
        }
        return members;
    }

    private Ast.TypeMember parseTypeMember() {
        int start = peek().start();
        String doc = peek().docComment();

        if (atPunct("(") || atPunct("<")) {
            List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
            List<Ast.Parameter> parameters = parseParameters();
            Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
            return new Ast.CallSignature(spanFrom(start), typeParameters, parameters, returnType, false);
        }
        if (atWord("new") && (peek(1).isPunct("(") || peek(1).isPunct("<"))) {
            next();
            List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
            List<Ast.Parameter> parameters = parseParameters();
            Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
            return new Ast.CallSignature(spanFrom(start), typeParameters, parameters, returnType, true);
        }

        boolean readonly = false;
        if (atWord("readonly") && isPropertyNameStart(peek(1)) && !peek(1).newlineBefore()) {
            next();
            readonly = true;
        }
        if (atPunct("[") && peek(1).kind() == TokenKind.IDENTIFIER && peek(2).isPunct(":")) {
            return parseIndexSignature(start);
        }
        if ((atWord("get") || atWord("set")) && isPropertyNameStart(peek(1)) && !peek(1).newlineBefore()) {
            next();
        }
        PropertyName key = parsePropertyName();
        boolean optional = eatPunct("?");
        if (atPunct("(") || atPunct("<")) {
            List<Ast.TypeParameter> typeParameters = parseTypeParametersOpt();
            List<Ast.Parameter> parameters = parseParameters();
            Ast.TypeNode returnType = eatPunct(":") ? parseReturnType() : null;
            return new Ast.MethodSignature(spanFrom(start), key.name(), typeParameters, parameters, returnType,
                    optional);
        }
        Ast.TypeNode type = eatPunct(":") ? parseType() : null;
        return new Ast.PropertySignature(spanFrom(start), key.name(), type, optional, readonly, doc);
    }

    private Ast.IndexSignature parseIndexSignature(int start) {
        expectPunct("[");
        String keyName = next().text();
        expectPunct(":");
        Ast.TypeNode keyType = parseType();
        expectPunct("]");
        eatPunct("?");
        Ast.TypeNode valueType = eatPunct(":") ? parseType() : null;
        return new Ast.IndexSignature(spanFrom(start), keyName, keyType, valueType);
    }
}
