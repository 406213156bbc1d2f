package ru.aritmos.flowanalyzer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Лексер TypeScript-подмножества, на котором пишутся flow.
 * <p>
 * Особенности:
 * <ul>
 *   <li>символ {@code >} всегда выдаётся отдельной лексемой, составные {@code >=}, {@code >>} и т.п.
 *   собирает парсер (иначе закрытие вложенных generic-аргументов неоднозначно);</li>
 *   <li>регулярное выражение отличается от деления по предыдущей значимой лексеме;</li>
 *   <li>шаблонные строки разбиваются на head/middle/tail с учётом вложенных фигурных скобок;</li>
 *   <li>JSDoc-комментарий прикрепляется к следующей лексеме.</li>
 * </ul>
 */
public final class Lexer {

    private static final String[] PUNCTUATORS = {
            "...", "===", "!==", "**=", "<<=", "&&=", "||=", "??=",
            "=>", "==", "!=", "<=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "++", "--", "<<", "&&", "||", "??", "?.", "**",
            "{", "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%",
            "&", "|", "^", "!", "~", "?", ":", "=", ".", "@"
    };

    private static final Set<String> REGEX_AFTER_WORDS = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void",
            "throw", "case", "do", "else", "yield", "await"
    );

    private final String src;
    private final LineIndex lines;
    private final List<Token> tokens = new ArrayList<>();
    // true — фигурная скобка подстановки ${ ... }, false — обычная
    private final Deque<Boolean> braces = new ArrayDeque<>();

    private int pos;
    private boolean newlineBefore;
    private String pendingDoc;

    public Lexer(String src, LineIndex lines) {
        this.src = src;
        this.lines = lines;
    }

    public List<Token> tokenize() {
        while (true) {
            skipTrivia();
            if (pos >= src.length()) {
                tokens.add(new Token(TokenKind.EOF, "", null, pos, pos, true, pendingDoc));
                return tokens;
            }
            scanToken();
        }
    }

    private void scanToken() {
        int start = pos;
        char c = src.charAt(pos);

        if (isIdentStart(c)) {
            pos++;
            while (pos < src.length() && isIdentPart(src.charAt(pos))) {
                pos++;
            }
            emit(TokenKind.IDENTIFIER, start, null);
            return;
        }
        if (c == '#' && pos + 1 < src.length() && isIdentStart(src.charAt(pos + 1))) {
            pos += 2;
            while (pos < src.length() && isIdentPart(src.charAt(pos))) {
                pos++;
            }
            emit(TokenKind.PRIVATE_NAME, start, null);
            return;
        }
        if (isDigit(c) || (c == '.' && pos + 1 < src.length() && isDigit(src.charAt(pos + 1)))) {
            scanNumber(start);
            return;
        }
        if (c == '"' || c == '\'') {
            String value = scanString(c);
            emit(TokenKind.STRING, start, value);
            return;
        }
        if (c == '`') {
            pos++;
            scanTemplate(start, true);
            return;
        }
        if (c == '}' && !braces.isEmpty() && braces.peek()) {
            braces.pop();
            pos++;
            scanTemplate(start, false);
            return;
        }
        if (c == '/' && regexAllowed()) {
            scanRegex(start);
            return;
        }
        for (String p : PUNCTUATORS) {
            if (src.startsWith(p, pos)) {
                if (p.equals("?.") && pos + 2 < src.length() && isDigit(src.charAt(pos + 2))) {
                    continue;
                }
                pos += p.length();
                if (p.equals("{")) {
                    braces.push(Boolean.FALSE);
                } else if (p.equals("}") && !braces.isEmpty()) {
                    braces.pop();
                }
                emit(TokenKind.PUNCTUATOR, start, null);
                return;
            }
        }
        throw error("Invalid character '" + c + "'", start);
    }

    private void emit(TokenKind kind, int start, Object value) {
        tokens.add(new Token(kind, src.substring(start, pos), value, start, pos, newlineBefore, pendingDoc));
        newlineBefore = false;
        pendingDoc = null;
    }

    private void skipTrivia() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
                newlineBefore = true;
                pos++;
            } else if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
                pos++;
            } else if (c == '/' && pos + 1 < src.length() && src.charAt(pos + 1) == '/') {
                while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
                    pos++;
                }
            } else if (c == '/' && pos + 1 < src.length() && src.charAt(pos + 1) == '*') {
                int end = src.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw error("'*/' expected", src.length());
                }
                String body = src.substring(pos, end + 2);
                if (body.indexOf('\n') >= 0 || body.indexOf('\r') >= 0) {
                    newlineBefore = true;
                }
                pendingDoc = body.startsWith("/**") && body.length() > 4 ? cleanDoc(body) : null;
                pos = end + 2;
            } else if (c == '#' && pos == 0 && src.startsWith("#!")) {
                while (pos < src.length() && src.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private static String cleanDoc(String raw) {
        String body = raw.substring(3, raw.length() - 2);
        StringBuilder out = new StringBuilder();
        for (String line : body.split("\\r?\\n")) {
            String l = line.strip();
            if (l.startsWith("*")) {
                l = l.substring(1).strip();
            }
            if (l.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(l);
        }
        return out.toString();
    }

    private boolean regexAllowed() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token prev = tokens.get(tokens.size() - 1);
        switch (prev.kind()) {
            case NUMBER, BIGINT, STRING, TEMPLATE, TEMPLATE_TAIL, REGEX, PRIVATE_NAME:
                return false;
            case IDENTIFIER:
                return REGEX_AFTER_WORDS.contains(prev.text());
            case PUNCTUATOR:
                String t = prev.text();
                return !(t.equals(")") || t.equals("]") || t.equals("}") || t.equals("++") || t.equals("--"));
            default:
                return true;
        }
    }

    private void scanNumber(int start) {
        char c = src.charAt(pos);
        if (c == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            char radixChar = Character.toLowerCase(src.charAt(pos + 1));
            int radix = radixChar == 'x' ? 16 : radixChar == 'o' ? 8 : 2;
            pos += 2;
            int digitsStart = pos;
            while (pos < src.length() && (Character.digit(src.charAt(pos), radix) >= 0 || src.charAt(pos) == '_')) {
                pos++;
            }
            if (pos == digitsStart) {
                throw error("Hexadecimal digit expected", pos);
            }
            String digits = src.substring(digitsStart, pos).replace("_", "");
            if (pos < src.length() && src.charAt(pos) == 'n') {
                pos++;
                emit(TokenKind.BIGINT, start, new java.math.BigInteger(digits, radix).doubleValue());
                return;
            }
            emit(TokenKind.NUMBER, start, new java.math.BigInteger(digits, radix).doubleValue());
            return;
        }
        while (pos < src.length() && (isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        if (pos < src.length() && src.charAt(pos) == 'n') {
            String digits = src.substring(start, pos).replace("_", "");
            pos++;
            emit(TokenKind.BIGINT, start, Double.parseDouble(digits));
            return;
        }
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            while (pos < src.length() && (isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < src.length() && isDigit(src.charAt(pos))) {
                while (pos < src.length() && isDigit(src.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = save;
            }
        }
        if (pos < src.length() && isIdentStart(src.charAt(pos))) {
            throw error("An identifier or keyword cannot immediately follow a numeric literal", pos);
        }
        emit(TokenKind.NUMBER, start, Double.parseDouble(src.substring(start, pos).replace("_", "")));
    }

    private String scanString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw error("Unterminated string literal", start);
            }
            char c = src.charAt(pos);
            if (c == quote) {
                pos++;
                return sb.toString();
            }
            if (c == '\n' || c == '\r') {
                throw error("Unterminated string literal", start);
            }
            if (c == '\\') {
                readEscape(sb);
            } else {
                sb.append(c);
                pos++;
            }
        }
    }

    private void scanTemplate(int start, boolean head) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw error("Unterminated template literal", start);
            }
            char c = src.charAt(pos);
            if (c == '`') {
                pos++;
                emit(head ? TokenKind.TEMPLATE : TokenKind.TEMPLATE_TAIL, start, sb.toString());
                return;
            }
            if (c == '$' && pos + 1 < src.length() && src.charAt(pos + 1) == '{') {
                pos += 2;
                braces.push(Boolean.TRUE);
                emit(head ? TokenKind.TEMPLATE_HEAD : TokenKind.TEMPLATE_MIDDLE, start, sb.toString());
                return;
            }
            if (c == '\\') {
                readEscape(sb);
            } else if (c == '\r') {
                // в шаблонах CRLF нормализуется в LF
                sb.append('\n');
                pos++;
                if (pos < src.length() && src.charAt(pos) == '\n') {
                    pos++;
                }
            } else {
                sb.append(c);
                pos++;
            }
        }
    }

    private void readEscape(StringBuilder sb) {
        pos++;
        if (pos >= src.length()) {
            throw error("Unexpected end of text", pos);
        }
        char e = src.charAt(pos);
        pos++;
        switch (e) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\u000B');
            case '0' -> sb.append('\0');
            case '\r' -> {
                if (pos < src.length() && src.charAt(pos) == '\n') {
                    pos++;
                }
            }
            case '\n' -> {
                // продолжение строки
            }
            case 'x' -> sb.append((char) readHex(2));
            case 'u' -> {
                if (pos < src.length() && src.charAt(pos) == '{') {
                    int close = src.indexOf('}', pos);
                    if (close < 0) {
                        throw error("Unterminated Unicode escape sequence", pos);
                    }
                    int cp = Integer.parseInt(src.substring(pos + 1, close), 16);
                    sb.appendCodePoint(cp);
                    pos = close + 1;
                } else {
                    sb.append((char) readHex(4));
                }
            }
            default -> sb.append(e);
        }
    }

    private int readHex(int digits) {
        if (pos + digits > src.length()) {
            throw error("Hexadecimal digit expected", pos);
        }
        String hex = src.substring(pos, pos + digits);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw error("Hexadecimal digit expected", pos + i);
            }
        }
        pos += digits;
        return Integer.parseInt(hex, 16);
    }

    private void scanRegex(int start) {
        pos++;
        boolean inClass = false;
        while (true) {
            if (pos >= src.length() || src.charAt(pos) == '\n' || src.charAt(pos) == '\r') {
                throw error("Unterminated regular expression literal", start);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                pos++;
                break;
            }
            pos++;
        }
        while (pos < src.length() && isIdentPart(src.charAt(pos))) {
            pos++;
        }
        emit(TokenKind.REGEX, start, src.substring(start, pos));
    }

    private FlowSyntaxException error(String message, int offset) {
        int at = Math.min(offset, src.length());
        return new FlowSyntaxException(message, at, lines.line(at), lines.column(at));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentPart(char c) {
        return c == '$' || c == '_' || Character.isLetterOrDigit(c) || c == '\u200C' || c == '\u200D';
    }
}
