package de.entwicklertraining.memory.client;

import org.json.JSONException;

/**
 * Checks text against the JSON grammar of RFC 8259 before org.json builds the value.
 * <p>
 * {@link org.json.JSONTokener} tolerates unquoted keys and values, single quotes,
 * trailing commas and comments. This validator rejects all of them.
 */
final class StrictJsonValidator {

    static final int MAX_DEPTH = 512;

    private final String text;
    private int pos;

    private StrictJsonValidator(String text) {
        this.text = text;
    }

    /**
     * Validates that the text is exactly one JSON value, optionally surrounded by whitespace.
     *
     * @param text the text to check
     * @throws JSONException naming the offset of the first violation
     */
    static void validate(String text) {
        StrictJsonValidator validator = new StrictJsonValidator(text);
        validator.skipWhitespace();
        validator.value(0);
        validator.skipWhitespace();
        if (validator.pos != text.length()) {
            throw validator.error("Unexpected trailing content");
        }
    }

    private void value(int depth) {
        if (pos >= text.length()) {
            throw error("Unexpected end of text");
        }
        char c = text.charAt(pos);
        switch (c) {
            case '{':
                object(depth + 1);
                break;
            case '[':
                array(depth + 1);
                break;
            case '"':
                string();
                break;
            case 't':
                literal("true");
                break;
            case 'f':
                literal("false");
                break;
            case 'n':
                literal("null");
                break;
            default:
                if (c == '-' || isDigit(c)) {
                    number();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
        }
    }

    private void object(int depth) {
        checkDepth(depth);
        pos++;
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            return;
        }
        while (true) {
            if (peek() != '"') {
                throw error("Expected a quoted member name");
            }
            string();
            skipWhitespace();
            expect(':');
            skipWhitespace();
            value(depth);
            skipWhitespace();
            char c = peek();
            pos++;
            if (c == '}') {
                return;
            }
            if (c != ',') {
                pos--;
                throw error("Expected ',' or '}'");
            }
            skipWhitespace();
        }
    }

    private void array(int depth) {
        checkDepth(depth);
        pos++;
        skipWhitespace();
        if (peek() == ']') {
            pos++;
            return;
        }
        while (true) {
            value(depth);
            skipWhitespace();
            char c = peek();
            pos++;
            if (c == ']') {
                return;
            }
            if (c != ',') {
                pos--;
                throw error("Expected ',' or ']'");
            }
            skipWhitespace();
        }
    }

    private void checkDepth(int depth) {
        if (depth > MAX_DEPTH) {
            throw error("Nesting deeper than " + MAX_DEPTH);
        }
    }

    private void string() {
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return;
            }
            if (c < 0x20) {
                pos--;
                throw error("Unescaped control character in string");
            }
            if (c == '\\') {
                escape();
            }
        }
        throw error("Unterminated string");
    }

    private void escape() {
        if (pos >= text.length()) {
            throw error("Unterminated escape");
        }
        char c = text.charAt(pos++);
        switch (c) {
            case '"':
            case '\\':
            case '/':
            case 'b':
            case 'f':
            case 'n':
            case 'r':
            case 't':
                return;
            case 'u':
                for (int i = 0; i < 4; i++) {
                    if (pos >= text.length() || !isHexDigit(text.charAt(pos))) {
                        throw error("Invalid unicode escape");
                    }
                    pos++;
                }
                return;
            default:
                pos--;
                throw error("Invalid escape '\\" + c + "'");
        }
    }

    private void number() {
        if (peek() == '-') {
            pos++;
        }
        if (peek() == '0') {
            pos++;
        } else if (isDigit(peek())) {
            digits();
        } else {
            throw error("Invalid number");
        }
        if (peek() == '.') {
            pos++;
            if (!isDigit(peek())) {
                throw error("Expected digits after decimal point");
            }
            digits();
        }
        if (peek() == 'e' || peek() == 'E') {
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (!isDigit(peek())) {
                throw error("Expected digits in exponent");
            }
            digits();
        }
    }

    private void digits() {
        while (isDigit(peek())) {
            pos++;
        }
    }

    private void literal(String word) {
        if (!text.startsWith(word, pos)) {
            throw error("Unexpected word");
        }
        pos += word.length();
    }

    private void expect(char c) {
        if (peek() != c) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return;
            }
            pos++;
        }
    }

    // 0 marks the end of the text
    private char peek() {
        return pos < text.length() ? text.charAt(pos) : 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private JSONException error(String message) {
        return new JSONException(message + " at offset " + pos);
    }
}
