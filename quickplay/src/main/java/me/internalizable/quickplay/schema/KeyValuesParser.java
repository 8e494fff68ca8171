package me.internalizable.quickplay.schema;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parser for KeyValues (VDF) text, the format of the game schema document.
 *
 * <p>Produces nested ordered maps whose values are either {@link String}
 * or {@code Map<String, Object>}. Repeated keys holding blocks are merged;
 * a repeated scalar key keeps the last value. Line comments and platform
 * conditionals ({@code [$WIN32]}) are skipped.</p>
 */
public final class KeyValuesParser {

    private final String text;
    private int pos;
    private int line = 1;

    private KeyValuesParser(String text) {
        this.text = text;
    }

    /**
     * Parse a KeyValues document.
     *
     * @param text document text
     * @return top level key/value map
     * @throws ParseException if the text is malformed
     */
    @Nonnull
    public static Map<String, Object> parse(@Nonnull String text) throws ParseException {
        Objects.requireNonNull(text, "text");
        return new KeyValuesParser(text).parseDocument();
    }

    private Map<String, Object> parseDocument() throws ParseException {
        Map<String, Object> root = new LinkedHashMap<>();
        Deque<Map<String, Object>> stack = new ArrayDeque<>();
        stack.push(root);

        while (true) {
            String key = nextToken();
            if (key == null) {
                break;
            }
            if (key.equals("}")) {
                if (stack.size() == 1) {
                    throw new ParseException("Unbalanced '}'", line);
                }
                stack.pop();
                continue;
            }
            if (key.equals("{")) {
                throw new ParseException("Block without a key", line);
            }

            String value = nextToken();
            if (value == null) {
                throw new ParseException("Missing value for key '" + key + "'", line);
            }
            if (value.equals("{")) {
                Map<String, Object> child = childBlock(stack.peek(), key);
                stack.push(child);
            } else if (value.equals("}")) {
                throw new ParseException("Missing value for key '" + key + "'", line);
            } else {
                stack.peek().put(key, value);
            }
        }

        if (stack.size() != 1) {
            throw new ParseException("Unterminated block", line);
        }
        return root;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> childBlock(Map<String, Object> parent, String key) {
        Object existing = parent.get(key);
        if (existing instanceof Map) {
            return (Map<String, Object>) existing;
        }
        Map<String, Object> child = new LinkedHashMap<>();
        parent.put(key, child);
        return child;
    }

    private String nextToken() throws ParseException {
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                return null;
            }
            char c = text.charAt(pos);
            if (c == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '/') {
                skipLine();
                continue;
            }
            if (c == '[') {
                skipConditional();
                continue;
            }
            if (c == '{' || c == '}') {
                pos++;
                return String.valueOf(c);
            }
            if (c == '"') {
                return readQuoted();
            }
            return readBare();
        }
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                line++;
            } else if (!Character.isWhitespace(c) && c != '\uFEFF') {
                return;
            }
            pos++;
        }
    }

    private void skipLine() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipConditional() throws ParseException {
        int end = text.indexOf(']', pos);
        if (end < 0) {
            throw new ParseException("Unterminated conditional", line);
        }
        pos = end + 1;
    }

    private String readQuoted() throws ParseException {
        int startLine = line;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\' && pos < text.length()) {
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '\\' -> sb.append('\\');
                    case '"' -> sb.append('"');
                    default -> sb.append('\\').append(escaped);
                }
                continue;
            }
            if (c == '\n') {
                line++;
            }
            sb.append(c);
        }
        throw new ParseException("Unterminated string", startLine);
    }

    private String readBare() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == '{' || c == '}' || c == '"') {
                break;
            }
            pos++;
        }
        return text.substring(start, pos);
    }

    /**
     * Thrown when KeyValues text is malformed.
     */
    public static class ParseException extends Exception {

        private final int line;

        public ParseException(String message, int line) {
            super(message + " (line " + line + ")");
            this.line = line;
        }

        /**
         * Get the line the error was detected on.
         *
         * @return 1-based line number
         */
        public int getLine() {
            return line;
        }
    }
}
