package me.internalizable.quickplay.score;

import javax.annotation.Nonnull;

/**
 * Cleans display names before they are published.
 *
 * <p>Some hosts advertise names with backslash escapes spelled out
 * ({@code \x01}, {@code \t}). Escapes are decoded before any
 * other check, so a spelled-out marker counts as a marker. Malformed escapes
 * are kept as written.</p>
 */
public final class NameSanitizer {

    private final String markerCharacters;

    public NameSanitizer(@Nonnull String markerCharacters) {
        this.markerCharacters = markerCharacters;
    }

    /**
     * Whether the name starts with an attention-seeking marker character.
     *
     * @param name raw display name
     * @return true if a marker leads the decoded name
     */
    public boolean hasLeadingMarker(@Nonnull String name) {
        String decoded = decodeEscapes(name);
        return !decoded.isEmpty() && markerCharacters.indexOf(decoded.charAt(0)) >= 0;
    }

    /**
     * Decode escapes, then strip marker and control characters and surrounding whitespace.
     *
     * @param name raw display name
     * @return sanitized name
     */
    @Nonnull
    public String sanitize(@Nonnull String name) {
        String decoded = decodeEscapes(name);
        StringBuilder sb = new StringBuilder(decoded.length());
        for (int i = 0; i < decoded.length(); i++) {
            char ch = decoded.charAt(i);
            if (markerCharacters.indexOf(ch) >= 0 || Character.isISOControl(ch)) {
                continue;
            }
            sb.append(ch);
        }
        return sb.toString().strip();
    }

    /**
     * Decode backslash escapes: two, four and eight digit hex escapes
     * ({@code \xHH}), octal escapes and the single-character escapes.
     *
     * @param name raw display name
     * @return the decoded name
     */
    @Nonnull
    public static String decodeEscapes(@Nonnull String name) {
        if (name.indexOf('\\') < 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        int i = 0;
        while (i < name.length()) {
            char ch = name.charAt(i);
            if (ch != '\\' || i + 1 >= name.length()) {
                sb.append(ch);
                i++;
                continue;
            }
            char next = name.charAt(i + 1);
            int consumed = switch (next) {
                case 'x' -> appendHex(name, i + 2, 2, sb);
                case 'u' -> appendHex(name, i + 2, 4, sb);
                case 'U' -> appendHex(name, i + 2, 8, sb);
                case '0', '1', '2', '3', '4', '5', '6', '7' -> appendOctal(name, i + 1, sb);
                default -> appendSimple(next, sb);
            };
            if (consumed == 0) {
                sb.append(ch);
                i++;
            } else {
                i += 1 + consumed;
            }
        }
        return sb.toString();
    }

    // ==================== Escapes ====================

    private static int appendHex(String name, int start, int digits, StringBuilder sb) {
        if (start + digits > name.length()) {
            return 0;
        }
        long codePoint = 0;
        for (int i = start; i < start + digits; i++) {
            int digit = Character.digit(name.charAt(i), 16);
            if (digit < 0) {
                return 0;
            }
            codePoint = codePoint * 16 + digit;
        }
        if (codePoint > Character.MAX_CODE_POINT) {
            return 0;
        }
        sb.appendCodePoint((int) codePoint);
        return 1 + digits;
    }

    private static int appendOctal(String name, int start, StringBuilder sb) {
        int end = start;
        int value = 0;
        while (end < name.length() && end - start < 3) {
            char digit = name.charAt(end);
            if (digit < '0' || digit > '7') {
                break;
            }
            value = value * 8 + (digit - '0');
            end++;
        }
        sb.append((char) value);
        return end - start;
    }

    private static int appendSimple(char escape, StringBuilder sb) {
        char decoded = switch (escape) {
            case '\\' -> '\\';
            case '\'' -> '\'';
            case '"' -> '"';
            case 'a' -> '\u0007';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'v' -> '\u000B';
            default -> 0;
        };
        if (decoded == 0) {
            return 0;
        }
        sb.append(decoded);
        return 1;
    }
}
