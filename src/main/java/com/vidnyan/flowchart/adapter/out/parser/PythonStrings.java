package com.vidnyan.flowchart.adapter.out.parser;

/**
 * Decoding of backslash escapes in non-raw string literals.
 * Unknown escapes keep their backslash, as Python does.
 */
final class PythonStrings {

    private PythonStrings() {
    }

    static String unescape(String body, boolean bytes) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> i = hex(body, i, 2, out);
                case 'u', 'U' -> {
                    if (bytes) {
                        out.append('\\').append(next);
                    } else {
                        i = hex(body, i, next == 'u' ? 4 : 8, out);
                    }
                }
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && isOctal(body.charAt(end))) {
                            end++;
                        }
                        out.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    /** Appends the code point of {@code digits} hex digits at {@code start}; malformed escapes stay literal. */
    private static int hex(String body, int start, int digits, StringBuilder out) {
        int end = start + digits;
        if (end <= body.length() && body.substring(start, end).chars().allMatch(PythonStrings::isHex)) {
            long codePoint = Long.parseLong(body.substring(start, end), 16);
            if (codePoint <= Character.MAX_CODE_POINT) {
                out.appendCodePoint((int) codePoint);
                return end;
            }
        }
        out.append('\\').append(body.charAt(start - 1));
        return start;
    }

    private static boolean isHex(int c) {
        return Character.digit(c, 16) >= 0;
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }
}
