package org.dxworks.catframe.analyzer;

/**
 * Removes {@code (* ... *)} comments from cat source while keeping string literals intact.
 * <ul>
 *   <li>Block comments nest; only the matching number of closers returns to code.</li>
 *   <li>Line breaks inside comments ({@code \n} and {@code \r}) are kept, so the output has the same line count as the input.</li>
 *   <li>Comment delimiters inside a {@code "..."} literal are plain text.</li>
 *   <li>An unterminated comment or string runs to the end of input.</li>
 * </ul>
 */
public final class CatScrubber {

    private CatScrubber() {}

    public static String scrub(String source) {
        if (source == null) return "";

        StringBuilder out = new StringBuilder(source.length());
        int depth = 0;
        boolean inString = false;
        int i = 0;

        while (i < source.length()) {
            char ch = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';

            if (inString) {
                out.append(ch);
                if (ch == '"' && !isEscaped(source, i)) {
                    inString = false;
                }
                i++;
                continue;
            }

            if (depth > 0) {
                if (ch == '(' && next == '*') {
                    depth++;
                    i += 2;
                    continue;
                }
                if (ch == '*' && next == ')') {
                    depth--;
                    i += 2;
                    continue;
                }
                if (ch == '\n' || ch == '\r') {
                    out.append(ch);
                }
                i++;
                continue;
            }

            if (ch == '"' && !isEscaped(source, i)) {
                inString = true;
                out.append(ch);
                i++;
                continue;
            }

            if (ch == '(' && next == '*') {
                depth = 1;
                i += 2;
                continue;
            }

            out.append(ch);
            i++;
        }

        return out.toString();
    }

    private static boolean isEscaped(String source, int index) {
        return index > 0 && source.charAt(index - 1) == '\\';
    }
}
