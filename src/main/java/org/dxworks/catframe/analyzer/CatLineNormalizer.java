package org.dxworks.catframe.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns scrubbed source into the lines that can carry statements: right-trimmed,
 * without blank lines and without {@code #} line comments.
 */
public final class CatLineNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final String LINE_COMMENT = "#";

    private CatLineNormalizer() {}

    public static List<String> normalize(String scrubbed) {
        List<String> lines = new ArrayList<>();
        if (scrubbed == null || scrubbed.isEmpty()) return lines;

        for (String raw : LINE_BREAK.split(scrubbed)) {
            String line = raw.stripTrailing();
            if (line.isEmpty()) continue;
            if (line.stripLeading().startsWith(LINE_COMMENT)) continue;
            lines.add(line);
        }
        return lines;
    }
}
