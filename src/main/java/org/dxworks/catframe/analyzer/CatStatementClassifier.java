package org.dxworks.catframe.analyzer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented classification of cat statements.
 * Checks run in priority order: include, show, let header, other top-level keyword, continuation.
 */
public final class CatStatementClassifier {

    private static final String NAME = "[A-Za-z_][A-Za-z0-9_.-]*";

    // include "file.cat" on a line of its own
    private static final Pattern INCLUDE_PATTERN = Pattern.compile(
        "\\s*include\\s+\"([^\"]+)\"\\s*"
    );

    private static final Pattern SHOW_PATTERN = Pattern.compile("^\\s*show\\b");

    // let [rec] NAME[(params)] = RHS
    private static final Pattern LET_PATTERN = Pattern.compile(
        "\\s*let\\s+(?:rec\\s+)?(" + NAME + ")(\\s*\\([^)]*\\))?\\s*=\\s*(.*)"
    );

    private static final Pattern TOP_LEVEL_KEYWORD_PATTERN = Pattern.compile(
        "^\\s*(let|include|acyclic|irreflexive|empty|flag|show)\\b"
    );

    private CatStatementClassifier() {}

    public static CatStatement classify(String line) {
        Matcher include = INCLUDE_PATTERN.matcher(line);
        if (include.matches()) {
            return CatStatement.include(line, include.group(1));
        }

        Matcher show = SHOW_PATTERN.matcher(line);
        if (show.find()) {
            String remainder = line.substring(show.end()).trim();
            return CatStatement.show(line, CatVocabulary.tokenize(remainder));
        }

        Matcher let = LET_PATTERN.matcher(line);
        if (let.matches()) {
            String params = let.group(2);
            boolean macro = params != null && params.trim().startsWith("(");
            return CatStatement.binding(line, let.group(1), macro, let.group(3));
        }

        if (TOP_LEVEL_KEYWORD_PATTERN.matcher(line).find()) {
            return CatStatement.otherKeyword(line);
        }

        return CatStatement.continuation(line);
    }
}
