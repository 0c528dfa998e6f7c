package org.dxworks.catframe.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed lexical tables of the cat language as seen by the name analysis:
 * statement keywords, framework-provided builtins and the identifier rule.
 */
public final class CatVocabulary {

    public static final Set<String> KEYWORDS = Set.of(
            "let", "rec", "include", "acyclic", "irreflexive", "empty", "flag", "show", "as", "with"
    );

    public static final Set<String> BUILTINS = Set.of(
            // base relations
            "po", "po-loc",
            "rf", "rfe", "rfi",
            "co", "coe", "coi",
            "fr", "fre", "fri",
            "rmw",
            // predicates, sets and helpers
            "id", "loc", "int", "ext", "data", "addr", "ctrl", "fencerel"
    );

    // Letter or underscore first; dots and hyphens are legal inside names (po-loc, x.y).
    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private static final Pattern LITERAL_TAG = Pattern.compile("[A-Z0-9_-]+");

    private CatVocabulary() {
    }

    /**
     * Returns every maximal identifier run in {@code text}, in order, duplicates included.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        Matcher matcher = IDENTIFIER.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    public static boolean isKeyword(String token) {
        return KEYWORDS.contains(token);
    }

    public static boolean isBuiltin(String token) {
        return BUILTINS.contains(token);
    }

    /**
     * Heuristic for event tags and constant sets such as {@code W}, {@code RMW} or {@code LKR}:
     * the token consists only of upper-case letters, digits, underscores and hyphens.
     * <p>
     * Approximate in both directions. Upper-case user bindings ({@code let UL = ...}) are never
     * reported as references, while mixed-case tags defined outside the supplied files
     * ({@code Acquire}, {@code Before-atomic}) are.
     */
    public static boolean isLiteralTag(String token) {
        return token != null && LITERAL_TAG.matcher(token).matches();
    }
}
