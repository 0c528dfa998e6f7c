package org.dxworks.catframe.analyzer;

import java.util.List;

/**
 * One normalized line, classified by its leading keyword.
 */
public final class CatStatement {

    public enum Kind {
        INCLUDE,
        SHOW,
        BINDING,
        OTHER_KEYWORD,
        CONTINUATION
    }

    private final Kind kind;
    private final String line;
    private final String includeTarget; // INCLUDE only
    private final List<String> shownNames; // SHOW only
    private final String bindingName; // BINDING only
    private final boolean macro; // BINDING only
    private final String rhs; // BINDING only

    private CatStatement(Kind kind, String line, String includeTarget, List<String> shownNames,
                         String bindingName, boolean macro, String rhs) {
        this.kind = kind;
        this.line = line;
        this.includeTarget = includeTarget;
        this.shownNames = shownNames;
        this.bindingName = bindingName;
        this.macro = macro;
        this.rhs = rhs;
    }

    static CatStatement include(String line, String target) {
        return new CatStatement(Kind.INCLUDE, line, target, List.of(), null, false, null);
    }

    static CatStatement show(String line, List<String> shownNames) {
        return new CatStatement(Kind.SHOW, line, null, List.copyOf(shownNames), null, false, null);
    }

    static CatStatement binding(String line, String name, boolean macro, String rhs) {
        return new CatStatement(Kind.BINDING, line, null, List.of(), name, macro, rhs);
    }

    static CatStatement otherKeyword(String line) {
        return new CatStatement(Kind.OTHER_KEYWORD, line, null, List.of(), null, false, null);
    }

    static CatStatement continuation(String line) {
        return new CatStatement(Kind.CONTINUATION, line, null, List.of(), null, false, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getLine() {
        return line;
    }

    public String getIncludeTarget() {
        return includeTarget;
    }

    public List<String> getShownNames() {
        return shownNames;
    }

    public String getBindingName() {
        return bindingName;
    }

    public boolean isMacro() {
        return macro;
    }

    public String getRhs() {
        return rhs;
    }

    /**
     * Every kind except a continuation ends the binding that is currently being folded.
     */
    public boolean closesBinding() {
        return kind != Kind.CONTINUATION;
    }
}
