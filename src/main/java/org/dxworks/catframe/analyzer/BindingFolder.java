package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.model.CatDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Folds classified statements into definitions, includes and shown names.
 * <p>
 * A {@code let} header opens a binding; continuation lines are appended to it until the next
 * statement that starts with a top-level keyword, or the end of input, closes it.
 * All state lives in the {@link Accumulator} created for one {@link #fold} call.
 */
public final class BindingFolder {

    private BindingFolder() {}

    public static Result fold(List<String> normalizedLines, String fileName) {
        Accumulator acc = new Accumulator(fileName);
        for (String line : normalizedLines) {
            acc = acc.accept(CatStatementClassifier.classify(line));
        }
        return acc.finish();
    }

    /** Output of one fold, in source order. Names are not de-duplicated here. */
    public static final class Result {
        public final List<String> includes;
        public final List<String> shownNames;
        public final List<CatDefinition> definitions;

        Result(List<String> includes, List<String> shownNames, List<CatDefinition> definitions) {
            this.includes = Collections.unmodifiableList(includes);
            this.shownNames = Collections.unmodifiableList(shownNames);
            this.definitions = Collections.unmodifiableList(definitions);
        }
    }

    static final class Accumulator {
        private final String fileName;
        private final List<String> includes = new ArrayList<>();
        private final List<String> shownNames = new ArrayList<>();
        private final List<CatDefinition> definitions = new ArrayList<>();
        private OpenBinding open;

        Accumulator(String fileName) {
            this.fileName = fileName;
        }

        Accumulator accept(CatStatement statement) {
            if (statement.closesBinding()) {
                close();
            }
            switch (statement.getKind()) {
                case INCLUDE -> includes.add(statement.getIncludeTarget());
                case SHOW -> shownNames.addAll(statement.getShownNames());
                case BINDING -> open = new OpenBinding(
                        statement.getBindingName(), statement.isMacro(), statement.getRhs());
                case CONTINUATION -> {
                    if (open != null) {
                        open.bodyLines.add(statement.getLine());
                    }
                }
                case OTHER_KEYWORD -> {
                    // consumed only by model evaluation
                }
            }
            return this;
        }

        Result finish() {
            close();
            return new Result(includes, shownNames, definitions);
        }

        private void close() {
            if (open == null) return;
            String body = String.join("\n", open.bodyLines).trim();
            definitions.add(new CatDefinition(open.name, open.macro, body, fileName));
            open = null;
        }
    }

    private static final class OpenBinding {
        final String name;
        final boolean macro;
        final List<String> bodyLines = new ArrayList<>();

        OpenBinding(String name, boolean macro, String firstLine) {
            this.name = name;
            this.macro = macro;
            this.bodyLines.add(firstLine);
        }
    }
}
