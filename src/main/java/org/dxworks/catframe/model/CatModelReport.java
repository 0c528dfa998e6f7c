package org.dxworks.catframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public class CatModelReport {

    private static final int MAX_LISTED_UNRESOLVED = 12;

    public String kind = "model";
    public CatModelAnalysis analysis = new CatModelAnalysis();
    public List<String> nonMacroDefined = new ArrayList<>(); // sorted
    public List<RelationDefinition> nonMacroDefinitions = new ArrayList<>(); // sorted by (name, fileName)

    // Per-file results in input order; written as separate records.
    @JsonIgnore
    public List<CatFileAnalysis> files = new ArrayList<>();

    /**
     * Display lines for the advisory signals. Empty when every include is supplied and every name resolves.
     */
    public List<String> warnings() {
        List<String> lines = new ArrayList<>();
        if (!analysis.missingIncludes.isEmpty()) {
            lines.add("Missing includes: " + String.join(", ", analysis.missingIncludes));
        }
        if (!analysis.unresolvedNames.isEmpty()) {
            List<String> listed = analysis.unresolvedNames.size() > MAX_LISTED_UNRESOLVED
                    ? analysis.unresolvedNames.subList(0, MAX_LISTED_UNRESOLVED)
                    : analysis.unresolvedNames;
            String suffix = analysis.unresolvedNames.size() > MAX_LISTED_UNRESOLVED ? "..." : "";
            lines.add("Unresolved names: " + String.join(", ", listed) + suffix);
        }
        return lines;
    }
}
