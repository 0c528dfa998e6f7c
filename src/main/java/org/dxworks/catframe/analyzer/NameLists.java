package org.dxworks.catframe.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class NameLists {

    private NameLists() {
        // utility class
    }

    /**
     * Trims every name, drops empty ones and keeps the first occurrence of each.
     */
    public static List<String> uniqueInOrder(Collection<String> names) {
        Set<String> seen = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null) continue;
            String normalized = name.trim();
            if (normalized.isEmpty()) continue;
            seen.add(normalized);
        }
        return new ArrayList<>(seen);
    }

    public static List<String> sorted(Collection<String> names) {
        List<String> out = uniqueInOrder(names);
        out.sort(null);
        return out;
    }
}
