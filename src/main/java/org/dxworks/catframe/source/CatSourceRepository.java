package org.dxworks.catframe.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Run-scoped index of cat files by include name.
 *
 * - The include name of a file is its base file name ("lock.cat").
 * - Detects the same name under multiple paths and prints them.
 * - Picks one file per name deterministically: the lexicographically last absolute path.
 */
public final class CatSourceRepository {

    private final List<SourceFile> sourceFiles;

    public CatSourceRepository(List<Path> catFiles) {
        Objects.requireNonNull(catFiles, "catFiles");

        Map<String, List<Path>> candidatesByName = new HashMap<>();
        for (Path p : catFiles) {
            if (p == null) continue;
            if (!Files.isRegularFile(p)) continue;
            candidatesByName.computeIfAbsent(includeName(p), k -> new ArrayList<>()).add(p);
        }

        printDuplicates(candidatesByName);

        Map<String, Path> index = new TreeMap<>();
        for (Map.Entry<String, List<Path>> e : candidatesByName.entrySet()) {
            index.put(e.getKey(), pickWinner(e.getValue()));
        }
        this.sourceFiles = Collections.unmodifiableList(readAll(index));
    }

    /**
     * Readable files, one per include name, sorted by name.
     */
    public List<SourceFile> sourceFiles() {
        return sourceFiles;
    }

    public static String includeName(Path p) {
        return p.getFileName().toString();
    }

    private static List<SourceFile> readAll(Map<String, Path> index) {
        List<SourceFile> files = new ArrayList<>();
        for (Map.Entry<String, Path> e : index.entrySet()) {
            try {
                files.add(new SourceFile(e.getKey(), readText(e.getValue())));
            } catch (IOException ex) {
                synchronized (System.err) {
                    System.err.println("  Error reading " + e.getValue() + ": " + ex.getMessage());
                }
            }
        }
        return files;
    }

    static String readText(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        // Remove BOM if present
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return text;
    }

    private static void printDuplicates(Map<String, List<Path>> candidatesByName) {
        Map<String, List<Path>> dupes = new TreeMap<>();

        for (Map.Entry<String, List<Path>> e : candidatesByName.entrySet()) {
            // Unique by absolute path
            LinkedHashMap<String, Path> unique = new LinkedHashMap<>();
            for (Path p : e.getValue()) {
                unique.put(p.toAbsolutePath().toString(), p);
            }
            if (unique.size() > 1) {
                dupes.put(e.getKey(), new ArrayList<>(unique.values()));
            }
        }

        if (dupes.isEmpty()) {
            return;
        }

        synchronized (System.out) {
            System.out.println("Warning: duplicate cat file names detected (multiple paths for same include name):");
            for (Map.Entry<String, List<Path>> e : dupes.entrySet()) {
                System.out.println("  - " + e.getKey());
                for (Path p : e.getValue()) {
                    System.out.println("      " + p.toAbsolutePath());
                }
            }
        }
    }

    private static Path pickWinner(List<Path> candidates) {
        return candidates.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toMap(
                        p -> p.toAbsolutePath().toString(),
                        p -> p,
                        (a, b) -> a,
                        LinkedHashMap::new
                ))
                .values()
                .stream()
                .max(Comparator.comparing((Path p) -> p.toAbsolutePath().toString()))
                .orElseThrow(() -> new IllegalArgumentException("No cat file candidates"));
    }
}
