package org.dxworks.catframe.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Linux-kernel memory model (LKMM) cat files shipped on the classpath under {@code cat/lkmm/}.
 * The directory listing lives in {@code cat/lkmm/index.txt}, one file name per line.
 */
public final class BundledModels {

    private static final String LKMM_DIR = "cat/lkmm/";
    private static final String INDEX = LKMM_DIR + "index.txt";

    private BundledModels() {}

    /**
     * Loads the bundled LKMM files sorted by name.
     *
     * @throws UncheckedIOException if the index or a listed file is missing from the classpath
     */
    public static List<SourceFile> lkmm() {
        List<SourceFile> files = new ArrayList<>();
        for (String line : readResource(INDEX).split("\r?\n")) {
            String name = line.trim();
            if (name.isEmpty() || name.startsWith("#")) continue;
            files.add(new SourceFile(name, readResource(LKMM_DIR + name)));
        }
        files.sort(Comparator.comparing(SourceFile::getName));
        return files;
    }

    private static String readResource(String resource) {
        ClassLoader loader = BundledModels.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Bundled resource not found: " + resource));
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled resource: " + resource, e);
        }
    }
}
