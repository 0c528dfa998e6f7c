package org.dxworks.catframe;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class CatFileDetector {

    private final List<String> extensions;

    public CatFileDetector(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    public boolean isCatFile(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (fileName.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
