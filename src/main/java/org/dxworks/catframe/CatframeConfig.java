package org.dxworks.catframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class CatframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "catframe-config.yml";
    private static final List<String> DEFAULT_FILE_EXTENSIONS = List.of(".cat");
    private static final boolean DEFAULT_EMIT_FILE_RECORDS = true;
    private static final boolean DEFAULT_INCLUDE_BUNDLED_LKMM = false;

    private final int maxFileLines;
    private final List<String> fileExtensions;
    private final boolean emitFileRecords;
    private final boolean includeBundledLkmm;

    private CatframeConfig(int maxFileLines, List<String> fileExtensions,
                           boolean emitFileRecords, boolean includeBundledLkmm) {
        this.maxFileLines = maxFileLines;
        this.fileExtensions = fileExtensions;
        this.emitFileRecords = emitFileRecords;
        this.includeBundledLkmm = includeBundledLkmm;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public List<String> getFileExtensions() {
        return fileExtensions;
    }

    public boolean isEmitFileRecords() {
        return emitFileRecords;
    }

    public boolean isIncludeBundledLkmm() {
        return includeBundledLkmm;
    }

    public static CatframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CatframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveEmitFileRecords = (yamlConfig.emitFileRecords != null)
                        ? yamlConfig.emitFileRecords
                        : DEFAULT_EMIT_FILE_RECORDS;
                boolean effectiveIncludeBundledLkmm = (yamlConfig.includeBundledLkmm != null)
                        ? yamlConfig.includeBundledLkmm
                        : DEFAULT_INCLUDE_BUNDLED_LKMM;

                return new CatframeConfig(effectiveMaxFileLines,
                        normalizeExtensions(yamlConfig.fileExtensions),
                        effectiveEmitFileRecords,
                        effectiveIncludeBundledLkmm);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static CatframeConfig defaults() {
        return new CatframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_FILE_EXTENSIONS,
                DEFAULT_EMIT_FILE_RECORDS, DEFAULT_INCLUDE_BUNDLED_LKMM);
    }

    public static CatframeConfig with(int maxFileLines, List<String> fileExtensions,
                                      boolean emitFileRecords, boolean includeBundledLkmm) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new CatframeConfig(effectiveMaxFileLines, normalizeExtensions(fileExtensions),
                emitFileRecords, includeBundledLkmm);
    }

    public CatframeConfig withIncludeBundledLkmm(boolean include) {
        return new CatframeConfig(maxFileLines, fileExtensions, emitFileRecords, include);
    }

    // Lower-cased, dot-prefixed; an absent or empty list means the default ".cat".
    private static List<String> normalizeExtensions(List<String> extensions) {
        if (extensions == null) {
            return DEFAULT_FILE_EXTENSIONS;
        }
        List<String> normalized = new ArrayList<>();
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) continue;
            String e = ext.trim().toLowerCase(Locale.ROOT);
            normalized.add(e.startsWith(".") ? e : "." + e);
        }
        return normalized.isEmpty() ? DEFAULT_FILE_EXTENSIONS : List.copyOf(normalized);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<String> fileExtensions;
        public Boolean emitFileRecords;
        public Boolean includeBundledLkmm;
    }
}
