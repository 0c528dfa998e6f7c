package org.dxworks.catframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatframeConfigTest {

    @Test
    void missingFileGivesDefaults(@TempDir Path tmp) {
        CatframeConfig config = CatframeConfig.load(tmp.resolve("catframe-config.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(List.of(".cat"), config.getFileExtensions());
        assertTrue(config.isEmitFileRecords());
        assertFalse(config.isIncludeBundledLkmm());
    }

    @Test
    void readsYamlValues(@TempDir Path tmp) throws IOException {
        Path yml = tmp.resolve("catframe-config.yml");
        Files.writeString(yml, String.join("\n",
                "maxFileLines: 10",
                "fileExtensions: [cat, .CATX, '']",
                "emitFileRecords: false",
                "includeBundledLkmm: true",
                "somethingElse: ignored"));

        CatframeConfig config = CatframeConfig.load(yml);

        assertEquals(10, config.getMaxFileLines());
        assertEquals(List.of(".cat", ".catx"), config.getFileExtensions());
        assertFalse(config.isEmitFileRecords());
        assertTrue(config.isIncludeBundledLkmm());
    }

    @Test
    void nonPositiveMaxLinesFallsBackToDefault(@TempDir Path tmp) throws IOException {
        Path yml = tmp.resolve("catframe-config.yml");
        Files.writeString(yml, "maxFileLines: -5\n");

        assertEquals(20000, CatframeConfig.load(yml).getMaxFileLines());
        assertEquals(20000, CatframeConfig.with(0, null, true, false).getMaxFileLines());
    }

    @Test
    void malformedYamlGivesDefaults(@TempDir Path tmp) throws IOException {
        Path yml = tmp.resolve("catframe-config.yml");
        Files.writeString(yml, "maxFileLines: [oops\n");

        CatframeConfig config = CatframeConfig.load(yml);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(List.of(".cat"), config.getFileExtensions());
    }
}
