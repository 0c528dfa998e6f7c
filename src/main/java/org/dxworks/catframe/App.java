package org.dxworks.catframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.catframe.analyzer.CatModelAnalyzer;
import org.dxworks.catframe.model.CatFileAnalysis;
import org.dxworks.catframe.model.CatModelReport;
import org.dxworks.catframe.source.BundledModels;
import org.dxworks.catframe.source.CatSourceRepository;
import org.dxworks.catframe.source.SourceFile;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String LKMM_FLAG = "--lkmm";

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    static int run(String[] args) throws IOException {
        List<String> positional = new ArrayList<>();
        boolean lkmmFlag = false;
        for (String arg : args) {
            if (LKMM_FLAG.equals(arg)) {
                lkmmFlag = true;
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            System.err.println("Usage: java -jar catframe.jar <input-path> <output-file> [--lkmm]");
            System.err.println("  <input-path>:  Directory or single .cat file");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("  --lkmm:        Also load the bundled Linux-kernel memory model files");
            return 2;
        }

        Path input = Paths.get(positional.get(0));
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        Path jsonlOutput = Paths.get(positional.get(1));
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        CatframeConfig config = CatframeConfig.load();
        if (lkmmFlag) {
            config = config.withIncludeBundledLkmm(true);
        }

        System.out.println("Starting cat model analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> paths = collectCatFiles(input, config);
        System.out.println("Found " + paths.size() + " cat files");

        List<SourceFile> files = new ArrayList<>();
        if (config.isIncludeBundledLkmm()) {
            List<SourceFile> bundled = BundledModels.lkmm();
            System.out.println("Loaded " + bundled.size() + " bundled LKMM files");
            files.addAll(bundled);
        }
        // Supplied files come last so they replace bundled files of the same name
        files.addAll(new CatSourceRepository(paths).sourceFiles());

        Instant startTime = Instant.now();
        CatModelReport report = CatModelAnalyzer.analyze(files);
        Instant endTime = Instant.now();

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", report.files.size());
            writeRecord(writer, runInfo);

            if (config.isEmitFileRecords()) {
                for (CatFileAnalysis file : report.files) {
                    writeRecord(writer, file);
                }
            }
            writeRecord(writer, report);

            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", report.files.size());
            doneInfo.put("missing_includes", report.analysis.missingIncludes.size());
            doneInfo.put("unresolved_names", report.analysis.unresolvedNames.size());
            doneInfo.put("duration_millis", Duration.between(startTime, endTime).toMillis());
            writeRecord(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Files analyzed: " + report.files.size());
        System.out.println("Definitions: " + report.analysis.definedNames.size()
                + " (" + report.analysis.macroNames.size() + " macros)");
        for (String warning : report.warnings()) {
            System.out.println("Warning: " + warning);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
        return 0;
    }

    private static void writeRecord(BufferedWriter writer, Object record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
    }

    static List<Path> collectCatFiles(Path input, CatframeConfig config) throws IOException {
        CatFileDetector detector = new CatFileDetector(config.getFileExtensions());
        int maxFileLines = config.getMaxFileLines();
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(detector::isCatFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (detector.isCatFile(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                System.out.println("Skipping " + path.getFileName() + ": more than " + maxFileLines + " lines");
                return false;
            }
            return true;
        } catch (IOException | java.io.UncheckedIOException e) {
            // Unreadable here; CatSourceRepository reports the read failure
            return true;
        }
    }
}
