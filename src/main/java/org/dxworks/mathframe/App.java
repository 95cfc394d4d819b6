package org.dxworks.mathframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mathframe.editor.MathField;
import org.dxworks.mathframe.parser.LatexParseException;
import org.dxworks.mathframe.report.FormulaAnalysis;
import org.dxworks.mathframe.report.FormulaError;
import org.dxworks.mathframe.report.FormulaReport;
import org.dxworks.mathframe.serializer.TreeExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar mathframe.jar <input-path> <output-file>");
            System.err.println("  <input-path>:  formula file or directory (.tex, .latex, .math)");
            System.err.println("  <output-file>: path to output JSONL file");
            System.err.println("Every non-blank line of an input file is parsed as one formula.");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting formula analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        MathframeConfig config = MathframeConfig.load();
        RunSummary summary = run(input, jsonlOutput, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Files analyzed: " + summary.files);
        System.out.println("Formulas parsed: " + summary.formulas);
        if (summary.errors > 0) {
            System.out.println("Formulas with errors: " + summary.errors);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Analyzes every formula file under {@code input} and writes one JSONL record per formula,
     * framed by a {@code run} header and a {@code done} trailer.
     */
    public static RunSummary run(Path input, Path jsonlOutput, MathframeConfig config) throws IOException {
        List<Path> files = collectFormulaFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " formula files");

        Instant startTime = Instant.now();
        AtomicInteger formulaCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                List<FormulaReport> reports;
                try {
                    reports = analyzeFile(file, config);
                } catch (IOException e) {
                    log.error("Failed to read {}", file, e);
                    reports = List.of(new FormulaError(file.toString(), 0, null, e.getMessage()));
                }

                synchronized (writer) {
                    for (FormulaReport report : reports) {
                        if (report instanceof FormulaError) {
                            errorCount.incrementAndGet();
                        } else {
                            formulaCount.incrementAndGet();
                        }
                        write(writer, report);
                    }
                    flush(writer);
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", files.size());
            doneInfo.put("formulas_parsed", formulaCount.get());
            doneInfo.put("formulas_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        return new RunSummary(files.size(), formulaCount.get(), errorCount.get());
    }

    /**
     * Parses each non-blank, non-comment line of {@code file} as a separate formula.
     */
    public static List<FormulaReport> analyzeFile(Path file, MathframeConfig config) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<FormulaReport> reports = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i == 0 && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            // blank lines and % comment lines separate formulas
            if (line.isBlank() || line.strip().startsWith("%")) {
                continue;
            }
            reports.add(analyzeFormula(file.toString(), i + 1, line.strip(), config));
        }
        return reports;
    }

    public static FormulaReport analyzeFormula(String filePath, int line, String formula, MathframeConfig config) {
        MathField field = new MathField(config);
        try {
            field.setLatexOrThrow(formula);
        } catch (LatexParseException e) {
            FormulaError error = new FormulaError(filePath, line, formula, e.getMessage());
            error.position = e.getPosition();
            error.expected = e.getExpected();
            return error;
        }

        FormulaAnalysis analysis = new FormulaAnalysis();
        analysis.filePath = filePath;
        analysis.line = line;
        analysis.input = formula;
        analysis.latex = field.latex();
        analysis.text = field.text();
        analysis.speech = field.speech();
        TreeExporter.fillStatistics(field.getRoot(), analysis);
        return analysis;
    }

    private static void write(BufferedWriter writer, FormulaReport report) {
        try {
            writer.write(MAPPER.writeValueAsString(report));
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write record for " + report.getFilePath() + ":" + report.getLine(), e);
        }
    }

    private static void flush(BufferedWriter writer) {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush output", e);
        }
    }

    static List<Path> collectFormulaFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(FormulaFileDetector::isFormulaFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (FormulaFileDetector.isFormulaFile(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                log.warn("Skipping {}: more than {} lines", path, maxFileLines);
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not count lines of {}, analyzing it anyway: {}", path, e.getMessage());
            return true;
        }
    }

    public static class RunSummary {
        public final int files;
        public final int formulas;
        public final int errors;

        RunSummary(int files, int formulas, int errors) {
            this.files = files;
            this.formulas = formulas;
            this.errors = errors;
        }
    }
}
