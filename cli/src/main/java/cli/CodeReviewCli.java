package cli;

import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewResult;
import model.SourceFile;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import report.ArchiveBuilder;
import report.HtmlReporter;
import report.JsonReporter;
import report.PdfReporter;
import report.ReportFormat;
import report.Reporter;
import report.ReporterFactory;
import review.EngineConfig;
import review.InputRejectedException;
import review.ReviewEngine;
import review.SessionSnapshot;
import review.SessionStatus;
import rules.RuleBasedCodeAnalyzer;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Главная точка входа CLI для Code Review Agent.
 * Использует библиотеку picocli для парсинга аргументов командной строки.
 *
 * <p>Ревью выполняется в текущем процессе: файлы собираются с диска, передаются
 * {@link ReviewEngine} с анализатором на правилах, после завершения печатается отчет.
 *
 * <p>Примеры использования:
 * <pre>
 * # Ревью каталога с выводом в консоль
 * code-review-agent src/
 *
 * # JSON отчет в файл и HTML отчет рядом
 * code-review-agent -f json -o review.json --report review.html src/
 *
 * # Собственная конфигурация и архив с результатами
 * code-review-agent -c config.yaml --archive results.zip app.py lib/
 *
 * # Пример конфигурации с настройками по умолчанию
 * code-review-agent create-config
 * </pre>
 *
 * <p>Коды завершения:
 * <ul>
 *   <li>0 - высококритичных замечаний нет</li>
 *   <li>1 - некорректный ввод (нет файлов, неверная конфигурация или формат)</li>
 *   <li>2 - ревью завершилось ошибкой или по таймауту</li>
 *   <li>3 - найдены замечания уровня high</li>
 *   <li>99 - непредвиденная ошибка</li>
 * </ul>
 *
 * @author Code Review Agent Team
 * @since 1.0
 */
@Command(
    name = "code-review-agent",
    description = "Automated code review of source files and directories",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT",
    subcommands = CreateConfigCommand.class
)
public class CodeReviewCli implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(CodeReviewCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_REVIEW_FAILED = 2;
    static final int EXIT_HIGH_SEVERITY = 3;
    static final int EXIT_UNEXPECTED = 99;

    @Spec
    private CommandSpec spec;

    @Parameters(
        arity = "0..*",
        paramLabel = "<paths>",
        description = "Source files or directories to review"
    )
    private List<Path> paths = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Review configuration file (YAML or JSON)"
    )
    private Path configFile;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: console, json, markdown, html, pdf (pdf requires --output) (default: console)",
        defaultValue = "console"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output file for the report (optional, defaults to stdout)"
    )
    private Path outputFile;

    @Option(
        names = {"--report"},
        description = "Also write the HTML report to this file"
    )
    private Path htmlReportFile;

    @Option(
        names = {"--archive"},
        description = "Also write the ZIP archive with results and report to this file"
    )
    private Path archiveFile;

    @Option(
        names = {"--extensions"},
        split = ",",
        description = "File extensions to review (default: .py,.js,.ts,.java,.cpp,.c,.cs,.php,.rb,.go,.rs)"
    )
    private List<String> extensions = new ArrayList<>();

    @Option(
        names = {"-nc", "--no-color"},
        description = "Disable colored output"
    )
    private boolean noColor;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
        names = {"--timeout"},
        description = "Review timeout in seconds (default: 300)",
        defaultValue = "300"
    )
    private long timeoutSeconds;

    private final Clock clock;

    public CodeReviewCli() {
        this(Clock.systemUTC());
    }

    CodeReviewCli(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (paths.isEmpty()) {
                err.println("ERROR: No paths given");
                spec.commandLine().usage(err);
                return EXIT_INVALID_INPUT;
            }

            ReportFormat reportFormat;
            try {
                reportFormat = ReportFormat.fromString(format);
            } catch (IllegalArgumentException e) {
                err.println("ERROR: " + e.getMessage());
                err.println("Valid formats: console, json, markdown, html, pdf");
                return EXIT_INVALID_INPUT;
            }
            if (reportFormat == ReportFormat.PDF && outputFile == null) {
                err.println("ERROR: PDF output requires --output");
                return EXIT_INVALID_INPUT;
            }
            if (timeoutSeconds < 0) {
                err.println("ERROR: Timeout cannot be negative");
                return EXIT_INVALID_INPUT;
            }

            ReviewConfig config;
            List<SourceFile> files;
            try {
                config = new ConfigLoader().load(configFile);
                List<String> excludes = new ArrayList<>(RuleBasedCodeAnalyzer.DEFAULT_EXCLUDES);
                excludes.addAll(config.getStringList("filters.excludeFiles"));
                files = new SourceCollector(extensions, excludes).collect(paths);
            } catch (IllegalArgumentException e) {
                err.println("ERROR: " + e.getMessage());
                return EXIT_INVALID_INPUT;
            }

            if (files.isEmpty()) {
                err.println("ERROR: No source files found in " + paths);
                return EXIT_INVALID_INPUT;
            }

            if (verbose) {
                err.println("Configuration:");
                err.println("  Files: " + files.size());
                err.println("  Format: " + reportFormat);
                err.println("  Config: " + (configFile != null ? configFile : "defaults"));
                err.println();
            }

            AnalysisProgressListener progress = verbose
                ? new ConsoleProgressListener(err)
                : AnalysisProgressListener.noOp();

            ReviewResult result;
            try {
                result = runReview(new ReviewBatch(files), config, progress);
            } catch (InputRejectedException e) {
                err.println("ERROR: " + e.getMessage());
                return EXIT_INVALID_INPUT;
            }
            if (result == null) {
                return EXIT_REVIEW_FAILED;
            }

            writeReport(result, reportFormat, out);
            writeExtras(result, out);

            return result.hasHighSeverityIssues() ? EXIT_HIGH_SEVERITY : EXIT_OK;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("ERROR: Review interrupted");
            return EXIT_REVIEW_FAILED;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Unexpected CLI failure", e);
            err.println("ERROR: Unexpected error occurred: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_UNEXPECTED;
        } finally {
            out.flush();
            err.flush();
        }
    }

    /**
     * Выполняет одно ревью в собственном движке и ждет его завершения.
     *
     * @return результат или null, если ревью завершилось ошибкой (ошибка уже выведена)
     */
    private ReviewResult runReview(ReviewBatch batch, ReviewConfig config, AnalysisProgressListener progress)
            throws InterruptedException {
        EngineConfig engineConfig = EngineConfig.builder()
            .maxConcurrentReviews(1)
            .queueCapacity(1)
            .maxFiles(Math.max(EngineConfig.DEFAULT_MAX_FILES, batch.size()))
            .analysisTimeout(Duration.ofSeconds(timeoutSeconds))
            .sessionTtl(Duration.ZERO)
            .build();

        try (ReviewEngine engine = new ReviewEngine(new RuleBasedCodeAnalyzer(), engineConfig)) {
            CountDownLatch finished = new CountDownLatch(1);
            engine.addListener(snapshot -> {
                progress.onProgress(snapshot.progress(), snapshot.currentStep());
                if (snapshot.isTerminal()) {
                    finished.countDown();
                }
            });

            String sessionId = engine.submit(batch, config);
            progress.onLog("INFO", "Review started: session " + sessionId);

            SessionSnapshot snapshot = engine.getStatus(sessionId);
            while (!snapshot.isTerminal()) {
                finished.await(250, TimeUnit.MILLISECONDS);
                snapshot = engine.getStatus(sessionId);
            }
            progress.onFinished(snapshot);

            if (snapshot.status() == SessionStatus.FAILED) {
                spec.commandLine().getErr().println("ERROR: Review failed: " + snapshot.error());
                return null;
            }
            return engine.getResult(sessionId);
        }
    }

    private void writeReport(ReviewResult result, ReportFormat reportFormat, PrintWriter out) throws IOException {
        if (reportFormat == ReportFormat.PDF) {
            try (OutputStream stream = Files.newOutputStream(outputFile)) {
                new PdfReporter(clock).generateToOutputStream(result, stream);
            }
            out.println("Report written to: " + outputFile);
            return;
        }

        Reporter reporter = ReporterFactory.createReporter(reportFormat, !noColor && outputFile == null, clock);
        if (outputFile != null) {
            try (PrintWriter fileWriter = new PrintWriter(Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8))) {
                reporter.generate(result, fileWriter);
            }
            out.println("Report written to: " + outputFile);
        } else {
            reporter.generate(result, out);
        }
    }

    private void writeExtras(ReviewResult result, PrintWriter out) throws IOException {
        if (htmlReportFile == null && archiveFile == null) {
            return;
        }
        String html = new HtmlReporter(clock).render(result);
        if (htmlReportFile != null) {
            Files.writeString(htmlReportFile, html, StandardCharsets.UTF_8);
            out.println("HTML report written to: " + htmlReportFile);
        }
        if (archiveFile != null) {
            byte[] archive = new ArchiveBuilder(clock, new JsonReporter()).build(result, html);
            Files.write(archiveFile, archive);
            out.println("Archive written to: " + archiveFile);
        }
    }

    /**
     * Печатает строки прогресса в поток ошибок в режиме verbose.
     */
    static final class ConsoleProgressListener implements AnalysisProgressListener {
        private final PrintWriter err;
        private String lastLine;

        ConsoleProgressListener(PrintWriter err) {
            this.err = err;
        }

        @Override
        public void onLog(String level, String message) {
            err.println("[" + level + "] " + message);
        }

        @Override
        public synchronized void onProgress(int progress, String step) {
            String line = String.format("[%3d%%] %s", progress, step);
            if (!line.equals(lastLine)) {
                lastLine = line;
                err.println(line);
            }
        }

        @Override
        public void onFinished(SessionSnapshot snapshot) {
            err.println("Review " + snapshot.status().getValue() + " for session " + snapshot.sessionId());
        }
    }

    public static void main(String[] args) {
        Logger.getLogger("").setLevel(Level.WARNING);
        int exitCode = new CommandLine(new CodeReviewCli()).execute(args);
        System.exit(exitCode);
    }
}
