package rules;

import model.IssueCategory;
import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewIssue;
import model.ReviewMetrics;
import model.ReviewResult;
import model.Severity;
import model.SourceFile;
import review.AnalysisContext;
import review.AnalysisException;
import review.CodeAnalyzer;
import util.GlobMatcher;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Детерминированный анализатор, прогоняющий зарегистрированные {@link CodeRule} по пакету файлов.
 *
 * <p>Фазы:
 * <ol>
 *   <li>Extracting and organizing files: отбрасывает исключенные пути и неподдерживаемые расширения</li>
 *   <li>Parsing source code structure: разбивает файлы на строки и считает строки кода</li>
 *   <li>Running security analysis</li>
 *   <li>Checking performance patterns</li>
 *   <li>Evaluating code style</li>
 *   <li>Detecting complexity issues</li>
 *   <li>Generating improvement suggestions: правила документации и сопровождаемости</li>
 *   <li>Compiling final report: фильтр по критичности, сортировка и рекомендации по оставшимся замечаниям</li>
 * </ol>
 */
public final class RuleBasedCodeAnalyzer implements CodeAnalyzer {
    private static final Logger logger = Logger.getLogger(RuleBasedCodeAnalyzer.class.getName());

    public static final String NAME = "rule-based-analyzer";

    public static final List<String> PHASES = List.of(
        "Extracting and organizing files",
        "Parsing source code structure",
        "Running security analysis",
        "Checking performance patterns",
        "Evaluating code style",
        "Detecting complexity issues",
        "Generating improvement suggestions",
        "Compiling final report"
    );

    /**
     * Пути, которые не анализируются никогда, в дополнение к {@code filters.excludeFiles}.
     */
    public static final List<String> DEFAULT_EXCLUDES = List.of(
        "__pycache__", ".git", ".svn", ".hg", "node_modules", ".venv", "venv",
        "dist", "build", "target", ".idea", ".vscode", "*.min.js", "*.min.css");

    private static final String UNITS = "units";
    private static final String LINES_OF_CODE = "linesOfCode";
    private static final String RECOMMENDATIONS = "recommendations";
    private static final String FINAL_ISSUES = "finalIssues";

    private final RuleRegistry registry;

    /**
     * Анализатор со всеми правилами, найденными через {@link RuleAutoDiscovery}.
     */
    public RuleBasedCodeAnalyzer() {
        this(discoverRules());
    }

    public RuleBasedCodeAnalyzer(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    private static RuleRegistry discoverRules() {
        RuleRegistry registry = new RuleRegistry();
        RuleAutoDiscovery.discoverAndRegister(registry);
        return registry;
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getPhases(ReviewBatch batch, ReviewConfig config) {
        return PHASES;
    }

    @Override
    public void runPhase(int index, AnalysisContext context) throws AnalysisException {
        RuleSettings settings = new RuleSettings(context.getConfig());
        switch (index) {
            case 0:
                extractFiles(context, settings);
                break;
            case 1:
                parseStructure(context);
                break;
            case 2:
                runRules(context, settings, EnumSet.of(IssueCategory.SECURITY));
                break;
            case 3:
                runRules(context, settings, EnumSet.of(IssueCategory.PERFORMANCE));
                break;
            case 4:
                runRules(context, settings, EnumSet.of(IssueCategory.STYLE));
                break;
            case 5:
                runRules(context, settings, EnumSet.of(IssueCategory.COMPLEXITY));
                break;
            case 6:
                runRules(context, settings, EnumSet.of(IssueCategory.DOCUMENTATION, IssueCategory.MAINTAINABILITY));
                break;
            case 7:
                compileReport(context, settings);
                break;
            default:
                throw new AnalysisException("Unknown phase index: " + index);
        }
    }

    private void extractFiles(AnalysisContext context, RuleSettings settings) {
        GlobMatcher excludes = new GlobMatcher(Stream.concat(DEFAULT_EXCLUDES.stream(),
            settings.getExcludePatterns().stream()).collect(Collectors.toList()));

        List<SourceUnit> units = new ArrayList<>();
        int skipped = 0;
        for (SourceFile file : context.getBatch()) {
            if (excludes.matches(file.getPath()) || !file.getLanguage().isSupported()) {
                skipped++;
                continue;
            }
            units.add(SourceUnit.of(file));
        }
        logger.fine("Session " + context.getSessionId() + ": " + units.size()
            + " file(s) selected, " + skipped + " skipped");
        context.setAttribute(UNITS, units);
    }

    private void parseStructure(AnalysisContext context) throws AnalysisException {
        int linesOfCode = units(context).stream().mapToInt(SourceUnit::getLinesOfCode).sum();
        context.setAttribute(LINES_OF_CODE, linesOfCode);
    }

    private void runRules(AnalysisContext context, RuleSettings settings, Set<IssueCategory> categories)
            throws AnalysisException {
        for (IssueCategory category : categories) {
            if (!settings.isCategoryEnabled(category)) {
                logger.fine("Category " + category.getKey() + " disabled for session " + context.getSessionId());
                continue;
            }
            for (SourceUnit unit : units(context)) {
                if (context.isCancelled()) {
                    return;
                }
                for (CodeRule rule : registry.getRules(category, unit.getLanguage())) {
                    context.addIssues(rule.check(unit, settings));
                }
            }
        }
    }

    private void compileReport(AnalysisContext context, RuleSettings settings) {
        Severity minSeverity = settings.getMinSeverity();
        List<ReviewIssue> issues = context.getIssues().stream()
            .filter(issue -> issue.getSeverity().isAtLeast(minSeverity))
            .sorted(ReviewIssue.REPORT_ORDER)
            .collect(Collectors.toList());
        context.setAttribute(FINAL_ISSUES, issues);
        // рекомендации только по замечаниям, прошедшим фильтр
        context.setAttribute(RECOMMENDATIONS, buildRecommendations(issues));
    }

    @Override
    @SuppressWarnings("unchecked")
    public ReviewResult buildResult(AnalysisContext context) throws AnalysisException {
        List<ReviewIssue> issues = context.getAttribute(FINAL_ISSUES, List.class)
            .orElseThrow(() -> new AnalysisException("Report was not compiled"));
        List<String> recommendations = context.getAttribute(RECOMMENDATIONS, List.class).orElse(List.of());
        int linesOfCode = context.getAttribute(LINES_OF_CODE, Integer.class).orElse(0);
        int filesProcessed = units(context).size();

        return ReviewResult.builder()
            .sessionId(context.getSessionId())
            .generatedAt(context.getClock().instant())
            .analyzer(NAME)
            .issues(issues)
            .metrics(ReviewMetrics.of(issues, filesProcessed, linesOfCode))
            .recommendations(recommendations)
            .configUsed(context.getConfig())
            .build();
    }

    @SuppressWarnings("unchecked")
    private static List<SourceUnit> units(AnalysisContext context) throws AnalysisException {
        return context.getAttribute(UNITS, List.class)
            .orElseThrow(() -> new AnalysisException("Files were not extracted"));
    }

    /**
     * Рекомендации по категориям найденных замечаний; общая рекомендация добавляется всегда.
     */
    static List<String> buildRecommendations(List<ReviewIssue> issues) {
        Set<IssueCategory> found = issues.stream()
            .map(ReviewIssue::getCategory)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(IssueCategory.class)));
        Set<String> recommendations = new LinkedHashSet<>();

        if (found.contains(IssueCategory.SECURITY)) {
            recommendations.add("Consider implementing automated testing for security-sensitive functions");
            recommendations.add("Add input validation for all user-facing interfaces");
        }
        if (found.contains(IssueCategory.PERFORMANCE)) {
            recommendations.add("Review loops that build strings or index sequences; prefer joins and direct iteration");
        }
        if (found.contains(IssueCategory.STYLE)) {
            recommendations.add("Enable an automatic formatter to keep code style consistent");
        }
        if (found.contains(IssueCategory.COMPLEXITY)) {
            recommendations.add("Refactor complex functions into smaller, well-named units");
        }
        if (found.contains(IssueCategory.DOCUMENTATION)) {
            recommendations.add("Document public functions and classes");
        }
        if (found.contains(IssueCategory.MAINTAINABILITY)) {
            recommendations.add("Track TODO and FIXME markers as issues and resolve them");
        }
        recommendations.add("Consider using static analysis tools in CI/CD pipeline");
        return List.copyOf(recommendations);
    }
}
