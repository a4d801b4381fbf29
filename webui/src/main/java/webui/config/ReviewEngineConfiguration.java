package webui.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import report.ArchiveBuilder;
import report.HtmlReporter;
import report.JsonReporter;
import review.CodeAnalyzer;
import review.ResultStore;
import review.ReviewEngine;
import review.SessionStore;
import rules.RuleBasedCodeAnalyzer;

import java.time.Clock;

/**
 * Сборка движка ревью и генераторов отчетов.
 */
@Configuration
@EnableConfigurationProperties(ReviewEngineProperties.class)
public class ReviewEngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CodeAnalyzer codeAnalyzer() {
        return new RuleBasedCodeAnalyzer();
    }

    /**
     * Движок закрывается вместе с контекстом: пул воркеров получает 60 секунд на завершение.
     */
    @Bean(destroyMethod = "close")
    public ReviewEngine reviewEngine(CodeAnalyzer codeAnalyzer, ReviewEngineProperties properties, Clock clock) {
        return new ReviewEngine(codeAnalyzer, properties.toEngineConfig(),
            new SessionStore(), new ResultStore(), clock);
    }

    @Bean
    public HtmlReporter htmlReporter(Clock clock) {
        return new HtmlReporter(clock);
    }

    @Bean
    public JsonReporter jsonReporter() {
        return new JsonReporter();
    }

    @Bean
    public ArchiveBuilder archiveBuilder(Clock clock, JsonReporter jsonReporter) {
        return new ArchiveBuilder(clock, jsonReporter);
    }
}
