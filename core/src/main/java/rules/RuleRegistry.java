package rules;

import model.IssueCategory;
import model.Language;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Реестр правил анализа: регистрация, удаление и поиск по категории и языку.
 */
public final class RuleRegistry {
    private static final Logger logger = Logger.getLogger(RuleRegistry.class.getName());

    private final Map<String, CodeRule> rules = new ConcurrentHashMap<>();

    /**
     * Регистрирует правило.
     *
     * @param rule регистрируемое правило
     * @throws IllegalArgumentException если правило с таким ID уже зарегистрировано
     */
    public void register(CodeRule rule) {
        Objects.requireNonNull(rule, "rule cannot be null");

        String id = rule.getId();
        if (rules.putIfAbsent(id, rule) != null) {
            throw new IllegalArgumentException("Rule with ID '" + id + "' is already registered");
        }
        logger.fine("Registered rule: " + rule.getName() + " (ID: " + id + ")");
    }

    public boolean unregister(String ruleId) {
        return rules.remove(ruleId) != null;
    }

    public Optional<CodeRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Collection<CodeRule> getAllRules() {
        return Collections.unmodifiableCollection(rules.values());
    }

    /**
     * Правила категории, поддерживающие язык, упорядоченные по ID.
     */
    public List<CodeRule> getRules(IssueCategory category, Language language) {
        return rules.values().stream()
            .filter(rule -> rule.getCategory() == category)
            .filter(rule -> rule.supports(language))
            .sorted(Comparator.comparing(CodeRule::getId))
            .collect(Collectors.toList());
    }

    public int getRegisteredRuleCount() {
        return rules.size();
    }
}
