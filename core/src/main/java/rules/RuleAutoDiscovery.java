package rules;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Автоматическое обнаружение правил через Java SPI (ServiceLoader).
 *
 * <p>Чтобы добавить правило:
 * <ul>
 *   <li>Реализуйте {@link CodeRule} (обычно наследуясь от {@link AbstractCodeRule})</li>
 *   <li>Добавьте полное имя класса в {@code META-INF/services/rules.CodeRule}</li>
 * </ul>
 *
 * <p>Пример содержимого файла META-INF/services:
 * <pre>
 * rules.security.DangerousEvalRule
 * rules.style.LineLengthRule
 * </pre>
 */
public final class RuleAutoDiscovery {
    private static final Logger logger = Logger.getLogger(RuleAutoDiscovery.class.getName());

    private RuleAutoDiscovery() {
        // Утилитный класс
    }

    /**
     * Находит все правила в classpath. Правило, которое не удалось загрузить, логируется и пропускается.
     */
    public static List<CodeRule> discoverRules() {
        List<CodeRule> discovered = new ArrayList<>();
        ServiceLoader<CodeRule> loader = ServiceLoader.load(CodeRule.class);
        Iterator<CodeRule> iterator = loader.iterator();
        while (true) {
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                CodeRule rule = iterator.next();
                discovered.add(rule);
                logger.fine("Discovered rule: " + rule.getId());
            } catch (ServiceConfigurationError e) {
                logger.warning("Failed to load rule: " + e.getMessage());
            }
        }
        logger.info("Discovered " + discovered.size() + " code rules");
        return discovered;
    }

    /**
     * Находит правила и регистрирует их в реестре.
     *
     * @return число зарегистрированных правил
     */
    public static int discoverAndRegister(RuleRegistry registry) {
        int registered = 0;
        for (CodeRule rule : discoverRules()) {
            try {
                registry.register(rule);
                registered++;
            } catch (IllegalArgumentException e) {
                logger.warning("Skipping rule: " + e.getMessage());
            }
        }
        return registered;
    }
}
