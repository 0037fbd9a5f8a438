package eu.virtualparadox.laysum.summary.disclaimer;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword scan deciding which domain disclaimers a summary needs.
 * <p>Matching is a case-insensitive substring test, so {@code "law"} also fires on {@code "lawful"}.
 * Each category fires at most once; output order is health, finance, legal.</p>
 */
@Component
public class DisclaimerDetector {

    public static final String HEALTH = "Health: Not medical advice.";
    public static final String FINANCE = "Finance: Not investment advice.";
    public static final String LEGAL = "Legal: Not legal advice.";

    private static final List<Category> CATEGORIES = List.of(
            new Category(HEALTH, List.of("randomized", "trial", "treatment", "patients", "diagnosis", "therapy", "risk factor")),
            new Category(FINANCE, List.of("stock", "portfolio", "investment", "trading", "returns")),
            new Category(LEGAL, List.of("regulatory", "law", "statute", "liability"))
    );

    /**
     * @param text text to scan, usually the document abstract; {@code null} is treated as empty
     * @return triggered disclaimers, possibly empty
     */
    public List<String> detect(final String text) {
        final List<String> disclaimers = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return disclaimers;
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        for (final Category category : CATEGORIES) {
            if (category.triggers().stream().anyMatch(lower::contains)) {
                disclaimers.add(category.disclaimer());
            }
        }
        return disclaimers;
    }

    private record Category(String disclaimer, List<String> triggers) {
    }
}
