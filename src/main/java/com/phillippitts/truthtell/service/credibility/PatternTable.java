package com.phillippitts.truthtell.service.credibility;

import com.phillippitts.truthtell.domain.CredibilityPattern;
import com.phillippitts.truthtell.domain.PatternCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable trigger table: lower-cased trigger text to its {@link CredibilityPattern}.
 * Built once at startup and shared by every analyzer call. Iteration order is insertion order,
 * which is also the order detected patterns are reported in.
 */
public final class PatternTable {

    private final Map<String, CredibilityPattern> byTrigger;

    public PatternTable(List<CredibilityPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        Map<String, CredibilityPattern> map = new LinkedHashMap<>();
        for (CredibilityPattern pattern : patterns) {
            CredibilityPattern previous = map.putIfAbsent(pattern.normalizedTrigger(), pattern);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate trigger: " + pattern.trigger());
            }
        }
        this.byTrigger = Collections.unmodifiableMap(map);
    }

    /**
     * The built-in rule set: negative weights for sensationalist, clickbait and conspiracy
     * wording, positive weights for sourcing language.
     */
    public static PatternTable defaultRules() {
        List<CredibilityPattern> rules = new ArrayList<>();
        rules.add(new CredibilityPattern("shocking", -8, PatternCategory.SENSATIONALISM));
        rules.add(new CredibilityPattern("unbelievable", -7, PatternCategory.SENSATIONALISM));
        rules.add(new CredibilityPattern("sensational", -6, PatternCategory.SENSATIONALISM));
        rules.add(new CredibilityPattern("breaking", -5, PatternCategory.SENSATIONALISM));
        rules.add(new CredibilityPattern("exclusive", -5, PatternCategory.SENSATIONALISM));

        rules.add(new CredibilityPattern("you won't believe", -8, PatternCategory.CLICKBAIT));
        rules.add(new CredibilityPattern("mind-blowing", -7, PatternCategory.CLICKBAIT));
        rules.add(new CredibilityPattern("viral", -6, PatternCategory.CLICKBAIT));
        rules.add(new CredibilityPattern("secret", -5, PatternCategory.CLICKBAIT));

        rules.add(new CredibilityPattern("conspiracy", -8, PatternCategory.CONSPIRACY));
        rules.add(new CredibilityPattern("exposed", -7, PatternCategory.CONSPIRACY));
        rules.add(new CredibilityPattern("they don't want you to know", -8, PatternCategory.CONSPIRACY));
        rules.add(new CredibilityPattern("hidden truth", -7, PatternCategory.CONSPIRACY));

        rules.add(new CredibilityPattern("according to research", 5, PatternCategory.CREDIBLE));
        rules.add(new CredibilityPattern("studies show", 4, PatternCategory.CREDIBLE));
        rules.add(new CredibilityPattern("experts say", 3, PatternCategory.CREDIBLE));
        rules.add(new CredibilityPattern("official statement", 5, PatternCategory.CREDIBLE));
        return new PatternTable(rules);
    }

    public List<CredibilityPattern> patterns() {
        return List.copyOf(byTrigger.values());
    }

    public Optional<CredibilityPattern> lookup(String trigger) {
        if (trigger == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byTrigger.get(trigger.toLowerCase(Locale.ROOT)));
    }

    public int size() {
        return byTrigger.size();
    }
}
