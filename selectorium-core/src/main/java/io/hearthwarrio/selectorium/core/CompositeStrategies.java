package io.hearthwarrio.selectorium.core;

import io.hearthwarrio.selectorium.core.composite.IndexDisambiguationStrategy;
import io.hearthwarrio.selectorium.core.composite.ParentScopeStrategy;
import io.hearthwarrio.selectorium.core.composite.TextFilterStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utility methods for {@link CompositeStrategy} chains.
 */
public final class CompositeStrategies {

    private CompositeStrategies() {
    }

    /**
     * Default chain: parent scoping, then text filter, then index.
     *
     * @param generator generator used to build parent candidates
     * @return immutable ordered list
     */
    public static List<CompositeStrategy> defaults(CandidateGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return List.of(
                new ParentScopeStrategy(generator),
                new TextFilterStrategy(),
                new IndexDisambiguationStrategy()
        );
    }

    /**
     * Normalizes a strategy list:
     * <ul>
     *   <li>removes null entries</li>
     *   <li>orders by {@link CompositeStrategy#order()} then {@link CompositeStrategy#id()}</li>
     *   <li>deduplicates by {@link CompositeStrategy#id()} (first one wins)</li>
     * </ul>
     *
     * @param strategies input list (may be null)
     * @return normalized immutable list
     */
    public static List<CompositeStrategy> normalize(List<? extends CompositeStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            return List.of();
        }

        List<CompositeStrategy> cleaned = new ArrayList<>();
        for (CompositeStrategy s : strategies) {
            if (s != null) {
                cleaned.add(s);
            }
        }
        cleaned.sort(Comparator.comparingInt(CompositeStrategy::order).thenComparing(CompositeStrategy::id));

        Map<String, CompositeStrategy> byId = new LinkedHashMap<>();
        for (CompositeStrategy s : cleaned) {
            byId.putIfAbsent(s.id(), s);
        }

        return List.copyOf(byId.values());
    }
}
