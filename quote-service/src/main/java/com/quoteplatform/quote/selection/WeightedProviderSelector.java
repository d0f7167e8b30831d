package com.quoteplatform.quote.selection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Orders eligible providers for one selection.
 *
 * <p>Positive-weight providers are drawn by weighted random sampling without replacement, so a
 * provider with twice the weight is twice as likely to be tried first. Zero-weight providers
 * follow in the order they were given and act as a last resort.
 */
public class WeightedProviderSelector {

    private final Random random;

    public WeightedProviderSelector() {
        this(new Random());
    }

    public WeightedProviderSelector(Random random) {
        this.random = random;
    }

    /**
     * @param eligible provider names in configured order
     * @param weights  weight per provider; missing entries count as zero
     * @return every eligible provider exactly once, in attempt order
     */
    public List<String> order(List<String> eligible, Map<String, Double> weights) {
        List<String> weighted = new ArrayList<>();
        List<String> lastResort = new ArrayList<>();
        for (String name : eligible) {
            if (weightOf(name, weights) > 0.0) {
                weighted.add(name);
            } else {
                lastResort.add(name);
            }
        }

        List<String> ordered = new ArrayList<>(eligible.size());
        while (!weighted.isEmpty()) {
            double total = 0.0;
            for (String name : weighted) {
                total += weightOf(name, weights);
            }
            double pick = random.nextDouble() * total;
            int chosen = weighted.size() - 1;
            for (int i = 0; i < weighted.size(); i++) {
                pick -= weightOf(weighted.get(i), weights);
                if (pick < 0) {
                    chosen = i;
                    break;
                }
            }
            ordered.add(weighted.remove(chosen));
        }
        ordered.addAll(lastResort);
        return ordered;
    }

    private static double weightOf(String name, Map<String, Double> weights) {
        Double w = weights.get(name);
        return w == null ? 0.0 : w;
    }
}
