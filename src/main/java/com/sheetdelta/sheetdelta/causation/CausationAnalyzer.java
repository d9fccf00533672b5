package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Links changes to the changes that explain them.
 * <p>
 * Every change is evaluated once, in path order, against every rule; the most confident match at or above
 * the threshold becomes its cause and the first-declared rule wins ties. Depths are then assigned in up to
 * {@code maxDepth} passes, one hop per pass. All working state lives inside a single call.
 */
public class CausationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CausationAnalyzer.class);

    static final Comparator<FieldChange> EVALUATION_ORDER =
            Comparator.comparing(FieldChange::path).thenComparing(FieldChange::kind);

    public List<CausationLink> analyze(
            List<FieldChange> changes,
            List<CausalRule> rules,
            int maxDepth,
            double minConfidence
    ) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1], was " + minConfidence);
        }

        List<FieldChange> ordered = new ArrayList<>(changes);
        ordered.sort(EVALUATION_ORDER);
        List<FieldChange> view = Collections.unmodifiableList(ordered);

        Map<FieldChange, FieldChange> canonical = new HashMap<>();
        for (FieldChange change : ordered) {
            canonical.putIfAbsent(change, change);
        }

        Map<FieldChange, Explanation> explanations = new IdentityHashMap<>();
        Map<FieldChange, List<FieldChange>> effectsByCause = new IdentityHashMap<>();

        for (FieldChange effect : ordered) {
            Set<FieldChange> excluded = chainedTo(effect, effectsByCause);
            CausalContext context = new CausalContext(view, effect, excluded);
            Explanation best = bestExplanation(effect, context, rules, canonical, minConfidence);
            if (best != null) {
                explanations.put(effect, best);
                effectsByCause.computeIfAbsent(best.cause(), key -> new ArrayList<>()).add(effect);
            }
        }

        return buildLinks(ordered, explanations, maxDepth);
    }

    private Explanation bestExplanation(
            FieldChange effect,
            CausalContext context,
            List<CausalRule> rules,
            Map<FieldChange, FieldChange> canonical,
            double minConfidence
    ) {
        Explanation best = null;
        for (CausalRule rule : rules) {
            Optional<CausalMatch> match;
            try {
                match = rule.explain(effect, context);
            } catch (RuntimeException ex) {
                log.warn("Causal rule '{}' failed on {}; treating as no match", rule.name(), effect.path(), ex);
                continue;
            }
            if (match == null || match.isEmpty()) {
                continue;
            }

            FieldChange cause = canonical.get(match.get().cause());
            if (cause == null || context.isExcluded(cause)) {
                log.debug("Discarding cause {} proposed by '{}' for {}", match.get().cause().path(), rule.name(), effect.path());
                continue;
            }
            double confidence = match.get().confidence();
            if (confidence < minConfidence) {
                continue;
            }
            // strictly greater keeps the first-declared rule on equal confidence
            if (best == null || confidence > best.confidence()) {
                best = new Explanation(cause, rule.name(), confidence);
            }
        }
        return best;
    }

    /**
     * The effect plus every change whose explanation chain already runs through it.
     */
    private Set<FieldChange> chainedTo(FieldChange effect, Map<FieldChange, List<FieldChange>> effectsByCause) {
        Set<FieldChange> chained = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<FieldChange> pending = new ArrayDeque<>();
        pending.push(effect);
        while (!pending.isEmpty()) {
            FieldChange next = pending.pop();
            if (chained.add(next)) {
                pending.addAll(effectsByCause.getOrDefault(next, List.of()));
            }
        }
        return chained;
    }

    private List<CausationLink> buildLinks(
            List<FieldChange> ordered,
            Map<FieldChange, Explanation> explanations,
            int maxDepth
    ) {
        Map<FieldChange, Integer> depths = new IdentityHashMap<>();
        for (FieldChange change : ordered) {
            if (!explanations.containsKey(change)) {
                depths.put(change, 0);
            }
        }

        for (int pass = 1; pass <= maxDepth; pass++) {
            for (FieldChange effect : ordered) {
                Explanation explanation = explanations.get(effect);
                if (explanation == null || depths.containsKey(effect)) {
                    continue;
                }
                Integer causeDepth = depths.get(explanation.cause());
                if (causeDepth != null && causeDepth == pass - 1) {
                    depths.put(effect, pass);
                }
            }
        }

        List<CausationLink> links = new ArrayList<>(explanations.size());
        for (FieldChange effect : ordered) {
            Explanation explanation = explanations.get(effect);
            if (explanation == null) {
                continue;
            }
            Integer depth = depths.get(effect);
            boolean truncated = depth == null || depth >= maxDepth;
            int boundedDepth = depth == null ? maxDepth : depth;
            links.add(new CausationLink(
                    effect,
                    explanation.cause(),
                    explanation.ruleName(),
                    explanation.confidence(),
                    boundedDepth,
                    truncated
            ));
            log.debug("{} explained by {} via '{}' (confidence={}, depth={}, truncated={})",
                    effect.path(), explanation.cause().path(), explanation.ruleName(),
                    explanation.confidence(), boundedDepth, truncated);
        }
        return links;
    }

    private record Explanation(FieldChange cause, String ruleName, double confidence) {
    }
}
