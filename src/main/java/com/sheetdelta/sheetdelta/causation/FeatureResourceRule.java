package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A feature added under the feature root ({@code class_features.rage} or {@code class_features[id=rage]})
 * explains any change under the resource root for the same feature name ({@code resources.rage.uses}).
 */
public class FeatureResourceRule implements CausalRule {

    private static final String NAME_FIELD = "name";

    private final String name;
    private final String featureRoot;
    private final String resourceRoot;
    private final double confidence;

    public FeatureResourceRule(String name, String featureRoot, String resourceRoot, double confidence) {
        this.name = Objects.requireNonNull(name, "name");
        this.featureRoot = Objects.requireNonNull(featureRoot, "featureRoot");
        this.resourceRoot = Objects.requireNonNull(resourceRoot, "resourceRoot");
        this.confidence = CausalMatch.requireConfidence(confidence);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CausalMatch> explain(FieldChange effect, CausalContext context) {
        String resource = nameBelow(effect.path(), resourceRoot);
        if (resource == null) {
            return Optional.empty();
        }

        for (FieldChange candidate : context.candidates()) {
            if (candidate.kind() != ChangeKind.ADDED) {
                continue;
            }
            String feature = nameBelow(candidate.path(), featureRoot);
            if (feature == null) {
                continue;
            }
            if (feature.equalsIgnoreCase(resource) || resource.equalsIgnoreCase(declaredName(candidate.newValue()))) {
                return Optional.of(new CausalMatch(candidate, confidence));
            }
        }
        return Optional.empty();
    }

    /**
     * Name of the segment right below {@code root}, or {@code null} when the path does not go below it.
     */
    private static String nameBelow(FieldPath path, String root) {
        List<String> segments = path.segments();
        int index = segments.indexOf(root);
        if (index < 0 || index + 1 >= segments.size()) {
            return null;
        }
        return FieldPath.segmentName(segments.get(index + 1));
    }

    private static String declaredName(Object value) {
        if (value instanceof Map<?, ?> map && map.get(NAME_FIELD) instanceof String declared) {
            return declared;
        }
        return null;
    }
}
