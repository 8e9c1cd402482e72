package io.github.drompincen.sheetbridge.runtime.mapping;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.error.SchemaMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches file column labels to schema attributes. Exact label matches are claimed first;
 * remaining attributes then compete for unclaimed labels by {@link StringSimilarity}, in
 * schema order. Among candidates at or above {@link StringSimilarity#FUZZY_THRESHOLD} the
 * highest score wins, then the smaller edit distance, then the leftmost column.
 */
@Component
public class ColumnMapper {

    private static final Logger log = LoggerFactory.getLogger(ColumnMapper.class);

    /**
     * @throws SchemaMismatchException if a required attribute has no column
     */
    public ColumnMappingPlan plan(List<String> fileLabels, Map<String, AttributeDefinition> attributes) {
        ColumnMappingPlan plan = match(fileLabels, attributes);
        List<ColumnMatch> missingRequired = plan.unmapped().stream()
                .filter(m -> m.attribute().required())
                .toList();
        if (!missingRequired.isEmpty()) {
            List<String> fields = missingRequired.stream().map(ColumnMatch::fieldName).toList();
            StringBuilder msg = new StringBuilder("File is missing required column(s): ");
            for (int i = 0; i < missingRequired.size(); i++) {
                ColumnMatch m = missingRequired.get(i);
                if (i > 0) msg.append(", ");
                msg.append("'").append(m.schemaLabel()).append("' (field ").append(m.fieldName()).append(")");
            }
            throw new SchemaMismatchException(msg.toString(), fields);
        }
        return plan;
    }

    /** Like {@link #plan} but never throws; unmatched required attributes are reported as unmapped. */
    public ColumnMappingPlan match(List<String> fileLabels, Map<String, AttributeDefinition> attributes) {
        Map<String, ColumnMatch> matched = new LinkedHashMap<>();
        boolean[] claimed = new boolean[fileLabels.size()];

        for (Map.Entry<String, AttributeDefinition> attr : attributes.entrySet()) {
            String wanted = attr.getKey().trim();
            for (int i = 0; i < fileLabels.size(); i++) {
                if (!claimed[i] && fileLabels.get(i) != null && fileLabels.get(i).trim().equals(wanted)) {
                    claimed[i] = true;
                    matched.put(attr.getKey(), new ColumnMatch(attr.getKey(), attr.getValue(), fileLabels.get(i), MatchKind.EXACT, 1.0));
                    break;
                }
            }
        }

        for (Map.Entry<String, AttributeDefinition> attr : attributes.entrySet()) {
            if (matched.containsKey(attr.getKey())) continue;
            int best = -1;
            double bestScore = 0;
            int bestDistance = Integer.MAX_VALUE;
            for (int i = 0; i < fileLabels.size(); i++) {
                String label = fileLabels.get(i);
                if (claimed[i] || label == null) continue;
                double byLabel = StringSimilarity.score(label, attr.getKey());
                double byField = StringSimilarity.score(label, attr.getValue().fieldName());
                double score = Math.max(byLabel, byField);
                int distance = byLabel >= byField
                        ? StringSimilarity.distance(label, attr.getKey())
                        : StringSimilarity.distance(label, attr.getValue().fieldName());
                if (score < StringSimilarity.FUZZY_THRESHOLD) continue;
                if (score > bestScore || (score == bestScore && distance < bestDistance)) {
                    best = i;
                    bestScore = score;
                    bestDistance = distance;
                }
            }
            if (best >= 0) {
                claimed[best] = true;
                matched.put(attr.getKey(), new ColumnMatch(attr.getKey(), attr.getValue(), fileLabels.get(best), MatchKind.FUZZY, bestScore));
                log.debug("Fuzzy matched column '{}' to '{}' (score {})", fileLabels.get(best), attr.getKey(), bestScore);
            }
        }

        List<ColumnMatch> matches = new ArrayList<>();
        for (Map.Entry<String, AttributeDefinition> attr : attributes.entrySet()) {
            matches.add(matched.getOrDefault(attr.getKey(), ColumnMatch.unmapped(attr.getKey(), attr.getValue())));
        }
        List<String> unclaimed = new ArrayList<>();
        for (int i = 0; i < fileLabels.size(); i++) {
            if (!claimed[i] && fileLabels.get(i) != null) unclaimed.add(fileLabels.get(i));
        }
        return new ColumnMappingPlan(matches, unclaimed);
    }
}
