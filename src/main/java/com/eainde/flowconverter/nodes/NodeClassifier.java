package com.eainde.flowconverter.nodes;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps an opaque node class identifier to a {@link NodeCategory}.
 *
 * <p>Lookup order, first hit wins:</p>
 * <ol>
 *   <li>exact match in {@link ClassifierRules#IDENTIFIER_TABLE};</li>
 *   <li>longest substring match against the same table, in either direction;</li>
 *   <li>keyword scan of the lower-cased class name ({@link ClassifierRules#KEYWORD_RULES});</li>
 *   <li>{@link NodeCategory#CUSTOM}.</li>
 * </ol>
 *
 * <p>Total: never throws, {@code null} and blank identifiers classify as CUSTOM.</p>
 */
@Slf4j
@Component
public class NodeClassifier {

    /** A table key containing the identifier only counts for identifiers at least this long. */
    static final int MIN_REVERSE_MATCH_LENGTH = 4;

    private final Map<String, NodeCategory> identifierTable;

    public NodeClassifier() {
        this(ClassifierRules.IDENTIFIER_TABLE);
    }

    NodeClassifier(Map<String, NodeCategory> identifierTable) {
        this.identifierTable = identifierTable;
    }

    public NodeCategory classify(String classIdentifier) {
        if (classIdentifier == null || classIdentifier.isBlank()) {
            return NodeCategory.CUSTOM;
        }
        String identifier = classIdentifier.trim();

        NodeCategory exact = identifierTable.get(identifier);
        if (exact != null) {
            log.debug("Classified '{}' as {} (exact)", identifier, exact.code());
            return exact;
        }

        NodeCategory partial = longestSubstringMatch(identifier);
        if (partial != null) {
            log.debug("Classified '{}' as {} (partial)", identifier, partial.code());
            return partial;
        }

        String className = finalSegment(identifier).toLowerCase(Locale.ROOT);
        for (ClassifierRules.KeywordRule rule : ClassifierRules.KEYWORD_RULES) {
            if (rule.matches(className)) {
                log.debug("Classified '{}' as {} (keyword)", identifier, rule.category().code());
                return rule.category();
            }
        }

        log.debug("No rule matched '{}', defaulting to {}", identifier, NodeCategory.CUSTOM.code());
        return NodeCategory.CUSTOM;
    }

    private NodeCategory longestSubstringMatch(String identifier) {
        String identifierName = finalSegment(identifier);
        NodeCategory best = null;
        int bestLength = 0;
        boolean bestNameMatches = false;

        for (Map.Entry<String, NodeCategory> entry : identifierTable.entrySet()) {
            String key = entry.getKey();
            int length;
            if (identifier.contains(key)) {
                length = key.length();
            } else if (identifier.length() >= MIN_REVERSE_MATCH_LENGTH && key.contains(identifier)) {
                length = identifier.length();
            } else {
                continue;
            }

            boolean nameMatches = finalSegment(key).equals(identifierName);
            // table order decides remaining ties, so only strictly better candidates replace
            if (length > bestLength || (length == bestLength && nameMatches && !bestNameMatches)) {
                best = entry.getValue();
                bestLength = length;
                bestNameMatches = nameMatches;
            }
        }
        return best;
    }

    static String finalSegment(String identifier) {
        int dot = identifier.lastIndexOf('.');
        return dot < 0 ? identifier : identifier.substring(dot + 1);
    }
}
