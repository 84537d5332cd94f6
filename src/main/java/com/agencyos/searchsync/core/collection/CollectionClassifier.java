package com.agencyos.searchsync.core.collection;

import com.agencyos.searchsync.core.model.ClassificationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides which host collections feed the search index and derives the tenant and
 * entity kind from the collection name.
 *
 * <h2>Naming convention (LOCKED)</h2>
 * <pre>
 * &lt;tenant&gt;&lt;suffix&gt;      e.g. pntl_products  -&gt; tenant=pntl, entity kind=products
 * </pre>
 *
 * <ul>
 *   <li>Suffixes are checked in configured order; the first one the name ends with wins.</li>
 *   <li>The entity kind is the matched suffix without its leading separator character.</li>
 *   <li>A name with no matching suffix is not relevant; its tenant is the whole name and its
 *       entity kind is {@code unknown}.</li>
 * </ul>
 *
 * <p>Pure and thread-safe: no I/O, no mutable state, never throws for a non-null name.</p>
 */
public final class CollectionClassifier {

    /** Suffixes used when none are configured. */
    public static final List<String> DEFAULT_SUFFIXES = List.of("_products", "_categories");

    private final List<String> suffixes;

    public CollectionClassifier(List<String> suffixes) {
        if (suffixes == null || suffixes.isEmpty()) {
            throw new IllegalArgumentException("At least one collection suffix is required");
        }
        List<String> copy = new ArrayList<>(suffixes.size());
        for (String s : suffixes) {
            if (s == null || s.isBlank()) {
                throw new IllegalArgumentException("Collection suffixes must not be blank: " + suffixes);
            }
            copy.add(s.trim());
        }
        this.suffixes = Collections.unmodifiableList(copy);
    }

    public static CollectionClassifier withDefaults() {
        return new CollectionClassifier(DEFAULT_SUFFIXES);
    }

    /**
     * Classifies a collection name against the configured suffixes.
     */
    public ClassificationResult classify(String sourceName) {
        return classify(sourceName, suffixes);
    }

    /**
     * Convenience for callers that only need the relevance flag.
     */
    public boolean isRelevant(String sourceName) {
        return classify(sourceName).relevant();
    }

    /**
     * Classifies {@code sourceName} against an explicit ordered suffix list.
     *
     * @param sourceName collection name; null is treated as not relevant
     * @param suffixSet  ordered suffixes, first match wins
     */
    public static ClassificationResult classify(String sourceName, List<String> suffixSet) {
        if (sourceName == null) {
            return ClassificationResult.notRelevant("");
        }
        for (String suffix : suffixSet) {
            if (sourceName.endsWith(suffix)) {
                String tenant = sourceName.substring(0, sourceName.length() - suffix.length());
                return new ClassificationResult(true, tenant, entityKindOf(suffix));
            }
        }
        return ClassificationResult.notRelevant(sourceName);
    }

    public List<String> suffixes() {
        return suffixes;
    }

    private static String entityKindOf(String suffix) {
        if (!suffix.isEmpty() && !Character.isLetterOrDigit(suffix.charAt(0))) {
            return suffix.substring(1);
        }
        return suffix;
    }
}
