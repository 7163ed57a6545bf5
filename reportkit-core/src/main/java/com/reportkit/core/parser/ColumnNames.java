package com.reportkit.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Column naming rules shared by the ingestion parsers.
 */
final class ColumnNames {

    private static final Logger logger = LoggerFactory.getLogger(ColumnNames.class);

    private ColumnNames() {
    }

    /**
     * Make names unique by suffixing repeats with _2, _3, ... in order of appearance.
     */
    static List<String> unique(List<String> names) {
        Set<String> seen = new HashSet<>();
        List<String> unique = new ArrayList<>(names.size());
        for (String name : names) {
            String candidate = name;
            int suffix = 2;
            while (!seen.add(candidate)) {
                candidate = name + "_" + suffix++;
            }
            if (!candidate.equals(name)) {
                logger.warn("Duplicate column '{}' renamed to '{}'", name, candidate);
            }
            unique.add(candidate);
        }
        return unique;
    }
}
