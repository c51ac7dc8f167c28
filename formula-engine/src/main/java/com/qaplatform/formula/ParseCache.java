package com.qaplatform.formula;

import com.qaplatform.formula.ast.FormulaNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Least-recently-used cache of parsed trees keyed by exact source text. Trees are
 * immutable, so one instance can be shared by concurrent evaluations.
 */
class ParseCache {

    private final int capacity;
    private final Map<String, FormulaNode> entries;

    ParseCache(int capacity) {
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, FormulaNode> eldest) {
                return size() > ParseCache.this.capacity;
            }
        };
    }

    synchronized FormulaNode get(String source) {
        return entries.get(source);
    }

    synchronized void put(String source, FormulaNode root) {
        entries.put(source, root);
    }

    synchronized int size() {
        return entries.size();
    }
}
