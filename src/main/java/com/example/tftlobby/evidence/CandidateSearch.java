package com.example.tftlobby.evidence;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Depth-first search of an unknown JSON document for objects shaped like {@link CompositionCandidate}.
 * Matches are returned in document order; a match's own children are searched too.
 */
public final class CandidateSearch {

    public static final int DEFAULT_MAX_DEPTH = 32;

    private final int maxDepth;

    public CandidateSearch() {
        this(DEFAULT_MAX_DEPTH);
    }

    public CandidateSearch(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public List<CompositionCandidate> find(JsonElement root) {
        List<CompositionCandidate> found = new ArrayList<>();
        walk(root, 0, found);
        return found;
    }

    private void walk(JsonElement node, int depth, List<CompositionCandidate> found) {
        if (node == null || depth > maxDepth) {
            return;
        }
        if (node.isJsonObject()) {
            JsonObject obj = node.getAsJsonObject();
            if (CompositionCandidate.matches(obj)) {
                found.add(CompositionCandidate.from(obj));
            }
            for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
                walk(e.getValue(), depth + 1, found);
            }
        } else if (node.isJsonArray()) {
            JsonArray arr = node.getAsJsonArray();
            for (JsonElement e : arr) {
                walk(e, depth + 1, found);
            }
        }
    }
}
