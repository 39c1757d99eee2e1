package com.example.tftlobby.evidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered, deduplicated tuple of up to three trait names. Value semantics: same names in the same order are equal.
 */
public final class Core {

    public static final Core EMPTY = new Core(Collections.emptyList());

    private static final int MAX_TRAITS = 3;
    private static final Pattern SET_PREFIX = Pattern.compile("^(?:TFT|Set)\\d+_", Pattern.CASE_INSENSITIVE);

    private final List<String> traits;

    private Core(List<String> traits) {
        this.traits = traits;
    }

    public static Core of(String... names) {
        List<String> list = new ArrayList<>();
        Collections.addAll(list, names);
        return of(list);
    }

    public static Core of(List<String> names) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String n : names) {
            if (n != null && !n.isEmpty()) unique.add(n);
        }
        if (unique.size() > MAX_TRAITS) {
            throw new IllegalArgumentException("a core holds at most " + MAX_TRAITS + " traits: " + unique);
        }
        if (unique.isEmpty()) return EMPTY;
        return new Core(Collections.unmodifiableList(new ArrayList<>(unique)));
    }

    public List<String> traits() {
        return traits;
    }

    public boolean isEmpty() {
        return traits.isEmpty();
    }

    public int size() {
        return traits.size();
    }

    public String displayName() {
        List<String> shown = new ArrayList<>(traits.size());
        for (String t : traits) {
            shown.add(SET_PREFIX.matcher(t).replaceFirst(""));
        }
        return String.join(" + ", shown);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Core)) return false;
        return traits.equals(((Core) o).traits);
    }

    @Override
    public int hashCode() {
        return traits.hashCode();
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", traits) + ")";
    }
}
