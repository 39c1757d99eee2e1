package com.example.tftlobby.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Minimal robots.txt reading: only {@code Disallow} prefixes under {@code User-agent: *} are honoured.
 */
public final class RobotsPolicy {

    public static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(Collections.emptyList());

    private final List<String> disallowed;

    private RobotsPolicy(List<String> disallowed) {
        this.disallowed = Collections.unmodifiableList(disallowed);
    }

    public static RobotsPolicy parse(String text) {
        if (text == null || text.isBlank()) {
            return ALLOW_ALL;
        }
        List<String> prefixes = new ArrayList<>();
        boolean wildcardBlock = false;
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith("user-agent:")) {
                wildcardBlock = "*".equals(valueOf(line));
            } else if (wildcardBlock && lower.startsWith("disallow:")) {
                String prefix = valueOf(line);
                if (!prefix.isEmpty()) {
                    prefixes.add(prefix);
                }
            }
        }
        return new RobotsPolicy(prefixes);
    }

    public boolean allows(String path) {
        for (String prefix : disallowed) {
            if (path.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    public List<String> disallowedPrefixes() {
        return disallowed;
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).trim();
    }
}
