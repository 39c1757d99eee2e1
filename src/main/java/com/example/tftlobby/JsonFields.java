package com.example.tftlobby;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Null-safe field access on Gson trees. Missing fields and unexpected types read as null or the given default.
 */
public final class JsonFields {

    public static JsonObject obj(JsonElement e) {
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    public static JsonObject obj(JsonObject parent, String key) {
        return parent == null ? null : obj(parent.get(key));
    }

    public static JsonArray arr(JsonObject parent, String key) {
        if (parent == null) return null;
        JsonElement e = parent.get(key);
        return e != null && e.isJsonArray() ? e.getAsJsonArray() : null;
    }

    public static String str(JsonObject parent, String key) {
        if (parent == null) return null;
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonPrimitive()) return null;
        String s = e.getAsString();
        return s.isEmpty() ? null : s;
    }

    /**
     * Numeric value of a field, or null when absent or not a JSON number. Numeric strings do not count.
     */
    public static Double num(JsonObject parent, String key) {
        if (parent == null) return null;
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonPrimitive()) return null;
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (!p.isNumber()) return null;
        double v = p.getAsDouble();
        return Double.isFinite(v) ? v : null;
    }

    public static int intOr(JsonObject parent, String key, int fallback) {
        Double v = num(parent, key);
        return v == null ? fallback : v.intValue();
    }

    private JsonFields() {}
}
