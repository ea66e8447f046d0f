package com.jsonsource.generator.codegen.convert;

/**
 * Private static members shared by the generated code of a unit. Each constant is emitted at
 * most once per companion class, whatever the number of classes needing it.
 */
public final class HelperFragments {

    private HelperFragments() {
        // Constants only
    }

    public static final String DECODE_LIST = """
            private static <E> List<E> decodeList(Object json, Function<Object, E> element) {
                if (json == null) {
                    return null;
                }
                List<E> result = new ArrayList<>();
                for (Object item : (Iterable<?>) json) {
                    result.add(element.apply(item));
                }
                return result;
            }""";

    public static final String DECODE_SET = """
            private static <E> Set<E> decodeSet(Object json, Function<Object, E> element) {
                if (json == null) {
                    return null;
                }
                Set<E> result = new LinkedHashSet<>();
                for (Object item : (Iterable<?>) json) {
                    result.add(element.apply(item));
                }
                return result;
            }""";

    public static final String DECODE_MAP = """
            private static <V> Map<String, V> decodeMap(Object json, Function<Object, V> value) {
                if (json == null) {
                    return null;
                }
                Map<String, V> result = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) json).entrySet()) {
                    result.put(String.valueOf(entry.getKey()), value.apply(entry.getValue()));
                }
                return result;
            }""";

    public static final String ENCODE_ITERABLE = """
            private static <E> List<Object> encodeIterable(Iterable<E> values, Function<E, Object> element) {
                if (values == null) {
                    return null;
                }
                List<Object> result = new ArrayList<>();
                for (E value : values) {
                    result.add(element.apply(value));
                }
                return result;
            }""";

    public static final String ENCODE_MAP = """
            private static <V> Map<String, Object> encodeMap(Map<String, V> values, Function<V, Object> value) {
                if (values == null) {
                    return null;
                }
                Map<String, Object> result = new LinkedHashMap<>();
                for (Map.Entry<String, V> entry : values.entrySet()) {
                    result.put(entry.getKey(), value.apply(entry.getValue()));
                }
                return result;
            }""";

    public static final String DECODE_ENUM = """
            private static <E extends Enum<E>> E decodeEnum(Map<E, String> values, Object json) {
                if (json == null) {
                    return null;
                }
                for (Map.Entry<E, String> entry : values.entrySet()) {
                    if (entry.getValue().equals(json)) {
                        return entry.getKey();
                    }
                }
                throw new IllegalArgumentException("`" + json + "` is not one of the supported values: "
                        + String.join(", ", values.values()));
            }""";

    public static final String CHECK_KEYS = """
            private static void checkKeys(Map<String, ?> json, List<String> allowedKeys, List<String> requiredKeys,
                    List<String> disallowNullValues) {
                if (allowedKeys != null) {
                    List<String> unrecognized = new ArrayList<>();
                    for (String key : json.keySet()) {
                        if (!allowedKeys.contains(key)) {
                            unrecognized.add(key);
                        }
                    }
                    if (!unrecognized.isEmpty()) {
                        throw new IllegalArgumentException("Unrecognized keys: [" + String.join(", ", unrecognized)
                                + "]; supported keys: [" + String.join(", ", allowedKeys) + "]");
                    }
                }
                List<String> missing = new ArrayList<>();
                for (String key : requiredKeys) {
                    if (!json.containsKey(key)) {
                        missing.add(key);
                    }
                }
                if (!missing.isEmpty()) {
                    throw new IllegalArgumentException("Required keys are missing: " + String.join(", ", missing));
                }
                List<String> nullValued = new ArrayList<>();
                for (String key : disallowNullValues) {
                    if (json.containsKey(key) && json.get(key) == null) {
                        nullValued.add(key);
                    }
                }
                if (!nullValued.isEmpty()) {
                    throw new IllegalArgumentException("These keys had `null` values, which is not allowed: "
                            + String.join(", ", nullValued));
                }
            }""";

    public static final String PUT_IF_NOT_NULL = """
            private static void putIfNotNull(Map<String, Object> json, String key, Object value) {
                if (value != null) {
                    json.put(key, value);
                }
            }""";

    public static final String JSON_OBJECT = """
            private static Map<String, Object> jsonObject(Object... keysAndValues) {
                Map<String, Object> result = new LinkedHashMap<>();
                for (int i = 0; i < keysAndValues.length; i += 2) {
                    result.put((String) keysAndValues[i], keysAndValues[i + 1]);
                }
                return java.util.Collections.unmodifiableMap(result);
            }""";

    public static final String JSON_ARRAY = """
            private static List<Object> jsonArray(Object... values) {
                return java.util.Collections.unmodifiableList(java.util.Arrays.asList(values));
            }""";
}
