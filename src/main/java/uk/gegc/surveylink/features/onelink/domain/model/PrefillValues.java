package uk.gegc.surveylink.features.onelink.domain.model;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings prefill values into the shape they have after a JSON round trip: integral numbers become the
 * narrowest of {@code Integer}, {@code Long} and {@code BigInteger}, decimals become {@code Double},
 * arrays and collections become lists, nested maps keep insertion order. A payload built from
 * canonical values equals its own decoding.
 */
public final class PrefillValues {

    private PrefillValues() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Map<String, Object> canonical(Map<String, ?> prefill) {
        if (prefill == null || prefill.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        prefill.forEach((key, value) -> result.put(key, canonicalValue(value)));
        return Collections.unmodifiableMap(result);
    }

    static Object canonicalValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, nestedValue) -> nested.put(String.valueOf(key), canonicalValue(nestedValue)));
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            collection.forEach(item -> items.add(canonicalValue(item)));
            return Collections.unmodifiableList(items);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(canonicalValue(Array.get(value, i)));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Float f) {
            // JSON carries the float's shortest decimal form, not its binary widening
            return Double.parseDouble(Float.toString(f));
        }
        if (value instanceof Double || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Number number) {
            return canonicalIntegral(number);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Character) {
            return value.toString();
        }
        return value;
    }

    private static Number canonicalIntegral(Number number) {
        BigInteger big = number instanceof BigInteger b ? b : BigInteger.valueOf(number.longValue());
        if (big.bitLength() < Integer.SIZE) {
            return big.intValue();
        }
        if (big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        return big;
    }
}
