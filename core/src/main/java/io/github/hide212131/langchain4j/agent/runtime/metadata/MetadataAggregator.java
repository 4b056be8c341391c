package io.github.hide212131.langchain4j.agent.runtime.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects metadata values per key during a run and folds them at the end.
 *
 * <p>Values of one key are folded with {@link Addable#add} when all of them share one {@code Addable} type.
 * Otherwise they are kept as an ordered list. Keys with no values produce no entry.</p>
 */
public final class MetadataAggregator {

    public static final String TOKEN_USAGE = "token_usage";

    private final Map<String, List<Object>> collected = new LinkedHashMap<>();

    public void register(String key) {
        collected.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new ArrayList<>());
    }

    public void record(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            return;
        }
        collected.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    public Map<String, List<Object>> snapshot() {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        collected.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public Map<String, Object> aggregate() {
        return aggregate(collected);
    }

    public static Map<String, Object> aggregate(Map<String, ? extends List<?>> metadata) {
        Map<String, Object> result = new LinkedHashMap<>();
        metadata.forEach((key, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            result.put(key, fold(values));
        });
        return Collections.unmodifiableMap(result);
    }

    /** Adds two metadata values of unknown type: addables are added, lists concatenated, otherwise right wins. */
    public static Object combine(Object left, Object right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        if (sameAddableType(left, right)) {
            return addUnchecked(left, right);
        }
        if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
            List<Object> merged = new ArrayList<>(leftList);
            merged.addAll(rightList);
            return List.copyOf(merged);
        }
        return right;
    }

    private static Object fold(List<?> values) {
        Object first = values.get(0);
        boolean foldable = first instanceof Addable<?>
                && values.stream().allMatch(value -> value != null && value.getClass() == first.getClass());
        if (!foldable) {
            return List.copyOf(values);
        }
        Object acc = first;
        for (int i = 1; i < values.size(); i++) {
            acc = addUnchecked(acc, values.get(i));
        }
        return acc;
    }

    private static boolean sameAddableType(Object left, Object right) {
        return left instanceof Addable<?> && left.getClass() == right.getClass();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Object addUnchecked(Object left, Object right) {
        return ((Addable) left).add((Addable) right);
    }
}
