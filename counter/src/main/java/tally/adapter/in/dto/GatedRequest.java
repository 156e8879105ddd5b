package tally.adapter.in.dto;

import java.util.List;

/**
 * A request carrying a {@code whenAll} list of rule conditions.
 *
 * <p>The request only takes effect when every condition is {@code true}. A missing
 * list means unconditional; a {@code null} entry counts as false.
 */
public interface GatedRequest {

    List<Boolean> whenAll();

    default boolean conditionsMet() {
        return allTrue(whenAll());
    }

    /**
     * Check a {@code whenAll} list.
     *
     * @param conditions the conditions, may be null
     * @return true if the list is absent or every entry is {@code true}
     */
    static boolean allTrue(List<Boolean> conditions) {
        return conditions == null || conditions.stream().allMatch(Boolean.TRUE::equals);
    }
}
