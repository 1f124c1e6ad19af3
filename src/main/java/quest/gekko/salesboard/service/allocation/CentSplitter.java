package quest.gekko.salesboard.service.allocation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Splits an amount evenly across users at cent precision without losing or creating a cent.
 * <p>
 * Every user gets {@code floor(amount / n)} at two decimals; the leftover cents go one each
 * to the first users in ascending user id order (plain string comparison). Changing that
 * order changes every historical recompute, so it is fixed here.
 * <p>
 * {@link #apportion} rounds several exact parts of one whole together: each part is floored
 * to cents and the cents missing from the rounded whole go to the largest remainders, ties
 * in key order. The rounded parts always add up to the rounded whole.
 */
public final class CentSplitter {

    static final BigDecimal CENT = new BigDecimal("0.01");

    private CentSplitter() {}

    /**
     * @param amount  the amount to split; rounded half-up to cents first
     * @param userIds the users sharing it, in any order and possibly with duplicates
     * @return shares keyed by user id in canonical order, summing exactly to the rounded amount
     */
    public static Map<String, BigDecimal> split(BigDecimal amount, Collection<String> userIds) {
        List<String> ordered = canonicalOrder(userIds);
        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        if (ordered.isEmpty()) return shares;

        BigDecimal total = amount.setScale(2, RoundingMode.HALF_UP);
        BigDecimal n = BigDecimal.valueOf(ordered.size());
        BigDecimal base = total.divide(n, 2, RoundingMode.FLOOR);
        int extraCents = total.subtract(base.multiply(n)).movePointRight(2).intValueExact();

        for (int i = 0; i < ordered.size(); i++) {
            shares.put(ordered.get(i), i < extraCents ? base.add(CENT) : base);
        }
        return shares;
    }

    /**
     * @param parts exact amounts keyed by a comparable key (e.g. role)
     * @return the parts at cent precision in key order, summing to {@code sum(parts)} rounded half-up
     */
    public static <K extends Comparable<? super K>> Map<K, BigDecimal> apportion(Map<K, BigDecimal> parts) {
        Map<K, BigDecimal> rounded = new TreeMap<>();
        BigDecimal exactTotal = BigDecimal.ZERO;
        BigDecimal flooredTotal = BigDecimal.ZERO;
        for (Map.Entry<K, BigDecimal> part : parts.entrySet()) {
            BigDecimal floor = part.getValue().setScale(2, RoundingMode.FLOOR);
            rounded.put(part.getKey(), floor);
            exactTotal = exactTotal.add(part.getValue());
            flooredTotal = flooredTotal.add(floor);
        }
        int extraCents = exactTotal.setScale(2, RoundingMode.HALF_UP).subtract(flooredTotal).movePointRight(2).intValueExact();

        // sort is stable, so equal remainders keep key order
        List<K> byRemainder = new ArrayList<>(rounded.keySet());
        byRemainder.sort(Comparator.comparing((K key) -> parts.get(key).subtract(rounded.get(key))).reversed());
        for (int i = 0; i < extraCents; i++) {
            rounded.merge(byRemainder.get(i), CENT, BigDecimal::add);
        }
        return new LinkedHashMap<>(rounded);
    }

    public static List<String> canonicalOrder(Collection<String> userIds) {
        return userIds.stream().distinct().sorted().toList();
    }
}
