package quest.gekko.salesboard.service.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CentSplitterTest {

    @Test
    @DisplayName("100.00 over three users: first user in id order gets the extra cent")
    void remainderGoesToFirstUser() {
        Map<String, BigDecimal> shares = CentSplitter.split(new BigDecimal("100.00"), List.of("u3", "u1", "u2"));

        assertEquals(List.of("u1", "u2", "u3"), List.copyOf(shares.keySet()));
        assertEquals(new BigDecimal("33.34"), shares.get("u1"));
        assertEquals(new BigDecimal("33.33"), shares.get("u2"));
        assertEquals(new BigDecimal("33.33"), shares.get("u3"));
    }

    @Test
    void evenSplitHasNoRemainder() {
        Map<String, BigDecimal> shares = CentSplitter.split(new BigDecimal("150.00"), List.of("a", "b", "c"));

        shares.values().forEach(v -> assertEquals(new BigDecimal("50.00"), v));
    }

    @Test
    @DisplayName("Shares sum exactly to the amount for 1 to 50 users")
    void noDriftForUpTo50Users() {
        BigDecimal[] amounts = { new BigDecimal("100.00"), new BigDecimal("0.07"), new BigDecimal("12345.67"), new BigDecimal("1.00") };
        for (BigDecimal amount : amounts) {
            for (int n = 1; n <= 50; n++) {
                List<String> users = new ArrayList<>();
                for (int i = 0; i < n; i++) users.add("user-" + i);

                Map<String, BigDecimal> shares = CentSplitter.split(amount, users);

                BigDecimal sum = shares.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
                assertEquals(0, sum.compareTo(amount), "amount " + amount + " over " + n + " users summed to " + sum);
                BigDecimal min = shares.values().stream().min(BigDecimal::compareTo).orElseThrow();
                BigDecimal max = shares.values().stream().max(BigDecimal::compareTo).orElseThrow();
                assertTrue(max.subtract(min).compareTo(CentSplitter.CENT) <= 0);
            }
        }
    }

    @Test
    void amountIsRoundedToCentsBeforeSplitting() {
        Map<String, BigDecimal> shares = CentSplitter.split(new BigDecimal("10.005"), List.of("a", "b"));

        assertEquals(new BigDecimal("5.01"), shares.get("a"));
        assertEquals(new BigDecimal("5.00"), shares.get("b"));
    }

    @Test
    void idsCompareAsPlainStrings() {
        assertEquals(List.of("u10", "u2", "u9"), CentSplitter.canonicalOrder(List.of("u9", "u2", "u10", "u2")));
    }

    @Test
    void nobodyToSplitAmong() {
        assertTrue(CentSplitter.split(new BigDecimal("5.00"), List.of()).isEmpty());
    }

    @Test
    @DisplayName("Apportioned parts go to the largest remainders and add up to the rounded whole")
    void apportionByLargestRemainder() {
        Map<String, BigDecimal> parts = new TreeMap<>(Map.of(
                "a", new BigDecimal("10.004"), "b", new BigDecimal("10.009"), "c", new BigDecimal("10.007")));

        Map<String, BigDecimal> rounded = CentSplitter.apportion(parts);

        // 30.02 in total: floors give 30.00, the two missing cents go to b then c
        assertEquals(List.of("a", "b", "c"), List.copyOf(rounded.keySet()));
        assertEquals(new BigDecimal("10.00"), rounded.get("a"));
        assertEquals(new BigDecimal("10.01"), rounded.get("b"));
        assertEquals(new BigDecimal("10.01"), rounded.get("c"));
    }

    @Test
    void apportionBreaksTiesByKeyOrder() {
        Map<String, BigDecimal> rounded = CentSplitter.apportion(Map.of(
                "second", new BigDecimal("125.125"), "first", new BigDecimal("125.125")));

        assertEquals(new BigDecimal("125.13"), rounded.get("first"));
        assertEquals(new BigDecimal("125.12"), rounded.get("second"));
    }

    @Test
    void apportionOfNothingIsEmpty() {
        assertTrue(CentSplitter.apportion(Map.<String, BigDecimal>of()).isEmpty());
    }
}
