package dao.subnet.settle.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Net outflow per asset (lowercase asset id hex -> minor units). Iteration is in asset id order.
 */
public final class PomDelta {

    private static final PomDelta EMPTY = new PomDelta(new TreeMap<>());

    private final SortedMap<String, BigInteger> amounts;

    private PomDelta(SortedMap<String, BigInteger> amounts) {
        this.amounts = Collections.unmodifiableSortedMap(amounts);
    }

    public static PomDelta empty() {
        return EMPTY;
    }

    public static PomDelta of(Map<String, BigInteger> amounts) {
        Builder b = builder();
        amounts.forEach(b::add);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedMap<String, BigInteger> amounts() {
        return amounts;
    }

    public BigInteger get(String assetId) {
        return amounts.getOrDefault(assetId, BigInteger.ZERO);
    }

    public boolean isEmpty() {
        return amounts.isEmpty();
    }

    public BigInteger total() {
        return amounts.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PomDelta other)) return false;
        return amounts.equals(other.amounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amounts);
    }

    @Override
    public String toString() {
        return "PomDelta" + amounts;
    }

    public static final class Builder {
        private final TreeMap<String, BigInteger> amounts = new TreeMap<>();

        private Builder() {}

        public Builder add(String assetId, BigInteger amount) {
            if (amount.signum() < 0) {
                throw new IllegalArgumentException("Negative amount for asset " + assetId + ": " + amount);
            }
            amounts.merge(assetId, amount, BigInteger::add);
            return this;
        }

        public PomDelta build() {
            return new PomDelta(new TreeMap<>(amounts));
        }
    }
}
