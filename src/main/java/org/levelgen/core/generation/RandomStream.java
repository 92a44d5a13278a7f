package org.levelgen.core.generation;

import java.util.List;

/**
 * Seeded linear congruential generator, {@code state = (a * state + c) mod 2^31}.
 * One instance per generation run; every random decision of the run is drawn from it,
 * so the same seed always reproduces the same map.
 */
public final class RandomStream {

    private static final long A = 1103515245L;
    private static final long C = 12345L;
    private static final long MASK = 0x7FFFFFFFL;
    private static final double MODULUS = 2147483648.0;

    private long state;

    public RandomStream(long seed) {
        this.state = Math.floorMod(seed, MASK + 1);
    }

    /** Next value in [0, 1). */
    public double nextDouble() {
        state = (A * state + C) & MASK;
        return state / MODULUS;
    }

    /** Uniform integer in [0, bound), 0 for a non-positive bound. */
    public int nextInt(int bound) {
        if (bound <= 0) return 0;
        return (int) Math.floor(nextDouble() * bound);
    }

    /** Uniform integer in [min, max], both inclusive. */
    public int range(int min, int max) {
        if (max <= min) return min;
        return min + (int) Math.floor(nextDouble() * (max - min + 1));
    }

    /** Uniform double in [min, min + span). */
    public double uniform(double min, double span) {
        return min + nextDouble() * span;
    }

    public boolean chance(double p) {
        return nextDouble() < p;
    }

    public double angle() {
        return nextDouble() * Math.PI * 2.0;
    }

    public <T> T pick(List<T> values) {
        return values.get(nextInt(values.size()));
    }

    /** Removes and returns a random element; callers check for an empty list first. */
    public <T> T take(List<T> values) {
        return values.remove(nextInt(values.size()));
    }
}
