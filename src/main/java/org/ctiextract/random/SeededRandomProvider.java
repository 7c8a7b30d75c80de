package org.ctiextract.random;

import java.util.Random;

/**
 * {@link IRandomProvider} backed by a {@link Random} seeded once at construction.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public double nextGaussian() {
        return random.nextGaussian();
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long mixed = seed;
        mixed = 31 * mixed + scope.hashCode();
        mixed = 31 * mixed + key;
        return new SeededRandomProvider(mix64(mixed));
    }

    // SplitMix64 finalizer
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
