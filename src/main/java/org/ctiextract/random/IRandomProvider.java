package org.ctiextract.random;

import java.util.Random;

/**
 * Source of pseudo-random numbers passed explicitly to every operation that needs randomness.
 * Implementations must be deterministic for a given seed.
 */
public interface IRandomProvider {

    /**
     * @param bound Exclusive upper bound, positive.
     * @return A uniformly distributed int in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * @return A uniformly distributed double in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * @return A standard normal deviate.
     */
    double nextGaussian();

    /**
     * Exposes the underlying generator for APIs that take a {@link Random}. Draws made through it
     * advance this provider.
     *
     * @return The backing generator.
     */
    Random asJavaRandom();

    /**
     * Creates an independent provider for a named sub-task, so that adding draws in one sub-task
     * does not shift the sequence seen by another.
     *
     * @param scope Name of the sub-task, e.g. {@code "readNoise"}.
     * @param key Discriminator within the scope, e.g. a frame index.
     * @return A provider seeded from this provider's seed, the scope and the key.
     */
    IRandomProvider deriveFor(String scope, long key);
}
