/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import java.util.Random;
import java.util.UUID;

/**
 * Generates the UIDs and the random name suffixes. It is seeded, so a simulation with the same seed and the same
 * inputs generates the same names.
 */
public class NameGenerator {
    /**
     * Characters used in generated name suffixes (no vowels, so that no words are formed)
     */
    private static final String ALPHABET = "bcdfghjklmnpqrstvwxz2456789";
    private static final int SUFFIX_LENGTH = 5;

    private final Random random;

    /**
     * Constructs the generator
     *
     * @param seed  Seed of the generator
     */
    public NameGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * @return  New unique identifier
     */
    public String uid() {
        long most = (random.nextLong() & ~0xF000L) | 0x4000L;
        long least = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;

        return new UUID(most, least).toString();
    }

    /**
     * @return  New random name suffix
     */
    public String suffix() {
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);

        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }

        return sb.toString();
    }

    /**
     * @param baseName  Name prefix (the name of the controller)
     *
     * @return  Generated name of the form {@code <baseName>-<suffix>}
     */
    public String generateName(String baseName) {
        return baseName + "-" + suffix();
    }
}
