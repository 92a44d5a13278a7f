package org.levelgen.core.generation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoiseFieldTest {

    @Test
    void constructionConsumesTwoPermutationShuffles() {
        RandomStream used = new RandomStream(9);
        new NoiseField(used, 0.1);

        RandomStream reference = new RandomStream(9);
        for (int i = 0; i < 510; i++) {
            reference.nextDouble();
        }
        assertEquals(reference.nextDouble(), used.nextDouble());
    }

    @Test
    void sameSeedSameField() {
        NoiseField a = new NoiseField(new RandomStream(21), 0.1);
        NoiseField b = new NoiseField(new RandomStream(21), 0.1);
        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 30; x++) {
                assertEquals(a.sample(x, y), b.sample(x, y));
                assertEquals(a.noise3(x * 0.3, y * 0.3, 1.5), b.noise3(x * 0.3, y * 0.3, 1.5));
            }
        }
    }

    @Test
    void differentSeedsDiffer() {
        NoiseField a = new NoiseField(new RandomStream(1), 0.1);
        NoiseField b = new NoiseField(new RandomStream(2), 0.1);
        double diff = 0;
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 20; x++) {
                diff += Math.abs(a.sample(x, y) - b.sample(x, y));
            }
        }
        assertNotEquals(0.0, diff);
    }

    @Test
    void outputStaysWithinUnitRange() {
        NoiseField noise = new NoiseField(new RandomStream(77), 0.37);
        for (int y = -50; y < 50; y++) {
            for (int x = -50; x < 50; x++) {
                double v2 = noise.sample(x, y, 2.0);
                double v3 = noise.noise3(x * 0.21, y * 0.17, (x + y) * 0.05);
                assertTrue(v2 >= -1.0 && v2 <= 1.0, "noise2 " + v2);
                assertTrue(v3 >= -1.0 && v3 <= 1.0, "noise3 " + v3);
            }
        }
    }

    @Test
    void latticeOriginIsZero() {
        NoiseField noise = new NoiseField(new RandomStream(4), 0.1);
        assertEquals(0.0, noise.noise2(0, 0), 1e-12);
    }
}
