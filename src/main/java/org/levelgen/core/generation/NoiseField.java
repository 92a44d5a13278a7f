package org.levelgen.core.generation;

/**
 * Seeded simplex noise in 2D and 3D. Output is in roughly [-1, 1].
 *
 * Both permutation tables are shuffled from the run's {@link RandomStream} at
 * construction (255 draws each), so the field is as reproducible as the seed.
 */
public final class NoiseField {

    private static final double F2 = 0.5 * (Math.sqrt(3.0) - 1.0);
    private static final double G2 = (3.0 - Math.sqrt(3.0)) / 6.0;
    private static final double F3 = 1.0 / 3.0;
    private static final double G3 = 1.0 / 6.0;

    private static final int[][] GRAD2 = {
            {1, 1}, {-1, 1}, {1, -1}, {-1, -1},
            {1, 0}, {-1, 0}, {1, 0}, {-1, 0},
            {0, 1}, {0, -1}, {0, 1}, {0, -1}
    };

    private static final int[][] GRAD3 = {
            {1, 1, 0}, {-1, 1, 0}, {1, -1, 0}, {-1, -1, 0},
            {1, 0, 1}, {-1, 0, 1}, {1, 0, -1}, {-1, 0, -1},
            {0, 1, 1}, {0, -1, 1}, {0, 1, -1}, {0, -1, -1}
    };

    private final int[] perm2;
    private final int[] perm3;
    private final double frequency;

    public NoiseField(RandomStream rng, double frequency) {
        this.perm2 = buildPermutation(rng);
        this.perm3 = buildPermutation(rng);
        this.frequency = frequency;
    }

    public double frequency() {
        return frequency;
    }

    /** Noise at (x, y) scaled by the field frequency times {@code octave}. */
    public double sample(double x, double y, double octave) {
        double f = frequency * octave;
        return noise2(x * f, y * f);
    }

    public double sample(double x, double y) {
        return sample(x, y, 1.0);
    }

    public double noise2(double x, double y) {
        double s = (x + y) * F2;
        int i = fastFloor(x + s);
        int j = fastFloor(y + s);
        double t = (i + j) * G2;
        double x0 = x - (i - t);
        double y0 = y - (j - t);

        int i1;
        int j1;
        if (x0 > y0) {
            i1 = 1;
            j1 = 0;
        } else {
            i1 = 0;
            j1 = 1;
        }

        double x1 = x0 - i1 + G2;
        double y1 = y0 - j1 + G2;
        double x2 = x0 - 1.0 + 2.0 * G2;
        double y2 = y0 - 1.0 + 2.0 * G2;

        int ii = i & 255;
        int jj = j & 255;

        double n0 = corner2(x0, y0, perm2[ii + perm2[jj]] % 12);
        double n1 = corner2(x1, y1, perm2[ii + i1 + perm2[jj + j1]] % 12);
        double n2 = corner2(x2, y2, perm2[ii + 1 + perm2[jj + 1]] % 12);
        return clamp(70.0 * (n0 + n1 + n2));
    }

    public double noise3(double x, double y, double z) {
        double s = (x + y + z) * F3;
        int i = fastFloor(x + s);
        int j = fastFloor(y + s);
        int k = fastFloor(z + s);
        double t = (i + j + k) * G3;
        double x0 = x - (i - t);
        double y0 = y - (j - t);
        double z0 = z - (k - t);

        int i1, j1, k1;
        int i2, j2, k2;
        if (x0 >= y0) {
            if (y0 >= z0) {
                i1 = 1; j1 = 0; k1 = 0; i2 = 1; j2 = 1; k2 = 0;
            } else if (x0 >= z0) {
                i1 = 1; j1 = 0; k1 = 0; i2 = 1; j2 = 0; k2 = 1;
            } else {
                i1 = 0; j1 = 0; k1 = 1; i2 = 1; j2 = 0; k2 = 1;
            }
        } else {
            if (y0 < z0) {
                i1 = 0; j1 = 0; k1 = 1; i2 = 0; j2 = 1; k2 = 1;
            } else if (x0 < z0) {
                i1 = 0; j1 = 1; k1 = 0; i2 = 0; j2 = 1; k2 = 1;
            } else {
                i1 = 0; j1 = 1; k1 = 0; i2 = 1; j2 = 1; k2 = 0;
            }
        }

        double x1 = x0 - i1 + G3;
        double y1 = y0 - j1 + G3;
        double z1 = z0 - k1 + G3;
        double x2 = x0 - i2 + 2.0 * G3;
        double y2 = y0 - j2 + 2.0 * G3;
        double z2 = z0 - k2 + 2.0 * G3;
        double x3 = x0 - 1.0 + 3.0 * G3;
        double y3 = y0 - 1.0 + 3.0 * G3;
        double z3 = z0 - 1.0 + 3.0 * G3;

        int ii = i & 255;
        int jj = j & 255;
        int kk = k & 255;

        double n0 = corner3(x0, y0, z0, perm3[ii + perm3[jj + perm3[kk]]] % 12);
        double n1 = corner3(x1, y1, z1, perm3[ii + i1 + perm3[jj + j1 + perm3[kk + k1]]] % 12);
        double n2 = corner3(x2, y2, z2, perm3[ii + i2 + perm3[jj + j2 + perm3[kk + k2]]] % 12);
        double n3 = corner3(x3, y3, z3, perm3[ii + 1 + perm3[jj + 1 + perm3[kk + 1]]] % 12);
        return clamp(32.0 * (n0 + n1 + n2 + n3));
    }

    private static double corner2(double x, double y, int gi) {
        double t = 0.5 - x * x - y * y;
        if (t < 0) return 0.0;
        t *= t;
        return t * t * (GRAD2[gi][0] * x + GRAD2[gi][1] * y);
    }

    private static double corner3(double x, double y, double z, int gi) {
        double t = 0.6 - x * x - y * y - z * z;
        if (t < 0) return 0.0;
        t *= t;
        return t * t * (GRAD3[gi][0] * x + GRAD3[gi][1] * y + GRAD3[gi][2] * z);
    }

    private static int[] buildPermutation(RandomStream rng) {
        int[] p = new int[512];
        for (int i = 0; i < 256; i++) p[i] = i;
        for (int i = 0; i < 255; i++) {
            int r = i + (int) (rng.nextDouble() * (256 - i));
            int tmp = p[i];
            p[i] = p[r];
            p[r] = tmp;
        }
        for (int i = 256; i < 512; i++) p[i] = p[i - 256];
        return p;
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }

    private static int fastFloor(double v) {
        int i = (int) v;
        return (v < i) ? i - 1 : i;
    }
}
