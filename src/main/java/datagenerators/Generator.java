package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public class Generator {
    // Printable ASCII, the default pool for benchmark texts
    public static final char[] PRINTABLE = buildPrintable();

    public static final char[] DNA = "acgt".toCharArray();

    private static char[] buildPrintable() {
        char[] chars = new char[127 - 32];
        for (int c = 32; c < 127; c++) {
            chars[c - 32] = (char) c;
        }
        return chars;
    }

    // Uniform draw from pool, reproducible for a given seed.
    public static String generateUniform(int length, char[] pool, long seed) {
        if (length < 0) throw new IllegalArgumentException("length < 0");
        if (pool == null || pool.length == 0) throw new IllegalArgumentException("pool is empty");

        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = pool[rng.nextInt(pool.length)];
        }
        return new String(chars);
    }

    public static String generateZipf(int length, char[] pool, double exponent, long seed) {
        if (length < 0) throw new IllegalArgumentException("length < 0");
        if (pool == null || pool.length == 0) throw new IllegalArgumentException("pool is empty");

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, pool.length]
        ZipfDistribution dist = new ZipfDistribution(rng, pool.length, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = pool[dist.sample() - 1];
        }
        return new String(chars);
    }
}
