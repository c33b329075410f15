package pl.marcinmilkowski.resonant_search.tokenizer;

/**
 * Trial-division primality helpers used to allocate term identifiers.
 */
public final class PrimeNumbers {

    private PrimeNumbers() {
    }

    /**
     * Check whether a number is prime by trial division up to its square root.
     */
    public static boolean isPrime(long n) {
        if (n < 2) return false;
        if (n < 4) return true;
        if (n % 2 == 0 || n % 3 == 0) return false;
        // 6k +/- 1 wheel
        for (long d = 5; d * d <= n; d += 6) {
            if (n % d == 0 || n % (d + 2) == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Smallest prime strictly greater than {@code n}.
     */
    public static long nextPrimeAfter(long n) {
        long candidate = n < 2 ? 2 : n + 1;
        while (!isPrime(candidate)) {
            candidate++;
        }
        return candidate;
    }
}
