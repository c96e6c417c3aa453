package org.calista.credence.calibration;

/**
 * Wilson score interval for a binomial proportion. Stays inside [0,1] and is usable
 * for small samples and proportions near 0 or 1.
 */
public record WilsonInterval(double low, double high, double level) {

    /** Two-sided 95% normal quantile. */
    public static final double Z_95 = 1.959963984540054;

    public WilsonInterval {
        if (!(low >= 0.0 && high <= 1.0 && low <= high)) {
            throw new IllegalArgumentException("bad interval [" + low + ", " + high + "]");
        }
    }

    public static WilsonInterval of95(long successes, long n) {
        return withZ(successes, n, Z_95, 0.95);
    }

    /**
     * @param level two-sided confidence level in (0,1), e.g. 0.95
     */
    public static WilsonInterval of(long successes, long n, double level) {
        if (!(level > 0.0 && level < 1.0)) throw new IllegalArgumentException("level must be within (0,1), got " + level);
        double z = level == 0.95 ? Z_95 : normalQuantile(1.0 - (1.0 - level) / 2.0);
        return withZ(successes, n, z, level);
    }

    private static WilsonInterval withZ(long successes, long n, double z, double level) {
        if (n < 0 || successes < 0 || successes > n) {
            throw new IllegalArgumentException("need 0 <= successes <= n, got " + successes + "/" + n);
        }
        if (n == 0) return new WilsonInterval(0.0, 1.0, level);

        double p = (double) successes / n;
        double z2 = z * z;
        double denom = 1.0 + z2 / n;
        double center = (p + z2 / (2.0 * n)) / denom;
        double half = z * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * (double) n)) / denom;
        return new WilsonInterval(Math.max(0.0, center - half), Math.min(1.0, center + half), level);
    }

    public double width() {
        return high - low;
    }

    public boolean contains(double p) {
        return p >= low && p <= high;
    }

    // Acklam's rational approximation of the standard normal inverse CDF (|error| < 1.2e-9)
    static double normalQuantile(double p) {
        if (!(p > 0.0 && p < 1.0)) throw new IllegalArgumentException("p must be within (0,1), got " + p);
        final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
                1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
                6.680131188771972e+01, -1.328068155288572e+01};
        final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
                -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
                3.754408661907416e+00};
        final double lowTail = 0.02425;

        if (p < lowTail) {
            double q = Math.sqrt(-2.0 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1.0);
        }
        if (p > 1.0 - lowTail) {
            double q = Math.sqrt(-2.0 * Math.log(1.0 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1.0);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
                / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1.0);
    }
}
