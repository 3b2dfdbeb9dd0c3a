package com.layeredilp;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable arbitrary-precision rational with normalized sign and gcd reduction.
 * Used for constraint coefficients and right-hand sides so that layer factors
 * such as 1/3 stay exact until the program is written out.
 */
public final class Fraction implements Comparable<Fraction> {
    public static final Fraction ZERO = new Fraction(BigInteger.ZERO, BigInteger.ONE);
    public static final Fraction ONE  = new Fraction(BigInteger.ONE,  BigInteger.ONE);

    /** Significant digits used when a non-terminating fraction is printed. */
    private static final MathContext PRINT_CONTEXT = new MathContext(16, RoundingMode.HALF_EVEN);

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public Fraction(BigInteger num, BigInteger den) {
        Objects.requireNonNull(num, "numerator");
        Objects.requireNonNull(den, "denominator");
        if (den.signum() == 0) throw new ArithmeticException("Zero denominator");
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        BigInteger g = num.gcd(den);
        this.n = num.divide(g);
        this.d = den.divide(g);
    }

    /** Factories */
    public static Fraction of(long k) { return new Fraction(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Fraction of(long num, long den) { return new Fraction(BigInteger.valueOf(num), BigInteger.valueOf(den)); }

    /** Exact value of a decimal, e.g. 2.25 becomes 9/4. */
    public static Fraction of(BigDecimal value) {
        if (value.scale() <= 0) return new Fraction(value.toBigIntegerExact(), BigInteger.ONE);
        return new Fraction(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
    }

    public Fraction add(Fraction o) {
        if (d.equals(o.d)) return new Fraction(n.add(o.n), d);
        return new Fraction(n.multiply(o.d).add(o.n.multiply(d)), d.multiply(o.d));
    }

    public Fraction subtract(Fraction o) {
        return add(o.negate());
    }

    public Fraction negate() { return n.signum() == 0 ? ZERO : new Fraction(n.negate(), d); }
    public Fraction abs()    { return n.signum() < 0 ? negate() : this; }
    public int signum()      { return n.signum(); }
    public boolean isOne()   { return n.equals(BigInteger.ONE) && d.equals(BigInteger.ONE); }
    public boolean isInteger() { return d.equals(BigInteger.ONE); }

    public BigDecimal toBigDecimal() {
        if (isInteger()) return new BigDecimal(n);
        return new BigDecimal(n).divide(new BigDecimal(d), PRINT_CONTEXT);
    }

    /**
     * Plain decimal text as the solver reads it: integers as integers,
     * anything else to 16 significant digits without trailing zeros.
     */
    public String toDecimalString() {
        if (isInteger()) return n.toString();
        return toBigDecimal().stripTrailingZeros().toPlainString();
    }

    // ---- Comparable ----
    @Override public int compareTo(Fraction o) {
        // a/b ? c/d  <=>  ad ? cb
        return n.multiply(o.d).compareTo(o.n.multiply(d));
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fraction)) return false;
        Fraction o = (Fraction) obj;
        return n.equals(o.n) && d.equals(o.d);
    }

    @Override public int hashCode() { return n.hashCode() * 31 + d.hashCode(); }

    /** Integers print as integers, rationals as a/b */
    @Override public String toString() {
        return d.equals(BigInteger.ONE) ? n.toString() : n + "/" + d;
    }
}
