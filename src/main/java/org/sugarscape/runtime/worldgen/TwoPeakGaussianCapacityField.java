package org.sugarscape.runtime.worldgen;

import java.util.List;

import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.spi.ICapacityField;
import org.sugarscape.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Capacity field made of two Gaussian bumps, rounded to the nearest integer.
 * <p>
 * Coordinates wrap toroidally on the field bounds before evaluation. Each bump is centered at a
 * point given as fractions of the bounds and spreads by {@code thetaX * width} and
 * {@code thetaY * height}:
 * <pre>
 *   g(dx, dy) = psi * exp(-(dx / (thetaX * X))^2 - (dy / (thetaY * Y))^2)
 *   capacity(x, y) = round(g(x - p1x * X, y - p1y * Y) + g(x - p2x * X, y - p2y * Y))
 * </pre>
 * Options:
 * <ul>
 *   <li><b>psi:</b> amplitude of both bumps (default 4.0)</li>
 *   <li><b>peak1 / peak2:</b> {@code [fx, fy]} centers as fractions of the bounds
 *   (defaults {@code [0.25, 0.25]} and {@code [0.75, 0.75]})</li>
 *   <li><b>theta-x / theta-y:</b> spreads as fractions of the bounds (default 0.3)</li>
 *   <li><b>randomize:</b> if true, draws psi from [1, 5], peak coordinates from [0.1, 0.9]
 *   and spreads from [0.1, 0.5], ignoring the other options</li>
 * </ul>
 */
public class TwoPeakGaussianCapacityField implements ICapacityField {

    public static final double DEFAULT_PSI = 4.0;
    public static final double DEFAULT_PEAK1 = 0.25;
    public static final double DEFAULT_PEAK2 = 0.75;
    public static final double DEFAULT_THETA = 0.3;

    private final int boundX;
    private final int boundY;
    private final double psi;
    private final double peak1X;
    private final double peak1Y;
    private final double peak2X;
    private final double peak2Y;
    private final double spreadX;
    private final double spreadY;

    /**
     * Creates a field with explicit parameters.
     *
     * @param boundX width used for wrapping and scaling, positive
     * @param boundY height used for wrapping and scaling, positive
     * @param psi    amplitude of each bump
     * @param peak1X x of the first center as a fraction of {@code boundX}
     * @param peak1Y y of the first center as a fraction of {@code boundY}
     * @param peak2X x of the second center as a fraction of {@code boundX}
     * @param peak2Y y of the second center as a fraction of {@code boundY}
     * @param thetaX spread along x as a fraction of {@code boundX}, positive
     * @param thetaY spread along y as a fraction of {@code boundY}, positive
     */
    public TwoPeakGaussianCapacityField(int boundX, int boundY, double psi,
                                        double peak1X, double peak1Y, double peak2X, double peak2Y,
                                        double thetaX, double thetaY) {
        if (boundX <= 0 || boundY <= 0) {
            throw new InvalidConfigurationException(
                    "Capacity field bounds must be positive, got " + boundX + "x" + boundY);
        }
        if (!(thetaX > 0) || !(thetaY > 0)) {
            throw new InvalidConfigurationException(
                    "Capacity field spreads must be positive, got theta-x=" + thetaX + ", theta-y=" + thetaY);
        }
        if (psi < 0) {
            throw new InvalidConfigurationException("Capacity field psi must be >= 0, got " + psi);
        }
        this.boundX = boundX;
        this.boundY = boundY;
        this.psi = psi;
        this.peak1X = peak1X * boundX;
        this.peak1Y = peak1Y * boundY;
        this.peak2X = peak2X * boundX;
        this.peak2Y = peak2Y * boundY;
        this.spreadX = thetaX * boundX;
        this.spreadY = thetaY * boundY;
    }

    /**
     * Configuration constructor used when the field is selected by class name.
     *
     * @param width   landscape width
     * @param height  landscape height
     * @param rng     source of randomness for {@code randomize = true}
     * @param options the field's options block
     */
    public TwoPeakGaussianCapacityField(int width, int height, IRandomProvider rng, Config options) {
        this(width, height,
                options.hasPath("randomize") && options.getBoolean("randomize")
                        ? randomParameters(rng)
                        : configuredParameters(options));
    }

    private TwoPeakGaussianCapacityField(int width, int height, double[] p) {
        this(width, height, p[0], p[1], p[2], p[3], p[4], p[5], p[6]);
    }

    /**
     * @return a field with the default parameters over the given bounds
     */
    public static TwoPeakGaussianCapacityField withDefaults(int width, int height) {
        return new TwoPeakGaussianCapacityField(width, height, DEFAULT_PSI,
                DEFAULT_PEAK1, DEFAULT_PEAK1, DEFAULT_PEAK2, DEFAULT_PEAK2, DEFAULT_THETA, DEFAULT_THETA);
    }

    /**
     * @return a field with randomly drawn parameters over the given bounds
     */
    public static TwoPeakGaussianCapacityField randomized(int width, int height, IRandomProvider rng) {
        return new TwoPeakGaussianCapacityField(width, height, randomParameters(rng));
    }

    @Override
    public int capacityAt(int x, int y) {
        double wx = Math.floorMod(x, boundX);
        double wy = Math.floorMod(y, boundY);
        return (int) Math.round(bump(wx - peak1X, wy - peak1Y) + bump(wx - peak2X, wy - peak2Y));
    }

    private double bump(double dx, double dy) {
        double nx = dx / spreadX;
        double ny = dy / spreadY;
        return psi * Math.exp(-(nx * nx) - (ny * ny));
    }

    private static double[] randomParameters(IRandomProvider rng) {
        return new double[]{
                rng.nextDouble(1.0, 5.0),
                rng.nextDouble(0.1, 0.9), rng.nextDouble(0.1, 0.9),
                rng.nextDouble(0.1, 0.9), rng.nextDouble(0.1, 0.9),
                rng.nextDouble(0.1, 0.5), rng.nextDouble(0.1, 0.5)
        };
    }

    private static double[] configuredParameters(Config options) {
        double[] peak1 = peak(options, "peak1", DEFAULT_PEAK1);
        double[] peak2 = peak(options, "peak2", DEFAULT_PEAK2);
        return new double[]{
                options.hasPath("psi") ? options.getDouble("psi") : DEFAULT_PSI,
                peak1[0], peak1[1], peak2[0], peak2[1],
                options.hasPath("theta-x") ? options.getDouble("theta-x") : DEFAULT_THETA,
                options.hasPath("theta-y") ? options.getDouble("theta-y") : DEFAULT_THETA
        };
    }

    private static double[] peak(Config options, String key, double fallback) {
        if (!options.hasPath(key)) {
            return new double[]{fallback, fallback};
        }
        List<Double> values = options.getDoubleList(key);
        if (values.size() != 2) {
            throw new InvalidConfigurationException(
                    "Capacity field option '" + key + "' must be a pair [fx, fy], got " + values);
        }
        return new double[]{values.get(0), values.get(1)};
    }

    @Override
    public String toString() {
        return String.format("TwoPeakGaussian[psi=%.3f, peak1=(%.2f, %.2f), peak2=(%.2f, %.2f), spread=(%.2f, %.2f)]",
                psi, peak1X, peak1Y, peak2X, peak2Y, spreadX, spreadY);
    }
}
