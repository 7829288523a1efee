package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.DeconvolutionMethod;
import io.github.jakubt4.eosensor.dto.KernelParameters;
import io.github.jakubt4.eosensor.dto.PsfKernel;
import io.github.jakubt4.eosensor.dto.PsfKernelType;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

/**
 * Blur kernel synthesis and single-channel image restoration.
 *
 * <p>Channels are row-major {@code double[height][width]} arrays, nominally in [0, 1]. Inputs are
 * never modified. Convolution is direct with zero-padded borders; cost grows with
 * iterations × pixels × kernel area and there is no early exit.
 */
@Slf4j
@Service
public class PsfKernelDeconvolver {

    public static final double DEFAULT_REGULARIZATION = 0.01;
    public static final double DEFAULT_NOISE_VARIANCE = 0.001;

    private static final double RATIO_EPSILON = 1e-10;
    private static final double TV_EPSILON = 1e-8;
    private static final int BLIND_INNER_ITERATIONS = 2;
    private static final int BLIND_KERNEL_UPDATE_INTERVAL = 3;

    public PsfKernel estimateKernel(final PsfKernelType type, final KernelParameters params) {
        final var kernel = switch (type) {
            case MOTION -> motionKernel(params.size(), params.length(), params.angle());
            case GAUSSIAN -> gaussianKernel(params.size(), params.sigma());
            case DEFOCUS -> defocusKernel(params.size());
        };
        log.debug("Estimated {} kernel {}x{}", type, params.size(), params.size());
        return kernel;
    }

    /**
     * Richardson-Lucy restoration.
     */
    public double[][] deconvolve(final double[][] channel, final PsfKernel kernel, final int iterations) {
        return deconvolve(channel, kernel, iterations, DeconvolutionMethod.RICHARDSON_LUCY,
                DEFAULT_REGULARIZATION, DEFAULT_NOISE_VARIANCE);
    }

    /**
     * @param regularization total-variation weight, read by {@link DeconvolutionMethod#RICHARDSON_LUCY_TV}
     * @param noiseVariance  noise-to-signal term, read by {@link DeconvolutionMethod#WIENER}
     * @param iterations     outer iterations; ignored by {@link DeconvolutionMethod#WIENER}
     */
    public double[][] deconvolve(final double[][] channel, final PsfKernel kernel, final int iterations,
                                 final DeconvolutionMethod method, final double regularization,
                                 final double noiseVariance) {
        final var restored = switch (method) {
            case RICHARDSON_LUCY -> richardsonLucy(channel, kernel, iterations, 0.0);
            case RICHARDSON_LUCY_TV -> richardsonLucy(channel, kernel, iterations, regularization);
            case WIENER -> wiener(channel, kernel, noiseVariance);
            case BLIND -> blind(channel, kernel, iterations);
        };
        log.debug("Deconvolved {}x{} channel with {} ({} iterations, kernel {})",
                channel.length, channel.length == 0 ? 0 : channel[0].length, method, iterations, kernel.size());
        return restored;
    }

    /**
     * 2-D correlation with the kernel centered at {@code size / 2}; taps falling outside the
     * image contribute nothing.
     */
    static double[][] convolve(final double[][] image, final PsfKernel kernel) {
        return convolve(image, kernel, kernel.size() / 2);
    }

    /**
     * Adjoint of {@link #convolve(double[][], PsfKernel)}: correlation with the half-turn kernel,
     * re-anchored so even-sized kernels stay aligned.
     */
    static double[][] correlateAdjoint(final double[][] image, final PsfKernel kernel) {
        final var size = kernel.size();
        return convolve(image, kernel.flipped(), size - 1 - size / 2);
    }

    private static double[][] convolve(final double[][] image, final PsfKernel kernel, final int center) {
        final var height = image.length;
        final var width = height == 0 ? 0 : image[0].length;
        final var size = kernel.size();
        final var result = new double[height][width];

        for (var y = 0; y < height; y++) {
            for (var x = 0; x < width; x++) {
                var sum = 0.0;
                for (var ky = 0; ky < size; ky++) {
                    final var iy = y + ky - center;
                    if (iy < 0 || iy >= height) {
                        continue;
                    }
                    for (var kx = 0; kx < size; kx++) {
                        final var ix = x + kx - center;
                        if (ix >= 0 && ix < width) {
                            sum += image[iy][ix] * kernel.tap(ky, kx);
                        }
                    }
                }
                result[y][x] = sum;
            }
        }
        return result;
    }

    private static double[][] richardsonLucy(final double[][] observed, final PsfKernel kernel,
                                             final int iterations, final double tvWeight) {
        final var height = observed.length;
        final var width = height == 0 ? 0 : observed[0].length;
        final var estimate = copy(observed);

        for (var iteration = 0; iteration < iterations; iteration++) {
            final var blurred = convolve(estimate, kernel);
            final var ratio = new double[height][width];
            for (var y = 0; y < height; y++) {
                for (var x = 0; x < width; x++) {
                    ratio[y][x] = blurred[y][x] > RATIO_EPSILON ? observed[y][x] / blurred[y][x] : 0.0;
                }
            }

            final var correction = correlateAdjoint(ratio, kernel);
            final var tvGradient = tvWeight != 0.0 ? totalVariationGradient(estimate) : null;
            for (var y = 0; y < height; y++) {
                for (var x = 0; x < width; x++) {
                    var value = estimate[y][x] * correction[y][x];
                    if (tvGradient != null) {
                        value -= tvWeight * tvGradient[y][x];
                    }
                    estimate[y][x] = FastMath.max(0.0, value);
                }
            }
        }
        return estimate;
    }

    private static double[][] wiener(final double[][] observed, final PsfKernel kernel, final double noiseVariance) {
        final var power = kernel.power();
        final var gain = power / (power + noiseVariance);
        final var filtered = correlateAdjoint(observed, kernel);
        for (final var row : filtered) {
            for (var x = 0; x < row.length; x++) {
                row[x] = FastMath.max(0.0, FastMath.min(1.0, row[x] * gain));
            }
        }
        return filtered;
    }

    /**
     * Alternates a fresh 2-step Richardson-Lucy pass from the observed channel with re-estimating
     * the kernel, every third iteration after the first.
     */
    private static double[][] blind(final double[][] observed, final PsfKernel initialKernel, final int iterations) {
        var kernel = initialKernel;
        var estimate = copy(observed);
        for (var iteration = 0; iteration < iterations; iteration++) {
            estimate = richardsonLucy(observed, kernel, BLIND_INNER_ITERATIONS, 0.0);
            if (iteration > 0 && iteration % BLIND_KERNEL_UPDATE_INTERVAL == 0) {
                kernel = kernelFromImages(observed, estimate, kernel.size());
            }
        }
        return estimate;
    }

    /**
     * Kernel estimated by correlating the blurred channel with the sharp estimate over the
     * interior pixels, normalized to unit sum unless every tap is zero.
     */
    static PsfKernel kernelFromImages(final double[][] blurred, final double[][] sharp, final int size) {
        final var height = blurred.length;
        final var width = height == 0 ? 0 : blurred[0].length;
        final var center = size / 2;
        final var taps = new double[size][size];

        for (var py = 0; py < size; py++) {
            for (var px = 0; px < size; px++) {
                var sum = 0.0;
                var count = 0;
                for (var y = center; y < height - center; y++) {
                    for (var x = center; x < width - center; x++) {
                        final var sy = y + py - center;
                        final var sx = x + px - center;
                        if (sy >= 0 && sy < height && sx >= 0 && sx < width) {
                            sum += blurred[y][x] * sharp[sy][sx];
                            count++;
                        }
                    }
                }
                taps[py][px] = count > 0 ? sum / count : 0.0;
            }
        }
        return normalized(taps);
    }

    /**
     * Normalized forward-difference gradient; zero differences at the last row and column.
     */
    static double[][] totalVariationGradient(final double[][] image) {
        final var height = image.length;
        final var width = height == 0 ? 0 : image[0].length;
        final var gradient = new double[height][width];
        for (var y = 0; y < height; y++) {
            for (var x = 0; x < width; x++) {
                final var gx = x < width - 1 ? image[y][x + 1] - image[y][x] : 0.0;
                final var gy = y < height - 1 ? image[y + 1][x] - image[y][x] : 0.0;
                gradient[y][x] = (gx + gy) / (FastMath.sqrt(gx * gx + gy * gy) + TV_EPSILON);
            }
        }
        return gradient;
    }

    private static PsfKernel motionKernel(final int size, final double length, final double angleDeg) {
        final var taps = new double[size][size];
        final var center = size / 2;
        final var angle = FastMath.toRadians(angleDeg);
        final var dx = FastMath.cos(angle);
        final var dy = FastMath.sin(angle);

        for (var i = 0; i < length; i++) {
            final var x = (int) FastMath.round(center + dx * (i - length / 2));
            final var y = (int) FastMath.round(center + dy * (i - length / 2));
            if (x >= 0 && x < size && y >= 0 && y < size) {
                taps[y][x] += 1.0;
            }
        }
        return normalized(taps);
    }

    private static PsfKernel gaussianKernel(final int size, final double sigma) {
        final var taps = new double[size][size];
        final var center = size / 2;
        for (var row = 0; row < size; row++) {
            for (var column = 0; column < size; column++) {
                final var x = column - center;
                final var y = row - center;
                taps[row][column] = FastMath.exp(-(x * x + y * y) / (2 * sigma * sigma));
            }
        }
        return normalized(taps);
    }

    private static PsfKernel defocusKernel(final int size) {
        final var taps = new double[size][size];
        final var center = size / 2;
        final var radius = size / 4.0;
        for (var row = 0; row < size; row++) {
            for (var column = 0; column < size; column++) {
                final var x = column - center;
                final var y = row - center;
                if (FastMath.sqrt(x * x + y * y) <= radius) {
                    taps[row][column] = 1.0;
                }
            }
        }
        return normalized(taps);
    }

    // All-zero kernels are returned as-is
    private static PsfKernel normalized(final double[][] taps) {
        var sum = 0.0;
        for (final var row : taps) {
            for (final var value : row) {
                sum += value;
            }
        }
        if (sum > 0) {
            for (final var row : taps) {
                for (var i = 0; i < row.length; i++) {
                    row[i] /= sum;
                }
            }
        }
        return new PsfKernel(taps);
    }

    private static double[][] copy(final double[][] source) {
        final var result = new double[source.length][];
        for (var row = 0; row < source.length; row++) {
            result[row] = source[row].clone();
        }
        return result;
    }
}
