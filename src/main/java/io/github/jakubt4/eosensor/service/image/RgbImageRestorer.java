package io.github.jakubt4.eosensor.service.image;

import io.github.jakubt4.eosensor.dto.DeconvolutionMethod;
import io.github.jakubt4.eosensor.dto.PsfKernel;
import io.github.jakubt4.eosensor.service.PsfKernelDeconvolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Restores an RGB raster by deconvolving its red, green and blue channels independently.
 * Alpha is carried over unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RgbImageRestorer {

    private static final int CHANNELS = 3;

    private final PsfKernelDeconvolver deconvolver;

    public BufferedImage restore(final BufferedImage source, final PsfKernel kernel, final int iterations) {
        return restore(source, kernel, iterations, DeconvolutionMethod.RICHARDSON_LUCY,
                PsfKernelDeconvolver.DEFAULT_REGULARIZATION, PsfKernelDeconvolver.DEFAULT_NOISE_VARIANCE);
    }

    public BufferedImage restore(final BufferedImage source, final PsfKernel kernel, final int iterations,
                                 final DeconvolutionMethod method, final double regularization,
                                 final double noiseVariance) {
        final var channels = split(source);
        final var restored = new double[CHANNELS][][];
        for (var c = 0; c < CHANNELS; c++) {
            restored[c] = deconvolver.deconvolve(channels[c], kernel, iterations, method, regularization, noiseVariance);
        }
        log.info("Restored {}x{} image with {} ({} iterations)",
                source.getWidth(), source.getHeight(), method, iterations);
        return merge(source, restored);
    }

    /**
     * Channels in R, G, B order, each normalized to [0, 1].
     */
    static double[][][] split(final BufferedImage image) {
        final var width = image.getWidth();
        final var height = image.getHeight();
        final var channels = new double[CHANNELS][height][width];
        for (var y = 0; y < height; y++) {
            for (var x = 0; x < width; x++) {
                final var rgb = image.getRGB(x, y);
                channels[0][y][x] = ((rgb >> 16) & 0xFF) / 255.0;
                channels[1][y][x] = ((rgb >> 8) & 0xFF) / 255.0;
                channels[2][y][x] = (rgb & 0xFF) / 255.0;
            }
        }
        return channels;
    }

    private static BufferedImage merge(final BufferedImage source, final double[][][] channels) {
        final var width = source.getWidth();
        final var height = source.getHeight();
        final var result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (var y = 0; y < height; y++) {
            for (var x = 0; x < width; x++) {
                final var alpha = source.getRGB(x, y) >>> 24;
                final var r = toByte(channels[0][y][x]);
                final var g = toByte(channels[1][y][x]);
                final var b = toByte(channels[2][y][x]);
                result.setRGB(x, y, (alpha << 24) | (r << 16) | (g << 8) | b);
            }
        }
        return result;
    }

    private static int toByte(final double value) {
        return (int) Math.round(Math.min(255.0, Math.max(0.0, value * 255.0)));
    }
}
