package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.DeconvolutionMethod;
import io.github.jakubt4.eosensor.dto.KernelParameters;
import io.github.jakubt4.eosensor.dto.PsfKernel;
import io.github.jakubt4.eosensor.dto.PsfKernelType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PsfKernelDeconvolverTest {

    private final PsfKernelDeconvolver deconvolver = new PsfKernelDeconvolver();

    @Test
    void synthesizedKernelsHaveUnitSum() {
        for (final var type : PsfKernelType.values()) {
            final var kernel = deconvolver.estimateKernel(type, KernelParameters.ofSize(15));
            assertThat(kernel.size()).isEqualTo(15);
            assertThat(kernel.sum()).isCloseTo(1.0, within(1e-12));
        }
    }

    @Test
    void horizontalMotionKernelLiesOnCenterRow() {
        final var kernel = deconvolver.estimateKernel(PsfKernelType.MOTION,
                KernelParameters.builder().size(15).length(5).angle(0).sigma(2).build());

        for (var row = 0; row < 15; row++) {
            for (var column = 0; column < 15; column++) {
                if (row != 7) {
                    assertThat(kernel.tap(row, column)).isZero();
                }
            }
        }
        assertThat(kernel.tap(7, 7)).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void defocusKernelIsUniformDisk() {
        final var kernel = deconvolver.estimateKernel(PsfKernelType.DEFOCUS, KernelParameters.ofSize(16));

        // radius 4 around (8, 8)
        assertThat(kernel.tap(8, 8)).isPositive();
        assertThat(kernel.tap(8, 12)).isEqualTo(kernel.tap(8, 8));
        assertThat(kernel.tap(8, 13)).isZero();
        assertThat(kernel.tap(0, 0)).isZero();
    }

    @Test
    void gaussianKernelPeaksAtCenter() {
        final var kernel = deconvolver.estimateKernel(PsfKernelType.GAUSSIAN, KernelParameters.ofSize(9));

        assertThat(kernel.tap(4, 4)).isGreaterThan(kernel.tap(4, 5));
        assertThat(kernel.tap(4, 5)).isCloseTo(kernel.tap(5, 4), within(1e-15));
    }

    @Test
    void identityKernelLeavesChannelUnchanged() {
        final var channel = ramp(12, 9);
        channel[3][4] = 0.0;

        for (final var iterations : new int[] {0, 1, 7, 25}) {
            final var restored = deconvolver.deconvolve(channel, PsfKernel.identity(5), iterations);
            assertThat(restored).isDeepEqualTo(channel);
        }
    }

    @Test
    void evenSizedIdentityKernelLeavesChannelUnchanged() {
        final var channel = new double[4][4];
        for (final var row : channel) {
            Arrays.fill(row, 0.5);
        }
        final var ramp = ramp(7, 6);

        for (final var size : new int[] {2, 4}) {
            assertThat(deconvolver.deconvolve(channel, PsfKernel.identity(size), 1)).isDeepEqualTo(channel);
            assertThat(deconvolver.deconvolve(ramp, PsfKernel.identity(size), 9)).isDeepEqualTo(ramp);
        }
    }

    @Test
    void wienerWithEvenSizedIdentityKeepsAlignment() {
        final var channel = ramp(6, 6);

        final var restored = deconvolver.deconvolve(channel, PsfKernel.identity(4), 1,
                DeconvolutionMethod.WIENER, 0.01, 1.0);

        assertThat(restored[0][0]).isCloseTo(channel[0][0] * 0.5, within(1e-12));
        assertThat(restored[5][5]).isCloseTo(channel[5][5] * 0.5, within(1e-12));
    }

    @Test
    void adjointCorrelationUndoesEvenKernelShift() {
        final var point = new double[5][5];
        point[2][2] = 1.0;
        // forward pass shifts the point down-right by one, the adjoint moves it back
        final var kernel = new PsfKernel(new double[][] {{1, 0}, {0, 0}});

        final var forward = PsfKernelDeconvolver.convolve(point, kernel);
        final var back = PsfKernelDeconvolver.correlateAdjoint(forward, kernel);

        assertThat(forward[3][3]).isEqualTo(1.0);
        assertThat(back).isDeepEqualTo(point);
    }

    @Test
    void blindDeconvolutionKeepsChannelUntilKernelIsReestimated() {
        final var channel = ramp(9, 9);

        final var restored = deconvolver.deconvolve(channel, PsfKernel.identity(3), 3,
                DeconvolutionMethod.BLIND, 0.01, 0.001);

        assertThat(restored).isDeepEqualTo(channel);
        assertThat(restored).isNotSameAs(channel);
    }

    @Test
    void blindDeconvolutionStaysNonNegativeAfterKernelUpdates() {
        final var point = new double[15][15];
        point[7][7] = 1.0;
        final var kernel = deconvolver.estimateKernel(PsfKernelType.GAUSSIAN,
                KernelParameters.builder().size(5).sigma(1.0).build());
        final var blurred = PsfKernelDeconvolver.convolve(point, kernel);

        final var restored = deconvolver.deconvolve(blurred, kernel, 7,
                DeconvolutionMethod.BLIND, 0.01, 0.001);

        assertThat(Arrays.stream(flatten(restored)).min().orElseThrow()).isGreaterThanOrEqualTo(0.0);
        assertThat(restored).hasDimensions(15, 15);
    }

    @Test
    void kernelFromFlatImagesIsUniform() {
        final var flat = new double[8][8];
        for (final var row : flat) {
            Arrays.fill(row, 0.4);
        }

        final var kernel = PsfKernelDeconvolver.kernelFromImages(flat, flat, 3);

        assertThat(kernel.sum()).isCloseTo(1.0, within(1e-12));
        for (final var tap : flatten(kernel.toArray())) {
            assertThat(tap).isCloseTo(1.0 / 9, within(1e-12));
        }
    }

    @Test
    void doesNotModifyInput() {
        final var channel = ramp(8, 8);
        final var copy = ramp(8, 8);
        final var kernel = deconvolver.estimateKernel(PsfKernelType.GAUSSIAN, KernelParameters.ofSize(5));

        deconvolver.deconvolve(channel, kernel, 3);

        assertThat(channel).isDeepEqualTo(copy);
    }

    @Test
    void richardsonLucySharpensBlurredPoint() {
        final var point = new double[21][21];
        point[10][10] = 1.0;
        final var kernel = deconvolver.estimateKernel(PsfKernelType.GAUSSIAN,
                KernelParameters.builder().size(7).sigma(1.0).build());
        final var blurred = PsfKernelDeconvolver.convolve(point, kernel);

        final var restored = deconvolver.deconvolve(blurred, kernel, 20);

        assertThat(restored[10][10]).isGreaterThan(blurred[10][10]);
        assertThat(Arrays.stream(flatten(restored)).min().orElseThrow()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void convolutionZeroPadsBorders() {
        final var ones = new double[3][3];
        for (final var row : ones) {
            Arrays.fill(row, 1.0);
        }
        final var box = new double[3][3];
        for (final var row : box) {
            Arrays.fill(row, 1.0 / 9);
        }

        final var result = PsfKernelDeconvolver.convolve(ones, new PsfKernel(box));

        assertThat(result[1][1]).isCloseTo(1.0, within(1e-12));
        assertThat(result[0][0]).isCloseTo(4.0 / 9, within(1e-12));
        assertThat(result[0][1]).isCloseTo(6.0 / 9, within(1e-12));
    }

    @Test
    void wienerOutputIsClampedToUnitRange() {
        final var bright = new double[6][6];
        for (final var row : bright) {
            Arrays.fill(row, 5.0);
        }

        final var restored = deconvolver.deconvolve(bright, PsfKernel.identity(3), 1,
                DeconvolutionMethod.WIENER, 0.01, 0.001);

        assertThat(flatten(restored)).containsOnly(1.0);
    }

    @Test
    void wienerScalesByKernelPowerRatio() {
        final var channel = ramp(5, 5);

        final var restored = deconvolver.deconvolve(channel, PsfKernel.identity(3), 1,
                DeconvolutionMethod.WIENER, 0.01, 1.0);

        assertThat(restored[2][3]).isCloseTo(channel[2][3] * 0.5, within(1e-12));
    }

    @Test
    void totalVariationVariantStaysNonNegative() {
        final var channel = ramp(10, 10);
        final var kernel = deconvolver.estimateKernel(PsfKernelType.DEFOCUS, KernelParameters.ofSize(7));

        final var restored = deconvolver.deconvolve(channel, kernel, 5,
                DeconvolutionMethod.RICHARDSON_LUCY_TV, 0.05, 0.001);

        assertThat(Arrays.stream(flatten(restored)).min().orElseThrow()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void kernelMustBeSquare() {
        assertThatThrownBy(() -> new PsfKernel(new double[][] {{1, 0}, {0}}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("square");
    }

    @Test
    void flippedKernelIsRotatedHalfTurn() {
        final var kernel = new PsfKernel(new double[][] {{1, 2}, {3, 4}});

        assertThat(kernel.flipped().toArray()).isDeepEqualTo(new double[][] {{4, 3}, {2, 1}});
        assertThat(kernel.power()).isEqualTo(30.0);
    }

    private static double[] flatten(final double[][] channel) {
        return Arrays.stream(channel).flatMapToDouble(Arrays::stream).toArray();
    }

    private static double[][] ramp(final int height, final int width) {
        final var channel = new double[height][width];
        for (var y = 0; y < height; y++) {
            for (var x = 0; x < width; x++) {
                channel[y][x] = (y * width + x + 1.0) / (height * width);
            }
        }
        return channel;
    }
}
