package io.github.jakubt4.eosensor.dto;

import lombok.Builder;

/**
 * Shape parameters for kernel synthesis. Only the fields relevant to the kernel type are read.
 *
 * @param size   kernel edge length in pixels
 * @param length motion blur length in pixels
 * @param angle  motion direction in degrees
 * @param sigma  Gaussian standard deviation in pixels
 */
@Builder(toBuilder = true)
public record KernelParameters(int size, double length, double angle, double sigma) {

    public static KernelParameters ofSize(final int size) {
        return new KernelParameters(size, 10.0, 0.0, 2.0);
    }
}
