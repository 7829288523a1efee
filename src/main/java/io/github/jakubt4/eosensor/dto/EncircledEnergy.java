package io.github.jakubt4.eosensor.dto;

import java.util.List;

/**
 * Tabulated encircled-energy curve and its 50/80/95 percent radii.
 *
 * @param radii  sampled radii in micrometers
 * @param energy cumulative energy in percent at each radius
 * @param ee50   radius enclosing 50 percent of the energy
 * @param ee80   radius enclosing 80 percent of the energy
 * @param ee95   radius enclosing 95 percent of the energy
 */
public record EncircledEnergy(List<Double> radii, List<Double> energy, double ee50, double ee80, double ee95) {

    public EncircledEnergy {
        radii = List.copyOf(radii);
        energy = List.copyOf(energy);
    }
}
