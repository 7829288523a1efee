package io.github.jakubt4.eosensor.dto;

/**
 * Raw two-line element set with its parsed elements.
 *
 * @param satelliteName name line, or {@code null} for a bare two-line set
 * @param line1         first data line
 * @param line2         second data line
 * @param elements      parsed mean elements
 */
public record TleRecord(String satelliteName, String line1, String line2, TleElements elements) {
}
