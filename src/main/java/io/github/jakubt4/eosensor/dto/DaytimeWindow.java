package io.github.jakubt4.eosensor.dto;

/**
 * Local solar time window, both ends inclusive, in 24h HHMM form (e.g. 1000 for 10:00).
 */
public record DaytimeWindow(int start, int end) {

    public static final DaytimeWindow DEFAULT = new DaytimeWindow(1000, 1700);

    public boolean contains(final int localTime) {
        return localTime >= start && localTime <= end;
    }
}
