package io.github.jakubt4.eosensor.dto;

public enum DeconvolutionMethod {
    RICHARDSON_LUCY,
    RICHARDSON_LUCY_TV,
    WIENER,
    /** Richardson-Lucy with periodic kernel re-estimation from the restored channel. */
    BLIND
}
