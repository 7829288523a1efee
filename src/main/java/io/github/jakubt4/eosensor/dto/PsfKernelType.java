package io.github.jakubt4.eosensor.dto;

public enum PsfKernelType {
    MOTION,
    GAUSSIAN,
    DEFOCUS
}
