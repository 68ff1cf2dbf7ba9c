package com.pulseparser.ast;

/**
 * Classical and pulse-level types. Port, frame and waveform are the hardware handle
 * types added by the calibration grammar; the rest are scalar types shared with the
 * host language.
 */
public sealed interface TypeNode extends Node permits
    IntType,
    UintType,
    FloatType,
    AngleType,
    BitType,
    BoolType,
    ComplexType,
    DurationType,
    PortType,
    FrameType,
    WaveformType {
}
