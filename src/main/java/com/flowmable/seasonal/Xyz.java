package com.flowmable.seasonal;

/**
 * CIE XYZ tristimulus values, scaled 0–100.
 */
public record Xyz(double x, double y, double z) {}
