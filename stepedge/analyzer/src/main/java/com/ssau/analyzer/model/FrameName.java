package com.ssau.analyzer.model;

import lombok.Value;

/**
 * Positional identifiers carried by an image file name.
 */
@Value
public class FrameName {
    int step;
    int imageNo;
    int speed;
    int bucket;
}
