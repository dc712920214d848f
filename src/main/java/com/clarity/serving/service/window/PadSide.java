package com.clarity.serving.service.window;

public enum PadSide {
    LEFT,
    RIGHT
}
