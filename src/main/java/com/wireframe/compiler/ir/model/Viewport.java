package com.wireframe.compiler.ir.model;

import lombok.Value;

@Value
public class Viewport {
    int width;
    int height;
}
