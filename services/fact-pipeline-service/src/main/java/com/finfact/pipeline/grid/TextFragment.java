package com.finfact.pipeline.grid;

public record TextFragment(int line, int offset, String text) {
}
