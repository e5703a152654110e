package com.takvimi.infrastructure.pdf;

/**
 * A word extracted from a page together with its horizontal extent.
 */
record PositionedWord(float x, float endX, String text) {

    PositionedWord {
        endX = Math.max(endX, x);
        text = text == null ? "" : text;
    }
}
