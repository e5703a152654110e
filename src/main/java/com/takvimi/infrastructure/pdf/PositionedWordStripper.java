package com.takvimi.infrastructure.pdf;

import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects every word of the stripped page range with its position, grouped into baselines.
 */
final class PositionedWordStripper extends PDFTextStripper {

    private static final float Y_TOLERANCE = 2.0f;

    private final List<TextLine> lines = new ArrayList<>();

    PositionedWordStripper() throws IOException {
        setSortByPosition(true);
    }

    /**
     * @return lines ordered from top to bottom
     */
    List<TextLine> lines() {
        List<TextLine> ordered = new ArrayList<>(lines);
        ordered.sort(Comparator.comparing(TextLine::y));
        return ordered;
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (textPositions != null && !textPositions.isEmpty() && text != null && !text.isBlank()) {
            float x = textPositions.stream()
                    .map(TextPosition::getXDirAdj)
                    .min(Float::compareTo)
                    .orElse(0f);
            float endX = textPositions.stream()
                    .map(position -> position.getXDirAdj() + position.getWidthDirAdj())
                    .max(Float::compareTo)
                    .orElse(x);
            float y = textPositions.stream()
                    .map(TextPosition::getYDirAdj)
                    .min(Float::compareTo)
                    .orElse(0f);
            resolveLine(y).addWord(new PositionedWord(x, endX, text));
        }
        super.writeString(text, textPositions);
    }

    private TextLine resolveLine(float y) {
        for (TextLine line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        TextLine line = new TextLine(y);
        lines.add(line);
        return line;
    }
}
