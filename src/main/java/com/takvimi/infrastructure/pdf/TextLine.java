package com.takvimi.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Words sharing one baseline, ordered left to right on access.
 */
final class TextLine {

    private final float y;
    private final List<PositionedWord> words = new ArrayList<>();
    private boolean sorted = false;

    TextLine(float y) {
        this.y = y;
    }

    void addWord(PositionedWord word) {
        if (word == null || word.text().isBlank()) {
            return;
        }
        words.add(word);
        sorted = false;
    }

    List<PositionedWord> words() {
        if (!sorted) {
            words.sort(Comparator.comparing(PositionedWord::x));
            sorted = true;
        }
        return words;
    }

    float y() {
        return y;
    }

    /**
     * Splits the line into cells: neighbouring words closer than {@code cellGap} belong to the same cell.
     *
     * @param cellGap minimal horizontal distance that separates two cells
     * @return cell texts from left to right
     */
    List<String> cells(float cellGap) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = null;
        float previousEnd = 0f;
        for (PositionedWord word : words()) {
            if (current != null && word.x() - previousEnd < cellGap) {
                current.append(' ').append(word.text().strip());
            } else {
                if (current != null) {
                    cells.add(current.toString());
                }
                current = new StringBuilder(word.text().strip());
            }
            previousEnd = word.endX();
        }
        if (current != null) {
            cells.add(current.toString());
        }
        return cells;
    }
}
