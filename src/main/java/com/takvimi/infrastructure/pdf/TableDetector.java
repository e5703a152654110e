package com.takvimi.infrastructure.pdf;

import com.takvimi.domain.document.DetectedTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds tables in positioned text: a table is a run of at least {@value #MIN_ROWS} consecutive lines
 * that each split into at least {@value #MIN_CELLS} cells.
 */
final class TableDetector {

    static final int MIN_ROWS = 2;
    static final int MIN_CELLS = 3;
    static final float DEFAULT_CELL_GAP = 8f;

    private final float cellGap;

    TableDetector() {
        this(DEFAULT_CELL_GAP);
    }

    TableDetector(float cellGap) {
        this.cellGap = cellGap;
    }

    List<DetectedTable> detect(List<TextLine> lines) {
        List<DetectedTable> tables = new ArrayList<>();
        List<List<String>> run = new ArrayList<>();
        for (TextLine line : lines) {
            List<String> cells = line.cells(cellGap);
            if (cells.size() >= MIN_CELLS) {
                run.add(cells);
            } else {
                flush(run, tables);
            }
        }
        flush(run, tables);
        return tables;
    }

    private void flush(List<List<String>> run, List<DetectedTable> tables) {
        if (run.size() >= MIN_ROWS) {
            tables.add(DetectedTable.of(List.copyOf(run)));
        }
        run.clear();
    }
}
