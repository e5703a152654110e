package com.takvimi.infrastructure.pdf;

import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.DetectedTable;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CalendarDocument} over an opened PDFBox {@link PDDocument}. Page text and tables are computed
 * once per page and kept for the lifetime of the document.
 */
public class PdfBoxCalendarDocument implements CalendarDocument {

    private final PDDocument document;
    private final TableDetector tableDetector;
    private final Map<Integer, String> textCache = new HashMap<>();
    private final Map<Integer, List<DetectedTable>> tableCache = new HashMap<>();

    PdfBoxCalendarDocument(PDDocument document) {
        this(document, new TableDetector());
    }

    PdfBoxCalendarDocument(PDDocument document, TableDetector tableDetector) {
        this.document = document;
        this.tableDetector = tableDetector;
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public String pageText(int pageIndex) throws IOException {
        checkIndex(pageIndex);
        String cached = textCache.get(pageIndex);
        if (cached != null) {
            return cached;
        }
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        String text = stripper.getText(document);
        textCache.put(pageIndex, text);
        return text;
    }

    @Override
    public List<DetectedTable> pageTables(int pageIndex) throws IOException {
        checkIndex(pageIndex);
        List<DetectedTable> cached = tableCache.get(pageIndex);
        if (cached != null) {
            return cached;
        }
        PositionedWordStripper stripper = new PositionedWordStripper();
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        stripper.getText(document);
        List<DetectedTable> tables = List.copyOf(tableDetector.detect(stripper.lines()));
        tableCache.put(pageIndex, tables);
        return tables;
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private void checkIndex(int pageIndex) throws IOException {
        if (pageIndex < 0 || pageIndex >= pageCount()) {
            throw new IOException("Page " + pageIndex + " is outside the document (" + pageCount() + " pages)");
        }
    }
}
