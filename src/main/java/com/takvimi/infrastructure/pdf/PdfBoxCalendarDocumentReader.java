package com.takvimi.infrastructure.pdf;

import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.CalendarDocumentReader;
import com.takvimi.infrastructure.exception.DocumentUnreadableException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Infrastructure service that opens calendar PDFs with PDFBox.
 * Hides the PDFBox loading details from the rest of the application.
 */
@Service
public class PdfBoxCalendarDocumentReader implements CalendarDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxCalendarDocumentReader.class);

    /**
     * Opens the PDF stored at {@code path}.
     *
     * @param path PDF on disk
     * @return opened document; the caller closes it
     * @throws DocumentUnreadableException when the file cannot be read or parsed
     */
    @Override
    public CalendarDocument open(Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            log.debug("Opening calendar PDF {} ({} bytes)", path, bytes.length);
            return open(bytes, path.toString());
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to read the PDF at " + path, e);
        }
    }

    /**
     * Opens a PDF already held in memory.
     *
     * @param content PDF bytes
     * @return opened document; the caller closes it
     * @throws DocumentUnreadableException when the bytes are not a readable PDF
     */
    @Override
    public CalendarDocument open(byte[] content) {
        return open(content, "in-memory document");
    }

    private CalendarDocument open(byte[] content, String source) {
        try {
            PDDocument document = Loader.loadPDF(content);
            log.debug("Loaded {} with {} pages", source, document.getNumberOfPages());
            return new PdfBoxCalendarDocument(document);
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to process the PDF " + source, e);
        }
    }
}
