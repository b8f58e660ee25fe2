package eu.virtualparadox.docrag.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trip through a small PDF written with PDFBox itself.
 */
class PdfTextExtractorTest {

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    private static Path writePdf(Path dir, String... pages) throws IOException {
        Path file = dir.resolve("sample.pdf");
        try (PDDocument doc = new PDDocument()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            doc.save(file.toFile());
        }
        return file;
    }

    @Test
    @DisplayName("Only .pdf files are supported")
    void supportsPdfOnly() {
        assertTrue(extractor.supports(Path.of("Paper.PDF")));
        assertFalse(extractor.supports(Path.of("notes.txt")));
    }

    @Test
    @DisplayName("Pages are extracted in order")
    void extractsPagesInOrder(@TempDir Path dir) throws IOException {
        Path pdf = writePdf(dir, "Alpha page text", "Bravo page text");

        String text = extractor.extract(pdf);

        int alpha = text.indexOf("Alpha page text");
        int bravo = text.indexOf("Bravo page text");
        assertTrue(alpha >= 0, text);
        assertTrue(bravo > alpha, text);
    }

    @Test
    @DisplayName("A corrupt file is reported as an extraction failure")
    void corruptFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.pdf");
        Files.writeString(file, "not a pdf");

        assertThrows(IllegalStateException.class, () -> extractor.extract(file));
    }
}
