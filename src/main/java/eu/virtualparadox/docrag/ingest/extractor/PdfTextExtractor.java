package eu.virtualparadox.docrag.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.text.Normalizer;
import java.util.Locale;

/**
 * PDF extractor backed by Apache PDFBox.
 * <p>
 * Pages are stripped one by one, NFC-normalized and concatenated in page order so that
 * sentences continue across page breaks.
 */
@Slf4j
@Service
public final class PdfTextExtractor implements TextExtractor {

    @Override
    public boolean supports(final Path source) {
        return source.getFileName() != null
                && source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public String extract(final Path source) {
        try (PDDocument pdf = PDDocument.load(source.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            final StringBuilder text = new StringBuilder();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text.append(Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC));
            }

            log.info("Extracted {} characters from {} pages of {}", text.length(), pageCount, source);
            return text.toString();
        }
        catch (final Exception e) {
            throw new IllegalStateException("Failed to extract text from PDF: " + source, e);
        }
    }
}
