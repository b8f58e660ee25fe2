package eu.virtualparadox.docrag.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

/**
 * Reads UTF-8 text and markdown files as-is (NFC-normalized).
 */
@Slf4j
@Service
public final class PlainTextExtractor implements TextExtractor {

    private static final Set<String> EXTENSIONS = Set.of(".txt", ".md", ".markdown", ".text");

    @Override
    public boolean supports(final Path source) {
        if (source.getFileName() == null) {
            return false;
        }
        final String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        final int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot));
    }

    @Override
    public String extract(final Path source) {
        try {
            final String text = Files.readString(source, StandardCharsets.UTF_8);
            log.info("Read {} characters from {}", text.length(), source);
            return Normalizer.normalize(text, Normalizer.Form.NFC);
        }
        catch (final IOException e) {
            throw new IllegalStateException("Failed to read text file: " + source, e);
        }
    }
}
