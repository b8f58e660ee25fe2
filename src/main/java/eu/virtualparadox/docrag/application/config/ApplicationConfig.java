package eu.virtualparadox.docrag.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "docrag")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;
    private Path models;

    /** Store location the segments of every run are written to. */
    private String storeLocation = "segments";

    /** Vector index built over {@link #storeLocation}. */
    private String indexName = "segments_index";

    private Retrieval retrieval = new Retrieval();
    private Generation generation = new Generation();
    private Embedding embedding = new Embedding();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }

    @Getter @Setter
    public static class Retrieval {
        private int topK = 5;
    }

    @Getter @Setter
    public static class Generation {
        private double temperature = 0.1;
        private int maxTokens = 512;
    }

    @Getter @Setter
    public static class Embedding {
        /** {@code spring-ai} (the configured Spring AI embedding model) or {@code onnx} (local model under models/retriever). */
        private String provider = "spring-ai";
        private String modelId = "nomic-embed-text";
    }
}
