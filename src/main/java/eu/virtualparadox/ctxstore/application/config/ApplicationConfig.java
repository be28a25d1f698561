package eu.virtualparadox.ctxstore.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Storage locations and embedding settings, bound from {@code ctxstore.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "ctxstore")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;
    private Path models;

    /**
     * Keeps the Lucene index in heap memory instead of {@link #index}. Used by tests.
     */
    private boolean indexInMemory = false;

    /**
     * Upper bound for a single embedding model call. A timed out call is a soft sync failure.
     */
    private Duration embeddingTimeout = Duration.ofSeconds(30);

    /**
     * Identifier recorded on every stored embedding chunk.
     */
    private String embeddingModel = "all-MiniLM-L6-v2";

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null && !indexInMemory) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }
}
