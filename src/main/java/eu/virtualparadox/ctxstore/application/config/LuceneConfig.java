package eu.virtualparadox.ctxstore.application.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Lucene resources of the vector index. Only keyword and vector fields are indexed, so no analyzer is configured.
 * <p>Each bean is closed by the container through its {@code close()} method, searcher first, directory last.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        if (props.isIndexInMemory() || props.getIndex() == null) {
            log.info("Using in-memory vector index");
            return new ByteBuffersDirectory();
        }
        log.info("Opening vector index at {}", props.getIndex());
        return FSDirectory.open(props.getIndex());
    }

    @Bean
    public IndexWriter indexWriter(final Directory directory) throws IOException {
        return new IndexWriter(directory, new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND));
    }

    /**
     * Near-real-time searcher on top of the writer, refreshed after every index change.
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        return new SearcherManager(writer, null);
    }
}
