package eu.virtualparadox.ctxstore.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated executor for embedding model calls, so that each call can be awaited with a timeout.
 */
public class EmbeddingExecutor extends ThreadPoolTaskExecutor {
}
