package eu.virtualparadox.ctxstore.rag.embed;

import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Creates session options that leave one core free for the rest of the process.
     */
    static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            int availableProcessors = Runtime.getRuntime().availableProcessors() - 1;
            int intraThreads = Math.max(1, availableProcessors);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        }
        catch (Exception e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
