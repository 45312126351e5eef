package eu.virtualparadox.finrag.util;

import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Session options for the embedding model. The page fan-out runs next to it, so intra-op threads
     * are capped at half of the available cores.
     */
    public static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX embedding session: intra-op threads {}, inter-op threads {}", intraThreads, 1);
            return opts;
        }
        catch (Exception e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
