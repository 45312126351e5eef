package eu.virtualparadox.finrag.rag.embed;

import java.util.List;

/**
 * Computes dense, L2-normalised vectors for chunk texts and queries.
 */
public interface EmbeddingService {

    /**
     * @param texts chunk texts
     * @return one vector per text, in input order
     */
    List<float[]> embed(List<String> texts);

    float[] embedQuery(final String text);

    /**
     * @return a short description of the loaded model, e.g. its path
     */
    String modelName();
}
