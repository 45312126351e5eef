package eu.virtualparadox.finrag.api.dto;

/**
 * Body of the search endpoints. Missing numbers fall back to the endpoint defaults.
 */
public record SearchRequest(String query, Integer limit, Double vectorWeight, Double keywordWeight) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 1000;

    /**
     * @return the requested limit capped at {@value #MAX_LIMIT}, or {@value #DEFAULT_LIMIT} when absent
     */
    public int limitOrDefault() {
        return limit == null ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }
}
