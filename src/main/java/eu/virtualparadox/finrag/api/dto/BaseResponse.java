package eu.virtualparadox.finrag.api.dto;

/**
 * Envelope of every API response that is not an error.
 */
public record BaseResponse<T>(boolean success, String message, T data) {

    public static <T> BaseResponse<T> ok(final String message, final T data) {
        return new BaseResponse<>(true, message, data);
    }

    public static <T> BaseResponse<T> fail(final String message, final T data) {
        return new BaseResponse<>(false, message, data);
    }
}
