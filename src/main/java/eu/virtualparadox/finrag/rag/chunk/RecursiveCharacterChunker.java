package eu.virtualparadox.finrag.rag.chunk;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Character based splitter that prefers paragraph breaks, then line breaks, then spaces, then single characters.
 * <p>
 * Text is split on the first separator that occurs in it, each separator staying at the start of the piece
 * that follows it. Pieces still longer than the chunk size are split again with the next separator. The
 * pieces are then packed greedily into windows of at most {@code chunkSize} characters; when a window is
 * full, pieces are dropped from its front until at most {@code chunkOverlap} characters remain, and those
 * carry over into the next window. Windows are whitespace-stripped and empty ones are dropped.
 * </p>
 * <p>Stateless and deterministic.</p>
 */
@Component
@Slf4j
public class RecursiveCharacterChunker {

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    public List<String> chunk(final String text, final int chunkSize, final int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap > chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be between 0 and chunkSize");
        }
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return split(text, SEPARATORS, chunkSize, chunkOverlap);
    }

    private List<String> split(final String text,
                               final List<String> separators,
                               final int chunkSize,
                               final int chunkOverlap) {
        String separator = separators.get(separators.size() - 1);
        List<String> remaining = List.of();

        for (int i = 0; i < separators.size(); i++) {
            final String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                remaining = separators.subList(i + 1, separators.size());
                break;
            }
        }

        final List<String> chunks = new ArrayList<>();
        final List<String> good = new ArrayList<>();

        for (final String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                good.add(piece);
                continue;
            }

            if (!good.isEmpty()) {
                chunks.addAll(merge(good, chunkSize, chunkOverlap));
                good.clear();
            }

            if (remaining.isEmpty()) {
                chunks.add(piece);
            } else {
                chunks.addAll(split(piece, remaining, chunkSize, chunkOverlap));
            }
        }

        if (!good.isEmpty()) {
            chunks.addAll(merge(good, chunkSize, chunkOverlap));
        }
        return chunks;
    }

    /**
     * Splits on a literal separator; the first piece is the text before the first separator and every
     * later piece starts with the separator. An empty separator splits into code points.
     */
    static List<String> splitKeepingSeparator(final String text, final String separator) {
        final List<String> pieces = new ArrayList<>();

        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
            return pieces;
        }

        int start = 0;
        int next = text.indexOf(separator);
        while (next >= 0) {
            addIfNotEmpty(pieces, text.substring(start, next));
            start = next;
            next = text.indexOf(separator, next + separator.length());
        }
        addIfNotEmpty(pieces, text.substring(start));
        return pieces;
    }

    private List<String> merge(final List<String> pieces, final int chunkSize, final int chunkOverlap) {
        final List<String> windows = new ArrayList<>();
        final List<String> current = new ArrayList<>();
        int total = 0;

        for (final String piece : pieces) {
            final int len = piece.length();

            if (total + len > chunkSize) {
                if (total > chunkSize) {
                    log.warn("Created a chunk of size {}, which is longer than the specified {}", total, chunkSize);
                }

                if (!current.isEmpty()) {
                    addIfNotEmpty(windows, String.join("", current).strip());

                    while (total > chunkOverlap || (total + len > chunkSize && total > 0)) {
                        total -= current.get(0).length();
                        current.remove(0);
                    }
                }
            }

            current.add(piece);
            total += len;
        }

        addIfNotEmpty(windows, String.join("", current).strip());
        return windows;
    }

    private static void addIfNotEmpty(final List<String> target, final String value) {
        if (!value.isEmpty()) {
            target.add(value);
        }
    }
}
