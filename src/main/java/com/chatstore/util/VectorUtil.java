package com.chatstore.util;

import com.chatstore.exception.InvalidEmbeddingException;

/**
 * Utility class for converting embeddings to and from pgvector's text format.
 */
public class VectorUtil {

    /**
     * Dimension of every stored vector (all-MiniLM-L6-v2 output size).
     */
    public static final int EMBEDDING_DIMENSIONS = 384;

    private VectorUtil() {
    }

    /**
     * Format a float array as a pgvector literal, e.g. [0.1,0.2,0.3].
     *
     * @param vector Embedding with exactly {@link #EMBEDDING_DIMENSIONS} components
     * @return Literal suitable for CAST(... AS vector)
     * @throws InvalidEmbeddingException if the vector is null, has the wrong
     *                                   length or contains NaN/infinite values
     */
    public static String formatVector(float[] vector) {
        requireDimensions(vector);
        StringBuilder sb = new StringBuilder(vector.length * 10);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            float component = vector[i];
            if (!Float.isFinite(component)) {
                throw new InvalidEmbeddingException("Embedding component " + i + " is not a finite number");
            }
            if (i > 0) {
                sb.append(',');
            }
            sb.append(component);
        }
        sb.append(']');
        return sb.toString();
    }

    /**
     * Parse pgvector's text output back into a float array.
     *
     * @param literal Text such as [0.1,0.2]; null yields null
     */
    public static float[] parseVector(String literal) {
        if (literal == null) {
            return null;
        }
        String body = literal.trim();
        if (body.length() < 2 || body.charAt(0) != '[' || body.charAt(body.length() - 1) != ']') {
            throw new InvalidEmbeddingException("Not a vector literal: " + abbreviate(body));
        }
        body = body.substring(1, body.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                vector[i] = Float.parseFloat(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            throw new InvalidEmbeddingException("Not a vector literal: " + abbreviate(literal));
        }
        return vector;
    }

    public static void requireDimensions(float[] vector) {
        if (vector == null) {
            throw new InvalidEmbeddingException("Embedding is required");
        }
        if (vector.length != EMBEDDING_DIMENSIONS) {
            throw new InvalidEmbeddingException(EMBEDDING_DIMENSIONS, vector.length);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }
}
