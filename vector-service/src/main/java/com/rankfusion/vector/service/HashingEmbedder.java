package com.rankfusion.vector.service;

import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Offline feature-hashing embedder. Every unigram and adjacent-word bigram of the lowercased
 * input is hashed with an 8-byte BLAKE2b digest into one of {@code dims} buckets, and the
 * resulting count vector is L2-normalized.
 */
public class HashingEmbedder {

    public static final int DEFAULT_DIMS = 1536;
    private static final int DIGEST_BYTES = 8;

    private final int dims;

    public HashingEmbedder() {
        this(DEFAULT_DIMS);
    }

    public HashingEmbedder(int dims) {
        if (dims <= 0) {
            throw new IllegalArgumentException("dims must be positive: " + dims);
        }
        this.dims = dims;
    }

    public int dims() {
        return dims;
    }

    public float[] embed(String text) {
        return embed(text, dims);
    }

    public float[] embed(String text, int dims) {
        float[] vector = new float[dims];
        for (String token : tokenize(text)) {
            vector[bucket(token, dims)] += 1.0f;
        }
        double norm = VectorMath.l2Norm(vector);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    public static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        String trimmed = text.toLowerCase(Locale.ROOT).trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        List<String> unigrams = Arrays.asList(trimmed.split("\\s+"));
        List<String> tokens = new ArrayList<>(unigrams.size() * 2);
        tokens.addAll(unigrams);
        for (int i = 0; i + 1 < unigrams.size(); i++) {
            tokens.add(unigrams.get(i) + "_" + unigrams.get(i + 1));
        }
        return tokens;
    }

    static int bucket(String token, int dims) {
        byte[] input = token.getBytes(StandardCharsets.UTF_8);
        Blake2bDigest digest = new Blake2bDigest(DIGEST_BYTES * 8);
        digest.update(input, 0, input.length);
        byte[] out = new byte[DIGEST_BYTES];
        digest.doFinal(out, 0);

        long value = 0L;
        for (int i = DIGEST_BYTES - 1; i >= 0; i--) {
            value = (value << 8) | (out[i] & 0xFFL);
        }
        return (int) Long.remainderUnsigned(value, dims);
    }
}
