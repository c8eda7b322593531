package com.rankfusion.vector;

import com.rankfusion.vector.model.FieldBoostedDocument;
import com.rankfusion.vector.service.HashingEmbedder;
import com.rankfusion.vector.service.VectorMath;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldBoostedDocumentTest {

    @Test
    void testFieldsAreRepeatedByBoost() {
        FieldBoostedDocument doc = FieldBoostedDocument.builder()
                .identity("Acme")
                .label("Engineer")
                .tags(List.of("ai", "ml"))
                .channel("ashby")
                .status("Applied")
                .freeText("notes")
                .context("ctx")
                .freeText("body")
                .build();

        List<String> parts = doc.parts();
        assertThat(Collections.frequency(parts, "Acme")).isEqualTo(5);
        assertThat(Collections.frequency(parts, "Engineer")).isEqualTo(4);
        assertThat(Collections.frequency(parts, "ai")).isEqualTo(3);
        assertThat(Collections.frequency(parts, "ashby")).isEqualTo(2);
        assertThat(Collections.frequency(parts, "Applied")).isEqualTo(2);
        assertThat(Collections.frequency(parts, "ctx")).isEqualTo(2);
        assertThat(Collections.frequency(parts, "body")).isEqualTo(1);
        assertThat(parts.subList(9, 15)).containsExactly("ai", "ml", "ai", "ml", "ai", "ml");
    }

    @Test
    void testNullFieldsBecomeBlank() {
        FieldBoostedDocument doc = FieldBoostedDocument.builder()
                .identity(null)
                .tags(null)
                .build();

        assertThat(doc.parts()).hasSize(5).allMatch(String::isEmpty);
    }

    @Test
    void testBoostedIdentityDominatesSimilarity() {
        HashingEmbedder embedder = new HashingEmbedder();
        float[] boosted = embedder.embed(FieldBoostedDocument.builder()
                .identity("anthropic")
                .freeText("distributed systems")
                .build()
                .text());

        double identitySimilarity = VectorMath.cosine(boosted, embedder.embed("anthropic"));
        double freeTextSimilarity = VectorMath.cosine(boosted, embedder.embed("distributed"));

        assertThat(identitySimilarity).isGreaterThan(freeTextSimilarity);
    }
}
