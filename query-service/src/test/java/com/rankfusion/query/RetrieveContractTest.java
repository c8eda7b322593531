package com.rankfusion.query;

import com.rankfusion.query.contract.ContractException;
import com.rankfusion.query.contract.RetrieveContract;
import com.rankfusion.query.contract.RetrieveEnvelope;
import com.rankfusion.query.contract.RetrieveItem;
import com.rankfusion.query.contract.RetrieveRequest;
import com.rankfusion.ranking.model.Candidate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrieveContractTest {

    @Test
    void testNormalizeTrimsAndAppliesDefaults() {
        RetrieveRequest normalized = RetrieveContract.normalize(new RetrieveRequest("  ml engineer ", null, "  ", " Applied "));

        assertThat(normalized.getQuery()).isEqualTo("ml engineer");
        assertThat(normalized.getK()).isEqualTo(5);
        assertThat(normalized.getStatus()).isNull();
        assertThat(normalized.getMethod()).isEqualTo("Applied");
    }

    @Test
    void testRejectsBlankAndOversizedQueries() {
        assertThatThrownBy(() -> RetrieveContract.normalize(new RetrieveRequest("   ", 5, null, null)))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("non-empty");
        assertThatThrownBy(() -> RetrieveContract.normalize(new RetrieveRequest("q".repeat(513), 5, null, null)))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("512");
        assertThat(RetrieveContract.normalize(new RetrieveRequest("q".repeat(512), 5, null, null)).getQuery()).hasSize(512);
    }

    @Test
    void testRejectsKOutOfRangeWithoutClamping() {
        assertThatThrownBy(() -> RetrieveContract.normalize(new RetrieveRequest("ml", 0, null, null)))
                .isInstanceOf(ContractException.class);
        assertThatThrownBy(() -> RetrieveContract.normalize(new RetrieveRequest("ml", 201, null, null)))
                .isInstanceOf(ContractException.class);
        assertThat(RetrieveContract.normalize(new RetrieveRequest("ml", 200, null, null)).getK()).isEqualTo(200);
    }

    @Test
    void testRejectsOversizedFilters() {
        assertThatThrownBy(() -> RetrieveContract.normalize(new RetrieveRequest("ml", 5, "s".repeat(121), null)))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("status");
        assertThatThrownBy(() -> RetrieveContract.normalize(new RetrieveRequest("ml", 5, null, "m".repeat(121))))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("method");
    }

    @Test
    void testItemsAreCanonicalized() {
        Candidate candidate = new Candidate("acme__ml__abc");
        candidate.setCompany("Acme");
        candidate.setMethod("ashby");
        candidate.setTags(Arrays.asList("ai", null, "ml"));
        candidate.setContextBundleText("x".repeat(400));
        candidate.setFinalScore(0.123456789);

        RetrieveItem item = RetrieveContract.toItems(List.of(candidate)).get(0);

        assertThat(item.appId()).isEqualTo("acme__ml__abc");
        assertThat(item.role()).isEmpty();
        assertThat(item.status()).isEmpty();
        assertThat(item.method()).isEqualTo("ashby");
        assertThat(item.tags()).containsExactly("ai", "ml");
        assertThat(item.score()).isEqualTo(0.1235);
        assertThat(item.context()).hasSize(320);
        assertThat(item.evidence()).isEmpty();
    }

    @Test
    void testBadRankedOutputIsAServerFaultNotABadRequest() {
        List<Candidate> tooMany = new ArrayList<>();
        for (int i = 0; i < 201; i++) {
            tooMany.add(new Candidate("c" + i));
        }
        Candidate negative = new Candidate("neg");
        negative.setFinalScore(-0.1);
        Candidate nan = new Candidate("nan");
        nan.setFinalScore(Double.NaN);

        assertThatThrownBy(() -> RetrieveContract.toItems(tooMany))
                .isInstanceOf(IllegalStateException.class)
                .isNotInstanceOf(ContractException.class);
        assertThatThrownBy(() -> RetrieveContract.toItems(List.of(negative))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RetrieveContract.toItems(List.of(nan))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testEnvelopeCarriesContractMetadata() {
        RetrieveRequest request = RetrieveContract.normalize(new RetrieveRequest("ml", 3, null, null));

        RetrieveEnvelope envelope = RetrieveContract.envelope(request, List.of(), Instant.parse("2026-02-19T12:00:00Z"));

        assertThat(envelope.contract()).isEqualTo("rag.retrieve.v1");
        assertThat(envelope.contractVersion()).isEqualTo("2026-02-19");
        assertThat(envelope.provider()).isEqualTo("local_fusion_v1");
        assertThat(envelope.generatedAt()).isEqualTo("2026-02-19T12:00:00Z");
        assertThat(envelope.request().getK()).isEqualTo(3);
        assertThat(envelope.results()).isEmpty();
    }
}
