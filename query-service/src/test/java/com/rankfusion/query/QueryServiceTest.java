package com.rankfusion.query;

import com.rankfusion.ingestion.exception.IndexNotBuiltException;
import com.rankfusion.query.contract.ContractException;
import com.rankfusion.query.contract.RetrieveEnvelope;
import com.rankfusion.query.contract.RetrieveItem;
import com.rankfusion.query.contract.RetrieveRequest;
import com.rankfusion.query.model.QueryRequest;
import com.rankfusion.query.model.QueryResult;
import com.rankfusion.query.model.RankedResult;
import com.rankfusion.query.service.QueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QueryServiceTest {

    @TempDir
    Path dataDir;

    private QueryFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new QueryFixture(dataDir);
    }

    @Test
    void testInterviewFeedbackLiftsMatchingCandidate() {
        fixture.ingestionService.build(List.of(
                QueryFixture.row("SalesCo", "Account Executive", "Applied", "https://salesco.com/careers", "sales"),
                QueryFixture.row("MLCo", "Senior ML Engineer", "Applied", "https://jobs.ashbyhq.com/mlco/1", "ai;ml")
        ));
        String mlId = fixture.idOf("MLCo");
        fixture.feedbackService.recordOutcome(mlId, "interview");

        QueryResult result = fixture.queryService.query(new QueryRequest("senior ml engineer", 2), "trace-1");

        List<RankedResult> ranked = result.getRankedResults();
        assertThat(ranked).hasSize(2);
        assertThat(ranked.get(0).getAppId()).isEqualTo(mlId);
        assertThat(ranked.get(0).getFinalScore()).isGreaterThan(ranked.get(1).getFinalScore());
        assertThat(ranked.get(0).getBanditPrior()).isGreaterThan(ranked.get(1).getBanditPrior());
        assertThat(ranked.get(0).getMemoryShort()).isCloseTo(0.9, within(1e-9));
        assertThat(ranked.get(1).getMemoryShort()).isZero();
        assertThat(ranked.get(0).getMemoryLong()).isEqualTo(0.8);
        assertThat(result.getRetrievalPath()).isEqualTo("MANUAL_RRF");
        assertThat(fixture.meterRegistry.timer("retrieval_query_latency_ms").count()).isEqualTo(1);
    }

    @Test
    void testQueryTruncatesToTopK() {
        fixture.ingestionService.build(List.of(
                QueryFixture.row("A", "Engineer", "Applied", "", "ai"),
                QueryFixture.row("B", "Engineer", "Applied", "", "ai"),
                QueryFixture.row("C", "Engineer", "Applied", "", "ai")
        ));

        QueryResult result = fixture.queryService.query(new QueryRequest("engineer", 2), null);

        assertThat(result.getRankedResults()).hasSize(2);
        assertThat(result.getCandidateCount()).isEqualTo(3);
    }

    @Test
    void testRetrieveFiltersBeforeTruncation() {
        fixture.ingestionService.build(List.of(
                QueryFixture.row("Alpha", "ML Engineer", "Applied", "https://jobs.lever.co/alpha/1", "ml"),
                QueryFixture.row("Beta", "ML Engineer", "Rejected", "https://jobs.lever.co/beta/1", "ml"),
                QueryFixture.row("Gamma", "ML Engineer", "Applied", "https://gamma.example/jobs", "ml")
        ));

        List<RetrieveItem> items = fixture.queryService.retrieve(new RetrieveRequest("ml engineer", 1, "applied", "LEVER"), "t");

        assertThat(items).hasSize(1);
        assertThat(items.get(0).company()).isEqualTo("Alpha");
        assertThat(items.get(0).status()).isEqualTo("Applied");
        assertThat(items.get(0).method()).isEqualTo("lever");
        assertThat(items.get(0).context()).startsWith("company=Alpha");
    }

    @Test
    void testRetrieveEnvelopeEchoesNormalizedRequest() {
        fixture.ingestionService.build(List.of(
                QueryFixture.row("Alpha", "ML Engineer", "Applied", "", "ml")
        ));

        RetrieveEnvelope envelope = fixture.queryService.retrieveEnvelope(new RetrieveRequest("  ml  ", null, " ", null), "t");

        assertThat(envelope.contract()).isEqualTo("rag.retrieve.v1");
        assertThat(envelope.generatedAt()).isEqualTo("2026-02-19T12:00:00Z");
        assertThat(envelope.request().getQuery()).isEqualTo("ml");
        assertThat(envelope.request().getK()).isEqualTo(5);
        assertThat(envelope.request().getStatus()).isNull();
        assertThat(envelope.results()).hasSize(1);
    }

    @Test
    void testInvalidRequestsAreRejected() {
        assertThatThrownBy(() -> fixture.queryService.query(new QueryRequest("   ", 5), null))
                .isInstanceOf(ContractException.class);
        assertThatThrownBy(() -> fixture.queryService.query(new QueryRequest("ml", 0), null))
                .isInstanceOf(ContractException.class);
        assertThatThrownBy(() -> fixture.queryService.retrieve(new RetrieveRequest("ml", 500, null, null), null))
                .isInstanceOf(ContractException.class);
    }

    @Test
    void testOversizedSearchQueryIsRejected() {
        fixture.ingestionService.build(List.of(
                QueryFixture.row("Alpha", "ML Engineer", "Applied", "", "ml")
        ));

        assertThatThrownBy(() -> fixture.queryService.query(new QueryRequest("a".repeat(600), 5), "t"))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("512");
        assertThat(fixture.queryService.query(new QueryRequest("a".repeat(512), 5), "t").getQuery()).hasSize(512);
    }

    @Test
    void testQueryBeforeBuildFails() {
        assertThatThrownBy(() -> fixture.queryService.query(new QueryRequest("ml", 5), null))
                .isInstanceOf(IndexNotBuiltException.class);
    }

    @Test
    void testCandidatePoolSizes() {
        assertThat(QueryService.queryCandidateK(1)).isEqualTo(40);
        assertThat(QueryService.queryCandidateK(10)).isEqualTo(80);
        assertThat(QueryService.retrieveCandidateK(2)).isEqualTo(60);
        assertThat(QueryService.retrieveCandidateK(10)).isEqualTo(120);
    }
}
