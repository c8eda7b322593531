package com.rankfusion.ranking;

import com.rankfusion.bandit.model.Outcome;
import com.rankfusion.bandit.service.ThompsonModel;
import com.rankfusion.ranking.model.Candidate;
import com.rankfusion.ranking.service.FeatureExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    void testNormalizeBase() {
        assertThat(FeatureExtractor.normalizeBase(-3.0)).isZero();
        assertThat(FeatureExtractor.normalizeBase(0.0)).isZero();
        assertThat(FeatureExtractor.normalizeBase(0.4)).isEqualTo(0.4);
        assertThat(FeatureExtractor.normalizeBase(1.0)).isEqualTo(1.0);
        assertThat(FeatureExtractor.normalizeBase(4.0)).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void testDisplayScorePrecedence() {
        Candidate c = new Candidate("x");
        assertThat(c.displayScore()).isZero();

        c.setDistance(1.0);
        assertThat(c.displayScore()).isEqualTo(0.5);
        c.setDistance(-4.0);
        assertThat(c.displayScore()).isEqualTo(1.0);

        c.setScore(0.3);
        assertThat(c.displayScore()).isEqualTo(0.3);

        c.setHybridScore(0.03);
        assertThat(c.displayScore()).isEqualTo(0.03);
    }

    @Test
    void testLexicalOverlapCountsDistinctSubstringHits() {
        Candidate c = new Candidate("x");
        c.setCompany("Acme");
        c.setRole("Machine Learning Engineer");
        c.setTags(List.of("ml"));
        c.setNotes("Remote friendly");

        assertThat(extractor.lexicalOverlap("senior ml engineer", c)).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(extractor.lexicalOverlap("ML ml ML", c)).isEqualTo(1.0);
        assertThat(extractor.lexicalOverlap("   ", c)).isZero();
        assertThat(extractor.lexicalOverlap("remote", c)).isEqualTo(1.0);
    }

    @Test
    void testBanditPriorAveragesKnownArms() {
        ThompsonModel model = new ThompsonModel();
        model.recordOutcome(List.of("cat:ai"), Outcome.OFFER);
        model.recordOutcome(List.of("method:ashby"), Outcome.BLOCKED);
        Candidate c = new Candidate("x");
        c.setMethod("ashby");
        c.setTags(List.of("ai", "unseen"));

        double expected = (2.0 / 3.0 + 1.0 / 3.0) / 2.0;
        assertThat(extractor.banditPrior(c, model)).isCloseTo(expected, within(1e-12));
    }

    @Test
    void testBanditPriorNeutralWithoutArms() {
        Candidate c = new Candidate("x");
        c.setTags(List.of("ai"));

        assertThat(extractor.banditPrior(c, new ThompsonModel())).isEqualTo(0.5);
        assertThat(extractor.banditPrior(c, null)).isEqualTo(0.5);
    }
}
