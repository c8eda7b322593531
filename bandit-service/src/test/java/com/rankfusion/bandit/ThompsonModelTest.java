package com.rankfusion.bandit;

import com.rankfusion.bandit.model.Arm;
import com.rankfusion.bandit.model.ArmSample;
import com.rankfusion.bandit.model.ArmStats;
import com.rankfusion.bandit.model.HistoricalRecord;
import com.rankfusion.bandit.model.Outcome;
import com.rankfusion.bandit.service.BetaSampler;
import com.rankfusion.bandit.service.ThompsonModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThompsonModelTest {

    private final ThompsonModel model = new ThompsonModel(new BetaSampler(42L));

    @Test
    void testRepeatedOffersConvergeAboveNinetyFivePercent() {
        for (int i = 0; i < 100; i++) {
            model.recordOutcome(List.of("x"), "ashby_channel", Outcome.OFFER);
        }

        assertThat(model.meanReward("cat:x")).hasValueSatisfying(mean -> assertThat(mean).isGreaterThan(0.95));
        assertThat(model.meanReward("method:ashby_channel")).hasValueSatisfying(mean -> assertThat(mean).isGreaterThan(0.95));
    }

    @Test
    void testArmsAreCreatedLazilyWithUniformPrior() {
        assertThat(model.isEmpty()).isTrue();

        model.recordOutcome(List.of("cat:ai"), Outcome.RESPONSE);

        Arm arm = model.arm("cat:ai").orElseThrow();
        assertThat(arm.getAlpha()).isEqualTo(1.5);
        assertThat(arm.getBeta()).isEqualTo(1.5);
        assertThat(arm.getPulls()).isEqualTo(1);
        assertThat(arm.getTotalReward()).isEqualTo(0.5);
    }

    @Test
    void testPseudoCountsTrackRewardSums() {
        List<Outcome> outcomes = List.of(Outcome.BLOCKED, Outcome.NO_RESPONSE, Outcome.INTERVIEW, Outcome.REJECTED);
        double sum = 0.0;
        for (Outcome outcome : outcomes) {
            model.recordOutcome(List.of("cat:remote"), outcome);
            sum += outcome.reward();
        }

        Arm arm = model.arm("cat:remote").orElseThrow();
        assertThat(arm.getAlpha()).isCloseTo(1.0 + sum, within(1e-12));
        assertThat(arm.getBeta()).isCloseTo(1.0 + outcomes.size() - sum, within(1e-12));
        assertThat(arm.getPulls()).isEqualTo(outcomes.size());
    }

    @Test
    void testRewardsOutsideRangeAreClamped() {
        model.recordReward(List.of("cat:a"), 3.0);
        model.recordReward(List.of("cat:b"), -2.0);

        assertThat(model.arm("cat:a").orElseThrow().getAlpha()).isEqualTo(2.0);
        assertThat(model.arm("cat:b").orElseThrow().getBeta()).isEqualTo(2.0);
    }

    @Test
    void testTagsAndMethodBecomeArms() {
        model.recordOutcome(List.of("ai", "remote"), "greenhouse", Outcome.INTERVIEW);
        model.recordOutcome(List.of("ai"), null, Outcome.REJECTED);

        assertThat(model.arms().keySet())
                .containsExactly("cat:ai", "cat:remote", "method:greenhouse", "method:direct");
    }

    @Test
    void testNullOutcomeTouchesNothing() {
        assertThrows(IllegalArgumentException.class, () -> model.recordOutcome(List.of("cat:ai"), (Outcome) null));
        assertThat(model.isEmpty()).isTrue();
    }

    @Test
    void testMeanRewardStaysInOpenUnitInterval() {
        assertThat(new Arm("fresh").getMeanReward()).isEqualTo(0.5);
        assertThat(new Arm("many", 1.0, 500.0, 499, 0.0).getMeanReward()).isGreaterThan(0.0).isLessThan(1.0);
        assertThat(new Arm("lucky", 500.0, 1.0, 499, 499.0).getMeanReward()).isGreaterThan(0.0).isLessThan(1.0);
    }

    @Test
    void testRecommendReturnsTopKSortedSamplesInRange() {
        for (int i = 0; i < 20; i++) {
            model.recordOutcome(List.of("cat:good"), Outcome.OFFER);
            model.recordOutcome(List.of("cat:bad"), Outcome.BLOCKED);
        }
        model.recordOutcome(List.of("cat:new"), Outcome.RESPONSE);

        List<ArmSample> top = model.recommend(2);

        assertThat(top).hasSize(2);
        assertThat(top.get(0).sampledValue()).isGreaterThanOrEqualTo(top.get(1).sampledValue());
        assertThat(top).allSatisfy(s -> assertThat(s.sampledValue()).isBetween(0.0, 1.0));
        assertThat(model.recommend(10)).hasSize(3);
        assertThat(new ThompsonModel().recommend(5)).isEmpty();
    }

    @Test
    void testStatsSortedByMeanDescending() {
        model.recordOutcome(List.of("cat:low"), Outcome.BLOCKED);
        model.recordOutcome(List.of("cat:high"), Outcome.OFFER);
        model.recordOutcome(List.of("cat:mid"), Outcome.RESPONSE);

        List<ArmStats> stats = model.stats();

        assertThat(stats).extracting(ArmStats::arm).containsExactly("cat:high", "cat:mid", "cat:low");
        assertThat(stats.get(0).pulls()).isEqualTo(1);
    }

    @Test
    void testBootstrapSkipsIndeterminateStatuses() {
        int replayed = model.bootstrap(List.of(
                new HistoricalRecord("Applied", List.of("ai"), "ashby"),
                new HistoricalRecord("Offer", List.of("ai"), "ashby"),
                new HistoricalRecord("Draft", List.of("sales"), "lever"),
                new HistoricalRecord("Closed", List.of("sales"), "lever"),
                new HistoricalRecord("Blocked", List.of(), null)
        ));

        assertThat(replayed).isEqualTo(3);
        assertThat(model.arm("cat:sales")).isEmpty();
        assertThat(model.arm("cat:ai").orElseThrow().getAlpha()).isCloseTo(1.0 + 0.05 + 1.0, within(1e-12));
        assertThat(model.arm("method:direct").orElseThrow().getPulls()).isEqualTo(1);
    }
}
