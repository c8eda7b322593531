package com.rankfusion.bandit;

import com.rankfusion.bandit.service.BetaSampler;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BetaSamplerTest {

    @Test
    void testSamplesStayInUnitInterval() {
        BetaSampler sampler = new BetaSampler(7L);
        double[][] params = {{1.0, 1.0}, {1.0, 200.0}, {200.0, 1.0}, {1.05, 1.95}, {50.5, 30.2}};
        for (double[] p : params) {
            for (int i = 0; i < 200; i++) {
                assertThat(sampler.sample(p[0], p[1])).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void testSampleMeanApproachesPosteriorMean() {
        BetaSampler sampler = new BetaSampler(11L);
        double sum = 0.0;
        int n = 5_000;
        for (int i = 0; i < n; i++) {
            sum += sampler.sample(8.0, 2.0);
        }

        assertThat(sum / n).isCloseTo(0.8, within(0.02));
    }

    @Test
    void testSeededSamplersAreReproducible() {
        BetaSampler a = new BetaSampler(99L);
        BetaSampler b = new BetaSampler(99L);

        for (int i = 0; i < 10; i++) {
            assertThat(a.sample(2.0, 3.0)).isEqualTo(b.sample(2.0, 3.0));
        }
    }
}
