package com.rankfusion.bandit;

import com.rankfusion.bandit.model.Outcome;
import com.rankfusion.bandit.service.ThompsonModel;
import com.rankfusion.bandit.store.ArmLoadResult;
import com.rankfusion.bandit.store.ArmRepository;
import com.rankfusion.bandit.store.LoadStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArmRepositoryTest {

    @TempDir
    Path dir;

    @Test
    void testMissingFileLoadsEmptyModel() {
        ArmLoadResult result = new ArmRepository(dir.resolve("arms.json")).load();

        assertThat(result.status()).isEqualTo(LoadStatus.MISSING);
        assertThat(result.model().isEmpty()).isTrue();
    }

    @Test
    void testSaveThenLoadPreservesArms() throws IOException {
        ArmRepository repository = new ArmRepository(dir.resolve("data").resolve("arms.json"));
        ThompsonModel model = repository.load().model();
        model.recordOutcome(List.of("ai", "ml"), "ashby", Outcome.INTERVIEW);
        repository.save(model);

        ArmLoadResult reloaded = repository.load();

        assertThat(reloaded.status()).isEqualTo(LoadStatus.LOADED);
        assertThat(reloaded.model().arms().keySet()).containsExactly("cat:ai", "cat:ml", "method:ashby");
        assertThat(reloaded.model().arm("cat:ai").orElseThrow().getTotalReward()).isEqualTo(0.8);
        assertThat(Files.readString(repository.path())).contains("\"total_reward\"").doesNotContain("meanReward").doesNotContain("confidence");
        try (Stream<Path> files = Files.list(repository.path().getParent())) {
            assertThat(files).containsExactly(repository.path());
        }
    }

    @Test
    void testCorruptFileTreatedAsNoHistory() throws IOException {
        Path path = dir.resolve("arms.json");
        Files.writeString(path, "{not json");

        ArmLoadResult result = new ArmRepository(path).load();

        assertThat(result.status()).isEqualTo(LoadStatus.CORRUPT);
        assertThat(result.status().degraded()).isTrue();
        assertThat(result.model().isEmpty()).isTrue();
    }

    @Test
    void testInvalidPseudoCountsTreatedAsCorrupt() throws IOException {
        Path path = dir.resolve("arms.json");
        Files.writeString(path, "{\"cat:ai\": {\"alpha\": 0.2, \"beta\": 1.0, \"pulls\": 0, \"total_reward\": 0.0}}");

        assertThat(new ArmRepository(path).load().status()).isEqualTo(LoadStatus.CORRUPT);
    }

    @Test
    void testArmNameFilledFromKey() throws IOException {
        Path path = dir.resolve("arms.json");
        Files.writeString(path, "{\"method:lever\": {\"alpha\": 2.0, \"beta\": 1.0, \"pulls\": 1, \"total_reward\": 1.0}}");

        ThompsonModel model = new ArmRepository(path).load().model();

        assertThat(model.arm("method:lever").orElseThrow().getName()).isEqualTo("method:lever");
    }

    @Test
    void testFailedMutationWritesNothing() {
        ArmRepository repository = new ArmRepository(dir.resolve("arms.json"));
        repository.update(model -> model.recordOutcome(List.of("cat:ai"), Outcome.OFFER));

        assertThrows(IllegalStateException.class, () -> repository.update(model -> {
            model.recordOutcome(List.of("cat:ai"), Outcome.OFFER);
            throw new IllegalStateException("abort");
        }));

        assertThat(repository.load().model().arm("cat:ai").orElseThrow().getPulls()).isEqualTo(1);
    }
}
