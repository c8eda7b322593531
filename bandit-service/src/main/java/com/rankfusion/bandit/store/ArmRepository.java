package com.rankfusion.bandit.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rankfusion.bandit.model.Arm;
import com.rankfusion.bandit.service.BetaSampler;
import com.rankfusion.bandit.service.ThompsonModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reads and writes the flat arm map ({@code {name: {alpha, beta, pulls, total_reward}}}).
 * Loads never fail: a missing or unreadable file yields an empty model. Saves rewrite the whole
 * map through a temp file and an atomic rename.
 */
public class ArmRepository {

    private static final Logger log = LoggerFactory.getLogger(ArmRepository.class);
    private static final TypeReference<LinkedHashMap<String, Arm>> ARM_MAP = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Supplier<BetaSampler> samplerFactory;

    public ArmRepository(Path path) {
        this(path, new ObjectMapper(), BetaSampler::new);
    }

    public ArmRepository(Path path, ObjectMapper objectMapper, Supplier<BetaSampler> samplerFactory) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.samplerFactory = samplerFactory;
    }

    public Path path() {
        return path;
    }

    public ArmLoadResult load() {
        if (!Files.exists(path)) {
            return new ArmLoadResult(new ThompsonModel(samplerFactory.get()), LoadStatus.MISSING, "no arm file");
        }
        try {
            Map<String, Arm> arms = objectMapper.readValue(path.toFile(), ARM_MAP);
            if (arms == null) {
                arms = Map.of();
            }
            for (Map.Entry<String, Arm> entry : arms.entrySet()) {
                Arm arm = entry.getValue();
                if (arm == null || arm.getAlpha() < 1.0 || arm.getBeta() < 1.0 || arm.getPulls() < 0) {
                    throw new IOException("invalid arm state for " + entry.getKey());
                }
            }
            return new ArmLoadResult(new ThompsonModel(arms, samplerFactory.get()), LoadStatus.LOADED, "");
        } catch (IOException | RuntimeException ex) {
            log.warn("arm state unreadable, starting fresh path={} cause={}", path, ex.getMessage());
            return new ArmLoadResult(new ThompsonModel(samplerFactory.get()), LoadStatus.CORRUPT, ex.getMessage());
        }
    }

    public void save(ThompsonModel model) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(tmp.toFile(), model.arms());
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to persist arms to " + path, ex);
        }
    }

    /**
     * Loads the model, applies {@code mutation} and saves the full arm map. If the mutation
     * throws, nothing is written.
     */
    public ThompsonModel update(Consumer<ThompsonModel> mutation) {
        ArmLoadResult loaded = load();
        ThompsonModel model = loaded.model();
        mutation.accept(model);
        save(model);
        return model;
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
