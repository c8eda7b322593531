package com.rankfusion.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankfusion.bandit.service.BetaSampler;
import com.rankfusion.bandit.store.ArmRepository;
import com.rankfusion.ingestion.store.EventLog;
import com.rankfusion.ingestion.store.RecordStore;
import com.rankfusion.ingestion.store.SeenKeyLedger;
import com.rankfusion.memory.store.JsonlFiles;
import com.rankfusion.memory.store.JsonlMemoryLog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;

@Configuration
public class StoreConfig {

    @Bean
    public DataPaths dataPaths(@Value("${rankfusion.data-dir:data}") String dataDir) {
        return new DataPaths(Path.of(dataDir));
    }

    @Bean
    public JsonlFiles jsonlFiles(ObjectMapper objectMapper) {
        return new JsonlFiles(objectMapper);
    }

    @Bean
    public JsonlMemoryLog jsonlMemoryLog(DataPaths dataPaths, JsonlFiles jsonlFiles) {
        return new JsonlMemoryLog(dataPaths.root(), jsonlFiles);
    }

    @Bean
    public RecordStore recordStore(DataPaths dataPaths, JsonlFiles jsonlFiles) {
        return new RecordStore(dataPaths.applications(), jsonlFiles);
    }

    @Bean
    public EventLog eventLog(DataPaths dataPaths, JsonlFiles jsonlFiles, JsonlMemoryLog jsonlMemoryLog) {
        return new EventLog(dataPaths.events(), jsonlFiles, jsonlMemoryLog, Clock.systemUTC());
    }

    @Bean
    public SeenKeyLedger seenKeyLedger(DataPaths dataPaths, ObjectMapper objectMapper) {
        return new SeenKeyLedger(dataPaths.feedbackLedger(), objectMapper);
    }

    /**
     * Arm repository. A configured seed makes every load sample from the same stream, which
     * keeps recommendations reproducible across requests.
     */
    @Bean
    public ArmRepository armRepository(
            DataPaths dataPaths,
            ObjectMapper objectMapper,
            @Value("${rankfusion.bandit.seed:#{null}}") Long seed
    ) {
        Supplier<BetaSampler> samplers = seed == null ? BetaSampler::new : () -> new BetaSampler(seed);
        return new ArmRepository(dataPaths.arms(), objectMapper, samplers);
    }
}
