package com.rankfusion.bandit.service;

import com.rankfusion.bandit.feedback.ArmDelta;
import com.rankfusion.bandit.model.Arm;
import com.rankfusion.bandit.model.ArmSample;
import com.rankfusion.bandit.model.ArmStats;
import com.rankfusion.bandit.model.HistoricalRecord;
import com.rankfusion.bandit.model.Outcome;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory Thompson Sampling model over named arms. Instances are loaded from and saved to
 * disk by {@link com.rankfusion.bandit.store.ArmRepository}; nothing here touches the file
 * system.
 *
 * <p>Arm names take the form {@code cat:<tag>} and {@code method:<channel>}.
 */
public class ThompsonModel {

    public static final String CATEGORY_PREFIX = "cat:";
    public static final String METHOD_PREFIX = "method:";
    public static final String DEFAULT_METHOD = "direct";

    private static final Map<String, Outcome> STATUS_TO_OUTCOME = Map.of(
            "Applied", Outcome.NO_RESPONSE,
            "Blocked", Outcome.BLOCKED,
            "Rejected", Outcome.REJECTED,
            "Offer", Outcome.OFFER
    );

    private final Map<String, Arm> arms = new LinkedHashMap<>();
    private final BetaSampler sampler;

    public ThompsonModel() {
        this(new BetaSampler());
    }

    public ThompsonModel(BetaSampler sampler) {
        this.sampler = sampler;
    }

    public ThompsonModel(Map<String, Arm> initialArms, BetaSampler sampler) {
        this(sampler);
        if (initialArms != null) {
            initialArms.forEach((name, arm) -> {
                if (arm.getName() == null || arm.getName().isBlank()) {
                    arm.setName(name);
                }
                arms.put(name, arm);
            });
        }
    }

    public static String categoryArm(String tag) {
        return CATEGORY_PREFIX + tag;
    }

    public static String methodArm(String method) {
        return METHOD_PREFIX + method;
    }

    public static List<String> armNamesFor(Collection<String> tags, String method) {
        List<String> names = new ArrayList<>();
        if (tags != null) {
            for (String tag : tags) {
                names.add(categoryArm(tag));
            }
        }
        String resolvedMethod = (method == null || method.isBlank()) ? DEFAULT_METHOD : method;
        names.add(methodArm(resolvedMethod));
        return names;
    }

    public void recordOutcome(Collection<String> tags, String method, Outcome outcome) {
        recordOutcome(armNamesFor(tags, method), outcome);
    }

    public void recordOutcome(Collection<String> armNames, Outcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        recordReward(armNames, outcome.reward());
    }

    public void recordReward(Collection<String> armNames, double reward) {
        if (armNames == null) {
            return;
        }
        for (String name : armNames) {
            getOrCreate(name).update(reward);
        }
    }

    /**
     * Seeds arms from historical statuses. Statuses without an implied outcome (drafts, closed
     * records) contribute nothing.
     *
     * @return number of records replayed
     */
    public int bootstrap(List<HistoricalRecord> records) {
        int replayed = 0;
        if (records == null) {
            return replayed;
        }
        for (HistoricalRecord record : records) {
            Outcome outcome = STATUS_TO_OUTCOME.get(record.status() == null ? "" : record.status());
            if (outcome == null) {
                continue;
            }
            recordOutcome(record.tags(), record.method(), outcome);
            replayed++;
        }
        return replayed;
    }

    public void applyDeltas(Map<String, ArmDelta> deltas) {
        if (deltas == null) {
            return;
        }
        deltas.forEach((name, delta) -> delta.applyTo(getOrCreate(name)));
    }

    public List<ArmSample> recommend(int k) {
        if (arms.isEmpty() || k <= 0) {
            return List.of();
        }
        List<ArmSample> sampled = new ArrayList<>(arms.size());
        for (Arm arm : arms.values()) {
            sampled.add(new ArmSample(arm.getName(), sampler.sample(arm.getAlpha(), arm.getBeta())));
        }
        sampled.sort(Comparator.comparingDouble(ArmSample::sampledValue).reversed());
        return new ArrayList<>(sampled.subList(0, Math.min(k, sampled.size())));
    }

    public List<ArmStats> stats() {
        List<ArmStats> rows = new ArrayList<>(arms.size());
        for (Arm arm : arms.values()) {
            rows.add(ArmStats.of(arm));
        }
        rows.sort(Comparator.comparingDouble(ArmStats::meanReward).reversed());
        return rows;
    }

    public Optional<Arm> arm(String name) {
        return Optional.ofNullable(arms.get(name));
    }

    public Optional<Double> meanReward(String name) {
        return arm(name).map(Arm::getMeanReward);
    }

    public Map<String, Arm> arms() {
        return Collections.unmodifiableMap(arms);
    }

    public boolean isEmpty() {
        return arms.isEmpty();
    }

    public int size() {
        return arms.size();
    }

    private Arm getOrCreate(String name) {
        return arms.computeIfAbsent(name, Arm::new);
    }
}
