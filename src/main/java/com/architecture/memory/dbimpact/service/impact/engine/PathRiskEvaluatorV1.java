package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.DependencyType;
import com.architecture.memory.dbimpact.model.impact.ImpactLevel;
import com.architecture.memory.dbimpact.model.impact.PolicySnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Version 1.0 of path risk evaluation. Deterministic, depth-aware, worst-case driven.
 *
 * <pre>
 * raw   = weight(maxDependencyType) x multiplier(changeType) x maxCriticality x depthFactor(depth)
 * score = round(raw), half away from zero
 * depthFactor(d) = max(0.2, 1.0 - 0.2 x (d - 1))
 * </pre>
 *
 * Score thresholds: 50 Critical, 30 High, 15 Medium, above 0 Low, otherwise None.
 *
 * <p>The weight tables below are the only source for both scoring and the policy snapshot.
 * {@link #fromSnapshot(PolicySnapshot)} rebuilds an evaluator from a stored snapshot so
 * that historical verdicts can be replayed.</p>
 */
@Component
public class PathRiskEvaluatorV1 implements PathRiskEvaluator {

    public static final String VERSION = "v1.0";

    private static final Map<DependencyType, Integer> V1_DEPENDENCY_WEIGHTS = new EnumMap<>(Map.of(
            DependencyType.DELETE, 10,
            DependencyType.SCHEMA_DEPENDENCY, 9,
            DependencyType.UPDATE, 8,
            DependencyType.INSERT, 7,
            DependencyType.API_CALL, 6,
            DependencyType.LOGICAL_FK, 6,
            DependencyType.UNKNOWN, 5,
            DependencyType.SELECT, 4
    ));

    private static final Map<ChangeType, Integer> V1_CHANGE_MULTIPLIERS = new EnumMap<>(Map.of(
            ChangeType.DELETE, 3,
            ChangeType.MODIFY, 2,
            ChangeType.CREATE, 1
    ));

    private static final double V1_DEPTH_DECAY = 0.2;
    private static final double V1_MIN_DEPTH_FACTOR = 0.2;
    private static final int V1_DEFAULT_WEIGHT = 5;
    private static final int V1_DEFAULT_MULTIPLIER = 1;
    private static final String CRITICALITY_SCALE = "1-5";

    private static final Map<ImpactLevel, Integer> V1_IMPACT_THRESHOLDS = new EnumMap<>(Map.of(
            ImpactLevel.CRITICAL, 50,
            ImpactLevel.HIGH, 30,
            ImpactLevel.MEDIUM, 15,
            ImpactLevel.LOW, 1
    ));

    // Most severe first, the order classification checks them in
    private static final List<ImpactLevel> CLASSIFIED_LEVELS =
            List.of(ImpactLevel.CRITICAL, ImpactLevel.HIGH, ImpactLevel.MEDIUM, ImpactLevel.LOW);

    private final String version;
    private final Map<DependencyType, Integer> dependencyWeights;
    private final Map<ChangeType, Integer> changeMultipliers;
    private final int defaultWeight;
    private final int defaultMultiplier;
    private final BigDecimal depthDecay;
    private final BigDecimal minDepthFactor;
    private final Map<ImpactLevel, Integer> impactThresholds;
    private final PolicySnapshot policySnapshot;

    public PathRiskEvaluatorV1() {
        this(VERSION, V1_DEPENDENCY_WEIGHTS, V1_CHANGE_MULTIPLIERS, V1_DEFAULT_WEIGHT, V1_DEFAULT_MULTIPLIER,
                V1_DEPTH_DECAY, V1_MIN_DEPTH_FACTOR, V1_IMPACT_THRESHOLDS);
    }

    private PathRiskEvaluatorV1(String version,
                                Map<DependencyType, Integer> dependencyWeights,
                                Map<ChangeType, Integer> changeMultipliers,
                                int defaultWeight,
                                int defaultMultiplier,
                                double depthDecay,
                                double minDepthFactor,
                                Map<ImpactLevel, Integer> impactThresholds) {
        if (defaultWeight <= 0) {
            throw new IllegalArgumentException("Default dependency weight must be positive");
        }
        this.version = version;
        this.dependencyWeights = Collections.unmodifiableMap(new EnumMap<>(dependencyWeights));
        this.changeMultipliers = Collections.unmodifiableMap(new EnumMap<>(changeMultipliers));
        this.defaultWeight = defaultWeight;
        this.defaultMultiplier = defaultMultiplier;
        this.depthDecay = BigDecimal.valueOf(depthDecay);
        this.minDepthFactor = BigDecimal.valueOf(minDepthFactor);
        this.impactThresholds = Collections.unmodifiableMap(new EnumMap<>(impactThresholds));
        this.policySnapshot = buildSnapshot(depthDecay, minDepthFactor);
    }

    /**
     * Rebuilds an evaluator from a stored snapshot. Table keys are enum constant names;
     * a key that no longer exists is rejected rather than silently dropped. A level
     * missing from the stored thresholds falls back to its v1.0 threshold.
     */
    public static PathRiskEvaluatorV1 fromSnapshot(PolicySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");

        Map<DependencyType, Integer> weights = new EnumMap<>(DependencyType.class);
        snapshot.getDependencyWeights().forEach((key, weight) -> weights.put(DependencyType.valueOf(key), weight));

        Map<ChangeType, Integer> multipliers = new EnumMap<>(ChangeType.class);
        snapshot.getChangeTypeMultipliers().forEach((key, multiplier) -> multipliers.put(ChangeType.valueOf(key), multiplier));

        Map<ImpactLevel, Integer> thresholds = new EnumMap<>(V1_IMPACT_THRESHOLDS);
        if (snapshot.getImpactThresholds() != null) {
            snapshot.getImpactThresholds().forEach((key, threshold) -> thresholds.put(ImpactLevel.valueOf(key), threshold));
        }

        return new PathRiskEvaluatorV1(snapshot.getVersion(), weights, multipliers,
                snapshot.getDefaultWeight(), snapshot.getDefaultMultiplier(),
                snapshot.getDepthDecayFactor(), snapshot.getMinimumDepthFactor(), thresholds);
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public PolicySnapshot getPolicySnapshot() {
        return policySnapshot;
    }

    @Override
    public DependencyPath evaluate(DependencyPath path, ChangeType changeType) {
        if (path == null) {
            throw new IllegalArgumentException("Path must not be null");
        }
        if (path.getNodes() == null || path.getNodes().isEmpty()) {
            throw new IllegalArgumentException("Path must have at least one node: " + path.getPathId());
        }
        if (path.getDepth() < 1) {
            throw new IllegalArgumentException("Path depth must be >= 1, was " + path.getDepth()
                    + " for " + path.getPathId());
        }

        int score = score(path.getMaxDependencyType(), changeType, path.getMaxCriticalityLevel(), path.getDepth());

        return path.toBuilder()
                .riskScore(score)
                .impactLevel(classifyImpact(score))
                .scored(true)
                .dominantEntity(path.getTerminalEntity())
                .dominantDependencyType(path.getMaxDependencyType())
                .build();
    }

    /**
     * Rounded risk score for the given factors.
     */
    public int score(DependencyType dependencyType, ChangeType changeType, int criticality, int depth) {
        BigDecimal raw = BigDecimal.valueOf(getDependencyWeight(dependencyType))
                .multiply(BigDecimal.valueOf(getChangeMultiplier(changeType)))
                .multiply(BigDecimal.valueOf(criticality))
                .multiply(depthFactorDecimal(depth));
        return raw.setScale(0, RoundingMode.HALF_UP).intValueExact();
    }

    public int getDependencyWeight(DependencyType type) {
        Integer weight = type == null ? null : dependencyWeights.get(type);
        return weight != null ? weight : defaultWeight;
    }

    public int getChangeMultiplier(ChangeType changeType) {
        Integer multiplier = changeType == null ? null : changeMultipliers.get(changeType);
        return multiplier != null ? multiplier : defaultMultiplier;
    }

    /**
     * Depth 1 keeps full weight; each further hop decays by 0.2 down to a floor of 0.2,
     * so deep chains keep residual risk.
     */
    public double depthFactor(int depth) {
        return depthFactorDecimal(depth).doubleValue();
    }

    private BigDecimal depthFactorDecimal(int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be >= 1, was " + depth);
        }
        BigDecimal factor = BigDecimal.ONE.subtract(depthDecay.multiply(BigDecimal.valueOf(depth - 1L)));
        return factor.max(minDepthFactor);
    }

    public ImpactLevel classifyImpact(int score) {
        for (ImpactLevel level : CLASSIFIED_LEVELS) {
            Integer threshold = impactThresholds.get(level);
            if (threshold != null && score >= threshold) {
                return level;
            }
        }
        return ImpactLevel.NONE;
    }

    private PolicySnapshot buildSnapshot(double decay, double minFactor) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        dependencyWeights.forEach((type, weight) -> weights.put(type.name(), weight));

        Map<String, Integer> multipliers = new LinkedHashMap<>();
        changeMultipliers.forEach((type, multiplier) -> multipliers.put(type.name(), multiplier));

        Map<String, Integer> thresholds = new LinkedHashMap<>();
        CLASSIFIED_LEVELS.forEach(level -> thresholds.put(level.name(), impactThresholds.get(level)));

        return PolicySnapshot.builder()
                .version(version)
                .depthDecayFactor(decay)
                .minimumDepthFactor(minFactor)
                .dependencyWeights(Collections.unmodifiableMap(weights))
                .changeTypeMultipliers(Collections.unmodifiableMap(multipliers))
                .defaultWeight(defaultWeight)
                .defaultMultiplier(defaultMultiplier)
                .criticalityScale(CRITICALITY_SCALE)
                .impactThresholds(Collections.unmodifiableMap(thresholds))
                .build();
    }
}
