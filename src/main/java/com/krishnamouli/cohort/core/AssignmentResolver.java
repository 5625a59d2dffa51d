package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.exception.ExperimentNotFoundException;
import com.krishnamouli.cohort.model.ExperimentAssignment;
import com.krishnamouli.cohort.model.ExperimentConfig;
import com.krishnamouli.cohort.model.Subject;
import com.krishnamouli.cohort.store.ConfigSnapshot;
import com.krishnamouli.cohort.store.ConfigurationStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes a subject's assignment from the current configuration snapshot.
 *
 * <p>
 * Two gates are applied to the same bucket value: the subject participates
 * when {@code bucket < sampling}, and participants are split by rescaling the
 * bucket into [0, 1) relative to the sampling rate. Lowering the sampling rate
 * therefore only drops subjects near the top of the participating range; the
 * remaining ones keep their relative order, though those close to a variant
 * boundary can still move to a neighbouring variant.
 *
 * <p>
 * Stateless apart from the store reference. Every call reads exactly one
 * snapshot, so a concurrent publish can never mix two configurations.
 */
public class AssignmentResolver {
    private final ConfigurationStore store;

    public AssignmentResolver(ConfigurationStore store) {
        this.store = store;
    }

    /**
     * @throws ExperimentNotFoundException if no published experiment has this key
     */
    public ExperimentAssignment resolve(String subjectKey, String experimentKey) {
        return resolve(store.snapshot(), subjectKey, experimentKey);
    }

    public ExperimentAssignment resolve(Subject subject, String experimentKey) {
        return resolve(subject.getKey(), experimentKey);
    }

    /**
     * Same as {@link #resolve(String, String)} but treats an unknown experiment
     * as "not in experiment".
     */
    public ExperimentAssignment resolveOrDefault(String subjectKey, String experimentKey) {
        try {
            return resolve(subjectKey, experimentKey);
        } catch (ExperimentNotFoundException e) {
            return ExperimentAssignment.notInExperiment(experimentKey);
        }
    }

    /**
     * Resolves every published experiment for a subject against one snapshot.
     */
    public Map<String, ExperimentAssignment> resolveAll(String subjectKey) {
        ConfigSnapshot snapshot = store.snapshot();
        Map<String, ExperimentAssignment> result = new LinkedHashMap<>();
        for (ExperimentConfig config : snapshot.getExperiments().values()) {
            result.put(config.getKey(), assign(subjectKey, config));
        }
        return result;
    }

    public static ExperimentAssignment resolve(ConfigSnapshot snapshot, String subjectKey, String experimentKey) {
        ExperimentConfig config = snapshot.get(experimentKey)
                .orElseThrow(() -> new ExperimentNotFoundException(experimentKey));
        return assign(subjectKey, config);
    }

    static ExperimentAssignment assign(String subjectKey, ExperimentConfig config) {
        if (subjectKey == null) {
            throw new IllegalArgumentException("Subject key must not be null");
        }
        String experimentKey = config.getKey();
        if (!config.isActive()) {
            return ExperimentAssignment.notInExperiment(experimentKey);
        }

        double sampling = config.getSampling();
        double value = BucketingFunction.bucket(subjectKey, experimentKey);
        if (value >= sampling) {
            return ExperimentAssignment.notInExperiment(experimentKey);
        }

        // Division can round up to exactly 1.0 when value sits just under sampling
        double rescaled = Math.min(value / sampling, Math.nextDown(1.0));
        int index = BucketingFunction.chooseVariant(rescaled, config.getVariants().size());
        return ExperimentAssignment.assigned(experimentKey, config.getVariants().get(index));
    }
}
