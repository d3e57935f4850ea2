/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.ammann.telemetry.exception.InvalidParameterException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outlier detection methods.
 *
 * <p>Only the four point-wise detectors can vote in the ensemble; seasonal, trend-deviation
 * and adaptive detectors need extra context and run on their own.
 */
public enum AnomalyMethod {
    Z_SCORE("z-score"),
    MODIFIED_Z_SCORE("modified-z-score"),
    IQR("iqr"),
    LOF("lof"),
    SEASONAL("seasonal"),
    TREND_DEVIATION("trend-deviation"),
    ADAPTIVE_THRESHOLD("adaptive-threshold");

    private static final Set<AnomalyMethod> ENSEMBLE_MEMBERS =
            EnumSet.of(Z_SCORE, MODIFIED_Z_SCORE, IQR, LOF);

    private final String value;

    AnomalyMethod(String value) {
        this.value = value;
    }

    public boolean isEnsembleMember() {
        return ENSEMBLE_MEMBERS.contains(this);
    }

    /**
     * Resolves a wire name such as {@code "z-score"} to its method.
     *
     * @throws InvalidParameterException if the name is unknown
     */
    @JsonCreator
    public static AnomalyMethod fromValue(String value) {
        for (AnomalyMethod method : values()) {
            if (method.value.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw InvalidParameterException.invalidParameter(
                "method", value, "one of z-score, modified-z-score, iqr, lof");
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
