/* (C)2026 */
package com.ammann.telemetry.enumeration;

/**
 * Letter grade of an overall data quality score.
 *
 * <p>A score is graded into the highest letter whose threshold it meets or exceeds.
 */
public enum QualityGrade {
    /** Score of 0.9 or above. */
    A(0.9),
    /** Score of 0.8 or above. */
    B(0.8),
    /** Score of 0.7 or above. */
    C(0.7),
    /** Score of 0.6 or above. */
    D(0.6),
    /** Score below 0.6. */
    F(0.0);

    private final double threshold;

    QualityGrade(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Returns the grade corresponding to the given score.
     *
     * @param score overall quality score in the range [0.0, 1.0]
     * @return the highest grade whose threshold the score meets
     */
    public static QualityGrade fromScore(double score) {
        if (score >= A.threshold) return A;
        if (score >= B.threshold) return B;
        if (score >= C.threshold) return C;
        if (score >= D.threshold) return D;
        return F;
    }

    public double getThreshold() {
        return threshold;
    }
}
