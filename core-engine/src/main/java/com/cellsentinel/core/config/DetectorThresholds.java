package com.cellsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed limits used by the standard detectors.
 *
 * <p>
 * Defaults are the reference constants of the engine. A YAML file may
 * restate them (see {@link ThresholdsLoader}); values are read once and stay
 * constant for every detection pass, they are never learned from data.
 * </p>
 *
 * <p>
 * Efficiencies and retentions are ratios ({@code 0.95} is 95 %), capacities
 * are in mAh/g, rates are fractions per cycle.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Rapid capacity fade ---
    private int rapidFadeCycle = 10;
    private double rapidFadeRetention = 0.80;
    private double rapidFadeCriticalRetention = 0.70;

    // --- Cell failure ---
    private double failureRetention = 0.50;
    private int failureCycleWindow = 50;

    // --- Coulombic efficiency (stable window) ---
    private int minStableEfficiencyPoints = 5;
    private double lowCeMean = 0.95;
    private double lowCeCriticalMean = 0.90;
    private double ceStdWarning = 0.05;
    private double ceStdCritical = 0.10;

    // --- Accelerating degradation ---
    private int accelerationMinPoints = 20;
    private double accelerationFactor = 2.0;
    private double accelerationMinRate = 0.002;

    // --- First cycle ---
    private double firstCycleEfficiency = 0.60;
    private double firstCycleCriticalEfficiency = 0.40;

    // --- Incomplete dataset / premature termination ---
    private int incompleteMinPoints = 5;
    private int incompleteMaxCycles = 30;
    private double incompleteRetention = 0.80;
    private int terminationMinPoints = 11;
    private int terminationWindow = 5;
    private double terminationVariation = 0.05;
    private double terminationRetention = 0.70;

    // --- Data integrity ---
    private double missingFraction = 0.20;
    private double zeroFraction = 0.30;

    // --- Physics ---
    private double impossibleEfficiency = 1.05;
    private double theoreticalCapacity = 450.0;

    // --- Cross-cell statistics ---
    private double outlierZScore = 3.0;
    private double outlierCriticalZScore = 4.0;

    /**
     * @return thresholds holding the reference defaults
     */
    public static DetectorThresholds defaults() {
        return new DetectorThresholds();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every limit is legal and that each Critical limit is
     * stricter than its Warning counterpart.
     *
     * @throws IllegalStateException listing every violation found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        positive(errors, "rapidFadeCycle", rapidFadeCycle);
        ratio(errors, "rapidFadeRetention", rapidFadeRetention);
        ratio(errors, "rapidFadeCriticalRetention", rapidFadeCriticalRetention);
        if (rapidFadeCriticalRetention > rapidFadeRetention) {
            errors.add("rapidFadeCriticalRetention must be <= rapidFadeRetention");
        }

        ratio(errors, "failureRetention", failureRetention);
        positive(errors, "failureCycleWindow", failureCycleWindow);

        if (minStableEfficiencyPoints < 2) {
            errors.add("minStableEfficiencyPoints must be >= 2, got: " + minStableEfficiencyPoints);
        }
        ratio(errors, "lowCeMean", lowCeMean);
        ratio(errors, "lowCeCriticalMean", lowCeCriticalMean);
        if (lowCeCriticalMean > lowCeMean) {
            errors.add("lowCeCriticalMean must be <= lowCeMean");
        }
        positive(errors, "ceStdWarning", ceStdWarning);
        if (ceStdCritical < ceStdWarning) {
            errors.add("ceStdCritical must be >= ceStdWarning");
        }

        if (accelerationMinPoints < 4) {
            errors.add("accelerationMinPoints must be >= 4, got: " + accelerationMinPoints);
        }
        positive(errors, "accelerationFactor", accelerationFactor);
        positive(errors, "accelerationMinRate", accelerationMinRate);

        ratio(errors, "firstCycleEfficiency", firstCycleEfficiency);
        ratio(errors, "firstCycleCriticalEfficiency", firstCycleCriticalEfficiency);
        if (firstCycleCriticalEfficiency > firstCycleEfficiency) {
            errors.add("firstCycleCriticalEfficiency must be <= firstCycleEfficiency");
        }

        positive(errors, "incompleteMinPoints", incompleteMinPoints);
        positive(errors, "incompleteMaxCycles", incompleteMaxCycles);
        ratio(errors, "incompleteRetention", incompleteRetention);
        if (terminationWindow < 2) {
            errors.add("terminationWindow must be >= 2, got: " + terminationWindow);
        }
        if (terminationMinPoints < terminationWindow) {
            errors.add("terminationMinPoints must be >= terminationWindow");
        }
        positive(errors, "terminationVariation", terminationVariation);
        ratio(errors, "terminationRetention", terminationRetention);

        ratio(errors, "missingFraction", missingFraction);
        ratio(errors, "zeroFraction", zeroFraction);

        positive(errors, "impossibleEfficiency", impossibleEfficiency);
        positive(errors, "theoreticalCapacity", theoreticalCapacity);

        positive(errors, "outlierZScore", outlierZScore);
        if (outlierCriticalZScore < outlierZScore) {
            errors.add("outlierCriticalZScore must be >= outlierZScore");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorThresholds: " + String.join("; ", errors));
        }
    }

    private static void positive(List<String> errors, String name, double value) {
        if (!(value > 0)) {
            errors.add(name + " must be > 0, got: " + value);
        }
    }

    private static void ratio(List<String> errors, String name, double value) {
        if (!(value > 0 && value <= 1)) {
            errors.add(name + " must be in (0, 1], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public int getRapidFadeCycle() {
        return rapidFadeCycle;
    }

    public void setRapidFadeCycle(int rapidFadeCycle) {
        this.rapidFadeCycle = rapidFadeCycle;
    }

    public double getRapidFadeRetention() {
        return rapidFadeRetention;
    }

    public void setRapidFadeRetention(double rapidFadeRetention) {
        this.rapidFadeRetention = rapidFadeRetention;
    }

    public double getRapidFadeCriticalRetention() {
        return rapidFadeCriticalRetention;
    }

    public void setRapidFadeCriticalRetention(double rapidFadeCriticalRetention) {
        this.rapidFadeCriticalRetention = rapidFadeCriticalRetention;
    }

    public double getFailureRetention() {
        return failureRetention;
    }

    public void setFailureRetention(double failureRetention) {
        this.failureRetention = failureRetention;
    }

    public int getFailureCycleWindow() {
        return failureCycleWindow;
    }

    public void setFailureCycleWindow(int failureCycleWindow) {
        this.failureCycleWindow = failureCycleWindow;
    }

    public int getMinStableEfficiencyPoints() {
        return minStableEfficiencyPoints;
    }

    public void setMinStableEfficiencyPoints(int minStableEfficiencyPoints) {
        this.minStableEfficiencyPoints = minStableEfficiencyPoints;
    }

    public double getLowCeMean() {
        return lowCeMean;
    }

    public void setLowCeMean(double lowCeMean) {
        this.lowCeMean = lowCeMean;
    }

    public double getLowCeCriticalMean() {
        return lowCeCriticalMean;
    }

    public void setLowCeCriticalMean(double lowCeCriticalMean) {
        this.lowCeCriticalMean = lowCeCriticalMean;
    }

    public double getCeStdWarning() {
        return ceStdWarning;
    }

    public void setCeStdWarning(double ceStdWarning) {
        this.ceStdWarning = ceStdWarning;
    }

    public double getCeStdCritical() {
        return ceStdCritical;
    }

    public void setCeStdCritical(double ceStdCritical) {
        this.ceStdCritical = ceStdCritical;
    }

    public int getAccelerationMinPoints() {
        return accelerationMinPoints;
    }

    public void setAccelerationMinPoints(int accelerationMinPoints) {
        this.accelerationMinPoints = accelerationMinPoints;
    }

    public double getAccelerationFactor() {
        return accelerationFactor;
    }

    public void setAccelerationFactor(double accelerationFactor) {
        this.accelerationFactor = accelerationFactor;
    }

    public double getAccelerationMinRate() {
        return accelerationMinRate;
    }

    public void setAccelerationMinRate(double accelerationMinRate) {
        this.accelerationMinRate = accelerationMinRate;
    }

    public double getFirstCycleEfficiency() {
        return firstCycleEfficiency;
    }

    public void setFirstCycleEfficiency(double firstCycleEfficiency) {
        this.firstCycleEfficiency = firstCycleEfficiency;
    }

    public double getFirstCycleCriticalEfficiency() {
        return firstCycleCriticalEfficiency;
    }

    public void setFirstCycleCriticalEfficiency(double firstCycleCriticalEfficiency) {
        this.firstCycleCriticalEfficiency = firstCycleCriticalEfficiency;
    }

    public int getIncompleteMinPoints() {
        return incompleteMinPoints;
    }

    public void setIncompleteMinPoints(int incompleteMinPoints) {
        this.incompleteMinPoints = incompleteMinPoints;
    }

    public int getIncompleteMaxCycles() {
        return incompleteMaxCycles;
    }

    public void setIncompleteMaxCycles(int incompleteMaxCycles) {
        this.incompleteMaxCycles = incompleteMaxCycles;
    }

    public double getIncompleteRetention() {
        return incompleteRetention;
    }

    public void setIncompleteRetention(double incompleteRetention) {
        this.incompleteRetention = incompleteRetention;
    }

    public int getTerminationMinPoints() {
        return terminationMinPoints;
    }

    public void setTerminationMinPoints(int terminationMinPoints) {
        this.terminationMinPoints = terminationMinPoints;
    }

    public int getTerminationWindow() {
        return terminationWindow;
    }

    public void setTerminationWindow(int terminationWindow) {
        this.terminationWindow = terminationWindow;
    }

    public double getTerminationVariation() {
        return terminationVariation;
    }

    public void setTerminationVariation(double terminationVariation) {
        this.terminationVariation = terminationVariation;
    }

    public double getTerminationRetention() {
        return terminationRetention;
    }

    public void setTerminationRetention(double terminationRetention) {
        this.terminationRetention = terminationRetention;
    }

    public double getMissingFraction() {
        return missingFraction;
    }

    public void setMissingFraction(double missingFraction) {
        this.missingFraction = missingFraction;
    }

    public double getZeroFraction() {
        return zeroFraction;
    }

    public void setZeroFraction(double zeroFraction) {
        this.zeroFraction = zeroFraction;
    }

    public double getImpossibleEfficiency() {
        return impossibleEfficiency;
    }

    public void setImpossibleEfficiency(double impossibleEfficiency) {
        this.impossibleEfficiency = impossibleEfficiency;
    }

    public double getTheoreticalCapacity() {
        return theoreticalCapacity;
    }

    public void setTheoreticalCapacity(double theoreticalCapacity) {
        this.theoreticalCapacity = theoreticalCapacity;
    }

    public double getOutlierZScore() {
        return outlierZScore;
    }

    public void setOutlierZScore(double outlierZScore) {
        this.outlierZScore = outlierZScore;
    }

    public double getOutlierCriticalZScore() {
        return outlierCriticalZScore;
    }

    public void setOutlierCriticalZScore(double outlierCriticalZScore) {
        this.outlierCriticalZScore = outlierCriticalZScore;
    }

    @Override
    public String toString() {
        return "DetectorThresholds{" +
                "rapidFade=" + rapidFadeRetention + "@" + rapidFadeCycle +
                ", failure=" + failureRetention + "@" + failureCycleWindow +
                ", lowCe=" + lowCeMean +
                ", ceStd=" + ceStdWarning +
                ", acceleration=" + accelerationFactor + "x/" + accelerationMinRate +
                ", firstCycleCe=" + firstCycleEfficiency +
                ", missing=" + missingFraction +
                ", zeros=" + zeroFraction +
                ", impossibleCe=" + impossibleEfficiency +
                ", theoreticalCapacity=" + theoreticalCapacity +
                ", zScore=" + outlierZScore + "/" + outlierCriticalZScore +
                '}';
    }
}
