package com.chronoplan.core.engine;

import com.chronoplan.core.model.OptimizationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "chronoplan.engine")
public class EngineProperties {

    private int proximityWindowDays = 7;
    private int simulationPaddingDays = 365;
    private int parallelPairThreshold = 64;
    private OptimizationStrategy defaultStrategy = OptimizationStrategy.SMOOTHING;

    public int getProximityWindowDays() {
        return proximityWindowDays;
    }

    public void setProximityWindowDays(int proximityWindowDays) {
        this.proximityWindowDays = proximityWindowDays;
    }

    public int getSimulationPaddingDays() {
        return simulationPaddingDays;
    }

    public void setSimulationPaddingDays(int simulationPaddingDays) {
        this.simulationPaddingDays = simulationPaddingDays;
    }

    public int getParallelPairThreshold() {
        return parallelPairThreshold;
    }

    public void setParallelPairThreshold(int parallelPairThreshold) {
        this.parallelPairThreshold = parallelPairThreshold;
    }

    public OptimizationStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(OptimizationStrategy defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }
}
