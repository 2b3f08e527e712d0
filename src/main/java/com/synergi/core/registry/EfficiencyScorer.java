package com.synergi.core.registry;

import com.synergi.core.config.SynergiProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Computes a worker's efficiency score: {@code reputation² / ((price + ε) · k)}.
 */
@Component
public class EfficiencyScorer {

    private final double constant;
    private final double epsilon;

    @Autowired
    public EfficiencyScorer(SynergiProperties properties) {
        this(properties.getOrchestration().getEfficiencyConstant(),
                properties.getOrchestration().getEfficiencyEpsilon());
    }

    public EfficiencyScorer(double constant, double epsilon) {
        if (constant <= 0) {
            throw new IllegalArgumentException("Efficiency constant must be positive: " + constant);
        }
        if (epsilon <= 0) {
            throw new IllegalArgumentException("Efficiency epsilon must be positive: " + epsilon);
        }
        this.constant = constant;
        this.epsilon = epsilon;
    }

    public double score(int reputation, BigDecimal price) {
        double squared = (double) reputation * reputation;
        return squared / ((price.doubleValue() + epsilon) * constant);
    }
}
