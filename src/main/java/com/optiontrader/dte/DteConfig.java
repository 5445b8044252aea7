package com.optiontrader.dte;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DTE optimizer settings, bound from application.yml under {@code optiontrader.dte}.
 *
 * <p>The forest shape is fixed per deployment; training calls cannot override it.
 */
@Data
@ConfigurationProperties(prefix = "optiontrader.dte")
public class DteConfig {

    /** Where the trained regressor is persisted and loaded from. */
    private String modelPath = "models/dte_optimizer_rf.ser";

    private int numTrees = 100;

    private int maxDepth = 5;

    private long seed = 42L;
}
