package com.optiontrader.dte;

/** Whether the DTE optimizer is predicting from a trained model. */
public enum OptimizerMode {
    /** No model loaded: the rule table decides. */
    COLD,
    /** Trained regressor loaded. */
    WARM
}
