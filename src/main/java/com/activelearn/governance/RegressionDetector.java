package com.activelearn.governance;

public interface RegressionDetector {

    RegressionComparison compare(String agent, int lookbackHours) throws RegressionDetectionException;
}
