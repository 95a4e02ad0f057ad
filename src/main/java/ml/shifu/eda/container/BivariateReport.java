/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.eda.container;

import ml.shifu.eda.core.correlation.CorrelationMatrix;

public class BivariateReport {

    private final CorrelationMatrix correlationMatrix;

    /**
     * null when one of the designated columns is missing
     */
    private final JointFeatureSummary jointSummary;

    public BivariateReport(CorrelationMatrix correlationMatrix, JointFeatureSummary jointSummary) {
        this.correlationMatrix = correlationMatrix;
        this.jointSummary = jointSummary;
    }

    public CorrelationMatrix getCorrelationMatrix() {
        return correlationMatrix;
    }

    public JointFeatureSummary getJointSummary() {
        return jointSummary;
    }
}
