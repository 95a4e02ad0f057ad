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
package ml.shifu.eda.core.insight;

import java.util.List;

/**
 * A rule turns analysis artifacts into zero or more {@link InsightRecord}s. Rules are independent of each other; a
 * rule whose inputs are undefined does not fire.
 */
public interface InsightRule {

    String getId();

    /**
     * Lower value is ranked first.
     */
    int getPriority();

    List<InsightRecord> evaluate(InsightContext context);
}
