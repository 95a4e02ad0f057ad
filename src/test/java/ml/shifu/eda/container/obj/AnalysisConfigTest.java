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
package ml.shifu.eda.container.obj;

import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AnalysisConfigTest {

    @Test
    public void testDefaults() {
        AnalysisConfig config = new AnalysisConfig();
        config.validate();
        Assert.assertEquals(config.getBinNum(), Integer.valueOf(10));
        Assert.assertEquals(config.getIqrMultiplier(), Double.valueOf(1.5d));
        Assert.assertEquals(config.getCorrelationThreshold(), Double.valueOf(0.7d));
        Assert.assertEquals(config.getMissingPctThreshold(), Double.valueOf(5.0d));
        Assert.assertEquals(config.getTopN(), Integer.valueOf(2));
        Assert.assertEquals(config.getSizeMin(), Double.valueOf(20d));
        Assert.assertEquals(config.getSizeMax(), Double.valueOf(200d));
        Assert.assertEquals(config.getxColumn(), "budget");
        Assert.assertEquals(config.getyColumn(), "revenue");
    }

    @Test
    public void testInvalidOptionsAreAllReported() {
        AnalysisConfig config = new AnalysisConfig();
        config.setBinNum(0);
        config.setCorrelationThreshold(1.2);
        config.setIqrMultiplier(Double.NaN);
        try {
            config.validate();
            Assert.fail("Invalid config should not pass");
        } catch (EdaException e) {
            Assert.assertEquals(e.getError(), EdaErrorCode.ERROR_CONFIG_INVALID);
            Assert.assertTrue(e.getMessage().contains("binNum"));
            Assert.assertTrue(e.getMessage().contains("correlationThreshold"));
            Assert.assertTrue(e.getMessage().contains("iqrMultiplier"));
        }
    }

    @Test(expectedExceptions = EdaException.class)
    public void testNegativeMissingThreshold() {
        AnalysisConfig config = new AnalysisConfig();
        config.setMissingPctThreshold(-1d);
        config.validate();
    }

    @Test(expectedExceptions = EdaException.class)
    public void testSizeRangeReversed() {
        AnalysisConfig config = new AnalysisConfig();
        config.setSizeMin(300d);
        config.validate();
    }

    @Test(expectedExceptions = EdaException.class)
    public void testZeroTopN() {
        AnalysisConfig config = new AnalysisConfig();
        config.setTopN(0);
        config.validate();
    }

    @Test
    public void testClone() {
        AnalysisConfig config = new AnalysisConfig();
        AnalysisConfig other = config.clone();
        other.getLogTransformColumns().add("revenue");
        other.setBinNum(3);
        Assert.assertEquals(config.getLogTransformColumns().size(), 1);
        Assert.assertEquals(config.getBinNum(), Integer.valueOf(10));
    }

    @Test
    public void testColumnKindOf() {
        Assert.assertEquals(ColumnKind.of("float64"), ColumnKind.NUMERIC);
        Assert.assertEquals(ColumnKind.of("categorical"), ColumnKind.CATEGORICAL);
        Assert.assertTrue(ColumnKind.NUMERIC.isNumerical());
        Assert.assertFalse(ColumnKind.DATE.isCategorical());
    }
}
