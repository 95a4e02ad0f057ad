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
package ml.shifu.eda;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.util.Constants;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.Test;

/**
 * EdaCLITest class
 */
public class EdaCLITest {

    private final File tmpDir = new File("target" + File.separator + "EdaCLITest");

    private static CommandLine parse(String... args) throws ParseException {
        return new GnuParser().parse(EdaCLI.buildOptions(), args);
    }

    @Test
    public void testHelpAndVersion() {
        Assert.assertEquals(EdaCLI.run(new String[] { "-h" }), 0);
        Assert.assertEquals(EdaCLI.run(new String[] { "help" }), 0);
        Assert.assertEquals(EdaCLI.run(new String[] { "-version" }), 0);
    }

    @Test
    public void testBuildConfigDefaults() throws ParseException {
        AnalysisConfig config = EdaCLI.buildConfig(parse());
        Assert.assertEquals(config.getBinNum(), Integer.valueOf(10));
        Assert.assertEquals(config.getDensityEnabled(), Boolean.TRUE);
    }

    @Test
    public void testBuildConfigOverrides() throws ParseException {
        AnalysisConfig config = EdaCLI.buildConfig(parse("-c", "src/test/resources/config/AnalysisConfig.json",
                "-bins", "8", "-iqr", "2", "-corr", "0.65", "-missing", "1", "-topn", "4", "-p", "2", "-logcols",
                " budget, runtime ,", "-nodensity"));
        Assert.assertEquals(config.getBinNum(), Integer.valueOf(8));
        Assert.assertEquals(config.getIqrMultiplier(), Double.valueOf(2d));
        Assert.assertEquals(config.getCorrelationThreshold(), Double.valueOf(0.65d));
        Assert.assertEquals(config.getMissingPctThreshold(), Double.valueOf(1d));
        Assert.assertEquals(config.getTopN(), Integer.valueOf(4));
        Assert.assertEquals(config.getNumParallel(), Integer.valueOf(2));
        Assert.assertEquals(config.getLogTransformColumns(), Arrays.asList("budget", "runtime"));
        Assert.assertEquals(config.getDensityEnabled(), Boolean.FALSE);
    }

    @Test
    public void testFileOptionsKeptWithoutOverride() throws ParseException {
        AnalysisConfig config = EdaCLI.buildConfig(parse("-c", "src/test/resources/config/AnalysisConfig.json"));
        Assert.assertEquals(config.getBinNum(), Integer.valueOf(5));
        Assert.assertEquals(config.getTopN(), Integer.valueOf(3));
    }

    @Test
    public void testInvalidOptions() {
        Assert.assertEquals(EdaCLI.run(new String[] { "-bins", "0" }), 1);
        Assert.assertEquals(EdaCLI.run(new String[] { "-bins", "abc" }), 1);
        Assert.assertEquals(EdaCLI.run(new String[] { "-corr", "1.5" }), 1);
        Assert.assertEquals(EdaCLI.run(new String[] { "-unknown" }), 1);
        Assert.assertEquals(EdaCLI.run(new String[] { "-c", "src/test/resources/config/NotExist.json" }), 1);
    }

    @Test
    public void testRun() throws IOException {
        File output = new File(tmpDir, "out");
        Assert.assertEquals(
                EdaCLI.run(new String[] { "-i", "src/test/resources/data/movies.csv", "-o", output.getPath(),
                        "-p", "2" }), 0);
        Assert.assertTrue(new File(output, Constants.REPORT_FILE_NAME).isFile());
        Assert.assertTrue(new File(output, Constants.CHARTS_JSON_FILE_NAME).isFile());
    }

    @AfterClass
    public void tearDown() throws IOException {
        FileUtils.deleteDirectory(tmpDir);
    }
}
