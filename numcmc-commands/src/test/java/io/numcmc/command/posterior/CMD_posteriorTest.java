package io.numcmc.command.posterior;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.numcmc.command.NumcmcCli;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CMD_posteriorTest {

    private static final String METADATA = """
        {
          "citation": "Synthetic test chain",
          "priors": { "Theta23": "Uniform:x", "DeltaCP": "Uniform:x" }
        }
        """;

    private static final String PLOTS = """
        {
          "levels": [0.6827, 0.9545],
          "plots": [
            {
              "variables": ["Theta23"],
              "axes": [ { "bins": 20, "lower": 0.0, "upper": 1.5708 } ],
              "priors": ["Uniform:sin^2(Theta23)"],
              "separate_orderings": true
            },
            {
              "name": "th23 vs dm32",
              "variables": ["SinSqTheta23", "AbsDm2_32"],
              "axes": [ { "bins": 10, "lower": 0.0, "upper": 1.0 },
                        { "bins": 10, "lower": 2.0e-3, "upper": 3.0e-3 } ],
              "joint_region": true
            }
          ]
        }
        """;

    @TempDir
    Path tempDir;

    @Test
    public void testSummaryForReweightedPlots() throws IOException {
        Path chain = writeChain(200);
        Path meta = write("meta.json", METADATA);
        Path plots = write("plots.json", PLOTS);

        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent));

        try {
            int exitCode = new CommandLine(new CMD_posterior()).execute(
                "-s", chain.toString(), "-m", meta.toString(), "-p", plots.toString());

            assertEquals(0, exitCode, "Command should exit with code 0");
            String output = outContent.toString();
            assertThat(output)
                .contains("Chain: " + chain + " (200 steps)")
                .contains("Citation: Synthetic test chain")
                .contains("Plot: Theta23")
                .contains("reweighted: ")
                .contains("Plot: th23 vs dm32")
                .contains("NORMAL")
                .contains("INVERTED")
                .contains("JOINT");
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    public void testJsonOutput() throws IOException {
        Path chain = writeChain(100);
        Path plots = write("plots.json", PLOTS);
        Path output = tempDir.resolve("result.json");

        int exitCode = runQuietly("-s", chain.toString(), "-p", plots.toString(),
            "--levels", "0.5,0.9", "-o", output.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(output), "Result file should be written");
        String json = Files.readString(output);
        assertThat(json)
            .contains("\"plots\"")
            .contains("\"COMBINED\"")
            .contains("\"mass_basis\": \"IN_RANGE\"")
            .contains("0.9");
    }

    @Test
    public void testExistingOutputNeedsForce() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", PLOTS);
        Path output = write("result.json", "{}");

        assertEquals(CMD_posterior.EXIT_INPUT_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString(), "-o", output.toString()));
        assertEquals("{}", Files.readString(output));

        assertEquals(CMD_posterior.EXIT_SUCCESS,
            runQuietly("-s", chain.toString(), "-p", plots.toString(), "-o", output.toString(), "--force"));
        assertThat(Files.readString(output)).contains("\"plots\"");
    }

    @Test
    public void testMaxSteps() throws IOException {
        Path chain = writeChain(200);
        Path plots = write("plots.json", PLOTS);

        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent));
        try {
            int exitCode = new CommandLine(new CMD_posterior()).execute(
                "-s", chain.toString(), "-p", plots.toString(), "--max-steps", "60", "--batch-size", "25");
            assertEquals(0, exitCode);
            assertThat(outContent.toString()).contains("(60 steps)");
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    public void testMissingInputFile() throws IOException {
        Path plots = write("plots.json", PLOTS);
        assertEquals(CMD_posterior.EXIT_INPUT_ERROR,
            runQuietly("-s", tempDir.resolve("absent.csv").toString(), "-p", plots.toString()));
    }

    @Test
    public void testMalformedChain() throws IOException {
        Path chain = write("chain.csv", "DeltaCP,Theta13,Theta23\n0.1,0.15,0.7\n");
        Path plots = write("plots.json", PLOTS);
        assertEquals(CMD_posterior.EXIT_INPUT_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString()));
    }

    @Test
    public void testMalformedPlotFile() throws IOException {
        Path chain = writeChain(10);
        Path plots = write("plots.json", "{ \"plots\": [ ");
        assertEquals(CMD_posterior.EXIT_INPUT_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString()));
    }

    @Test
    public void testInvalidPriorIsASpecificationError() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", """
            { "plots": [ { "variables": ["Theta23"],
                           "axes": [ { "bins": 10, "lower": 0.0, "upper": 1.5708 } ],
                           "priors": ["Gaussian(0.5):sin^2(Theta23)"] } ] }
            """);
        assertEquals(CMD_posterior.EXIT_SPEC_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString()));
    }

    @Test
    public void testUnknownVariableIsASpecificationError() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", """
            { "plots": [ { "variables": ["Theta34"],
                           "axes": [ { "bins": 10, "lower": 0.0, "upper": 1.0 } ] } ] }
            """);
        assertEquals(CMD_posterior.EXIT_SPEC_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString()));
    }

    @Test
    public void testLevelOutsideUnitInterval() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", PLOTS);
        assertEquals(CMD_posterior.EXIT_SPEC_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString(), "--levels", "0.68,1.5"));
    }

    @Test
    public void testNonPositiveBatchSizeIsAnInputError() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", PLOTS);
        Path output = tempDir.resolve("result.json");

        assertEquals(CMD_posterior.EXIT_INPUT_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString(), "--batch-size", "0", "-o", output.toString()));
        assertEquals(CMD_posterior.EXIT_INPUT_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString(), "--batch-size", "-5"));
        assertFalse(Files.exists(output), "Nothing should be written for rejected options");
    }

    @Test
    public void testStandardVariablesCanBeDisabled() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", PLOTS);
        assertEquals(CMD_posterior.EXIT_SPEC_ERROR,
            runQuietly("-s", chain.toString(), "-p", plots.toString(), "--no-standard-variables"));
    }

    @Test
    public void testRunsAsSubcommand() throws IOException {
        Path chain = writeChain(50);
        Path plots = write("plots.json", PLOTS);
        assertEquals(0, runQuietly(new CommandLine(new NumcmcCli()),
            "posterior", "-s", chain.toString(), "-p", plots.toString()));
    }

    private int runQuietly(String... args) {
        return runQuietly(new CommandLine(new CMD_posterior()), args);
    }

    private static int runQuietly(CommandLine commandLine, String... args) {
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(new ByteArrayOutputStream()));
        try {
            return commandLine.execute(args);
        } finally {
            System.setOut(originalOut);
        }
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /// Writes a chain whose steps alternate between the two mass orderings, with
    /// Theta23 spread evenly over (0.6, 1.0).
    private Path writeChain(int steps) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("# synthetic chain\n");
        sb.append("DeltaCP, Theta13, Theta23, Theta12, Deltam2_32, Deltam2_21\n");
        for (int i = 0; i < steps; i++) {
            double theta23 = 0.6 + 0.4 * (i + 0.5) / steps;
            double dm32 = i % 2 == 0 ? 2.5e-3 : -2.4e-3;
            sb.append(String.format(Locale.ROOT, "%.4f, 0.15, %.6f, 0.58, %.4e, 7.4e-5%n",
                -1.5 + 0.01 * i, theta23, dm32));
        }
        return write("chain.csv", sb.toString());
    }
}
