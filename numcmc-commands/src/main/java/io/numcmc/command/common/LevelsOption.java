package io.numcmc.command.common;

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

import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared option for the credible levels regions are built at.
 */
public class LevelsOption {

    /**
     * Levels used when neither the command line nor the plot file gives any:
     * the 1, 2 and 3 sigma Gaussian coverages.
     */
    public static final List<Double> DEFAULT_LEVELS = List.of(0.6827, 0.9545, 0.9973);

    @CommandLine.Option(
        names = {"--levels", "-l"},
        description = "Comma-separated credible levels in (0, 1) (default: levels from the plot file, else 0.6827,0.9545,0.9973)",
        split = ","
    )
    private List<Double> levels = new ArrayList<>();

    /**
     * Resolves the effective levels.
     *
     * @param fromPlotFile levels given by the plot file, possibly empty
     * @return command-line levels if given, else the plot file's, else {@link #DEFAULT_LEVELS}
     */
    public double[] resolve(List<Double> fromPlotFile) {
        List<Double> chosen = !levels.isEmpty() ? levels
            : !fromPlotFile.isEmpty() ? fromPlotFile
            : DEFAULT_LEVELS;
        double[] out = new double[chosen.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = chosen.get(i);
        }
        return out;
    }
}
