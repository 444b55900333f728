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

import com.google.gson.JsonParseException;
import io.numcmc.command.chain.DelimitedChainSource;
import io.numcmc.command.common.LevelsOption;
import io.numcmc.command.common.OutputFileOption;
import io.numcmc.command.common.StreamingOption;
import io.numcmc.posterior.config.PlotConfig;
import io.numcmc.posterior.config.PlotsConfig;
import io.numcmc.posterior.config.PosteriorGsonConfig;
import io.numcmc.posterior.plot.ChainMetadata;
import io.numcmc.posterior.plot.Plot;
import io.numcmc.posterior.plot.PlotRegions;
import io.numcmc.posterior.plot.PlotStack;
import io.numcmc.posterior.region.CredibleRegionBuilder;
import io.numcmc.posterior.region.MassBasis;
import io.numcmc.posterior.sample.VariableRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/// Reweight the priors of an MCMC chain and build HPD credible regions.
///
/// Reads a delimited chain, its metadata (declared priors and external constraints)
/// and a set of plot definitions, streams the chain once through every plot, then
/// prints a summary and optionally writes the densities and regions as JSON.
///
/// ```
/// numcmc posterior -s chain.csv -m meta.json -p plots.json --levels 0.6827,0.9545 -o result.json
/// ```
///
/// When `--metadata` is omitted every physical parameter is assumed to carry a flat
/// prior and no constraints are available.
@CommandLine.Command(name = "posterior",
    header = "Reweight chain priors and build credible regions",
    description = "Streams an MCMC chain through 1-D and 2-D posterior plots, optionally replacing "
        + "one prior per plot and applying external constraints, and reports HPD credible regions",
    exitCodeList = {
        "0: success",
        "1: input error (missing or unreadable file, malformed chain or JSON, output exists, batch size not positive)",
        "2: invalid prior, constraint or plot specification, or a plot failed"
    })
public class CMD_posterior implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_posterior.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_SPEC_ERROR = 2;

    @CommandLine.Option(names = {"-s", "--samples"}, required = true,
        description = "Chain file: a header row of column names, then numeric rows")
    private Path samples;

    @CommandLine.Option(names = {"-m", "--metadata"},
        description = "Chain metadata JSON with the declared priors and constraints")
    private Path metadata;

    @CommandLine.Option(names = {"-p", "--plots"}, required = true,
        description = "Plot definitions JSON")
    private Path plots;

    @CommandLine.Option(names = {"--standard-variables"}, negatable = true, defaultValue = "true",
        fallbackValue = "true",
        description = "Register the standard derived variables such as SinSqTheta23 (default: ${DEFAULT-VALUE})")
    private boolean standardVariables = true;

    @CommandLine.Option(names = {"--mass-basis"}, defaultValue = "IN_RANGE",
        description = "Mass the levels refer to: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private MassBasis massBasis = MassBasis.IN_RANGE;

    @CommandLine.Mixin
    private LevelsOption levelsOption = new LevelsOption();

    @CommandLine.Mixin
    private StreamingOption streamingOption = new StreamingOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    /// Run CMD_posterior
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_posterior()).execute(args));
    }

    /// Execute the posterior command
    ///
    /// @return 0 for success, 1 for input errors, 2 for specification errors or failed plots
    @Override
    public Integer call() {
        List<Path> inputs = new ArrayList<>(List.of(samples, plots));
        if (metadata != null) {
            inputs.add(metadata);
        }
        for (Path input : inputs) {
            if (!Files.isRegularFile(input)) {
                logger.error("File not found: {}", input);
                return EXIT_INPUT_ERROR;
            }
        }
        try {
            streamingOption.validate();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid streaming options: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        Optional<OutputFileOption.OutputFile> output = outputFileOption.getOutputFile();
        if (output.isPresent() && output.get().existsWithoutForce()) {
            logger.error("Output file {} already exists; use --force to overwrite", output.get().path());
            return EXIT_INPUT_ERROR;
        }

        try {
            ChainMetadata chainMetadata = readMetadata();
            PlotsConfig plotsConfig;
            try (Reader reader = Files.newBufferedReader(plots, StandardCharsets.UTF_8)) {
                plotsConfig = PosteriorGsonConfig.readPlots(reader);
            }
            double[] levels = levelsOption.resolve(plotsConfig.getLevels());
            for (double level : levels) {
                if (!(level > 0.0 && level < 1.0)) {
                    logger.error("Credible level must lie in (0, 1), got {}", level);
                    return EXIT_SPEC_ERROR;
                }
            }

            DelimitedChainSource source = new DelimitedChainSource(samples);
            VariableRegistry registry = new VariableRegistry();
            if (standardVariables) {
                registry.registerStandardVariables();
            }
            Set<String> known = new LinkedHashSet<>(source.columnNames());
            known.addAll(registry.names());

            StreamingOption.StreamConfig stream = streamingOption.getStreamConfig();
            logger.debug("Streaming {} with {}", source.getId(), stream);
            PlotStack stack = new PlotStack(source, chainMetadata, registry)
                .withBatchSize(stream.batchSize())
                .withMaxSteps(stream.maxSteps());
            for (PlotConfig plotConfig : plotsConfig.getPlots()) {
                stack.addPlot(plotConfig.toDefinition(known));
            }
            stack.run();

            Map<Plot, PlotRegions> regions = stack.regions(new CredibleRegionBuilder(massBasis), levels);
            PosteriorReport report = PosteriorReport.of(source.getId(), stack, regions, levels, massBasis);
            report.printSummary(System.out);
            if (output.isPresent()) {
                report.writeJson(output.get().path());
                logger.info("Wrote results to {}", output.get().path());
            }
            if (report.hasFailures()) {
                logger.error("One or more plots failed; see the summary above");
                return EXIT_SPEC_ERROR;
            }
            return EXIT_SUCCESS;
        } catch (IOException | UncheckedIOException | JsonParseException e) {
            logger.error("Error reading input: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid specification: {}", e.getMessage());
            return EXIT_SPEC_ERROR;
        }
    }

    private ChainMetadata readMetadata() throws IOException {
        if (metadata == null) {
            logger.warn("No chain metadata given; assuming flat priors in every physical parameter");
            return ChainMetadata.uniformPriors();
        }
        try (Reader reader = Files.newBufferedReader(metadata, StandardCharsets.UTF_8)) {
            return PosteriorGsonConfig.readMetadata(reader);
        }
    }
}
