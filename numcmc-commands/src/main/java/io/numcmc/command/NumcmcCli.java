package io.numcmc.command;

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

import io.numcmc.command.posterior.CMD_posterior;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Entry point of the numcmc command line tools.
///
/// This is an umbrella command; the work is done by its subcommands.
@CommandLine.Command(name = "numcmc",
    header = "Neutrino oscillation MCMC posterior tools",
    description = "Contains subcommands to reweight and summarize oscillation parameter chains",
    mixinStandardHelpOptions = true,
    versionProvider = NumcmcCli.VersionProvider.class,
    subcommands = {
        CMD_posterior.class
    })
public class NumcmcCli implements Callable<Integer> {

    /// Run NumcmcCli
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new NumcmcCli()).execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /// Reports the version recorded in the jar manifest.
    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = NumcmcCli.class.getPackage().getImplementationVersion();
            return new String[]{"numcmc " + (version != null ? version : "development build")};
        }
    }
}
