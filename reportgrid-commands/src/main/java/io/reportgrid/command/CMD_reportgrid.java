/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.reportgrid.command;

import io.reportgrid.command.subcommands.CMD_reportgrid_export;
import io.reportgrid.command.subcommands.CMD_reportgrid_show;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/// Entry point of the report command line: shows a page of a report document or
/// exports it, after applying search, column filters, sorting and paging.
@Command(name = "reportgrid",
    mixinStandardHelpOptions = true,
    version = "reportgrid 0.1.0",
    header = "browse and export tabular reports",
    description = """
        Loads a report document (JSON or CSV), applies the given search, column filters,
        sort order and page, and either prints the resulting page or exports every
        matching row as CSV or PDF.""",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: success",
        "1: degraded (the PDF export fell back to the print dialog)",
        "2: error"
    },
    subcommands = {
        CMD_reportgrid_show.class,
        CMD_reportgrid_export.class,
        HelpCommand.class
    })
public class CMD_reportgrid implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_DEGRADED = 1;
    public static final int EXIT_ERROR = 2;

    @Spec
    private CommandSpec spec;

    /// run the reportgrid command
    /// @param args command line args
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /// @return a command line for the reportgrid command with the shared parser settings
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_reportgrid())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: show or export");
    }
}
