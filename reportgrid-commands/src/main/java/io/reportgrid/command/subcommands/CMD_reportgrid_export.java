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


package io.reportgrid.command.subcommands;

import io.reportgrid.command.CMD_reportgrid;
import io.reportgrid.command.ReportOptions;
import io.reportgrid.command.ReportSession;
import io.reportgrid.config.EngineConfig;
import io.reportgrid.export.ExportOutcome;
import io.reportgrid.model.ReportTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/// Exports every row matching the given search and filters, in the given sort order.
@Command(name = "export",
    description = "Export the matching rows of a report document as CSV or PDF",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: the file was written",
        "1: degraded, the PDF went to the print dialog instead of a file",
        "2: the export failed, or the document, configuration or options could not be used"
    })
public class CMD_reportgrid_export implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_reportgrid_export.class);

    public enum Format {
        csv,
        pdf
    }

    @Mixin
    private ReportOptions options = new ReportOptions();

    @Option(names = {"--format"},
        description = "The export format (default: ${DEFAULT-VALUE}, valid values: ${COMPLETION-CANDIDATES})",
        defaultValue = "csv")
    private Format format = Format.csv;

    @Option(names = {"--output-dir", "-o"}, paramLabel = "DIR",
        description = "Where the export file is written (default: ${DEFAULT-VALUE})",
        defaultValue = ".")
    private Path outputDir;

    @Override
    public Integer call() {
        ReportTable table;
        EngineConfig config;
        try {
            config = options.loadConfig();
            table = options.loadTable();
        } catch (IllegalArgumentException | UncheckedIOException e) {
            logger.error("Cannot export {}: {}", options.getDocument(), e.getMessage());
            System.err.println("error: " + e.getMessage());
            return CMD_reportgrid.EXIT_ERROR;
        }

        try (ReportSession session = new ReportSession(table, config, outputDir, System.out)) {
            ExportOutcome outcome = session.await(view -> {
                options.applyTo(view.store());
                if (format == Format.pdf) {
                    return view.exportPdf();
                }
                return CompletableFuture.completedFuture(view.exportCsv());
            });
            outcome.fileIfWritten().ifPresent(file -> System.out.println(file.toAbsolutePath()));
            return exitCodeFor(outcome);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Cannot export {}: {}", options.getDocument(), cause.getMessage(), cause);
            System.err.println("error: " + cause.getMessage());
            return CMD_reportgrid.EXIT_ERROR;
        } catch (TimeoutException e) {
            logger.error("Timed out exporting {}", options.getDocument(), e);
            return CMD_reportgrid.EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while exporting {}", options.getDocument());
            return CMD_reportgrid.EXIT_ERROR;
        }
    }

    static int exitCodeFor(ExportOutcome outcome) {
        switch (outcome.status()) {
            case SUCCESS:
                return CMD_reportgrid.EXIT_OK;
            case DEGRADED:
                return CMD_reportgrid.EXIT_DEGRADED;
            default:
                return CMD_reportgrid.EXIT_ERROR;
        }
    }
}
