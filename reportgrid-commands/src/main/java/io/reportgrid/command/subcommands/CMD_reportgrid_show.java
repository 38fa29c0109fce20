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
import io.reportgrid.command.TextTableRenderer;
import io.reportgrid.config.EngineConfig;
import io.reportgrid.model.ReportTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/// Prints one page of a report after applying search, filters, sort and paging.
@Command(name = "show",
    description = "Print one page of a report document as a text table",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: the page was printed",
        "2: the document, configuration or options could not be used"
    })
public class CMD_reportgrid_show implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_reportgrid_show.class);

    @Mixin
    private ReportOptions options = new ReportOptions();

    @Option(names = {"--choices"}, description = "Also list the filter choices of columns that offer them")
    private boolean choices;

    @Option(names = {"--suggest"}, paramLabel = "TEXT", description = "Also list search suggestions for TEXT")
    private String suggest;

    @Override
    public Integer call() {
        ReportTable table;
        EngineConfig config;
        try {
            config = options.loadConfig();
            table = options.loadTable();
        } catch (IllegalArgumentException | UncheckedIOException e) {
            logger.error("Cannot show {}: {}", options.getDocument(), e.getMessage());
            System.err.println("error: " + e.getMessage());
            return CMD_reportgrid.EXIT_ERROR;
        }

        TextTableRenderer renderer = new TextTableRenderer();
        try (ReportSession session = new ReportSession(table, config, Path.of("."), System.out)) {
            String text = session.call(view -> {
                options.applyTo(view.store());
                StringBuilder sb = new StringBuilder(renderer.render(view.snapshot()));
                if (choices) {
                    sb.append(renderer.renderFilterOptions(view.snapshot().filterOptions()));
                }
                if (suggest != null) {
                    List<String> suggestions = view.store().suggest(suggest);
                    sb.append("Suggestions: ").append(String.join(", ", suggestions)).append('\n');
                }
                return sb.toString();
            });
            System.out.print(text);
            return CMD_reportgrid.EXIT_OK;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Cannot show {}: {}", options.getDocument(), cause.getMessage(), cause);
            System.err.println("error: " + cause.getMessage());
            return CMD_reportgrid.EXIT_ERROR;
        } catch (TimeoutException e) {
            logger.error("Timed out showing {}", options.getDocument(), e);
            return CMD_reportgrid.EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while showing {}", options.getDocument());
            return CMD_reportgrid.EXIT_ERROR;
        }
    }
}
