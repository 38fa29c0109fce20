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

import io.reportgrid.config.ConfigLoader;
import io.reportgrid.config.EngineConfig;
import io.reportgrid.io.ReportDocuments;
import io.reportgrid.model.ReportTable;
import io.reportgrid.view.ReportViewStore;
import io.reportgrid.view.ViewSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// The options shared by every report subcommand: which document to load, the
/// configuration, and the view state to put it in before showing or exporting.
public class ReportOptions {
    private static final Logger logger = LogManager.getLogger(ReportOptions.class);

    @Parameters(index = "0", paramLabel = "DOCUMENT", description = "The report document, a .json or .csv file")
    private Path document;

    @Option(names = {"--config"}, paramLabel = "FILE",
        description = "A YAML file overriding the bundled defaults")
    private Path config;

    @Option(names = {"--search", "-s"}, description = "Keep rows where any cell contains this text, ignoring case")
    private String search;

    @Option(names = {"--filter", "-f"}, paramLabel = "COLUMN=VALUE",
        description = "Keep rows whose COLUMN equals VALUE exactly; may be repeated")
    private Map<String, String> filters = new LinkedHashMap<>();

    @Option(names = {"--sort"}, paramLabel = "COLUMN", description = "Sort by this column, ascending")
    private String sort;

    @Option(names = {"--desc"}, description = "Sort descending instead (requires --sort)")
    private boolean descending;

    @Option(names = {"--page-size"}, description = "Rows per page, one of the configured choices")
    private Integer pageSize;

    @Option(names = {"--page", "-p"}, description = "The page to show (default: 1)")
    private Integer page;

    public Path getDocument() {
        return document;
    }

    public EngineConfig loadConfig() {
        if (config == null) {
            return ConfigLoader.loadDefaults();
        }
        logger.debug("Loading configuration overrides from {}", config);
        return ConfigLoader.load(config);
    }

    public ReportTable loadTable() {
        return ReportDocuments.load(document);
    }

    /// Puts the store in the requested state: column filters, then search, then sort,
    /// then page size and page.
    /// @param store the store of the loaded report
    /// @throws IllegalArgumentException for unknown columns, page sizes or pages
    public void applyTo(ReportViewStore store) {
        filters.forEach((column, value) -> {
            requireColumn(store, column, "--filter");
            store.setColumnFilter(column, value);
        });
        if (search != null) {
            store.setSearchTerm(search);
        }
        if (sort != null) {
            requireColumn(store, sort, "--sort");
            store.sortBy(sort);
            if (descending) {
                store.sortBy(sort);
            }
        } else if (descending) {
            throw new IllegalArgumentException("--desc needs a --sort column");
        }
        if (pageSize != null) {
            ViewSnapshot snapshot = store.snapshot();
            if (!snapshot.pageSizeChoices().contains(pageSize)) {
                throw new IllegalArgumentException("--page-size must be one of " + snapshot.pageSizeChoices()
                    + ", got " + pageSize);
            }
            store.setPageSize(pageSize);
        }
        if (page != null) {
            int totalPages = store.snapshot().totalPages();
            if (page < 1 || page > totalPages) {
                throw new IllegalArgumentException("--page must be between 1 and " + totalPages + ", got " + page);
            }
            store.goToPage(page);
        }
        logger.debug("Applied view options to '{}': {}", store.title(), store.snapshot());
    }

    private static void requireColumn(ReportViewStore store, String column, String option) {
        if (!store.model().hasColumn(column)) {
            throw new IllegalArgumentException(option + " names unknown column '" + column + "', columns are "
                + store.columns());
        }
    }
}
