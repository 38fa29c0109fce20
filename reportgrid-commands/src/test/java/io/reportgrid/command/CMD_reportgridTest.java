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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CMD_reportgrid")
class CMD_reportgridTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private Path document;
    private Path quickConfig;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));

        document = Files.writeString(tempDir.resolve("users.csv"),
            "Id,Name,Dept,Score\n"
                + "1,alice,Sales,90\n"
                + "2,bob,Ops,75\n"
                + "3,carol,Ops,82\n"
                + "4,dave,Dev,\"1,200\"\n",
            StandardCharsets.UTF_8);
        quickConfig = Files.writeString(tempDir.resolve("quick.yaml"),
            "export:\n"
                + "  pdf:\n"
                + "    font-timeout-ms: 0\n"
                + "    settle-delay-ms: 0\n",
            StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        return CMD_reportgrid.newCommandLine().execute(args);
    }

    private String out() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errContent.toString(StandardCharsets.UTF_8);
    }

    private List<Path> filesIn(Path dir, String extension) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(f -> f.getFileName().toString().endsWith(extension)).collect(Collectors.toList());
        }
    }

    @Test
    @DisplayName("should reject a call without subcommand")
    void shouldRequireSubcommand() {
        assertThat(run()).isEqualTo(CMD_reportgrid.EXIT_ERROR);
    }

    @Nested
    @DisplayName("show")
    class Show {

        @Test
        @DisplayName("should print the filtered page with its filter tags")
        void shouldPrintFilteredPage() {
            int exitCode = run("show", document.toString(), "--filter", "Dept=Ops");

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_OK);
            assertThat(out())
                .contains("users")
                .contains("Filters: Dept: Ops")
                .contains("bob")
                .contains("carol")
                .doesNotContain("alice")
                .contains("Rows 1-2 of 2 (filtered from 4)");
        }

        @Test
        @DisplayName("should sort numerically and mark the sorted column")
        void shouldSortDescending() {
            int exitCode = run("show", document.toString(), "--sort", "Score", "--desc");

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_OK);
            String out = out();
            assertThat(out).contains("Score ▼");
            assertThat(out.indexOf("dave")).isLessThan(out.indexOf("alice"));
            assertThat(out.indexOf("alice")).isLessThan(out.indexOf("carol"));
            assertThat(out.indexOf("carol")).isLessThan(out.indexOf("bob"));
        }

        @Test
        @DisplayName("should print the placeholder when nothing matches")
        void shouldPrintPlaceholder() {
            int exitCode = run("show", document.toString(), "--search", "nobody");

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_OK);
            assertThat(out()).contains("Filters: search: nobody").contains("No data");
        }

        @Test
        @DisplayName("should list filter choices and search suggestions on request")
        void shouldListChoicesAndSuggestions() {
            int exitCode = run("show", document.toString(), "--choices", "--suggest", "ca");

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_OK);
            assertThat(out())
                .contains("Dept: Dev, Ops, Sales")
                .contains("Suggestions: carol");
        }

        @Test
        @DisplayName("should fail for an unknown filter column")
        void shouldRejectUnknownColumn() {
            int exitCode = run("show", document.toString(), "--filter", "Team=Ops");

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_ERROR);
            assertThat(err()).contains("unknown column 'Team'");
        }

        @Test
        @DisplayName("should fail for --desc without --sort")
        void shouldRejectDescWithoutSort() {
            assertThat(run("show", document.toString(), "--desc")).isEqualTo(CMD_reportgrid.EXIT_ERROR);
        }

        @Test
        @DisplayName("should fail for page sizes that are not offered")
        void shouldRejectPageSize() {
            assertThat(run("show", document.toString(), "--page-size", "7")).isEqualTo(CMD_reportgrid.EXIT_ERROR);
            assertThat(err()).contains("--page-size must be one of");
        }

        @Test
        @DisplayName("should fail for a missing document")
        void shouldRejectMissingDocument() {
            int exitCode = run("show", tempDir.resolve("missing.csv").toString());

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_ERROR);
            assertThat(err()).contains("missing.csv");
        }
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        @DisplayName("should write the matching rows as CSV")
        void shouldExportCsv() throws IOException {
            Path outDir = tempDir.resolve("out");

            int exitCode = run("export", document.toString(), "--filter", "Dept=Ops", "--output-dir",
                outDir.toString());

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_OK);
            List<Path> files = filesIn(outDir, ".csv");
            assertThat(files).hasSize(1);
            assertThat(files.get(0).getFileName().toString()).startsWith("User_Management_");
            assertThat(Files.readString(files.get(0), StandardCharsets.UTF_8))
                .isEqualTo("\uFEFFId,Name,Dept,Score\r\n2,bob,Ops,75\r\n3,carol,Ops,82\r\n");
            assertThat(out()).contains("CSV file").contains(files.get(0).getFileName().toString());
        }

        @Test
        @DisplayName("should write a PDF with the document tier")
        void shouldExportPdf() throws IOException {
            Path outDir = tempDir.resolve("pdf");

            int exitCode = run("export", document.toString(), "--format", "pdf", "--output-dir", outDir.toString(),
                "--config", quickConfig.toString());

            assertThat(exitCode).isEqualTo(CMD_reportgrid.EXIT_OK);
            List<Path> files = filesIn(outDir, ".pdf");
            assertThat(files).hasSize(1);
            assertThat(Files.size(files.get(0))).isPositive();
        }

        @Test
        @DisplayName("should fail for an unsupported document type")
        void shouldRejectUnsupportedDocument() throws IOException {
            Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");

            assertThat(run("export", text.toString())).isEqualTo(CMD_reportgrid.EXIT_ERROR);
            assertThat(err()).contains("unsupported report document");
        }

        @Test
        @DisplayName("should reject unknown formats as a usage error")
        void shouldRejectUnknownFormat() {
            assertThat(run("export", document.toString(), "--format", "xlsx")).isEqualTo(CMD_reportgrid.EXIT_ERROR);
        }
    }
}
