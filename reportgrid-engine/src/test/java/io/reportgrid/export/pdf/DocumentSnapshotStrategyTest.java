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


package io.reportgrid.export.pdf;

import io.reportgrid.ReportFixtures;
import io.reportgrid.config.EngineConfig;
import io.reportgrid.model.ReportTable;
import io.reportgrid.model.RowModelBuilder;
import io.reportgrid.notify.sched.VirtualTimeScheduler;
import io.reportgrid.paging.PageState;
import io.reportgrid.view.ChromeState;
import io.reportgrid.view.ReportViewStore;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DocumentSnapshotStrategy")
class DocumentSnapshotStrategyTest {

    private static final ZonedDateTime GENERATED = ZonedDateTime.parse("2024-05-07T08:59:00+09:00[Asia/Tokyo]");

    @TempDir
    Path tempDir;

    private final DocumentSnapshotStrategy strategy = new DocumentSnapshotStrategy(new FontReadiness(null));

    private ReportViewStore store(ReportTable table) {
        return new ReportViewStore(RowModelBuilder.build(table), EngineConfig.defaults(), new VirtualTimeScheduler());
    }

    private TierResult export(ReportViewStore store, Path file) {
        PdfExportRequest request = new PdfExportRequest(store, file, ReportFixtures.pdfSettings(10, 0), GENERATED);
        return strategy.attemptExport(request).toCompletableFuture().join();
    }

    private static String text(Path file) throws IOException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            return new PDFTextStripper().getText(document);
        }
    }

    private static int pageCount(Path file) throws IOException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            return document.getNumberOfPages();
        }
    }

    @Test
    @DisplayName("should be available with PDFBox on the class path")
    void shouldBeAvailable() {
        assertThat(strategy.isAvailable()).isTrue();
        assertThat(strategy.name()).isEqualTo("document");
    }

    @Test
    @DisplayName("should write every filtered row as text across pages")
    void shouldWriteAllRows() throws IOException {
        Path file = tempDir.resolve("users.pdf");

        TierResult result = export(store(ReportFixtures.users(57)), file);

        assertThat(result.status()).isEqualTo(TierResult.Status.SUCCESS);
        assertThat(result.file()).isEqualTo(file);
        assertThat(result.message()).isEqualTo("PDF file users.pdf saved (57 rows, 2 pages)");
        assertThat(pageCount(file)).isEqualTo(2);
        assertThat(text(file))
            .contains("User Report")
            .contains("Generated: 2024-05-07 08:59")
            .contains("Rows: 57 / 57")
            .contains("user0")
            .contains("user56");
    }

    @Test
    @DisplayName("should write only the filtered rows and put the view back")
    void shouldHonourFilterAndRestore() throws IOException {
        ReportViewStore store = store(ReportFixtures.users(57));
        store.setPageSize(10);
        store.setColumnFilter("Dept", "Ops");
        store.goToPage(2);
        Path file = tempDir.resolve("ops.pdf");

        TierResult result = export(store, file);

        assertThat(result.isFailure()).isFalse();
        String text = text(file);
        assertThat(text).contains("Rows: 19 / 57").contains("user1").doesNotContain("user0");
        assertThat(store.pageState()).isEqualTo(new PageState(2, 10));
        assertThat(store.chrome()).isEqualTo(ChromeState.visible());
    }

    @Test
    @DisplayName("should write a placeholder page when no row matches")
    void shouldWritePlaceholder() throws IOException {
        ReportViewStore store = store(ReportFixtures.users(5));
        store.setSearchTerm("nobody");
        Path file = tempDir.resolve("empty.pdf");

        TierResult result = export(store, file);

        assertThat(result.isFailure()).isFalse();
        assertThat(pageCount(file)).isEqualTo(1);
        assertThat(text(file)).contains("No data").contains("Rows: 0 / 5");
    }

    @Test
    @DisplayName("should leave Japanese text to the next tier when no font is configured")
    void shouldFailWithoutGlyphs() {
        ReportViewStore store = store(ReportTable.of("ライセンス分析", "ユーザー名", "部署")
            .withRow("山田太郎", "営業部"));
        Path file = tempDir.resolve("license.pdf");

        TierResult result = export(store, file);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.message()).isEqualTo(DocumentSnapshotStrategy.MISSING_GLYPHS);
        assertThat(file).doesNotExist();
        assertThat(store.chrome()).isEqualTo(ChromeState.visible());
    }

    @Test
    @DisplayName("should fail on a single unshowable cell even when the headers are plain")
    void shouldFailOnOneUnshowableCell() {
        ReportTable table = ReportTable.of("Monthly Report", "Name", "Dept")
            .withRow("alice", "Sales")
            .withRow("山田", "Sales");

        TierResult result = export(store(table), tempDir.resolve("monthly.pdf"));

        assertThat(result.message()).isEqualTo(DocumentSnapshotStrategy.MISSING_GLYPHS);
    }

    @Test
    @DisplayName("should write control characters in cells as spaces")
    void shouldBlankControlCharacters() throws IOException {
        ReportTable table = ReportTable.of("Tabbed Report", "Name", "Note")
            .withRow("alice", "first\tsecond");
        Path file = tempDir.resolve("tabbed.pdf");

        TierResult result = export(store(table), file);

        assertThat(result.status()).isEqualTo(TierResult.Status.SUCCESS);
        assertThat(text(file)).contains("first second");
    }

    @Test
    @DisplayName("should fail the tier when the file cannot be written")
    void shouldFailOnWriteError() {
        Path file = tempDir.resolve("missing-dir").resolve("users.pdf");

        TierResult result = export(store(ReportFixtures.users(3)), file);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.message()).startsWith("could not write users.pdf");
        assertThat(file).doesNotExist();
    }
}
