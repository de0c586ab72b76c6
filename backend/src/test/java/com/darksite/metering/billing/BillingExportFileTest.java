package com.darksite.metering.billing;

import com.darksite.metering.domain.model.BillingRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingExportFileTest {

    private static final Instant TRIGGERED_AT = Instant.parse("2024-05-02T01:00:07Z");
    private static final String HEADER =
            "accountId\tqty\tstartDate\tendDate\tmeteredItem\tappid\tsno\tfqdn\ttype\tdescription\tguid";

    @TempDir
    Path tempDir;

    private Path exportDir;
    private BillingExportFile exportFile;

    @BeforeEach
    void setUp() {
        exportDir = tempDir.resolve("exports");
        exportFile = new BillingExportFile(exportDir, "csv", ZoneOffset.UTC);
    }

    private static BillingRow row(int sno, String item, String qty) {
        return new BillingRow("prod", new BigDecimal(qty), LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2),
                item, "app-7", sno, "web-01", "VM", item + " usage for VM web-01", "vm-a");
    }

    @Test
    @DisplayName("Should name the file after the trigger time")
    void shouldNameFileAfterTriggerTime() {
        assertThat(exportFile.fileName(TRIGGERED_AT)).isEqualTo("metering_export_20240502_010007.csv");
    }

    @Test
    @DisplayName("Should write a tab-separated file with a header row that reads back unchanged")
    void shouldWriteAndReadBack() throws IOException {
        // Given
        List<BillingRow> rows = List.of(row(1, "vCPU", "4"), row(2, "Memory_GB", "8.0"));

        // When
        Path file = exportFile.write(rows, TRIGGERED_AT);

        // Then
        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(HEADER);
        assertThat(lines.get(2)).isEqualTo(
                "prod\t8.0\t2024-05-01\t2024-05-02\tMemory_GB\tapp-7\t2\tweb-01\tVM\tMemory_GB usage for VM web-01\tvm-a");
        assertThat(exportFile.read(file)).isEqualTo(rows);
    }

    @Test
    @DisplayName("Should write only the header when there are no rows")
    void shouldWriteHeaderOnly() throws IOException {
        Path file = exportFile.write(List.of(), TRIGGERED_AT);

        assertThat(Files.readAllLines(file)).containsExactly(HEADER);
    }

    @Test
    @DisplayName("Should refuse to overwrite an existing export")
    void shouldNotOverwrite() throws IOException {
        // Given
        Path first = exportFile.write(List.of(row(1, "vCPU", "4")), TRIGGERED_AT);
        String original = Files.readString(first);

        // When / Then
        assertThatThrownBy(() -> exportFile.write(List.of(), TRIGGERED_AT))
                .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readString(first)).isEqualTo(original);
    }

    @Test
    @DisplayName("Should leave no temporary file behind")
    void shouldCleanUpTemporaryFile() throws IOException {
        exportFile.write(List.of(row(1, "vCPU", "4")), TRIGGERED_AT);

        try (Stream<Path> files = Files.list(exportDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("metering_export_20240502_010007.csv");
        }
    }
}
