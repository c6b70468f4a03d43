package com.weatherledger.service.rows;

import com.weatherledger.core.util.JsonUtils;
import com.weatherledger.ingest.rows.RowBatch;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class RowBatchReader {
    private RowBatchReader() {
    }

    public static RowBatch read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Row batch file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            RowBatch batch = JsonUtils.objectMapper().readValue(in, RowBatch.class);
            if (batch == null) {
                throw new IllegalStateException("Failed reading row batch from " + file + ": file is empty");
            }
            return batch;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading row batch from " + file, e);
        }
    }
}
