package com.phillippitts.scalogram.service.io;

import com.phillippitts.scalogram.domain.Signal;
import com.phillippitts.scalogram.exception.LoadFailureException;
import org.apache.commons.math3.util.ResizableDoubleArray;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a signal from an {@code .aaa} text file.
 *
 * <p>Format:
 * <pre>
 * &lt;any fields&gt;,...,&lt;entry count&gt;,&lt;sampling period in s&gt;
 * &lt;sample&gt;[,&lt;ignored columns&gt;...]
 * ...
 * </pre>
 * The header's last field is the sampling period {@code dt}, the second-to-last the number of
 * entries. Each following non-blank line contributes its first column as one sample, and the
 * line count must equal the declared entry count. The declared count is only compared with
 * the rows actually read; storage grows with the data, not with the header.
 */
public final class AaaFileSignalSource implements SignalSource {

    private final Path file;

    public AaaFileSignalSource(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
    }

    public Path file() {
        return file;
    }

    @Override
    public String identifier() {
        return file.getFileName().toString();
    }

    @Override
    public Signal load() {
        String id = identifier();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII)) {
            String header = reader.readLine();
            if (header == null || header.isBlank()) {
                throw new LoadFailureException(id, "missing header line");
            }
            String[] fields = header.split(",");
            if (fields.length < 2) {
                throw new LoadFailureException(id, "header needs at least two fields, got: " + header.trim());
            }
            double dt = parseDouble(id, fields[fields.length - 1], "sampling period");
            int declared = parseInt(id, fields[fields.length - 2]);
            if (!Double.isFinite(dt) || dt <= 0.0) {
                throw new LoadFailureException(id, "sampling period must be positive and finite, got: " + dt);
            }
            if (declared < 0) {
                throw new LoadFailureException(id, "entry count must not be negative, got: " + declared);
            }

            ResizableDoubleArray samples = new ResizableDoubleArray();
            int count = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (count == declared) {
                    throw new LoadFailureException(id, "more rows than the declared " + declared + " entries");
                }
                int comma = line.indexOf(',');
                String first = comma < 0 ? line : line.substring(0, comma);
                count++;
                samples.addElement(parseDouble(id, first, "sample on data row " + count));
            }
            if (count != declared) {
                throw new LoadFailureException(id, "header declares " + declared + " entries but file has " + count);
            }
            return new Signal(id, samples.getElements(), 1.0 / dt);
        } catch (IOException e) {
            throw new LoadFailureException(id, e.getMessage(), e);
        }
    }

    private static double parseDouble(String id, String text, String what) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new LoadFailureException(id, "malformed " + what + ": '" + text.trim() + "'", e);
        }
    }

    private static int parseInt(String id, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new LoadFailureException(id, "malformed entry count: '" + text.trim() + "'", e);
        }
    }
}
