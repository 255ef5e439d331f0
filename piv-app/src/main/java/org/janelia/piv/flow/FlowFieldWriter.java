package org.janelia.piv.flow;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

import org.janelia.piv.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves flow fields to delimited text files with one "x y u v mask" row per vector.
 * The mask column is written numerically (1 for invalid, 0 for valid) using the same format as the other columns.
 * Files with a .gz extension are compressed.
 *
 * @author Eric Trautman
 */
public class FlowFieldWriter {

    public static final String DEFAULT_FORMAT = "%8.4f";
    public static final String DEFAULT_DELIMITER = "\t";

    private final String format;
    private final String delimiter;

    public FlowFieldWriter() {
        this(DEFAULT_FORMAT, DEFAULT_DELIMITER);
    }

    /**
     * @param  format     {@link java.util.Formatter} pattern for a single value (e.g. "%6.3f").
     * @param  delimiter  string separating columns.
     */
    public FlowFieldWriter(final String format,
                           final String delimiter) {
        this.format = format;
        this.delimiter = delimiter;
        // throws IllegalFormatException for invalid formats
        formatValue(0.0);
    }

    public void save(final FlowField flowField,
                     final String path)
            throws IOException {

        final File file = FileUtil.prepareFileForWrite(path);

        try (final Writer writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(file.getAbsolutePath())) {
            write(flowField, writer);
        }

        LOG.info("save: exit, saved {} vectors to {}", flowField.size(), file.getAbsolutePath());
    }

    public void write(final FlowField flowField,
                      final Writer writer)
            throws IOException {
        for (int i = 0; i < flowField.size(); i++) {
            writer.write(formatRow(flowField, i));
            writer.write('\n');
        }
    }

    String formatRow(final FlowField flowField,
                     final int i) {
        return formatValue(flowField.getX(i)) + delimiter +
               formatValue(flowField.getY(i)) + delimiter +
               formatValue(flowField.getU(i)) + delimiter +
               formatValue(flowField.getV(i)) + delimiter +
               formatValue(flowField.isInvalid(i) ? 1.0 : 0.0);
    }

    private String formatValue(final double value) {
        return String.format(Locale.ROOT, format, value);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FlowFieldWriter.class);
}
