package org.janelia.piv.flow;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.janelia.piv.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads flow fields saved by {@link FlowFieldWriter} (or any whitespace delimited
 * text file with x, y, u, v, and mask columns).
 * Blank lines and lines starting with '#' are ignored and extra columns are skipped.
 *
 * @author Eric Trautman
 */
public class FlowFieldReader {

    public FlowField load(final String path)
            throws IOException {

        final FlowField flowField;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path)) {
            flowField = read(reader, path);
        }

        LOG.debug("load: loaded {} from {}", flowField, path);

        return flowField;
    }

    /**
     * @param  reader      source of flow field rows.
     * @param  sourceName  name used to identify the source in error messages.
     *
     * @throws IOException
     *   if the data cannot be read or a row is malformed.
     */
    public FlowField read(final Reader reader,
                          final String sourceName)
            throws IOException {

        final List<double[]> rows = new ArrayList<>();

        final BufferedReader bufferedReader = new BufferedReader(reader);
        int lineNumber = 0;
        for (String line = bufferedReader.readLine(); line != null; line = bufferedReader.readLine()) {
            lineNumber++;
            final String trimmedLine = line.trim();
            if ((trimmedLine.length() > 0) && (! trimmedLine.startsWith("#"))) {
                rows.add(parseRow(trimmedLine, sourceName, lineNumber));
            }
        }

        final int n = rows.size();
        final double[] x = new double[n];
        final double[] y = new double[n];
        final double[] u = new double[n];
        final double[] v = new double[n];
        final boolean[] mask = new boolean[n];
        for (int i = 0; i < n; i++) {
            final double[] row = rows.get(i);
            x[i] = row[0];
            y[i] = row[1];
            u[i] = row[2];
            v[i] = row[3];
            mask[i] = row[4] != 0.0;
        }

        return new FlowField(x, y, u, v, mask);
    }

    private static double[] parseRow(final String line,
                                     final String sourceName,
                                     final int lineNumber)
            throws IOException {

        final String[] columns = WHITESPACE.split(line);
        if (columns.length < COLUMN_COUNT) {
            throw new IOException("line " + lineNumber + " of " + sourceName + " has " + columns.length +
                                  " columns but at least " + COLUMN_COUNT + " are required");
        }

        final double[] values = new double[COLUMN_COUNT];
        for (int i = 0; i < COLUMN_COUNT; i++) {
            try {
                values[i] = Double.parseDouble(columns[i]);
            } catch (final NumberFormatException e) {
                throw new IOException("line " + lineNumber + " of " + sourceName +
                                      " has invalid value '" + columns[i] + "' in column " + (i + 1), e);
            }
        }
        return values;
    }

    private static final int COLUMN_COUNT = 5;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Logger LOG = LoggerFactory.getLogger(FlowFieldReader.class);
}
