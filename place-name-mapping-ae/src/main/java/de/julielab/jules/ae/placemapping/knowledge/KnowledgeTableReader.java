package de.julielab.jules.ae.placemapping.knowledge;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.julielab.java.utilities.FileUtilities;
import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.utils.KnowledgeTableException;

/**
 * Reads the tab separated knowledge tables. Empty lines and lines starting with
 * <tt>#</tt> are skipped. A table location is either a classpath resource,
 * prefixed with {@link PlaceMappingConfiguration#CLASSPATH_PREFIX}, or a file
 * path. Files may be gzipped.
 */
public class KnowledgeTableReader {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeTableReader.class);

    public static class TableRow {
        private final int lineNumber;
        private final String[] columns;

        TableRow(int lineNumber, String[] columns) {
            this.lineNumber = lineNumber;
            this.columns = columns;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public int size() {
            return columns.length;
        }

        public String get(int column) {
            return columns[column];
        }

        /**
         * @return the column value or <tt>null</tt> if the row is shorter
         */
        public String getOptional(int column) {
            return column < columns.length && !columns[column].isEmpty() ? columns[column] : null;
        }
    }

    /**
     * Reads all data rows of a table.
     *
     * @param tableName  the table name used in error messages
     * @param location   classpath resource or file
     * @param minColumns the minimum number of columns of each row
     * @param maxColumns the maximum number of columns of each row
     * @return the rows of the table, never empty
     * @throws KnowledgeTableException if the table cannot be read, a row has the wrong
     *                                 number of columns or there are no rows at all
     */
    public List<TableRow> readRows(String tableName, String location, int minColumns, int maxColumns)
            throws KnowledgeTableException {
        List<TableRow> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(openTable(tableName, location), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                ++lineNumber;
                // a byte order mark would become part of the first value
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF')
                    line = line.substring(1);
                if (line.isBlank() || line.trim().startsWith("#"))
                    continue;
                String[] columns = line.split("\t");
                for (int i = 0; i < columns.length; i++)
                    columns[i] = columns[i].trim();
                if (columns.length < minColumns || columns.length > maxColumns)
                    throw new KnowledgeTableException("Line " + lineNumber + " of the " + tableName + " table at "
                            + location + " has " + columns.length + " columns but between " + minColumns + " and "
                            + maxColumns + " are expected: " + line);
                rows.add(new TableRow(lineNumber, columns));
            }
        } catch (IOException e) {
            throw new KnowledgeTableException("The " + tableName + " table could not be read from " + location, e);
        }
        if (rows.isEmpty())
            throw new KnowledgeTableException("The " + tableName + " table at " + location + " is empty.");
        log.debug("Read {} rows from the {} table at {}", rows.size(), tableName, location);
        return rows;
    }

    /**
     * Reads a single column table.
     */
    public List<String> readLines(String tableName, String location) throws KnowledgeTableException {
        List<String> lines = new ArrayList<>();
        for (TableRow row : readRows(tableName, location, 1, 1))
            lines.add(row.get(0));
        return lines;
    }

    private InputStream openTable(String tableName, String location) throws IOException, KnowledgeTableException {
        if (location == null)
            throw new KnowledgeTableException("No location is given for the " + tableName + " table.");
        if (location.startsWith(PlaceMappingConfiguration.CLASSPATH_PREFIX)) {
            String resource = location.substring(PlaceMappingConfiguration.CLASSPATH_PREFIX.length());
            if (!resource.startsWith("/"))
                resource = "/" + resource;
            InputStream is = KnowledgeTableReader.class.getResourceAsStream(resource);
            if (is == null)
                throw new KnowledgeTableException("The " + tableName + " table was not found on the classpath at " + resource);
            return is;
        }
        File file = new File(location);
        if (!file.exists())
            throw new KnowledgeTableException("The " + tableName + " table file " + file.getAbsolutePath() + " does not exist.");
        return FileUtilities.getInputStreamFromFile(file);
    }
}
