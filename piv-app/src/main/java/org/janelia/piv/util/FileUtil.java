package org.janelia.piv.util;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.janelia.piv.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    public static final FileUtil DEFAULT_INSTANCE = new FileUtil();

    /**
     * @return reader for the specified file that transparently decompresses .gz files.
     */
    public Reader getExtensionBasedReader(final String fullPathName)
            throws IOException {

        final InputStream inputStream;

        if (fullPathName.endsWith(".gz")) {
            inputStream = new GZIPInputStream(new FileInputStream(fullPathName), BUFFER_SIZE);
        } else {
            inputStream = new BufferedInputStream(new FileInputStream(fullPathName), BUFFER_SIZE);
        }

        return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
    }

    /**
     * @return writer for the specified file that transparently compresses .gz files.
     */
    public Writer getExtensionBasedWriter(final String fullPathName)
            throws IOException {

        final OutputStream outputStream;

        if (fullPathName.endsWith(".gz")) {
            outputStream = new GZIPOutputStream(new FileOutputStream(fullPathName), BUFFER_SIZE);
        } else {
            outputStream = new BufferedOutputStream(new FileOutputStream(fullPathName), BUFFER_SIZE);
        }

        return new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
    }

    public static void saveJsonFile(final String path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    public static void saveJsonFile(final String path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final File toFile = prepareFileForWrite(path);

        try (final Writer writer = DEFAULT_INSTANCE.getExtensionBasedWriter(toFile.getAbsolutePath())) {
            mapper.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + toFile.getAbsolutePath(), t);
        }

        LOG.info("saveJsonFile: exit, wrote data to {}", toFile.getAbsolutePath());
    }

    /**
     * Creates the parent directory for the specified path if it does not already exist.
     *
     * @return absolute file for the specified path.
     */
    public static File prepareFileForWrite(final String path) {
        final Path absolutePath = Paths.get(path).toAbsolutePath();
        final Path parentPath = absolutePath.getParent();
        if (parentPath != null) {
            ensureWritableDirectory(parentPath.toFile());
        }
        return absolutePath.toFile();
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        // symbolic links are removed without following them
        if (file.isDirectory() && (! Files.isSymbolicLink(file.toPath()))) {
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleted {}", file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete {}", file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int BUFFER_SIZE = 65536;

}
