package org.janelia.piv.util;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds files that match a shell style glob pattern (e.g. "img_*_a.png" or "run_?/*.tif")
 * relative to a base directory.
 *
 * Matching rules:
 * <ul>
 *     <li>patterns use the {@link java.nio.file.FileSystem#getPathMatcher glob syntax},
 *         components are separated by '/' and wildcards never span components,</li>
 *     <li>only regular files are returned,</li>
 *     <li>a name starting with '.' only matches a pattern component that also starts with '.',</li>
 *     <li>case sensitivity follows the host file system.</li>
 * </ul>
 *
 * @author Eric Trautman
 */
public class FileSetFinder {

    private final Path baseDirectory;

    /**
     * @param  baseDirectory  directory to search, relative paths are resolved against the working directory.
     */
    public FileSetFinder(final Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    /**
     * @return absolute paths of all files matching the specified pattern,
     *         sorted lexicographically by their full path string.
     *
     * @throws IllegalArgumentException
     *   if the pattern is empty or absolute.
     *
     * @throws IOException
     *   if the base directory cannot be read.
     */
    public List<Path> find(final String pattern)
            throws IllegalArgumentException, IOException {

        final List<String> patternComponents = splitPattern(pattern);

        if (! Files.isDirectory(baseDirectory)) {
            LOG.warn("find: {} is not a directory", baseDirectory);
            return Collections.emptyList();
        }

        List<Path> candidatePaths = Collections.singletonList(baseDirectory);
        final int lastIndex = patternComponents.size() - 1;
        for (int i = 0; i <= lastIndex; i++) {
            final String component = patternComponents.get(i);
            final boolean isLastComponent = (i == lastIndex);
            final List<Path> nextCandidatePaths = new ArrayList<>();
            for (final Path directory : candidatePaths) {
                addMatchingEntries(directory, component, isLastComponent, nextCandidatePaths);
            }
            candidatePaths = nextCandidatePaths;
        }

        final List<Path> matchingPaths = candidatePaths.stream()
                .sorted((a, b) -> a.toString().compareTo(b.toString()))
                .collect(Collectors.toList());

        LOG.debug("find: found {} files matching '{}' in {}", matchingPaths.size(), pattern, baseDirectory);

        return matchingPaths;
    }

    static List<String> splitPattern(final String pattern)
            throws IllegalArgumentException {

        if ((pattern == null) || pattern.trim().isEmpty()) {
            throw new IllegalArgumentException("pattern must be specified");
        }
        if (pattern.startsWith("/")) {
            throw new IllegalArgumentException("pattern '" + pattern + "' must be relative to the base directory");
        }

        final List<String> components = new ArrayList<>();
        for (final String component : pattern.split("/")) {
            if (component.length() > 0) {
                components.add(component);
            }
        }
        return components;
    }

    /**
     * Adds entries of the specified directory that match one pattern component.
     * Only directories are kept for intermediate components and only regular files for the last one.
     * Unreadable subdirectories are skipped, an unreadable base directory is an error.
     */
    private void addMatchingEntries(final Path directory,
                                    final String component,
                                    final boolean isLastComponent,
                                    final List<Path> matchingEntries)
            throws IOException {

        final PathMatcher matcher = directory.getFileSystem().getPathMatcher("glob:" + component);
        final boolean includeHidden = component.startsWith(".");

        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (final Path entry : stream) {
                final Path name = entry.getFileName();
                if ((includeHidden || (! name.toString().startsWith("."))) && matcher.matches(name)) {
                    if (isLastComponent ? Files.isRegularFile(entry) : Files.isDirectory(entry)) {
                        matchingEntries.add(entry);
                    }
                }
            }
        } catch (final DirectoryIteratorException e) {
            handleReadFailure(directory, e.getCause());
        } catch (final IOException e) {
            handleReadFailure(directory, e);
        }
    }

    private void handleReadFailure(final Path directory,
                                   final IOException failure)
            throws IOException {
        if (directory.equals(baseDirectory)) {
            throw failure;
        }
        LOG.warn("handleReadFailure: skipping unreadable directory {}", directory, failure);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileSetFinder.class);
}
