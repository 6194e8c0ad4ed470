package com.example.cliporganizer.application.service;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.exception.RootNotFoundException;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.model.ScanWarning;
import com.example.cliporganizer.domain.model.ScannedFile;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks a library root and yields the video files below it.
 *
 * <p>Paths are reported as the filesystem returns them; canonical keys are computed later by the reconciler.
 */
@Component
public class VideoFileScanner {

    private static final Logger log = LoggerFactory.getLogger(VideoFileScanner.class);

    private final AppSyncProperties appSyncProperties;

    public VideoFileScanner(AppSyncProperties appSyncProperties) {
        this.appSyncProperties = appSyncProperties;
    }

    /**
     * Starts a scan of {@code root}. Directories are listed lazily while the result is iterated.
     *
     * @throws RootNotFoundException if the root does not exist or is not a directory
     */
    public VideoFileScan scan(Path root) {
        if (root == null || !Files.exists(root)) {
            throw new RootNotFoundException(root == null ? null : root.toString(), "Root folder does not exist");
        }
        if (!Files.isDirectory(root)) {
            throw new RootNotFoundException(root.toString(), "Root folder is not a directory");
        }
        Set<String> extensions = appSyncProperties.normalizedVideoExtensions();
        if (extensions.isEmpty()) {
            throw new IllegalStateException("app.sync.video-extensions is empty");
        }
        return new VideoFileScan(root.toAbsolutePath().normalize(), extensions);
    }

    public boolean isVideoFile(String fileName, Set<String> extensions) {
        int idx = fileName.lastIndexOf('.');
        if (idx < 0 || idx >= fileName.length() - 1) {
            return false;
        }
        return extensions.contains(fileName.substring(idx + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * One pass over a library root. Can be iterated only once; a new scan is needed to look again.
     */
    public final class VideoFileScan implements Iterable<ScannedFile> {

        private final Path root;
        private final Set<String> extensions;
        private final List<ScanWarning> warnings = new ArrayList<>();
        private final AtomicBoolean consumed = new AtomicBoolean(false);

        private VideoFileScan(Path root, Set<String> extensions) {
            this.root = root;
            this.extensions = extensions;
        }

        public Path getRoot() {
            return root;
        }

        /**
         * Entries skipped so far because they could not be read.
         */
        public List<ScanWarning> getWarnings() {
            return Collections.unmodifiableList(warnings);
        }

        @Override
        public Iterator<ScannedFile> iterator() {
            if (!consumed.compareAndSet(false, true)) {
                throw new IllegalStateException("Scan of " + root + " has already been consumed");
            }
            return new ScanIterator();
        }

        private void warn(Path path, String message, Exception cause) {
            warnings.add(new ScanWarning(path.toString(), message));
            log.warn("SYNC_SCAN_ENTRY_UNREADABLE path={} reason={}",
                    LogSanitizer.sanitizePath(path.toString()), LogSanitizer.sanitize(cause.getMessage()));
        }

        private final class ScanIterator implements Iterator<ScannedFile> {

            private final Deque<Path> pendingDirs = new ArrayDeque<>();
            private final Deque<Path> pendingFiles = new ArrayDeque<>();
            private final Set<Path> visited = new HashSet<>();
            private ScannedFile next;

            private ScanIterator() {
                pendingDirs.push(root);
            }

            @Override
            public boolean hasNext() {
                while (next == null) {
                    if (!pendingFiles.isEmpty()) {
                        next = readFile(pendingFiles.poll());
                        continue;
                    }
                    if (pendingDirs.isEmpty()) {
                        return false;
                    }
                    listDirectory(pendingDirs.pop());
                }
                return true;
            }

            @Override
            public ScannedFile next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ScannedFile result = next;
                next = null;
                return result;
            }

            private void listDirectory(Path dir) {
                if (appSyncProperties.isFollowDirectoryLinks() && !markVisited(dir)) {
                    return;
                }
                List<Path> files = new ArrayList<>();
                List<Path> subDirs = new ArrayList<>();
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                    for (Path entry : stream) {
                        if (isTraversableDirectory(entry)) {
                            subDirs.add(entry);
                        } else if (isVideoFile(String.valueOf(entry.getFileName()), extensions)) {
                            files.add(entry);
                        }
                    }
                } catch (IOException | SecurityException e) {
                    warn(dir, "Directory could not be read: " + e.getMessage(), e);
                    return;
                }
                Collections.sort(files);
                Collections.sort(subDirs);
                pendingFiles.addAll(files);
                // depth-first, in name order
                for (int i = subDirs.size() - 1; i >= 0; i--) {
                    pendingDirs.push(subDirs.get(i));
                }
            }

            private boolean isTraversableDirectory(Path entry) {
                if (appSyncProperties.isFollowDirectoryLinks()) {
                    return Files.isDirectory(entry);
                }
                return Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS);
            }

            private boolean markVisited(Path dir) {
                try {
                    return visited.add(dir.toRealPath());
                } catch (IOException e) {
                    warn(dir, "Directory could not be resolved: " + e.getMessage(), e);
                    return false;
                }
            }

            private ScannedFile readFile(Path file) {
                try {
                    BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                    if (!attributes.isRegularFile()) {
                        return null;
                    }
                    Path parent = file.getParent();
                    return new ScannedFile(
                            file.toString(),
                            parent == null ? null : parent.toString(),
                            attributes.size(),
                            attributes.lastModifiedTime().toInstant());
                } catch (IOException | SecurityException e) {
                    warn(file, "File metadata could not be read: " + e.getMessage(), e);
                    return null;
                }
            }
        }
    }
}
