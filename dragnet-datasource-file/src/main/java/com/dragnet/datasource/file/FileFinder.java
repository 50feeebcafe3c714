package com.dragnet.datasource.file;

import com.dragnet.core.exception.SourceException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Lists the regular files under a set of roots. Directories are expanded on a bounded pool of workers; the walk is
 * complete when no expansion is outstanding. Entries that cannot be read are reported, not fatal.
 */
@Slf4j
public final class FileFinder {

    /**
     * @param files regular files found, sorted
     * @param errors one message per path that could not be read
     */
    public record Found(List<Path> files, List<String> errors) {}

    private final int workers;

    public FileFinder(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        this.workers = workers;
    }

    public Found find(Collection<Path> roots) {
        return find(roots, path -> true);
    }

    /**
     * @param include entries (files and directories below the roots) for which this returns {@code false} are skipped
     */
    public Found find(Collection<Path> roots, Predicate<Path> include) {
        if (roots.isEmpty()) {
            return new Found(List.of(), List.of());
        }
        Walk walk = new Walk(include);
        AtomicInteger threads = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "dragnet-find-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            // counts the submitting thread until every root is queued
            walk.pending.incrementAndGet();
            roots.forEach(root -> walk.submit(pool, root));
            walk.release();
            walk.done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("interrupted while listing " + roots, e);
        } finally {
            pool.shutdownNow();
        }
        List<Path> files = new ArrayList<>(walk.files);
        files.sort(null);
        List<String> errors = new ArrayList<>(walk.errors);
        log.debug("Find complete roots={} files={} errors={}", roots.size(), files.size(), errors.size());
        return new Found(files, errors);
    }

    private static final class Walk {

        private final Predicate<Path> include;
        private final AtomicInteger pending = new AtomicInteger();
        private final CountDownLatch done = new CountDownLatch(1);
        private final Queue<Path> files = new ConcurrentLinkedQueue<>();
        private final Queue<String> errors = new ConcurrentLinkedQueue<>();

        Walk(Predicate<Path> include) {
            this.include = include;
        }

        void submit(ExecutorService pool, Path path) {
            pending.incrementAndGet();
            pool.execute(() -> {
                try {
                    visit(pool, path);
                } finally {
                    release();
                }
            });
        }

        void release() {
            if (pending.decrementAndGet() == 0) {
                done.countDown();
            }
        }

        private void visit(ExecutorService pool, Path path) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                if (!attrs.isDirectory()) {
                    files.add(path);
                    return;
                }
                try (DirectoryStream<Path> entries = Files.newDirectoryStream(path)) {
                    for (Path entry : entries) {
                        if (include.test(entry)) {
                            submit(pool, entry);
                        }
                    }
                }
            } catch (NoSuchFileException e) {
                log.debug("Skipping missing path {}", path);
                errors.add(path + ": no such file or directory");
            } catch (IOException e) {
                log.warn("Failed to read {}", path, e);
                errors.add(path + ": " + e.getMessage());
            }
        }
    }
}
