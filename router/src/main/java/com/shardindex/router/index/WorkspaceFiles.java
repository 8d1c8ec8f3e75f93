package com.shardindex.router.index;

import com.shardindex.core.model.FileText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the Java sources below a shard root.
 */
public final class WorkspaceFiles {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceFiles.class);

    private WorkspaceFiles() {
    }

    /**
     * Sorted {@code .java} files below {@code root}; empty if the root does not exist.
     */
    public static List<Path> listJavaFiles(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("Source root {} is not a directory", root);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".java"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + root, e);
        }
    }

    /**
     * Reads every file in {@code paths}; unreadable files are skipped with a warning.
     */
    public static List<FileText> read(List<Path> paths) {
        List<FileText> files = new ArrayList<>(paths.size());
        for (Path path : paths) {
            try {
                files.add(new FileText(path.toString(), Files.readString(path, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Skipping unreadable source file {}: {}", path, e.toString());
            }
        }
        return files;
    }

    /**
     * Lists and reads the shard's files on the bounded-elastic scheduler.
     */
    public static Mono<List<FileText>> collect(Path root) {
        return collect(root, Schedulers.boundedElastic());
    }

    public static Mono<List<FileText>> collect(Path root, Scheduler scheduler) {
        return Mono.fromCallable(() -> read(listJavaFiles(root)))
            .subscribeOn(scheduler);
    }
}
