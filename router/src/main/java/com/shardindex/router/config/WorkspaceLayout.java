package com.shardindex.router.config;

import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Ordered source roots of a workspace. A root's position in the list is its shard id.
 */
@Value
public class WorkspaceLayout {
    List<SourceRoot> sourceRoots;

    public WorkspaceLayout(List<SourceRoot> sourceRoots) {
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public static WorkspaceLayout of(Path... roots) {
        List<SourceRoot> sourceRoots = new ArrayList<>(roots.length);
        for (Path root : roots) {
            sourceRoots.add(new SourceRoot(root));
        }
        return new WorkspaceLayout(sourceRoots);
    }

    public int shardCount() {
        return sourceRoots.size();
    }

    public Path root(int shardId) {
        return sourceRoots.get(shardId).getPath();
    }

    public boolean hasShard(int shardId) {
        return shardId >= 0 && shardId < sourceRoots.size();
    }

    /**
     * Shard of the first root that is a path prefix of {@code file}.
     */
    public OptionalInt shardForPath(Path file) {
        for (int i = 0; i < sourceRoots.size(); i++) {
            if (file.startsWith(sourceRoots.get(i).getPath())) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
