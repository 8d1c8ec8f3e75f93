package com.shardindex.router.config;

import lombok.Value;

import java.nio.file.Path;

@Value
public class SourceRoot {
    Path path;
}
