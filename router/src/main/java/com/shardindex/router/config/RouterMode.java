package com.shardindex.router.config;

public enum RouterMode {
    IN_PROCESS,
    DISTRIBUTED
}
