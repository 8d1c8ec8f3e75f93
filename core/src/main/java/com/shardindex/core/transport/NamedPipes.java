package com.shardindex.core.transport;

import java.nio.file.Path;

/**
 * Maps pipe names onto the domain-socket files that serve them.
 * <p>
 * {@code \\.\pipe\shard-index} and {@code shard-index} both resolve to
 * {@code <java.io.tmpdir>/shard-index.pipe}.
 * </p>
 */
public final class NamedPipes {
    private NamedPipes() {
    }

    private static final String WINDOWS_PREFIX = "\\\\.\\pipe\\";

    public static Path socketPath(String pipeName) {
        String name = pipeName.startsWith(WINDOWS_PREFIX)
                ? pipeName.substring(WINDOWS_PREFIX.length())
                : pipeName;
        if (name.isEmpty()) {
            throw new IllegalArgumentException("empty pipe name: " + pipeName);
        }
        StringBuilder safe = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            safe.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' ? c : '_');
        }
        return Path.of(System.getProperty("java.io.tmpdir"), safe + ".pipe");
    }

    /**
     * Filesystem path of a local (domain socket or named pipe) address.
     */
    public static Path localPath(TransportAddress address) {
        switch (address.getKind()) {
            case UNIX:
                return address.path();
            case NAMED_PIPE:
                return socketPath(address.getLocation());
            default:
                throw new IllegalArgumentException("not a local transport: " + address);
        }
    }
}
