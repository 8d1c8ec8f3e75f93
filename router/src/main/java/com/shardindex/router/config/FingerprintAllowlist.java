package com.shardindex.router.config;

import com.shardindex.core.transport.CertificateFingerprints;
import com.shardindex.core.transport.PeerIdentity;
import com.shardindex.router.error.ConfigException;
import lombok.Value;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * TLS client-certificate fingerprints allowed to serve shards: a global list and per-shard lists.
 */
@Value
public class FingerprintAllowlist {
    private static final FingerprintAllowlist EMPTY = new FingerprintAllowlist(Set.of(), Map.of());

    Set<String> global;
    Map<Integer, Set<String>> shards;

    public FingerprintAllowlist(Set<String> global, Map<Integer, Set<String>> shards) {
        this.global = Set.copyOf(global);
        Map<Integer, Set<String>> copy = new HashMap<>();
        shards.forEach((shard, list) -> copy.put(shard, Set.copyOf(list)));
        this.shards = Map.copyOf(copy);
    }

    public static FingerprintAllowlist empty() {
        return EMPTY;
    }

    public boolean isConfigured() {
        return !global.isEmpty() || !shards.isEmpty();
    }

    /**
     * The allowlist applies to a shard when the global list is non-empty or the shard has its own
     * entry.
     */
    public boolean isEnforcedFor(int shardId) {
        return !global.isEmpty() || shards.containsKey(shardId);
    }

    public boolean allows(int shardId, PeerIdentity identity) {
        Optional<String> fingerprint = identity.fingerprint();
        if (fingerprint.isEmpty()) {
            return false;
        }
        String fp = fingerprint.get();
        if (containsIgnoreCase(global, fp)) {
            return true;
        }
        Set<String> perShard = shards.get(shardId);
        return perShard != null && containsIgnoreCase(perShard, fp);
    }

    /**
     * Copy with every entry normalised to lower-case hex.
     *
     * @throws ConfigException if an entry is not a SHA-256 fingerprint
     */
    public FingerprintAllowlist normalized() {
        Map<Integer, Set<String>> normalizedShards = new HashMap<>();
        shards.forEach((shard, list) -> normalizedShards.put(shard, normalizeAll(list)));
        return new FingerprintAllowlist(normalizeAll(global), normalizedShards);
    }

    private static Set<String> normalizeAll(Set<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String value : values) {
            try {
                out.add(CertificateFingerprints.normalize(value));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("invalid TLS client certificate fingerprint: " + e.getMessage(), e);
            }
        }
        return out;
    }

    private static boolean containsIgnoreCase(Set<String> values, String fingerprint) {
        for (String value : values) {
            if (value.equalsIgnoreCase(fingerprint)) {
                return true;
            }
        }
        return false;
    }
}
