package com.shardindex.router.handshake;

import com.shardindex.core.msg.RpcMessages.WorkerHello;
import com.shardindex.core.transport.PeerIdentity;
import com.shardindex.router.config.FingerprintAllowlist;
import com.shardindex.router.error.HandshakeRejectedException;
import com.shardindex.router.state.RouterState;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Decides whether a worker hello is admitted.
 * <p>
 * Checks run in a fixed order: shared-secret token, TLS fingerprint allowlist, then shard
 * availability. Only an admitted hello reserves a worker id; a rejection leaves the state
 * untouched.
 * </p>
 */
public class WorkerAdmission {
    private final RouterState state;
    private final String authToken;
    private final FingerprintAllowlist allowlist;

    public WorkerAdmission(RouterState state, String authToken, FingerprintAllowlist allowlist) {
        this.state = state;
        this.authToken = authToken;
        this.allowlist = allowlist;
    }

    /**
     * @return Worker id reserved for the shard
     * @throws HandshakeRejectedException with the reason and the message to send back
     */
    public int admit(WorkerHello hello, PeerIdentity identity) {
        if (authToken != null && !tokenMatches(hello.getAuthToken())) {
            throw new HandshakeRejectedException("bad_token", "authentication failed");
        }
        int shardId = hello.getShardId();
        if (allowlist.isEnforcedFor(shardId) && !allowlist.allows(shardId, identity)) {
            throw new HandshakeRejectedException("unauthorized", "shard authorization failed");
        }
        return state.reserveWorker(shardId);
    }

    private boolean tokenMatches(String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
            authToken.getBytes(StandardCharsets.UTF_8),
            presented.getBytes(StandardCharsets.UTF_8));
    }
}
