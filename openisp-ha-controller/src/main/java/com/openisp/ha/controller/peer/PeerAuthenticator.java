package com.openisp.ha.controller.peer;

import com.openisp.ha.controller.exception.ClusterAuthenticationException;
import com.openisp.ha.model.ClusterConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifies the shared cluster secret carried in peer control messages.
 */
public final class PeerAuthenticator {

    private PeerAuthenticator() {
    }

    /**
     * Checks the presented secret against the local config.
     *
     * @throws ClusterAuthenticationException if the secrets differ or either is missing
     */
    public static void verify(ClusterConfig local, String presentedSecret) {
        if (!matches(local.getClusterSecret(), presentedSecret)) {
            throw new ClusterAuthenticationException();
        }
    }

    static boolean matches(String expected, String presented) {
        if (expected == null || expected.isEmpty() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
