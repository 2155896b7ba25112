package com.mcpfactory.orchestrator.store;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Produces job ids of the form {@code job_<epochMillis>_<8 hex chars>}.
 *
 * The millisecond prefix makes ids sort lexically by creation time (13 digits
 * until the year 2286); the random suffix keeps two jobs submitted in the same
 * millisecond apart.
 */
@Component
public class JobIdGenerator {

    private static final String PREFIX = "job_";

    private final SecureRandom random = new SecureRandom();

    public String nextId() {
        byte[] suffix = new byte[4];
        random.nextBytes(suffix);
        return PREFIX + System.currentTimeMillis() + "_" + HexFormat.of().formatHex(suffix);
    }
}
