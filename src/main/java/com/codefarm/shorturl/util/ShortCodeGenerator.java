package com.codefarm.shorturl.util;

import com.codefarm.shorturl.config.ShortUrlProperties;
import com.codefarm.shorturl.exception.ShortCodeConflictException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints short codes from a Snowflake style composite: 41 bits of milliseconds since
 * 2021-01-01, 10 bits of machine id and 12 bits of sequence, base62 encoded.
 * <p>
 * The sequence is a plain atomic counter that wraps every 4096 calls and only resets on
 * restart. Recently issued codes are remembered in a bounded cache so an obvious
 * duplicate is skipped before it reaches the store; the unique index on the short code
 * column remains the real guarantee.
 */
@Component
public class ShortCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ShortCodeGenerator.class);

    static final long EPOCH_START = 1609459200000L; // 2021-01-01

    private static final long SEQUENCE_BITS = 12L;
    private static final long MACHINE_ID_BITS = 10L;

    static final long MAX_MACHINE_ID = (1L << MACHINE_ID_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private static final long MACHINE_ID_SHIFT = SEQUENCE_BITS;
    private static final long TIMESTAMP_SHIFT = SEQUENCE_BITS + MACHINE_ID_BITS;

    private final long machineId;
    private final int maxAttempts;
    private final Base62Encoder encoder;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Cache<String, Boolean> recentCodes;

    @Autowired
    public ShortCodeGenerator(
            @Value("${snowflake.machine.id:-1}") long configuredMachineId,
            ShortUrlProperties properties,
            Base62Encoder encoder,
            Clock clock) {
        this(resolveMachineId(configuredMachineId),
                properties.generator().recentCodesSize(),
                properties.generator().maxAttempts(),
                encoder,
                clock);
    }

    ShortCodeGenerator(long machineId, long recentCodesSize, int maxAttempts, Base62Encoder encoder, Clock clock) {
        if (machineId > MAX_MACHINE_ID || machineId < 0) {
            throw new IllegalArgumentException("Machine ID out of range: " + machineId);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one generation attempt is required");
        }
        this.machineId = machineId;
        this.maxAttempts = maxAttempts;
        this.encoder = encoder;
        this.clock = clock;
        this.recentCodes = Caffeine.newBuilder()
                .maximumSize(recentCodesSize)
                .executor(Runnable::run)
                .build();
    }

    /**
     * @return a code not issued recently by this process
     * @throws ShortCodeConflictException if every attempt hit a recently issued code
     */
    public String nextCode() {
        long timestamp = clock.millis() - EPOCH_START;
        if (timestamp < 0) {
            throw new IllegalStateException("Clock is set before the short code epoch");
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long seq = sequence.getAndIncrement() & SEQUENCE_MASK;
            String code = encoder.toBase62(compose(timestamp, seq));
            if (recentCodes.asMap().putIfAbsent(code, Boolean.TRUE) == null) {
                return code;
            }
            log.debug("Short code {} was issued recently, taking next sequence (attempt {}/{})",
                    code, attempt, maxAttempts);
        }
        throw new ShortCodeConflictException("Could not generate a free short code after " + maxAttempts + " attempts");
    }

    /**
     * Records a code that entered the store by another route, such as a custom alias.
     */
    public void markIssued(String code) {
        recentCodes.put(code, Boolean.TRUE);
    }

    long compose(long timestamp, long seq) {
        return (timestamp << TIMESTAMP_SHIFT)
                | (machineId << MACHINE_ID_SHIFT)
                | seq;
    }

    static long resolveMachineId(long configured) {
        if (configured >= 0) {
            return configured;
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = System.getenv().getOrDefault("HOSTNAME", "localhost");
            log.warn("Could not resolve local host name, deriving machine id from {}", host, e);
        }
        long derived = host.hashCode() & MAX_MACHINE_ID;
        log.info("Derived short code machine id {} from host {}", derived, host);
        return derived;
    }
}
