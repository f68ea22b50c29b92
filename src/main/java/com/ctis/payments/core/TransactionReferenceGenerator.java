package com.ctis.payments.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;

/**
 * Generates caller-visible references of the form {@code PAY-<epochSeconds>-<random>}.
 */
@Component
@RequiredArgsConstructor
public class TransactionReferenceGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;

    public String next() {
        long epochSeconds = clock.instant().getEpochSecond();
        String random = Long.toHexString(RANDOM.nextLong() & 0xFFFFFFFFFFL).toUpperCase(Locale.ROOT);
        return "PAY-" + epochSeconds + "-" + random;
    }
}
