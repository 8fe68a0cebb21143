package com.questrail.testkit;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Compact duration text such as "1h30m0s", "3s" or "250ms".
 */
final class Durations {

    private Durations() {
    }

    static String format(Duration d) {
        if (d.isZero()) {
            return "0s";
        }

        String sign = d.isNegative() ? "-" : "";
        Duration abs = d.abs();

        if (abs.compareTo(Duration.ofSeconds(1)) < 0) {
            long nanos = abs.toNanos();
            if (nanos % 1_000_000 == 0) {
                return sign + (nanos / 1_000_000) + "ms";
            }
            if (nanos % 1_000 == 0) {
                return sign + (nanos / 1_000) + "µs";
            }
            return sign + nanos + "ns";
        }

        long hours = abs.toHours();
        int minutes = abs.toMinutesPart();
        BigDecimal seconds = BigDecimal.valueOf(abs.toSecondsPart())
                .add(BigDecimal.valueOf(abs.toNanosPart(), 9))
                .stripTrailingZeros();

        StringBuilder b = new StringBuilder(sign);
        if (hours > 0) {
            b.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            b.append(minutes).append('m');
        }
        b.append(seconds.toPlainString()).append('s');
        return b.toString();
    }
}
