package org.iceforge.ocient.connector.service;

import java.time.Instant;

/**
 * Dashboard time-range macros. The assembler emits them and {@link #expand} resolves them to
 * quoted native timestamps just before a statement is sent.
 */
public final class TimeMacros {

    public static final String TIME_FROM = "$__timeFrom()";
    public static final String TIME_TO = "$__timeTo()";

    private TimeMacros() {
    }

    /**
     * Replaces both macros with {@code 'yyyy-MM-dd HH:mm:ss'} in UTC. A null bound leaves its
     * macro untouched.
     */
    public static String expand(String sql, Instant from, Instant to) {
        if (sql == null) return null;
        String out = sql;
        if (from != null) {
            out = out.replace(TIME_FROM, SqlLiterals.quote(TimestampParser.format(from)));
        }
        if (to != null) {
            out = out.replace(TIME_TO, SqlLiterals.quote(TimestampParser.format(to)));
        }
        return out;
    }
}
