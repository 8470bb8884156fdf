package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.ColumnType;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes the timestamp encodings that show up in collection-format results.
 *
 * <p>Encodings are tried in declaration order of {@link Encoding} and the first one that parses
 * wins. Text without an offset is read as UTC.
 */
public final class TimestampParser {

    public static final Instant ZERO_INSTANT = (Instant) ColumnType.TIMESTAMP.zeroValue();

    private static final DateTimeFormatter NATIVE_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter INTERNET_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter BARE_FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    // shortest accepted text: "yyyy-MM-dd HH:mm:ss"
    private static final int MIN_LENGTH = 19;

    public enum Encoding {
        /** {@code yyyy-MM-dd HH:mm:ss} with up to nine optional fractional digits. */
        NATIVE {
            @Override
            Instant parseExact(String text) {
                return LocalDateTime.parse(text, NATIVE_FORMAT).toInstant(ZoneOffset.UTC);
            }
        },
        /** RFC 3339 date-time with {@code T} separator and an offset or {@code Z}. */
        INTERNET {
            @Override
            Instant parseExact(String text) {
                return OffsetDateTime.parse(text, INTERNET_FORMAT).toInstant();
            }
        },
        /** {@code yyyy-MM-dd HH:mm:ss}, no fraction, no zone. */
        BARE {
            @Override
            Instant parseExact(String text) {
                return LocalDateTime.parse(text, BARE_FORMAT).toInstant(ZoneOffset.UTC);
            }
        };

        abstract Instant parseExact(String text);
    }

    public record ParsedTimestamp(Instant instant, Encoding encoding) {}

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String text) {
        return parseWithEncoding(text).map(ParsedTimestamp::instant);
    }

    public static Optional<ParsedTimestamp> parseWithEncoding(String text) {
        if (!looksLikeDateTime(text)) {
            return Optional.empty();
        }
        for (Encoding encoding : Encoding.values()) {
            try {
                return Optional.of(new ParsedTimestamp(encoding.parseExact(text), encoding));
            } catch (DateTimeParseException e) {
                // try the next encoding
            }
        }
        return Optional.empty();
    }

    public static boolean isTimestamp(String text) {
        return parseWithEncoding(text).isPresent();
    }

    /**
     * Renders an instant in the native {@code yyyy-MM-dd HH:mm:ss} form, in UTC.
     */
    public static String format(Instant instant) {
        return BARE_FORMAT.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    private static boolean looksLikeDateTime(String text) {
        return text != null
                && text.length() >= MIN_LENGTH
                && text.charAt(4) == '-'
                && text.charAt(7) == '-';
    }
}
