package com.signalrelay.common.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.common.exception.SignalParseException;
import com.signalrelay.common.model.ClassifiedSignal;
import com.signalrelay.common.model.Signal;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * Turns raw webhook bytes into a {@link ClassifiedSignal}.
 *
 * <p>The body is decoded as JSON whatever content type the caller declared. A body that is
 * a JSON string holding a JSON object (double-encoded by some alerting tools) is unwrapped
 * once. Validation rules:
 * <ul>
 *   <li>{@code action}, {@code ticker}: required, non-blank text</li>
 *   <li>{@code price}: required; a JSON number or a numeric string, finite</li>
 *   <li>{@code sl}, {@code tp1..tp3}: optional, default 0.0, same numeric rules</li>
 *   <li>{@code date} ({@code yyyy-MM-dd}), {@code time} ({@code HH:mm:ss}): optional,
 *       filled from the clock when absent, rejected when malformed</li>
 * </ul>
 * Any violation raises {@link SignalParseException}.
 *
 * <p>{@link #parseRow(JsonNode)} reads rows returned by the persistence sink with a looser
 * timestamp policy: a date is mandatory, an unreadable time falls back to midnight, and
 * ISO date-time values are accepted for both.
 */
public class SignalParser {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SignalParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    /**
     * Decodes, validates, timestamps and classifies one inbound body.
     *
     * @throws SignalParseException when the body is not a valid signal
     */
    public ClassifiedSignal parse(byte[] raw) {
        JsonNode body = decode(raw);
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);

        LocalDate date = body.hasNonNull("date")
            ? parseDate(requireText(body, "date"))
            : now.toLocalDate();
        LocalTime time = body.hasNonNull("time")
            ? parseTime(requireText(body, "time"))
            : now.toLocalTime();

        return ClassifiedSignal.of(toSignal(body, date, time, false));
    }

    /**
     * Reads one stored row from the persistence sink. Blank optional number cells read
     * as 0.0, since spreadsheet-backed sinks store empty cells as {@code ""}.
     *
     * @throws SignalParseException when the row lacks a required field or a readable date
     */
    public Signal parseRow(JsonNode row) {
        if (row == null || !row.isObject()) {
            throw new SignalParseException("history row must be a JSON object");
        }
        if (!row.hasNonNull("date")) {
            throw new SignalParseException("field 'date' is required");
        }
        LocalDate date = parseDate(row.get("date").asText());
        LocalTime time;
        try {
            time = row.hasNonNull("time") ? parseTime(row.get("time").asText()) : LocalTime.MIDNIGHT;
        } catch (SignalParseException e) {
            time = LocalTime.MIDNIGHT;
        }
        return toSignal(row, date, time, true);
    }

    // ── decoding ────────────────────────────────────────────────────────────

    private JsonNode decode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new SignalParseException("request body is empty");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
            if (node != null && node.isTextual()) {
                node = objectMapper.readTree(node.asText());
            }
        } catch (JsonProcessingException e) {
            throw new SignalParseException("body is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SignalParseException("body could not be read: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new SignalParseException("body must be a JSON object");
        }
        return node;
    }

    // ── field validation ────────────────────────────────────────────────────

    private Signal toSignal(JsonNode node, LocalDate date, LocalTime time, boolean blankAsZero) {
        return new Signal(
            requireText(node, "action"),
            requireText(node, "ticker"),
            requireNumber(node, "price"),
            optionalNumber(node, "sl", blankAsZero),
            optionalNumber(node, "tp1", blankAsZero),
            optionalNumber(node, "tp2", blankAsZero),
            optionalNumber(node, "tp3", blankAsZero),
            optionalText(node, "result"),
            optionalText(node, "comment"),
            optionalText(node, "chat_id"),
            optionalText(node, "text"),
            date,
            time);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SignalParseException("field '" + field + "' is required");
        }
        if (!value.isValueNode()) {
            throw new SignalParseException("field '" + field + "' must be a string");
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            throw new SignalParseException("field '" + field + "' must not be blank");
        }
        return text;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.isValueNode()) {
            throw new SignalParseException("field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static double requireNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SignalParseException("field '" + field + "' is required");
        }
        return toNumber(value, field);
    }

    private static double optionalNumber(JsonNode node, String field, boolean blankAsZero) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return 0.0;
        if (blankAsZero && value.isTextual() && value.asText().isBlank()) return 0.0;
        return toNumber(value, field);
    }

    private static double toNumber(JsonNode value, String field) {
        double number;
        if (value.isNumber()) {
            number = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                number = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new SignalParseException("field '" + field + "' is not a number: '" + value.asText() + "'");
            }
        } else {
            throw new SignalParseException("field '" + field + "' must be a number");
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new SignalParseException("field '" + field + "' must be a finite number");
        }
        return number;
    }

    // ── timestamps ──────────────────────────────────────────────────────────

    private LocalDate parseDate(String value) {
        String v = value.trim();
        try {
            return LocalDate.parse(v, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            LocalDateTime dateTime = parseIsoDateTime(v);
            if (dateTime != null) return dateTime.toLocalDate();
            throw new SignalParseException("field 'date' must be yyyy-MM-dd, got '" + value + "'");
        }
    }

    private LocalTime parseTime(String value) {
        String v = value.trim();
        try {
            return LocalTime.parse(v, DateTimeFormatter.ISO_LOCAL_TIME).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException e) {
            LocalDateTime dateTime = parseIsoDateTime(v);
            if (dateTime != null) return dateTime.toLocalTime().truncatedTo(ChronoUnit.SECONDS);
            throw new SignalParseException("field 'time' must be HH:mm:ss, got '" + value + "'");
        }
    }

    /** ISO date-time with or without offset; offset values are shifted into the service zone. */
    private LocalDateTime parseIsoDateTime(String value) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.atZoneSameInstant(clock.getZone()).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
