package com.kotsin.scanner.data;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * HistoricalCandle - one row of the history API's candle response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoricalCandle {

    @JsonAlias({"Datetime", "datetime", "DateTime", "Date", "date", "timestamp"})
    private String datetime;

    @JsonAlias({"Open", "open"})
    private double open;

    @JsonAlias({"High", "high"})
    private double high;

    @JsonAlias({"Low", "low"})
    private double low;

    @JsonAlias({"Close", "close"})
    private double close;

    @JsonAlias({"Volume", "volume"})
    private double volume;

    /**
     * Parse the row timestamp. Accepts ISO instants, offset date-times and zone-less
     * date-times (read as UTC). Empty when the value cannot be parsed.
     */
    public Optional<Instant> getTimestampAsInstant() {
        if (datetime == null || datetime.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    datetime.trim().replace(' ', 'T'), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
