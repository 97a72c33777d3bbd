package com.croppulse.decision.repository;

import com.aerospike.client.Record;

import java.time.LocalDate;

/**
 * Null-preserving bin readers. {@link Record#getDouble} and friends return 0 for a
 * missing bin, which would turn "never observed" into a real value.
 */
final class RecordBins {

    private RecordBins() {}

    static Double nullableDouble(Record record, String bin) {
        Object v = record.getValue(bin);
        return v == null ? null : ((Number) v).doubleValue();
    }

    static Boolean nullableBoolean(Record record, String bin) {
        Object v = record.getValue(bin);
        if (v == null) return null;
        if (v instanceof Boolean) return (Boolean) v;
        return ((Number) v).longValue() != 0;
    }

    static LocalDate date(Record record, String bin) {
        String v = record.getString(bin);
        return v == null || v.isEmpty() ? null : LocalDate.parse(v);
    }

    static String dateString(LocalDate date) {
        return date == null ? null : date.toString();
    }

    static boolean inRange(LocalDate date, LocalDate from, LocalDate to) {
        return date != null && !date.isBefore(from) && !date.isAfter(to);
    }
}
