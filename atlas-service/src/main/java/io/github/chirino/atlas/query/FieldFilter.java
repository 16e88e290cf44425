package io.github.chirino.atlas.query;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * One equality, membership or range predicate. All filters of a query are combined with AND.
 */
public final class FieldFilter {

    public enum Operator {
        EQUALS,
        IN,
        RANGE
    }

    private final FilterField field;
    private final Operator operator;
    private final List<String> values;
    private final LocalDate from;
    private final LocalDate to;

    private FieldFilter(
            FilterField field,
            Operator operator,
            List<String> values,
            LocalDate from,
            LocalDate to) {
        this.field = field;
        this.operator = operator;
        this.values = values;
        this.from = from;
        this.to = to;
    }

    public static FieldFilter equalTo(FilterField field, String value) {
        Objects.requireNonNull(value, "value");
        if (field.kind() == FilterField.Kind.PRIMARY_DATE) {
            LocalDate date = parseDate(value);
            return new FieldFilter(field, Operator.RANGE, List.of(), date, date);
        }
        return new FieldFilter(field, Operator.EQUALS, List.of(value), null, null);
    }

    public static FieldFilter in(FilterField field, List<String> values) {
        if (field.kind() == FilterField.Kind.PRIMARY_DATE) {
            throw new InvalidQueryException(
                    "primary_date supports equality and range filters only");
        }
        return new FieldFilter(field, Operator.IN, List.copyOf(values), null, null);
    }

    /** Inclusive date range; either bound may be null for an open end. */
    public static FieldFilter between(FilterField field, LocalDate from, LocalDate to) {
        if (field.kind() != FilterField.Kind.PRIMARY_DATE) {
            throw new InvalidQueryException(
                    "Range filters are only supported on primary_date, not " + field);
        }
        if (from == null && to == null) {
            throw new InvalidQueryException("A range filter needs at least one bound");
        }
        return new FieldFilter(field, Operator.RANGE, List.of(), from, to);
    }

    public static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (RuntimeException e) {
            throw new InvalidQueryException("Invalid date: " + value + " (expected yyyy-MM-dd)");
        }
    }

    public FilterField field() {
        return field;
    }

    public Operator operator() {
        return operator;
    }

    public List<String> values() {
        return values;
    }

    public LocalDate from() {
        return from;
    }

    public LocalDate to() {
        return to;
    }

    /** True when no row can ever satisfy this predicate. */
    public boolean isUnsatisfiable() {
        return switch (operator) {
            case IN -> values.isEmpty();
            case RANGE -> from != null && to != null && from.isAfter(to);
            case EQUALS -> false;
        };
    }

    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        return switch (operator) {
            case EQUALS, IN -> values.contains(candidate);
            case RANGE -> false;
        };
    }

    public boolean matches(LocalDate candidate) {
        if (candidate == null || operator != Operator.RANGE) {
            return false;
        }
        return (from == null || !candidate.isBefore(from))
                && (to == null || !candidate.isAfter(to));
    }

    @Override
    public String toString() {
        return switch (operator) {
            case EQUALS -> field + " = " + values.get(0);
            case IN -> field + " IN " + values;
            case RANGE -> field + " BETWEEN " + from + " AND " + to;
        };
    }
}
