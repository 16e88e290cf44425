package io.github.chirino.atlas.api.dto;

import java.util.List;

/**
 * One field filter. Exactly one of {@code value}, {@code values} or the {@code from}/{@code to}
 * range should be set.
 */
public class FilterDto {

    private String field;
    private String value;
    private List<String> values;
    private String from;
    private String to;

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public List<String> getValues() {
        return values;
    }

    public void setValues(List<String> values) {
        this.values = values;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }
}
