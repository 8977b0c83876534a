package io.cliphub.core.model;

import org.json.JSONObject;

import java.util.Objects;

/**
 * One topic/value pair, optionally carrying a binary value as encoded text.
 * <p>
 * {@code value} holds an org.json value ({@link String}, {@link Number}, {@link Boolean},
 * {@link JSONObject}, {@link org.json.JSONArray} or {@link JSONObject#NULL}).
 * Binary values stay encoded; only the selection engine decodes them to raw bytes.
 */
public record DataItem(String topic, Object value, String valueType, String valueEncoding) {

    public static final String BINARY = "binary";
    public static final String BASE64 = "base64";
    public static final String HEX = "hex";

    public DataItem {
        value = value == null ? JSONObject.NULL : value;
    }

    public static DataItem of(final String topic, final Object value) {
        return new DataItem(topic, value, null, null);
    }

    public static DataItem binary(final String topic, final String encoded, final String encoding) {
        return new DataItem(topic, encoded, BINARY, encoding);
    }

    public boolean isBinary() {
        return BINARY.equals(valueType);
    }

    public boolean hasTopic() {
        return topic != null && !topic.isEmpty();
    }

    public JSONObject toJson() {
        final JSONObject json = new JSONObject();
        json.put("topic", topic);
        json.put("value", value);
        if (valueType != null) json.put("valueType", valueType);
        if (valueEncoding != null) json.put("valueEncoding", valueEncoding);
        return json;
    }

    @Override
    public String toString() {
        return "DataItem" + toJson();
    }

    /* org.json containers do not implement equals, compare their serialized form */
    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof DataItem other)) return false;
        return Objects.equals(topic, other.topic)
                && Objects.equals(valueType, other.valueType)
                && Objects.equals(valueEncoding, other.valueEncoding)
                && JSONObject.valueToString(value).equals(JSONObject.valueToString(other.value));
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, valueType, valueEncoding);
    }
}
