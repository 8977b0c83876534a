package io.cliphub.envelope;

import io.cliphub.core.error.HubError;
import io.cliphub.core.error.Result;
import io.cliphub.core.model.DataItem;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalization and encoding validation of inbound DataItems. Pure functions, no shared state.
 */
public final class DataItems {

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/=]+$");
    private static final Pattern HEX = Pattern.compile("^[0-9a-f]+$");

    private DataItems() {
    }

    /**
     * Normalizes a single object or an array of objects into DataItems.
     * <p>
     * The topic comes from each item, falling back to {@code topicFallback}. Fields other than
     * {@code topic}, {@code value}, {@code valueType} and {@code valueEncoding} are dropped.
     *
     * @param input         an org.json value, usually a {@link JSONObject} or {@link JSONArray}
     * @param topicFallback topic used for items that do not name one, may be {@code null}
     * @return the items in input order, or a validation error
     */
    public static Result<List<DataItem>> normalize(final Object input, final String topicFallback) {
        if (input == null || JSONObject.NULL.equals(input)) {
            return Result.err(HubError.validation("data is required"));
        }

        final List<Object> raw = new ArrayList<>();
        if (input instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) raw.add(array.opt(i));
        } else if (input instanceof JSONObject) {
            raw.add(input);
        } else {
            return Result.err(HubError.validation("data must be an object or array of objects"));
        }

        final List<DataItem> items = new ArrayList<>(raw.size());
        for (final Object element : raw) {
            if (!(element instanceof JSONObject it)) {
                return Result.err(HubError.validation("each data item must be an object"));
            }

            String topic = it.optString("topic", "");
            if (topic.isEmpty()) topic = topicFallback;
            if (topic == null || topic.isEmpty()) {
                return Result.err(HubError.validation("data.topic is required"));
            }

            final Object value = it.opt("value");
            final String valueType = optText(it, "valueType");
            final String valueEncoding = optText(it, "valueEncoding");

            final Result<Void> check = validateEncoding(valueType, valueEncoding, value);
            if (!check.isOk()) return Result.err(check.error());

            items.add(new DataItem(topic, value, valueType, valueEncoding));
        }
        return Result.ok(List.copyOf(items));
    }

    /**
     * Checks binary payload constraints; a no-op unless {@code valueType} is {@code "binary"}.
     * <ul>
     *     <li>hex: lowercase, even length, no {@code 0x} prefix, no separators</li>
     *     <li>base64: standard alphabet, padded, must decode</li>
     * </ul>
     */
    public static Result<Void> validateEncoding(final String valueType,
                                                final String valueEncoding,
                                                final Object value) {
        if (!DataItem.BINARY.equals(valueType)) return Result.ok(null);

        if (!(value instanceof String text)) {
            return Result.err(HubError.validation("binary value must be a string"));
        }

        if (DataItem.HEX.equals(valueEncoding)) {
            if (!HEX.matcher(text).matches()) {
                return Result.err(HubError.validation("hex must be lowercase, no 0x and no separators"));
            }
            if (text.length() % 2 != 0) {
                return Result.err(HubError.validation("hex must have an even number of digits"));
            }
            return Result.ok(null);
        }

        if (DataItem.BASE64.equals(valueEncoding)) {
            if (!text.isEmpty() && !BASE64.matcher(text).matches()) {
                return Result.err(HubError.validation("invalid base64 characters"));
            }
            if (text.length() % 4 != 0) {
                return Result.err(HubError.validation("invalid base64"));
            }
            try {
                Base64.getDecoder().decode(text);
            } catch (final IllegalArgumentException e) {
                return Result.err(HubError.validation("invalid base64"));
            }
            return Result.ok(null);
        }

        return Result.err(HubError.validation("valueEncoding must be 'base64' or 'hex'"));
    }

    /**
     * Decodes a validated binary value to raw bytes.
     *
     * @throws IllegalArgumentException if the item is not binary or its encoding is unknown
     */
    public static byte[] decodeBinary(final DataItem item) {
        if (!item.isBinary() || !(item.value() instanceof String text)) {
            throw new IllegalArgumentException("not a binary item: " + item.topic());
        }
        if (DataItem.BASE64.equals(item.valueEncoding())) return Base64.getDecoder().decode(text);
        if (DataItem.HEX.equals(item.valueEncoding())) return HexFormat.of().parseHex(text);
        throw new IllegalArgumentException("unknown valueEncoding: " + item.valueEncoding());
    }

    private static String optText(final JSONObject json, final String key) {
        final Object v = json.opt(key);
        if (v == null || JSONObject.NULL.equals(v)) return null;
        final String s = v.toString();
        return s.isEmpty() ? null : s;
    }
}
