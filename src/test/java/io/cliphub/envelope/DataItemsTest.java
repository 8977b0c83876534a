package io.cliphub.envelope;

import io.cliphub.core.error.ErrorKind;
import io.cliphub.core.error.Result;
import io.cliphub.core.model.DataItem;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DataItemsTest {

    @Test
    void singleObjectBecomesOneItem() {
        final Result<List<DataItem>> r = DataItems.normalize(new JSONObject().put("topic", "c").put("value", "hello"), null);

        assertTrue(r.isOk());
        assertEquals(List.of(DataItem.of("c", "hello")), r.value());
    }

    @Test
    void arrayKeepsOrderAndUsesFallbackTopic() {
        final JSONArray input = new JSONArray()
                .put(new JSONObject().put("value", 1))
                .put(new JSONObject().put("topic", "p").put("value", 2));

        final List<DataItem> items = DataItems.normalize(input, "c").value();

        assertEquals(2, items.size());
        assertEquals("c", items.get(0).topic());
        assertEquals("p", items.get(1).topic());
    }

    @Test
    void unknownFieldsAreDropped() {
        final JSONObject in = new JSONObject().put("topic", "c").put("value", "x").put("extra", true);

        final JSONObject out = DataItems.normalize(in, null).value().get(0).toJson();

        assertFalse(out.has("extra"));
    }

    @Test
    void missingValueIsNull() {
        final DataItem item = DataItems.normalize(new JSONObject().put("topic", "c"), null).value().get(0);

        assertEquals(JSONObject.NULL, item.value());
    }

    @Test
    void rejectsMissingInputAndTopic() {
        assertEquals("data is required", DataItems.normalize(null, "c").error().message());
        assertEquals("data.topic is required", DataItems.normalize(new JSONObject().put("value", 1), null).error().message());
        assertEquals(ErrorKind.VALIDATION, DataItems.normalize("text", "c").error().kind());
        assertEquals("each data item must be an object",
                DataItems.normalize(new JSONArray().put(3), "c").error().message());
    }

    @Test
    void hexMustBeLowercaseEvenWithoutPrefix() {
        assertTrue(DataItems.validateEncoding("binary", "hex", "00ff10").isOk());

        assertFalse(DataItems.validateEncoding("binary", "hex", "00FF").isOk());
        assertFalse(DataItems.validateEncoding("binary", "hex", "0x00").isOk());
        assertFalse(DataItems.validateEncoding("binary", "hex", "00 ff").isOk());
        assertFalse(DataItems.validateEncoding("binary", "hex", "abc").isOk());
        assertFalse(DataItems.validateEncoding("binary", "hex", "").isOk());
    }

    @Test
    void base64MustBePaddedStandardAlphabet() {
        assertTrue(DataItems.validateEncoding("binary", "base64", "aGVsbG8=").isOk());
        assertTrue(DataItems.validateEncoding("binary", "base64", "").isOk());

        assertFalse(DataItems.validateEncoding("binary", "base64", "aGVsbG8").isOk());
        assertFalse(DataItems.validateEncoding("binary", "base64", "aGV-bG8=").isOk());
        assertFalse(DataItems.validateEncoding("binary", "base64", "a===").isOk());
    }

    @Test
    void binaryRequiresStringValueAndKnownEncoding() {
        assertEquals("binary value must be a string",
                DataItems.validateEncoding("binary", "base64", 42).error().message());
        assertEquals("valueEncoding must be 'base64' or 'hex'",
                DataItems.validateEncoding("binary", "utf-16", "abcd").error().message());
    }

    @Test
    void nonBinaryTypesPassThrough() {
        assertTrue(DataItems.validateEncoding(null, null, 42).isOk());
        assertTrue(DataItems.validateEncoding("text", "whatever", "x").isOk());

        final DataItem item = DataItems.normalize(new JSONObject()
                .put("topic", "c").put("value", "x").put("valueType", "text"), null).value().get(0);
        assertEquals("text", item.valueType());
    }

    @Test
    void invalidBinaryItemFailsTheWholeBatch() {
        final JSONArray input = new JSONArray()
                .put(new JSONObject().put("topic", "c").put("value", "ok"))
                .put(new JSONObject().put("topic", "p").put("value", "zz").put("valueType", "binary").put("valueEncoding", "hex"));

        assertFalse(DataItems.normalize(input, null).isOk());
    }

    @Test
    void decodesBothEncodingsToTheSameBytes() {
        final byte[] b64 = DataItems.decodeBinary(DataItem.binary("c", "aGk=", DataItem.BASE64));
        final byte[] hex = DataItems.decodeBinary(DataItem.binary("c", "6869", DataItem.HEX));

        assertArrayEquals("hi".getBytes(StandardCharsets.UTF_8), b64);
        assertArrayEquals(b64, hex);
        assertThrows(IllegalArgumentException.class, () -> DataItems.decodeBinary(DataItem.of("c", "hi")));
    }
}
