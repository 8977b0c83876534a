package io.cliphub.selection;

import org.json.JSONObject;

import java.util.Map;

/**
 * Result of probing the selection tool at startup.
 */
public record SelectionHealth(String path,
                              boolean exists,
                              boolean executable,
                              boolean inPath,
                              Map<Selection, Boolean> readable,
                              boolean ok) {

    public SelectionHealth {
        readable = Map.copyOf(readable);
    }

    public JSONObject toJson() {
        final JSONObject selections = new JSONObject();
        readable.forEach((sel, readOk) -> selections.put(sel.label(), new JSONObject().put("readOk", readOk)));
        return new JSONObject()
                .put("path", path)
                .put("exists", exists)
                .put("executable", executable)
                .put("inPath", inPath)
                .put("selections", selections)
                .put("ok", ok);
    }
}
