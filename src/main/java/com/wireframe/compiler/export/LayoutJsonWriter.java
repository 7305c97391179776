package com.wireframe.compiler.export;

import com.google.gson.JsonObject;
import com.wireframe.compiler.layout.LayoutBox;
import com.wireframe.compiler.layout.LayoutResult;

/**
 * Serializes a layout as {@code {"<nodeId>": {"x", "y", "width", "height"}}} in placement order.
 */
public class LayoutJsonWriter {

    public String write(LayoutResult result) {
        return JsonSupport.GSON.toJson(toJson(result));
    }

    public JsonObject toJson(LayoutResult result) {
        JsonObject json = new JsonObject();
        result.asMap().forEach((id, box) -> json.add(id, box(box)));
        return json;
    }

    private static JsonObject box(LayoutBox box) {
        JsonObject json = new JsonObject();
        json.addProperty("x", box.getX());
        json.addProperty("y", box.getY());
        json.addProperty("width", box.getWidth());
        json.addProperty("height", box.getHeight());
        return json;
    }
}
