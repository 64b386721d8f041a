package com.phillippitts.voicenotes.service.extraction;

import com.phillippitts.voicenotes.domain.Intent;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON Schema of the structured-generation output, sent as a strict {@code response_format}.
 *
 * <p>Strict mode requires every property to be listed as required; optional values are
 * expressed as a union with {@code null}.
 */
public final class VoiceItemSchema {

    public static final String NAME = "voice_item";

    private VoiceItemSchema() {}

    public static JSONObject schema() {
        JSONObject todo = object()
                .put("properties", new JSONObject()
                        .put("task", type("string"))
                        .put("done", type("boolean"))
                        .put("due", nullable("string")))
                .put("required", new JSONArray().put("task").put("done").put("due"));

        JSONObject data = object()
                .put("properties", new JSONObject()
                        .put("todos", new JSONObject()
                                .put("type", new JSONArray().put("array").put("null"))
                                .put("items", todo)
                                .put("description", "List of action items if intent is TODO"))
                        .put("researchAnswer", nullable("string")
                                .put("description", "Answer to the question if intent is RESEARCH"))
                        .put("draftContent", nullable("string")
                                .put("description", "Polished, ready-to-use text if intent is DRAFT")))
                .put("required", new JSONArray().put("todos").put("researchAnswer").put("draftContent"));

        JSONArray intents = new JSONArray();
        for (Intent intent : Intent.values()) {
            intents.put(intent.name());
        }

        return object()
                .put("properties", new JSONObject()
                        .put("title", type("string").put("description", "A short, descriptive title (max 60 characters)"))
                        .put("tags", new JSONObject().put("type", "array").put("items", type("string"))
                                .put("description", "2-5 relevant tags for categorization"))
                        .put("summary", type("string").put("description", "A 2-3 sentence summary of the content"))
                        .put("keyFacts", new JSONObject().put("type", "array").put("items", type("string"))
                                .put("description", "Hard facts like names, dates, amounts"))
                        .put("intent", type("string").put("enum", intents)
                                .put("description", "The primary intent of the voice input"))
                        .put("data", data))
                .put("required", new JSONArray()
                        .put("title").put("tags").put("summary").put("keyFacts").put("intent").put("data"));
    }

    /** The {@code response_format} object for a chat completion request. */
    public static JSONObject responseFormat() {
        return new JSONObject()
                .put("type", "json_schema")
                .put("json_schema", new JSONObject()
                        .put("name", NAME)
                        .put("strict", true)
                        .put("schema", schema()));
    }

    private static JSONObject object() {
        return new JSONObject().put("type", "object").put("additionalProperties", false);
    }

    private static JSONObject type(String type) {
        return new JSONObject().put("type", type);
    }

    private static JSONObject nullable(String type) {
        return new JSONObject().put("type", new JSONArray().put(type).put("null"));
    }
}
