package com.phillippitts.voicenotes.service.extraction;

import com.phillippitts.voicenotes.domain.DraftData;
import com.phillippitts.voicenotes.domain.ExtractedContent;
import com.phillippitts.voicenotes.domain.Intent;
import com.phillippitts.voicenotes.domain.IntentData;
import com.phillippitts.voicenotes.domain.NoteData;
import com.phillippitts.voicenotes.domain.ResearchData;
import com.phillippitts.voicenotes.domain.TodoData;
import com.phillippitts.voicenotes.domain.TodoEntry;
import com.phillippitts.voicenotes.domain.VoiceItem;
import com.phillippitts.voicenotes.exception.SchemaValidationException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Re-validates structured-generation output client-side and maps it onto the sealed
 * {@link IntentData} branches.
 *
 * <p>Rejects, with {@link SchemaValidationException}: non-JSON content, missing or mistyped
 * required fields, unknown intents, a tag count outside 2..5, and any populated data field
 * that does not belong to the declared intent (or a missing one that does).
 */
public final class ExtractedContentParser {

    private ExtractedContentParser() {}

    public static ExtractedContent parse(String content) {
        if (content == null || content.isBlank()) {
            throw new SchemaValidationException("response content is empty", null);
        }
        JSONObject json;
        try {
            json = new JSONObject(content);
        } catch (JSONException e) {
            throw new SchemaValidationException("response content is not a JSON object", null, e);
        }

        String title = requireString(json, "title");
        String summary = requireString(json, "summary");
        List<String> tags = requireStringList(json, "tags");
        if (tags.size() < VoiceItem.MIN_TAGS || tags.size() > VoiceItem.MAX_TAGS) {
            throw new SchemaValidationException("expected " + VoiceItem.MIN_TAGS + "-" + VoiceItem.MAX_TAGS
                    + " tags, got " + tags.size(), "tags");
        }
        List<String> keyFacts = requireStringList(json, "keyFacts");
        Intent intent = requireIntent(json);

        JSONObject data = json.optJSONObject("data");
        if (data == null) {
            throw new SchemaValidationException("missing object field", "data");
        }
        return new ExtractedContent(title, tags, summary, keyFacts, toIntentData(intent, data));
    }

    static IntentData toIntentData(Intent intent, JSONObject data) {
        boolean hasTodos = present(data, "todos");
        boolean hasResearch = present(data, "researchAnswer");
        boolean hasDraft = present(data, "draftContent");

        switch (intent) {
            case TODO:
                requireExclusive(intent, hasTodos, hasResearch || hasDraft, "data.todos");
                return new TodoData(parseTodos(data));
            case RESEARCH:
                requireExclusive(intent, hasResearch, hasTodos || hasDraft, "data.researchAnswer");
                return new ResearchData(stringField(data, "researchAnswer"));
            case DRAFT:
                requireExclusive(intent, hasDraft, hasTodos || hasResearch, "data.draftContent");
                return new DraftData(stringField(data, "draftContent"));
            case NOTE:
                if (hasTodos || hasResearch || hasDraft) {
                    throw new SchemaValidationException("intent NOTE must not populate any data field", "data");
                }
                return new NoteData();
            default:
                throw new SchemaValidationException("unsupported intent " + intent, "intent");
        }
    }

    private static void requireExclusive(Intent intent, boolean ownPresent, boolean foreignPresent, String field) {
        if (!ownPresent) {
            throw new SchemaValidationException("intent " + intent + " requires " + field, field);
        }
        if (foreignPresent) {
            throw new SchemaValidationException("intent " + intent + " must populate only " + field, "data");
        }
    }

    private static List<TodoEntry> parseTodos(JSONObject data) {
        JSONArray array = data.optJSONArray("todos");
        if (array == null) {
            throw new SchemaValidationException("expected an array", "data.todos");
        }
        List<TodoEntry> todos = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            String field = "data.todos[" + i + "]";
            if (item == null) {
                throw new SchemaValidationException("expected an object", field);
            }
            Object task = item.opt("task");
            if (!(task instanceof String taskText) || taskText.isBlank()) {
                throw new SchemaValidationException("missing task", field + ".task");
            }
            Object done = item.opt("done");
            if (done != null && !JSONObject.NULL.equals(done) && !(done instanceof Boolean)) {
                throw new SchemaValidationException("done must be a boolean", field + ".done");
            }
            String due = item.isNull("due") ? null : item.optString("due", null);
            todos.add(new TodoEntry(taskText, Boolean.TRUE.equals(done), due == null || due.isBlank() ? null : due));
        }
        return todos;
    }

    private static boolean present(JSONObject data, String key) {
        return data.has(key) && !data.isNull(key);
    }

    private static String stringField(JSONObject data, String key) {
        Object value = data.opt(key);
        if (!(value instanceof String text)) {
            throw new SchemaValidationException("expected a string", "data." + key);
        }
        return text;
    }

    private static String requireString(JSONObject json, String key) {
        Object value = json.opt(key);
        if (!(value instanceof String text)) {
            throw new SchemaValidationException("missing string field", key);
        }
        return text;
    }

    private static List<String> requireStringList(JSONObject json, String key) {
        JSONArray array = json.optJSONArray(key);
        if (array == null) {
            throw new SchemaValidationException("missing array field", key);
        }
        List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object value = array.opt(i);
            if (!(value instanceof String text)) {
                throw new SchemaValidationException("expected a string", key + "[" + i + "]");
            }
            values.add(text);
        }
        return values;
    }

    private static Intent requireIntent(JSONObject json) {
        String value = requireString(json, "intent");
        try {
            return Intent.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException("unknown intent '" + value + "'", "intent", e);
        }
    }
}
