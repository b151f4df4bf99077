package io.kcl.tools.ls.lsp;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import io.kcl.tools.ls.LanguageServiceException;

public final class JsonUtil {

    private static final Gson GSON = new Gson();

    private JsonUtil() {
    }

    /**
     * @param what name of the expected value, used in the error message
     * @throws DeserializationException when {@code json} does not fit {@code type}
     */
    public static <T> T fromJson(String what, JsonElement json, Class<T> type) {
        try {
            T value = GSON.fromJson(json == null ? JsonNull.INSTANCE : json, type);
            if (value == null) {
                throw new JsonParseException("null value");
            }
            return value;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new DeserializationException("could not deserialize " + what + ": " + e.getMessage() + ": " + json, e);
        }
    }

    public static JsonElement toJson(Object value) {
        try {
            return GSON.toJsonTree(value);
        } catch (RuntimeException e) {
            throw new LanguageServiceException("could not serialize to json: " + e.getMessage(), e);
        }
    }
}
