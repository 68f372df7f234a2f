package com.servicetemplate.common.util;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;

/**
 * Renders configuration objects as JSON with {@link Sensitive} fields masked.
 * <p>
 * Keys come from {@link SerializedName} when present, otherwise from the field name. Fields
 * inherited from superclasses are flattened into the same object.
 */
public final class MaskedJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private static final String MASK = "****";

    private MaskedJson() {}

    public static String toJson(Object value) {
        if (value == null) {
            return "{}";
        }
        return GSON.toJson(toTree(value));
    }

    /**
     * Masks a secret: first two and last two characters kept for values of eight or more
     * characters, fully masked otherwise.
     */
    public static String mask(String value) {
        if (value != null && value.length() >= 8) {
            return value.substring(0, 2) + MASK + value.substring(value.length() - 2);
        }
        return MASK;
    }

    static JsonElement toTree(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof String text) {
            return new JsonPrimitive(text);
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        if (value instanceof Character character) {
            return new JsonPrimitive(character);
        }
        if (value instanceof Enum<?> constant) {
            return new JsonPrimitive(constant.name());
        }
        if (value instanceof Map<?, ?> map) {
            JsonObject object = new JsonObject();
            map.forEach((k, v) -> object.add(String.valueOf(k), toTree(v)));
            return object;
        }
        if (value instanceof Collection<?> collection) {
            JsonArray array = new JsonArray();
            collection.forEach(item -> array.add(toTree(item)));
            return array;
        }
        if (value.getClass().isArray()) {
            JsonArray array = new JsonArray();
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                array.add(toTree(Array.get(value, i)));
            }
            return array;
        }
        if (value.getClass().getName().startsWith("java.")) {
            // JDK value types (Path, Duration, URI...) are closed to reflection
            return new JsonPrimitive(value.toString());
        }
        return toObject(value);
    }

    private static JsonObject toObject(Object value) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> type = value.getClass(); type != null && type != Object.class; type = type.getSuperclass()) {
            hierarchy.push(type);
        }

        JsonObject object = new JsonObject();
        for (Class<?> type : hierarchy) {
            for (Field field : type.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                object.add(keyOf(field), fieldValue(field, value));
            }
        }
        return object;
    }

    private static JsonElement fieldValue(Field field, Object owner) {
        Object fieldValue;
        try {
            field.setAccessible(true);
            fieldValue = field.get(owner);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new IllegalStateException("Cannot read field " + field.getName() + " of "
                    + owner.getClass().getName(), e);
        }
        if (field.isAnnotationPresent(Sensitive.class) && (fieldValue == null || fieldValue instanceof String)) {
            return new JsonPrimitive(mask((String) fieldValue));
        }
        return toTree(fieldValue);
    }

    private static String keyOf(Field field) {
        SerializedName name = field.getAnnotation(SerializedName.class);
        return name != null ? name.value() : field.getName();
    }
}
