package io.github.drompincen.sheetbridge.runtime.schema;

import java.util.Locale;

/** Derives store-safe identifiers from user labels. */
public final class SchemaNames {

    private SchemaNames() {}

    /** "Order Date (UTC)" becomes "order_date_utc"; labels starting with a digit get an "f_" prefix. */
    public static String toFieldName(String label) {
        String snake = label == null ? "" : label.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (snake.isEmpty()) return "field";
        if (Character.isDigit(snake.charAt(0))) snake = "f_" + snake;
        return snake.length() > 64 ? snake.substring(0, 64) : snake;
    }

    public static String toCollectionName(String name) {
        String collection = toFieldName(name);
        if (collection.startsWith("system")) collection = "c_" + collection;
        return collection;
    }
}
