package org.iceforge.ocient.connector.model;

import java.util.Locale;

public record ColumnInfo(String columnName, String dataType, String isNullable, String columnDefault) {

    public boolean isTemporal() {
        if (dataType == null) return false;
        String t = dataType.toLowerCase(Locale.ROOT);
        return t.contains("timestamp") || t.contains("date");
    }
}
