package org.iceforge.ocient.connector.service;

final class SqlLiterals {

    private SqlLiterals() {
    }

    static String quote(String s) {
        return "'" + escape(s) + "'";
    }

    static String escape(String s) {
        return s == null ? "" : s.replace("'", "''");
    }
}
