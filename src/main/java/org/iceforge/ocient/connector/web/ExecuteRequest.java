package org.iceforge.ocient.connector.web;

/**
 * Body of {@code POST /v1/execute}.
 */
public class ExecuteRequest {

    public static final String COLLECTION_FORMAT = "collection";

    private String database;
    private String statement;
    private String format = COLLECTION_FORMAT;

    public ExecuteRequest() {
    }

    public ExecuteRequest(String database, String statement) {
        this.database = database;
        this.statement = statement;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getStatement() {
        return statement;
    }

    public void setStatement(String statement) {
        this.statement = statement;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
