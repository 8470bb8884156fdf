package org.iceforge.ocient.connector.web;

import java.util.List;

/**
 * One dashboard query: either raw SQL text or query-builder selections.
 */
public class QueryRequest {

    /**
     * Identifies this query's result inside a batch response.
     */
    private String refId = "A";

    /**
     * true: run {@link #queryText} as is. false: assemble SQL from the builder fields.
     */
    private boolean rawQuery = true;

    private String queryText;

    private String schema;
    private String table;

    /**
     * Columns to select, in order. Empty selects every column.
     */
    private List<SelectedColumn> selectedColumns;

    private List<WhereClause> whereClauses;

    /**
     * Column bounded by the dashboard time range and used for ordering.
     */
    private String timeseriesColumn;

    public String getRefId() {
        return refId;
    }

    public void setRefId(String refId) {
        this.refId = refId;
    }

    public boolean isRawQuery() {
        return rawQuery;
    }

    public void setRawQuery(boolean rawQuery) {
        this.rawQuery = rawQuery;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public List<SelectedColumn> getSelectedColumns() {
        return selectedColumns;
    }

    public void setSelectedColumns(List<SelectedColumn> selectedColumns) {
        this.selectedColumns = selectedColumns;
    }

    public List<WhereClause> getWhereClauses() {
        return whereClauses;
    }

    public void setWhereClauses(List<WhereClause> whereClauses) {
        this.whereClauses = whereClauses;
    }

    public String getTimeseriesColumn() {
        return timeseriesColumn;
    }

    public void setTimeseriesColumn(String timeseriesColumn) {
        this.timeseriesColumn = timeseriesColumn;
    }

    public static class SelectedColumn {
        private String name;
        private boolean timeseriesColumn;

        public SelectedColumn() {
        }

        public SelectedColumn(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isTimeseriesColumn() {
            return timeseriesColumn;
        }

        public void setTimeseriesColumn(boolean timeseriesColumn) {
            this.timeseriesColumn = timeseriesColumn;
        }
    }

    public static class WhereClause {
        private String column;
        private String operator = "=";
        private String value = "";

        public WhereClause() {
        }

        public WhereClause(String column, String operator, String value) {
            this.column = column;
            this.operator = operator;
            this.value = value;
        }

        public String getColumn() {
            return column;
        }

        public void setColumn(String column) {
            this.column = column;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }
    }
}
