package io.a2a.extras.taskengine.jdbc;

import org.postgresql.util.PGobject;

import java.sql.SQLException;

/**
 * Turns a JSON document into a statement parameter for the document columns.
 */
@FunctionalInterface
public interface JsonbAdapter {

    /**
     * @param json the JSON text, may be null
     * @return a {@code jsonb} {@link PGobject} on PostgreSQL, the text itself elsewhere, or null
     */
    Object adapt(String json);

    /**
     * Passes JSON text through untouched, for character large object columns.
     */
    final class TextJsonbAdapter implements JsonbAdapter {
        @Override
        public Object adapt(String json) {
            return json;
        }
    }

    final class PostgresJsonbAdapter implements JsonbAdapter {
        @Override
        public Object adapt(String json) {
            if (json == null) {
                return null;
            }
            try {
                PGobject pgObject = new PGobject();
                pgObject.setType("jsonb");
                pgObject.setValue(json);
                return pgObject;
            } catch (SQLException e) {
                throw new IllegalArgumentException("Failed to create PostgreSQL jsonb parameter", e);
            }
        }
    }
}
