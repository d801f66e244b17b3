package com.genads.api.store;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Store-level helpers shared by the persistence code: identifier and timestamp
 * assignment for new records, and collection introspection for diagnostics
 * and the start-up schema check.
 */
@Component
@RequiredArgsConstructor
public class RecordStore {

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    private final DataSource dataSource;

    public String newId() {
        return RecordIds.next(Instant.now());
    }

    public LocalDateTime now() {
        return LocalDateTime.now();
    }

    /**
     * Tables visible in the current catalog/schema, lower-cased and sorted.
     * Connection problems are thrown to the caller.
     */
    public List<String> listCollections() throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            List<String> names = new ArrayList<>();
            try (ResultSet tables = meta.getTables(connection.getCatalog(), connection.getSchema(), "%", TABLE_TYPES)) {
                while (tables.next()) {
                    names.add(tables.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                }
            }
            names.sort(String::compareTo);
            return names;
        }
    }

    /**
     * Declared collections whose table is absent from the store.
     */
    public List<RecordCollection> missingCollections() throws SQLException {
        List<String> present = listCollections();
        return Arrays.stream(RecordCollection.values())
                .filter(collection -> !present.contains(collection.getTableName()))
                .toList();
    }
}
