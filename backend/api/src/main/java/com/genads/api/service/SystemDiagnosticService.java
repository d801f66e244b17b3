package com.genads.api.service;

import com.genads.api.dto.SystemDto;
import com.genads.api.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Best-effort store report for the {@code /test} endpoint. Never throws.
 */
@Slf4j
@Service
public class SystemDiagnosticService {

    static final int MAX_COLLECTIONS = 10;
    private static final int MAX_ERROR_LENGTH = 80;

    private final ObjectProvider<RecordStore> recordStoreProvider;
    private final String databaseUrl;
    private final String databaseName;

    public SystemDiagnosticService(ObjectProvider<RecordStore> recordStoreProvider,
                                   @Value("${genads.database.url:}") String databaseUrl,
                                   @Value("${genads.database.name:}") String databaseName) {
        this.recordStoreProvider = recordStoreProvider;
        this.databaseUrl = databaseUrl;
        this.databaseName = databaseName;
    }

    public SystemDto.DatabaseReport inspect() {
        SystemDto.DatabaseReport.DatabaseReportBuilder report = SystemDto.DatabaseReport.builder()
                .backend("✅ Running")
                .database("❌ Not Available")
                .databaseUrl(null)
                .databaseName(null)
                .connectionStatus("Not Connected")
                .collections(List.of());

        try {
            RecordStore recordStore = recordStoreProvider.getIfAvailable();
            if (recordStore == null) {
                report.database("⚠️ Available but not initialized");
                return report.build();
            }

            report.database("✅ Available")
                    .databaseUrl(isSet(databaseUrl) ? "✅ Set" : "❌ Not Set")
                    .databaseName(isSet(databaseName) ? databaseName : "❌ Not Set")
                    .connectionStatus("Connected");
            try {
                List<String> collections = recordStore.listCollections();
                report.collections(collections.subList(0, Math.min(MAX_COLLECTIONS, collections.size())))
                        .database("✅ Connected & Working");
            } catch (Exception e) {
                log.warn("[Diagnostic] Collection listing failed: {}", e.getMessage());
                report.database("⚠️ Connected but Error: " + truncate(e.getMessage()));
            }
        } catch (Exception e) {
            log.warn("[Diagnostic] Store inspection failed: {}", e.getMessage());
            report.database("❌ Error: " + truncate(e.getMessage()));
        }

        return report.build();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String truncate(String message) {
        if (message == null) return "unknown";
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
