package com.genads.api.config;

import com.genads.api.store.RecordCollection;
import com.genads.api.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks at start-up that every declared collection has a table. A missing
 * table or an unreachable store is logged; the service still starts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaVerifier implements ApplicationRunner {

    private final RecordStore recordStore;

    @Override
    public void run(ApplicationArguments args) {
        try {
            List<RecordCollection> missing = recordStore.missingCollections();
            if (missing.isEmpty()) {
                log.info("[Schema] All {} collections present", RecordCollection.values().length);
            } else {
                log.warn("[Schema] Missing tables: {}", missing.stream().map(RecordCollection::getTableName).toList());
            }
        } catch (Exception e) {
            log.warn("[Schema] Could not verify tables: {}", e.getMessage());
        }
    }
}
