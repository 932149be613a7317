package com.example.modcache.backend;

import com.example.modcache.storage.StorageAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Exports one guild's settings and recent moderation history as JSON.
 */
@Slf4j
@Component
public class GuildBackupExporter {

    static final int HISTORY_LIMIT = 1000;

    private static final String RECENT_CASES =
        "SELECT case_number, user_id, moderator_id, action, reason, duration, created_at, active"
            + " FROM cases WHERE guild_id = ? ORDER BY created_at DESC, id DESC LIMIT " + HISTORY_LIMIT;
    private static final String RECENT_WARNINGS =
        "SELECT user_id, moderator_id, reason, created_at"
            + " FROM warnings WHERE guild_id = ? ORDER BY created_at DESC, id DESC LIMIT " + HISTORY_LIMIT;

    private final GuildSettingsStore settingsStore;
    private final StorageAccessor storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GuildBackupExporter(
        GuildSettingsStore settingsStore,
        StorageAccessor storage,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.settingsStore = settingsStore;
        this.storage = storage;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public String export(long guildId) {
        GuildSettingsStore.validateGuildId(guildId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("settings", settingsStore.getSettings(guildId));
        List<Map<String, Object>> cases = storage.execute(RECENT_CASES, guildId);
        data.put("cases", cases);
        List<Map<String, Object>> warnings = storage.execute(RECENT_WARNINGS, guildId);
        data.put("warnings", warnings);

        Map<String, Object> backup = new LinkedHashMap<>();
        backup.put("guild_id", guildId);
        backup.put("timestamp", clock.instant().toString());
        backup.put("schema_version", storage.currentSchemaVersion());
        backup.put("data", data);

        try {
            String json = objectMapper.writeValueAsString(backup);
            log.info("Exported guild {}: {} cases, {} warnings", guildId, cases.size(), warnings.size());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize backup of guild " + guildId, e);
        }
    }
}
