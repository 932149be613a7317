package com.example.modcache.backend;

import com.example.modcache.core.CacheManager;
import com.example.modcache.storage.StorageAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-guild settings, read through the cache and written through storage.
 *
 * <p>Every write commits first and invalidates afterwards, so a reader never caches a value
 * older than the last commit it could have observed.
 */
@Slf4j
@Component
public class GuildSettingsStore {

    public static final String SETTINGS = "settings";
    public static final String PREFIXES = "prefixes";
    public static final String CHANNELS = "channels";

    public static final String DEFAULT_PREFIX = "!";
    static final String PREFIX_KEY = "prefix";

    private static final TypeReference<LinkedHashMap<String, Object>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private static final String SELECT_SETTINGS = "SELECT settings FROM guild_settings WHERE guild_id = ?";
    private static final String UPSERT_SETTINGS =
        "INSERT INTO guild_settings (guild_id, settings) VALUES (?, ?)"
            + " ON CONFLICT(guild_id) DO UPDATE SET settings = excluded.settings";

    private final CacheManager cacheManager;
    private final StorageAccessor storage;
    private final ObjectMapper objectMapper;

    public GuildSettingsStore(CacheManager cacheManager, ObjectMapper objectMapper) {
        this.cacheManager = cacheManager;
        this.storage = cacheManager.storage();
        this.objectMapper = objectMapper;
    }

    /**
     * Settings of a guild; empty when the guild has none stored. The returned map is a copy.
     */
    public Map<String, Object> getSettings(long guildId) {
        validateGuildId(guildId);
        Map<String, Object> cached = cacheManager.getOrLoad(SETTINGS, guildId, () -> loadSettings(guildId));
        return new LinkedHashMap<>(cached);
    }

    public void updateSettings(long guildId, Map<String, Object> settings) {
        validateGuildId(guildId);
        Objects.requireNonNull(settings, "settings");
        String json = toJson(settings);
        storage.transaction(tx -> tx.update(UPSERT_SETTINGS, guildId, json));
        evict(guildId);
    }

    /**
     * Sets one key. A null value removes it. The read and the write share one transaction.
     */
    public void setSetting(long guildId, String key, Object value) {
        validateGuildId(guildId);
        Objects.requireNonNull(key, "key");
        storage.transaction(tx -> {
            Map<String, Object> settings = tx.queryForOptional(SELECT_SETTINGS, String.class, guildId)
                .map(this::fromJson)
                .orElseGet(LinkedHashMap::new);
            if (value == null) {
                settings.remove(key);
            } else {
                settings.put(key, value);
            }
            return tx.update(UPSERT_SETTINGS, guildId, toJson(settings));
        });
        evict(guildId);
    }

    public String getPrefix(long guildId) {
        validateGuildId(guildId);
        return cacheManager.getOrLoad(PREFIXES, guildId, () -> {
            Object prefix = loadSettings(guildId).get(PREFIX_KEY);
            return prefix instanceof String && !((String) prefix).isBlank() ? (String) prefix : DEFAULT_PREFIX;
        });
    }

    public Optional<Long> getLogChannel(long guildId, String logType) {
        validateGuildId(guildId);
        Objects.requireNonNull(logType, "logType");
        Long channelId = cacheManager.getOrLoad(CHANNELS, channelKey(guildId, logType),
            () -> toChannelId(loadSettings(guildId).get(logChannelSetting(logType))));
        return Optional.ofNullable(channelId);
    }

    /**
     * Binds a log type to a channel, or removes the binding when {@code channelId} is null.
     */
    public void setLogChannel(long guildId, String logType, Long channelId) {
        Objects.requireNonNull(logType, "logType");
        if (channelId != null && channelId <= 0) {
            throw new IllegalArgumentException("Invalid channel id: " + channelId);
        }
        setSetting(guildId, logChannelSetting(logType), channelId);
    }

    static String channelKey(long guildId, String logType) {
        return guildId + ":" + logType;
    }

    static String logChannelSetting(String logType) {
        return logType + "_log_channel";
    }

    private void evict(long guildId) {
        cacheManager.invalidate(SETTINGS, guildId);
        cacheManager.invalidate(PREFIXES, guildId);
        String channelPrefix = guildId + ":";
        int channels = cacheManager.invalidateMatching(CHANNELS,
            key -> key instanceof String && ((String) key).startsWith(channelPrefix));
        log.debug("Evicted cached settings for guild {} ({} channel bindings)", guildId, channels);
    }

    private Map<String, Object> loadSettings(long guildId) {
        List<String> rows = storage.query(SELECT_SETTINGS, (rs, rowNum) -> rs.getString(1), guildId);
        if (rows.isEmpty() || rows.get(0) == null || rows.get(0).isBlank()) {
            return Map.of();
        }
        return fromJson(rows.get(0));
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, SETTINGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored settings are not valid JSON", e);
        }
    }

    private String toJson(Map<String, Object> settings) {
        try {
            return objectMapper.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Settings are not serializable", e);
        }
    }

    private static Long toChannelId(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof String && !((String) raw).isBlank()) {
            try {
                return Long.parseLong((String) raw);
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed channel id '{}'", raw);
            }
        }
        return null;
    }

    static void validateGuildId(long guildId) {
        if (guildId <= 0) {
            throw new IllegalArgumentException("Invalid guild id: " + guildId);
        }
    }
}
