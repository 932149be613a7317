package com.example.modcache.storage;

import java.util.List;

/**
 * Schema of the moderation service, oldest step first.
 */
public final class ModerationSchema {

    public static final int LATEST_VERSION = 4;

    private static final List<SchemaMigration> MIGRATIONS = List.of(
        SchemaMigration.of(1, "guild settings and core moderation records",
            "CREATE TABLE IF NOT EXISTS guild_settings ("
                + " guild_id INTEGER PRIMARY KEY,"
                + " settings TEXT DEFAULT '{}')",
            "CREATE TABLE IF NOT EXISTS cases ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " case_number INTEGER NOT NULL,"
                + " user_id INTEGER NOT NULL,"
                + " moderator_id INTEGER,"
                + " action TEXT,"
                + " reason TEXT,"
                + " duration TEXT,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                + " active BOOLEAN DEFAULT 1,"
                + " UNIQUE (guild_id, case_number))",
            "CREATE TABLE IF NOT EXISTS warnings ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " user_id INTEGER NOT NULL,"
                + " moderator_id INTEGER,"
                + " reason TEXT,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS mod_notes ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " user_id INTEGER NOT NULL,"
                + " moderator_id INTEGER,"
                + " note TEXT,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS tempbans ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " user_id INTEGER NOT NULL,"
                + " moderator_id INTEGER,"
                + " reason TEXT,"
                + " expires_at TIMESTAMP NOT NULL,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS mod_stats ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " moderator_id INTEGER NOT NULL,"
                + " action TEXT,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS idx_cases_guild_user ON cases(guild_id, user_id)",
            "CREATE INDEX IF NOT EXISTS idx_cases_guild_active ON cases(guild_id, active)",
            "CREATE INDEX IF NOT EXISTS idx_warnings_guild_user ON warnings(guild_id, user_id)",
            "CREATE INDEX IF NOT EXISTS idx_mod_notes_guild_user ON mod_notes(guild_id, user_id)",
            "CREATE INDEX IF NOT EXISTS idx_tempbans_expires_at ON tempbans(expires_at)",
            "CREATE INDEX IF NOT EXISTS idx_mod_stats_guild_moderator ON mod_stats(guild_id, moderator_id)"),

        SchemaMigration.of(2, "reports, tickets, staff sanctions and blacklist",
            "CREATE TABLE IF NOT EXISTS reports ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " reporter_id INTEGER,"
                + " reported_id INTEGER,"
                + " reason TEXT,"
                + " resolved BOOLEAN DEFAULT 0,"
                + " resolved_by INTEGER,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS tickets ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " channel_id INTEGER,"
                + " user_id INTEGER,"
                + " ticket_number INTEGER,"
                + " category TEXT,"
                + " details TEXT,"
                + " status TEXT DEFAULT 'open',"
                + " claimed_by INTEGER,"
                + " claimed_at TIMESTAMP,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                + " closed_at TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS staff_sanctions ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " staff_id INTEGER NOT NULL,"
                + " issuer_id INTEGER,"
                + " reason TEXT,"
                + " sanction_type TEXT DEFAULT 'warn',"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS blacklist ("
                + " user_id INTEGER PRIMARY KEY,"
                + " reason TEXT,"
                + " added_by INTEGER,"
                + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS idx_reports_guild_resolved ON reports(guild_id, resolved)",
            "CREATE INDEX IF NOT EXISTS idx_tickets_guild_status ON tickets(guild_id, status)",
            "CREATE INDEX IF NOT EXISTS idx_staff_sanctions_guild_staff ON staff_sanctions(guild_id, staff_id)"),

        SchemaMigration.of(3, "modmail",
            "CREATE TABLE IF NOT EXISTS modmail_threads ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " user_id INTEGER NOT NULL,"
                + " channel_id INTEGER,"
                + " category TEXT DEFAULT 'general',"
                + " priority TEXT DEFAULT 'normal',"
                + " opened_at TEXT,"
                + " closed_at TEXT,"
                + " status TEXT DEFAULT 'open',"
                + " claimed_by INTEGER,"
                + " message_count INTEGER DEFAULT 0)",
            "CREATE TABLE IF NOT EXISTS modmail_messages ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " thread_id INTEGER NOT NULL REFERENCES modmail_threads(id),"
                + " author_id INTEGER,"
                + " content TEXT,"
                + " timestamp TEXT,"
                + " is_staff BOOLEAN DEFAULT 0)",
            "CREATE TABLE IF NOT EXISTS modmail_blocks ("
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                + " guild_id INTEGER NOT NULL,"
                + " user_id INTEGER NOT NULL,"
                + " reason TEXT,"
                + " blocked_by INTEGER,"
                + " created_at TEXT)",
            "CREATE INDEX IF NOT EXISTS idx_modmail_threads_guild_user ON modmail_threads(guild_id, user_id, status)",
            "CREATE INDEX IF NOT EXISTS idx_modmail_blocks_guild_user ON modmail_blocks(guild_id, user_id)"),

        SchemaMigration.of(4, "ai moderation memory",
            "CREATE TABLE IF NOT EXISTS ai_memory ("
                + " user_id INTEGER PRIMARY KEY,"
                + " memory_text TEXT,"
                + " last_updated TIMESTAMP DEFAULT CURRENT_TIMESTAMP)")
    );

    private ModerationSchema() {
    }

    public static List<SchemaMigration> migrations() {
        return MIGRATIONS;
    }
}
