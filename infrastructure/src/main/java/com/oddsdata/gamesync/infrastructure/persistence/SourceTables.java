package com.oddsdata.gamesync.infrastructure.persistence;

import com.oddsdata.gamesync.domain.enums.GameSource;

/**
 * Table and column names owned by each source. Only these constants are ever spliced into SQL.
 */
public final class SourceTables {
    
    private SourceTables() {
    }
    
    public static String mappingColumn(GameSource source) {
        return switch (source) {
            case ACTION_NETWORK -> "action_network_game_id";
            case VSIN -> "vsin_game_id";
            case SBD -> "sbd_game_id";
            case SBR -> "sbr_game_id";
        };
    }
    
    public static String rawTable(GameSource source) {
        return switch (source) {
            case ACTION_NETWORK -> "raw_action_network_games";
            case VSIN -> "raw_vsin_games";
            case SBD -> "raw_sbd_games";
            case SBR -> "raw_sbr_games";
        };
    }
}
