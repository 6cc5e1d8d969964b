package com.oddsdata.gamesync.infrastructure.outcome;

import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.model.OutcomeQuery;
import com.oddsdata.gamesync.domain.model.OutcomeSourceRow;
import com.oddsdata.gamesync.domain.outcome.OutcomeSourceReader;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Reads authoritative outcomes from game_outcomes joined to games_complete.
 * Pages are keyed on the outcome id so rows written during a run never shift later pages.
 */
@Component
public class JdbcOutcomeSourceReader implements OutcomeSourceReader {
    
    private static final String COMPLETE_SCORES = "go.home_score IS NOT NULL AND go.away_score IS NOT NULL";
    
    private static final String HAS_SCORED_ENRICHED_ROW = "EXISTS (SELECT 1 FROM enhanced_games eg WHERE "
            + "((gc.canonical_game_id IS NOT NULL AND eg.canonical_game_id = gc.canonical_game_id) "
            + "OR (gc.action_network_game_id IS NOT NULL AND eg.action_network_game_id = gc.action_network_game_id)) "
            + "AND eg.home_score IS NOT NULL AND eg.away_score IS NOT NULL)";
    
    private static final RowMapper<OutcomeSourceRow> ROW_MAPPER = JdbcOutcomeSourceReader::mapRow;
    
    private final NamedParameterJdbcTemplate jdbcTemplate;
    
    public JdbcOutcomeSourceReader(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @Override
    public List<OutcomeSourceRow> findOutcomes(OutcomeQuery query) {
        StringBuilder sql = new StringBuilder()
                .append("SELECT go.id AS outcome_id, go.game_id, go.home_team, go.away_team, ")
                .append("go.home_score, go.away_score, go.home_win, go.over_result, go.home_cover_spread, ")
                .append("go.total_line, go.home_spread_line, go.game_date AS outcome_game_date, ")
                .append("gc.canonical_game_id, gc.action_network_game_id, gc.game_datetime, ")
                .append("gc.game_date, gc.season, gc.venue_name, gc.game_status ")
                .append("FROM game_outcomes go ")
                .append("INNER JOIN games_complete gc ON go.game_id = gc.id ")
                .append("WHERE ").append(COMPLETE_SCORES)
                .append(" AND go.id > :afterId");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("afterId", query.getAfterOutcomeId())
                .addValue("pageSize", query.getPageSize());
        if (query.isOnlyMissing()) {
            sql.append(" AND NOT ").append(HAS_SCORED_ENRICHED_ROW);
        }
        if (query.getSince() != null) {
            sql.append(" AND go.game_date >= :since");
            params.addValue("since", Date.valueOf(query.getSince()));
        }
        sql.append(" ORDER BY go.id LIMIT :pageSize");
        try {
            return jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read outcome page after id " + query.getAfterOutcomeId(), e);
        }
    }
    
    @Override
    public long countCompleteOutcomes() {
        return count("SELECT COUNT(*) FROM game_outcomes go WHERE " + COMPLETE_SCORES);
    }
    
    @Override
    public long countMissing() {
        return count("SELECT COUNT(*) FROM game_outcomes go INNER JOIN games_complete gc ON go.game_id = gc.id "
                + "WHERE " + COMPLETE_SCORES + " AND NOT " + HAS_SCORED_ENRICHED_ROW);
    }
    
    private long count(String sql) {
        try {
            Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to count outcomes", e);
        }
    }
    
    private static OutcomeSourceRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        Date gameDate = rs.getDate("game_date");
        if (gameDate == null) {
            gameDate = rs.getDate("outcome_game_date");
        }
        return OutcomeSourceRow.builder()
                .outcomeId(rs.getLong("outcome_id"))
                .sourceGameId(rs.getLong("game_id"))
                .canonicalId(rs.getString("canonical_game_id"))
                .actionNetworkGameId(rs.getString("action_network_game_id"))
                .homeTeam(rs.getString("home_team"))
                .awayTeam(rs.getString("away_team"))
                .homeScore(rs.getObject("home_score", Integer.class))
                .awayScore(rs.getObject("away_score", Integer.class))
                .homeWin(rs.getObject("home_win", Boolean.class))
                .over(rs.getObject("over_result", Boolean.class))
                .homeCoverSpread(rs.getObject("home_cover_spread", Boolean.class))
                .totalLine(rs.getObject("total_line", Double.class))
                .homeSpreadLine(rs.getObject("home_spread_line", Double.class))
                .gameDate(gameDate != null ? gameDate.toLocalDate() : null)
                .gameDatetime(rs.getObject("game_datetime", OffsetDateTime.class))
                .season(rs.getObject("season", Integer.class))
                .venueName(rs.getString("venue_name"))
                .gameStatus(rs.getString("game_status"))
                .build();
    }
}
