package com.oddsdata.gamesync.infrastructure.ingest;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.ingest.RawGameCatalog;
import com.oddsdata.gamesync.domain.model.RawGameInfo;
import com.oddsdata.gamesync.domain.model.UnmappedCandidate;
import com.oddsdata.gamesync.infrastructure.persistence.SourceTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads the raw per-source ingestion tables, which are owned by the collectors.
 * Unmapped ids are found by anti-joining each table against its mapping column.
 */
@Component
public class JdbcRawGameCatalog implements RawGameCatalog {
    
    private static final Logger log = LoggerFactory.getLogger(JdbcRawGameCatalog.class);
    
    private static final RowMapper<UnmappedCandidate> CANDIDATE_MAPPER = (rs, rowNum) -> {
        Date gameDate = rs.getDate("game_date");
        return UnmappedCandidate.builder()
                .source(GameSource.fromTag(rs.getString("source_type")))
                .externalId(rs.getString("external_id"))
                .homeTeam(rs.getString("home_team"))
                .awayTeam(rs.getString("away_team"))
                .gameDate(gameDate != null ? gameDate.toLocalDate() : null)
                .originTable(rs.getString("origin_table"))
                .build();
    };
    
    private final NamedParameterJdbcTemplate jdbcTemplate;
    
    public JdbcRawGameCatalog(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @Override
    public List<UnmappedCandidate> findUnmapped(Optional<GameSource> source, int pageSize, int offset) {
        String sql = "SELECT source_type, external_id, home_team, away_team, game_date, origin_table FROM ("
                + unmappedUnion(source)
                + ") unmapped ORDER BY source_type, external_id LIMIT :limit OFFSET :offset";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", pageSize)
                .addValue("offset", offset);
        try {
            List<UnmappedCandidate> page = jdbcTemplate.query(sql, params, CANDIDATE_MAPPER);
            log.debug("Found {} unmapped ids (source={}, pageSize={}, offset={})",
                    page.size(), source.map(GameSource::getTag).orElse("all"), pageSize, offset);
            return page;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to scan raw tables for unmapped ids", e);
        }
    }
    
    @Override
    public long countUnmapped(Optional<GameSource> source) {
        String sql = "SELECT COUNT(*) FROM (" + unmappedUnion(source) + ") unmapped";
        try {
            Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to count unmapped ids", e);
        }
    }
    
    @Override
    public Optional<RawGameInfo> findGameInfo(GameSource source, String externalId) {
        String sql = "SELECT home_team, away_team, game_date, game_datetime FROM " + SourceTables.rawTable(source)
                + " WHERE external_game_id = :externalId AND home_team IS NOT NULL AND away_team IS NOT NULL"
                + " ORDER BY game_date DESC LIMIT 1";
        try {
            List<RawGameInfo> rows = jdbcTemplate.query(sql, new MapSqlParameterSource("externalId", externalId),
                    (rs, rowNum) -> {
                        Date gameDate = rs.getDate("game_date");
                        return RawGameInfo.builder()
                                .homeTeam(rs.getString("home_team"))
                                .awayTeam(rs.getString("away_team"))
                                .gameDate(gameDate != null ? gameDate.toLocalDate() : null)
                                .gameDatetime(rs.getObject("game_datetime", OffsetDateTime.class))
                                .build();
                    });
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read raw game info for " + source + ":" + externalId, e);
        }
    }
    
    private static String unmappedUnion(Optional<GameSource> source) {
        List<GameSource> sources = source.map(List::of).orElseGet(() -> Arrays.asList(GameSource.values()));
        return sources.stream()
                .map(JdbcRawGameCatalog::unmappedSelect)
                .collect(Collectors.joining(" UNION ALL "));
    }
    
    private static String unmappedSelect(GameSource source) {
        String table = SourceTables.rawTable(source);
        return "SELECT '" + source.getTag() + "' AS source_type, r.external_game_id AS external_id, "
                + "MAX(r.home_team) AS home_team, MAX(r.away_team) AS away_team, MAX(r.game_date) AS game_date, "
                + "'" + table + "' AS origin_table "
                + "FROM " + table + " r "
                + "WHERE r.external_game_id IS NOT NULL AND NOT EXISTS ("
                + "SELECT 1 FROM game_id_mappings m WHERE m." + SourceTables.mappingColumn(source)
                + " = r.external_game_id) "
                + "GROUP BY r.external_game_id";
    }
}
