package com.oddsdata.gamesync.domain.enums;

/**
 * Quality signals raised by the mapping validation pass. Rows are flagged, never deleted.
 */
public enum MappingIssueType {
    LOW_CONFIDENCE,
    STALE_VERIFICATION,
    DUPLICATE_GAME      // Several canonical ids share teams and date (doubleheaders land here too)
}
