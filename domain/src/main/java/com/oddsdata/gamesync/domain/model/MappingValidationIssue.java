package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.MappingIssueType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingValidationIssue {
    private MappingIssueType issueType;
    private long issueCount;
    private String sampleCanonicalId;
}
