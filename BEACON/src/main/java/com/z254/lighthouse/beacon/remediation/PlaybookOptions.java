package com.z254.lighthouse.beacon.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller switches for a remediation run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaybookOptions {

    /** Propose steps without applying them or writing the remediation log */
    @Builder.Default
    private boolean dryRun = true;

    /** Whether playbooks may include bid adjustments */
    private boolean allowBidChanges;

    public static PlaybookOptions dryRun() {
        return PlaybookOptions.builder().build();
    }
}
