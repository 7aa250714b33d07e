package com.moviemart.cms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hidden / deleted tallies for one content family within a pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionCounts {
    private int hidden;
    private int deleted;

    public void recordHidden() {
        hidden++;
    }

    public void recordDeleted() {
        deleted++;
    }

    public void add(int hiddenCount, int deletedCount) {
        hidden += hiddenCount;
        deleted += deletedCount;
    }
}
