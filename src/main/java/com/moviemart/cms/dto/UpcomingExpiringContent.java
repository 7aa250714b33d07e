package com.moviemart.cms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Dashboard view of scheduled content about to leave the catalogue, per family.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpcomingExpiringContent {

    @Builder.Default
    private List<ExpiringContentView> videos = new ArrayList<>();

    @Builder.Default
    private List<ExpiringContentView> events = new ArrayList<>();

    @Builder.Default
    private List<ExpiringContentView> movies = new ArrayList<>();
}
