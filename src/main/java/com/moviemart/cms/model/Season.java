package com.moviemart.cms.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Season {

    @Id
    private String id;

    private int seasonNumber;
    private String title;
    private String description;

    @Builder.Default
    private List<Episode> episodes = new ArrayList<>();

    @Builder.Default
    @Field("isActive")
    private boolean active = true;
}
