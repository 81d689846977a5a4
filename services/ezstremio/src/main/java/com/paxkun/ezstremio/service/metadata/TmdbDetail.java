package com.paxkun.ezstremio.service.metadata;

import com.google.gson.annotations.SerializedName;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The fields of a TMDB movie or tv detail response needed to search for the title.
 * Movies fill {@code title}, {@code originalTitle} and {@code releaseDate};
 * tv shows fill {@code name}, {@code originalName} and {@code firstAirDate}.
 */
@Data
@NoArgsConstructor
public class TmdbDetail {

    private int id;

    private String title;

    private String name;

    @SerializedName("original_title")
    private String originalTitle;

    @SerializedName("original_name")
    private String originalName;

    @SerializedName("release_date")
    private String releaseDate;

    @SerializedName("first_air_date")
    private String firstAirDate;
}
