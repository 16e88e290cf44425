package io.github.chirino.atlas.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** A search request plus the number of clusters wanted. */
public class ClusterRequest extends SearchRequest {

    @NotNull @Min(1)
    private Integer k;

    public Integer getK() {
        return k;
    }

    public void setK(Integer k) {
        this.k = k;
    }
}
