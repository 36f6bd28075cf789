package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Consumption-pattern clusters: exactly one cluster id per feature row")
public class ClusterAssignment {

    long generatedAt;

    @Schema(description = "Configured number of clusters", example = "4")
    int k;

    long seed;

    @Schema(description = "Features the clustering ran on (scaled space)")
    List<String> features;

    @Schema(description = "One entry per feature-matrix row, in row order")
    List<ClusterMembership> assignments;

    @Schema(description = "Centroid coordinates per cluster, in the order of 'features'")
    List<List<Double>> centroids;

    List<Integer> clusterSizes;

    @Schema(description = "Mean unscaled load per cluster (MW)")
    List<Double> meanLoadMw;

    @Schema(description = "Mean silhouette coefficient in [-1, 1]; reported, not enforced", example = "0.71")
    double silhouetteScore;

    int silhouetteSampleSize;

    @Schema(description = "Within-cluster sum of squared distances")
    double inertia;

    int iterations;
}
