package io.github.chirino.atlas.api;

import io.github.chirino.atlas.api.dto.ClusterRequest;
import io.github.chirino.atlas.api.dto.ClusterResponse;
import io.github.chirino.atlas.cluster.Cluster;
import io.github.chirino.atlas.cluster.ClusterAnalyzer;
import io.github.chirino.atlas.cluster.ClusterResult;
import io.github.chirino.atlas.model.Position;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Path("/v1/clusters")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ClusterResource {

    @Inject QueryRequestMapper mapper;

    @Inject ClusterAnalyzer analyzer;

    @POST
    public ClusterResponse cluster(@Valid ClusterRequest request) {
        ClusterResult result = analyzer.analyze(mapper.toSpec(request), request.getK());
        ClusterResponse response = new ClusterResponse();
        List<ClusterResponse.ClusterDto> clusters = new ArrayList<>(result.clusters().size());
        for (Cluster cluster : result.clusters()) {
            clusters.add(toDto(cluster));
        }
        response.setClusters(clusters);
        response.setLabelStatus(result.labelStatus().toValue());
        response.setRequestedK(result.requestedK());
        response.setEffectiveK(result.effectiveK());
        response.setPointCount(result.pointCount());
        response.setInputTruncated(result.inputTruncated());
        return response;
    }

    private static ClusterResponse.ClusterDto toDto(Cluster cluster) {
        ClusterResponse.ClusterDto dto = new ClusterResponse.ClusterDto();
        dto.setId(cluster.id());
        dto.setSize(cluster.size());
        List<String> members = new ArrayList<>(cluster.size());
        for (UUID id : cluster.memberIds()) {
            members.add(id.toString());
        }
        dto.setMemberIds(members);
        dto.setCentroid(new double[] {cluster.centroid().x(), cluster.centroid().y()});
        List<double[]> boundary = new ArrayList<>(cluster.boundary().size());
        for (Position vertex : cluster.boundary()) {
            boundary.add(new double[] {vertex.x(), vertex.y()});
        }
        dto.setBoundary(boundary);
        dto.setLabel(cluster.label());
        dto.setRepresentativeTitles(cluster.representativeTitles());
        return dto;
    }
}
