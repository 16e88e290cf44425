package io.github.chirino.atlas.api.dto;

import java.util.List;

public class ClusterResponse {

    private List<ClusterDto> clusters;
    private String labelStatus;
    private int requestedK;
    private int effectiveK;
    private int pointCount;
    private boolean inputTruncated;

    public List<ClusterDto> getClusters() {
        return clusters;
    }

    public void setClusters(List<ClusterDto> clusters) {
        this.clusters = clusters;
    }

    public String getLabelStatus() {
        return labelStatus;
    }

    public void setLabelStatus(String labelStatus) {
        this.labelStatus = labelStatus;
    }

    public int getRequestedK() {
        return requestedK;
    }

    public void setRequestedK(int requestedK) {
        this.requestedK = requestedK;
    }

    public int getEffectiveK() {
        return effectiveK;
    }

    public void setEffectiveK(int effectiveK) {
        this.effectiveK = effectiveK;
    }

    public int getPointCount() {
        return pointCount;
    }

    public void setPointCount(int pointCount) {
        this.pointCount = pointCount;
    }

    public boolean isInputTruncated() {
        return inputTruncated;
    }

    public void setInputTruncated(boolean inputTruncated) {
        this.inputTruncated = inputTruncated;
    }

    public static class ClusterDto {

        private int id;
        private int size;
        private List<String> memberIds;
        private double[] centroid;
        private List<double[]> boundary;
        private String label;
        private List<String> representativeTitles;

        public int getId() {
            return id;
        }

        public void setId(int id) {
            this.id = id;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public List<String> getMemberIds() {
            return memberIds;
        }

        public void setMemberIds(List<String> memberIds) {
            this.memberIds = memberIds;
        }

        public double[] getCentroid() {
            return centroid;
        }

        public void setCentroid(double[] centroid) {
            this.centroid = centroid;
        }

        public List<double[]> getBoundary() {
            return boundary;
        }

        public void setBoundary(List<double[]> boundary) {
            this.boundary = boundary;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public List<String> getRepresentativeTitles() {
            return representativeTitles;
        }

        public void setRepresentativeTitles(List<String> representativeTitles) {
            this.representativeTitles = representativeTitles;
        }
    }
}
