package com.rankfusion.search.model;

import java.util.List;

public class QueryRequest {
    private String query;
    private List<Double> queryVector;
    private Integer topK;
    private Double vectorWeight;
    private Double textWeight;
    private Integer rankConstant;
    private Boolean degradeOnPartialFailure;
    private Integer candidateDepth;
    private Long timeoutMs;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<Double> getQueryVector() {
        return queryVector;
    }

    public void setQueryVector(List<Double> queryVector) {
        this.queryVector = queryVector;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    public Double getVectorWeight() {
        return vectorWeight;
    }

    public void setVectorWeight(Double vectorWeight) {
        this.vectorWeight = vectorWeight;
    }

    public Double getTextWeight() {
        return textWeight;
    }

    public void setTextWeight(Double textWeight) {
        this.textWeight = textWeight;
    }

    public Integer getRankConstant() {
        return rankConstant;
    }

    public void setRankConstant(Integer rankConstant) {
        this.rankConstant = rankConstant;
    }

    public Boolean getDegradeOnPartialFailure() {
        return degradeOnPartialFailure;
    }

    public void setDegradeOnPartialFailure(Boolean degradeOnPartialFailure) {
        this.degradeOnPartialFailure = degradeOnPartialFailure;
    }

    public Integer getCandidateDepth() {
        return candidateDepth;
    }

    public void setCandidateDepth(Integer candidateDepth) {
        this.candidateDepth = candidateDepth;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
