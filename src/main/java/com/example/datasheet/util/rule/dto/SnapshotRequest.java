package com.example.datasheet.util.rule.dto;

import com.example.datasheet.util.rule.DesignRule;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 快照请求：文档路径 + 已生成的设计规则
 */
public class SnapshotRequest {

    @JsonProperty("path")
    private String path;

    @JsonProperty("rules")
    private List<DesignRule> rules = new ArrayList<>();

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public List<DesignRule> getRules() { return rules; }
    public void setRules(List<DesignRule> rules) { this.rules = rules; }
}
