package com.example.datasheet.util.rule;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 设计规则（由下游规则生成阶段产出）
 */
public class DesignRule {

    @JsonProperty("group")
    private String group;

    @JsonProperty("rule")
    private String rule;

    @JsonProperty("pins")
    private List<String> pins = new ArrayList<>();

    @JsonProperty("essential")
    private Boolean essential;

    public DesignRule() {
    }

    public DesignRule(String group, String rule, List<String> pins, Boolean essential) {
        this.group = group;
        this.rule = rule;
        this.pins = pins;
        this.essential = essential;
    }

    // Getters and Setters
    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }

    public String getRule() { return rule; }
    public void setRule(String rule) { this.rule = rule; }

    public List<String> getPins() { return pins; }
    public void setPins(List<String> pins) { this.pins = pins; }

    public Boolean getEssential() { return essential; }
    public void setEssential(Boolean essential) { this.essential = essential; }

    @Override
    public String toString() {
        return "DesignRule{group='" + group + "', rule='" + rule + "', pins=" + pins + ", essential=" + essential + "}";
    }
}
