package com.example.datasheet.util.rule.dto;

import com.example.datasheet.util.rule.DesignRule;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个文档的结果快照（下游持久化的字段约定）
 */
public class DatasheetSnapshot {

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("pin")
    private List<List<String>> pin = new ArrayList<>();

    @JsonProperty("checklist")
    private List<DesignRule> checklist = new ArrayList<>();

    @JsonProperty("footnote")
    private String footnote = "";

    public DatasheetSnapshot() {
    }

    public DatasheetSnapshot(String filename, List<List<String>> pin, List<DesignRule> checklist, String footnote) {
        this.filename = filename;
        this.pin = pin;
        this.checklist = checklist;
        this.footnote = footnote;
    }

    // Getters and Setters
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public List<List<String>> getPin() { return pin; }
    public void setPin(List<List<String>> pin) { this.pin = pin; }

    public List<DesignRule> getChecklist() { return checklist; }
    public void setChecklist(List<DesignRule> checklist) { this.checklist = checklist; }

    public String getFootnote() { return footnote; }
    public void setFootnote(String footnote) { this.footnote = footnote; }
}
