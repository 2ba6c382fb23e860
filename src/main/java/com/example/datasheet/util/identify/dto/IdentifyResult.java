package com.example.datasheet.util.identify.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 器件识别结果
 */
public class IdentifyResult {

    private static final Pattern LEADING_LETTERS = Pattern.compile("^([A-Za-z]+)");

    @JsonProperty("file")
    private final String file;

    @JsonProperty("primary_identifier")
    private final String primaryIdentifier;

    @JsonProperty("candidates")
    private final List<String> candidates;

    @JsonProperty("packages")
    private final List<String> packages;

    @JsonProperty("family_prefix")
    private final String familyPrefix;

    public IdentifyResult(String file, String primaryIdentifier, List<String> candidates, List<String> packages) {
        this.file = file;
        this.primaryIdentifier = primaryIdentifier;
        this.candidates = candidates == null ? Collections.<String>emptyList() : List.copyOf(candidates);
        this.packages = packages == null ? Collections.<String>emptyList() : List.copyOf(packages);
        this.familyPrefix = familyPrefix(primaryIdentifier);
    }

    /**
     * 器件系列前缀：主标识符开头的连续字母（大写），如 STM32F103 → STM
     */
    public static String familyPrefix(String identifier) {
        if (identifier == null) {
            return null;
        }
        Matcher m = LEADING_LETTERS.matcher(identifier);
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : null;
    }

    public String getFile() { return file; }
    public String getPrimaryIdentifier() { return primaryIdentifier; }
    public List<String> getCandidates() { return candidates; }
    public List<String> getPackages() { return packages; }
    public String getFamilyPrefix() { return familyPrefix; }

    @Override
    public String toString() {
        return "IdentifyResult{file=" + file + ", primary=" + primaryIdentifier
                + ", candidates=" + candidates.size() + ", packages=" + packages + "}";
    }
}
