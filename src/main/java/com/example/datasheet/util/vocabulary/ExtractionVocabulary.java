package com.example.datasheet.util.vocabulary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.regex.Pattern;

/**
 * 抽取词表（拒绝集、前缀白名单、关键词、表头规则）
 *
 * 设计原则：
 * 1. 默认值随 jar 打包在 classpath:extraction-vocabulary.json
 * 2. 支持从外部 JSON 文件按 key 部分覆盖（按组织定制）
 * 3. 容错回退（外部文件解析失败时使用默认词表）
 *
 * 加载完成后不可变，可在多线程间共享。
 */
@Slf4j
public class ExtractionVocabulary {

    public static final String DEFAULT_RESOURCE = "extraction-vocabulary.json";

    // ========== 标识符分类 ==========

    /** 通用格式拒绝集（大小写敏感） */
    private Set<String> formatReject = new HashSet<>();

    /** 协议/信号拒绝集（与大写后的 token 比较） */
    private Set<String> protocolReject = new HashSet<>();

    /** 信号名前缀（正则片段） */
    private List<String> signalPrefixes = new ArrayList<>();

    // ========== 封装 ==========

    private List<String> packageKeywords = new ArrayList<>();
    private List<String> packagePrefixes = new ArrayList<>();

    // ========== 订购信息 / 厂商代码 ==========

    private String orderingPattern = "";
    private String vendorCodePattern = "";

    // ========== 引脚表打分 ==========

    private List<String> strongHeaderKeywords = new ArrayList<>();
    private List<String> moderateHeaderKeywords = new ArrayList<>();
    private List<String> electricalHeaderKeywords = new ArrayList<>();
    private Set<String> supplyMnemonics = new HashSet<>();

    // ========== 表头归一化 ==========

    private List<HeaderRule> headerRules = new ArrayList<>();

    // ========== 编译产物 ==========

    private Pattern signalNamePattern;
    private Pattern orderingHeaderPattern;
    private Pattern vendorLiteralPattern;

    private ExtractionVocabulary() {
    }

    /**
     * 加载 classpath 中的默认词表
     */
    public static ExtractionVocabulary loadDefault() {
        ExtractionVocabulary vocabulary = new ExtractionVocabulary();
        vocabulary.apply(readDefaultTree());
        vocabulary.compile();
        return vocabulary;
    }

    /**
     * 从 JSON 文件加载词表（在默认词表基础上部分覆盖）
     *
     * @param jsonPath JSON 文件路径
     * @return 词表（失败时返回默认词表）
     */
    public static ExtractionVocabulary loadFromJson(String jsonPath) {
        ExtractionVocabulary vocabulary = new ExtractionVocabulary();
        vocabulary.apply(readDefaultTree());

        try {
            JsonNode json = new ObjectMapper().readTree(new File(jsonPath));
            vocabulary.apply(json);
            vocabulary.compile();
            log.info("已加载词表覆盖文件: {}", jsonPath);
            return vocabulary;
        } catch (Exception e) {
            log.warn("词表覆盖文件加载失败，使用默认词表: {} ({})", jsonPath, e.getMessage());
            return loadDefault();
        }
    }

    private static JsonNode readDefaultTree() {
        try (InputStream in = ExtractionVocabulary.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("classpath 中缺少 " + DEFAULT_RESOURCE);
            }
            return new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("默认词表解析失败: " + e.getMessage(), e);
        }
    }

    /**
     * 只覆盖 JSON 中出现的 key
     */
    private void apply(JsonNode json) {
        if (json.has("formatReject")) {
            formatReject = new LinkedHashSet<>(readStrings(json.get("formatReject")));
        }
        if (json.has("protocolReject")) {
            protocolReject = new LinkedHashSet<>();
            for (String s : readStrings(json.get("protocolReject"))) {
                protocolReject.add(s.toUpperCase(Locale.ROOT));
            }
        }
        if (json.has("signalPrefixes")) {
            signalPrefixes = readStrings(json.get("signalPrefixes"));
        }
        if (json.has("packageKeywords")) {
            packageKeywords = readStrings(json.get("packageKeywords"));
        }
        if (json.has("packagePrefixes")) {
            packagePrefixes = readStrings(json.get("packagePrefixes"));
        }
        if (json.has("orderingPattern")) {
            orderingPattern = json.get("orderingPattern").asText();
        }
        if (json.has("vendorCodePattern")) {
            vendorCodePattern = json.get("vendorCodePattern").asText();
        }
        if (json.has("strongHeaderKeywords")) {
            strongHeaderKeywords = readStrings(json.get("strongHeaderKeywords"));
        }
        if (json.has("moderateHeaderKeywords")) {
            moderateHeaderKeywords = readStrings(json.get("moderateHeaderKeywords"));
        }
        if (json.has("electricalHeaderKeywords")) {
            electricalHeaderKeywords = readStrings(json.get("electricalHeaderKeywords"));
        }
        if (json.has("supplyMnemonics")) {
            supplyMnemonics = new LinkedHashSet<>(readStrings(json.get("supplyMnemonics")));
        }
        if (json.has("headerRules")) {
            List<HeaderRule> rules = new ArrayList<>();
            for (JsonNode node : json.get("headerRules")) {
                rules.add(new HeaderRule(
                        node.path("label").asText(),
                        readStrings(node.get("allOf")),
                        readStrings(node.get("anyOf")),
                        readStrings(node.get("noneOf")),
                        readStrings(node.get("equalsAny"))));
            }
            headerRules = rules;
        }
    }

    private void compile() {
        if (signalPrefixes.isEmpty()) {
            // 空前缀表不拒绝任何 token
            signalNamePattern = Pattern.compile("(?!)");
        } else {
            signalNamePattern = Pattern.compile(
                    "^(" + String.join("|", signalPrefixes) + ")[A-Z0-9/._-]*$", Pattern.CASE_INSENSITIVE);
        }
        orderingHeaderPattern = Pattern.compile(orderingPattern, Pattern.CASE_INSENSITIVE);
        vendorLiteralPattern = Pattern.compile(vendorCodePattern);

        formatReject = Collections.unmodifiableSet(formatReject);
        protocolReject = Collections.unmodifiableSet(protocolReject);
        signalPrefixes = Collections.unmodifiableList(signalPrefixes);
        packageKeywords = Collections.unmodifiableList(packageKeywords);
        packagePrefixes = Collections.unmodifiableList(packagePrefixes);
        strongHeaderKeywords = Collections.unmodifiableList(strongHeaderKeywords);
        moderateHeaderKeywords = Collections.unmodifiableList(moderateHeaderKeywords);
        electricalHeaderKeywords = Collections.unmodifiableList(electricalHeaderKeywords);
        supplyMnemonics = Collections.unmodifiableSet(supplyMnemonics);
        headerRules = Collections.unmodifiableList(headerRules);
    }

    private static List<String> readStrings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            values.add(item.asText());
        }
        return values;
    }

    public Set<String> getFormatReject() { return formatReject; }
    public Set<String> getProtocolReject() { return protocolReject; }
    public List<String> getSignalPrefixes() { return signalPrefixes; }
    public List<String> getPackageKeywords() { return packageKeywords; }
    public List<String> getPackagePrefixes() { return packagePrefixes; }
    public List<String> getStrongHeaderKeywords() { return strongHeaderKeywords; }
    public List<String> getModerateHeaderKeywords() { return moderateHeaderKeywords; }
    public List<String> getElectricalHeaderKeywords() { return electricalHeaderKeywords; }
    public Set<String> getSupplyMnemonics() { return supplyMnemonics; }
    public List<HeaderRule> getHeaderRules() { return headerRules; }

    /** 信号名形状：已知前缀 + 任意字母数字/分隔符后缀 */
    public Pattern getSignalNamePattern() { return signalNamePattern; }

    /** 订购信息（ordering / part number / MPN ...），大小写不敏感 */
    public Pattern getOrderingHeaderPattern() { return orderingHeaderPattern; }

    /** 厂商文献代码 */
    public Pattern getVendorLiteralPattern() { return vendorLiteralPattern; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ExtractionVocabulary{\n");
        sb.append("  formatReject=").append(formatReject.size()).append(",\n");
        sb.append("  protocolReject=").append(protocolReject.size()).append(",\n");
        sb.append("  signalPrefixes=").append(signalPrefixes.size()).append(",\n");
        sb.append("  packageKeywords=").append(packageKeywords).append(",\n");
        sb.append("  headerRules=").append(headerRules.size()).append("\n");
        sb.append("}");
        return sb.toString();
    }
}
