package com.example.datasheet.service;

import com.example.datasheet.util.identify.dto.IdentifyResult;
import com.example.datasheet.util.pin.PinIndex;
import com.example.datasheet.util.rule.DesignRule;
import com.example.datasheet.util.rule.DesignRules;
import com.example.datasheet.util.rule.dto.DatasheetSnapshot;
import com.example.datasheet.util.table.CanonicalHeaders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文档结果快照
 *
 * 组装下游持久化使用的 {filename, pin, checklist, footnote} 结构：
 * - key：识别出的主标识符，没有时用文件名（去扩展名）
 * - pin：第一个封装的引脚表，为空时用规范表头占位
 * - checklist：合法规则经规范化、去重后，引脚引用映射为引脚表中的引脚名
 * 不做任何文件写入。
 */
@Slf4j
@Service
public class DatasheetSnapshotService {

    private final DatasheetIdentifyService identifyService;
    private final PinTableService pinTableService;

    @Autowired
    public DatasheetSnapshotService(DatasheetIdentifyService identifyService, PinTableService pinTableService) {
        this.identifyService = identifyService;
        this.pinTableService = pinTableService;
    }

    public Map<String, DatasheetSnapshot> buildSnapshot(Path path, List<DesignRule> rules) throws IOException {
        IdentifyResult identity = identifyService.identify(path);
        List<List<String>> pinTable = firstPinTable(pinTableService.extractPinTable(path));
        PinIndex pinIndex = new PinIndex(pinTable);

        List<DesignRule> normalized = new ArrayList<>();
        int dropped = 0;
        for (DesignRule rule : rules == null ? new ArrayList<DesignRule>() : rules) {
            if (!DesignRules.isValid(rule)) {
                dropped++;
                continue;
            }
            normalized.add(DesignRules.normalize(rule));
        }

        List<DesignRule> checklist = new ArrayList<>();
        for (DesignRule rule : DesignRules.dedup(normalized)) {
            rule.setPins(pinIndex.resolve(rule.getPins()));
            checklist.add(rule);
        }
        if (dropped > 0) {
            log.warn("丢弃 {} 条不合法的规则: {}", dropped, path);
        }

        String fileName = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        String key = identity.getPrimaryIdentifier() != null
                ? identity.getPrimaryIdentifier()
                : stem(fileName);

        Map<String, DatasheetSnapshot> snapshot = new LinkedHashMap<>();
        snapshot.put(key, new DatasheetSnapshot(fileName, pinTable, checklist, ""));
        log.info("快照已生成: key={}, rules={}, pinRows={}", key, checklist.size(), pinTable.size() - 1);
        return snapshot;
    }

    private static List<List<String>> firstPinTable(Map<String, List<List<String>>> pinTables) {
        if (pinTables == null || pinTables.isEmpty()) {
            return CanonicalHeaders.sentinelTable();
        }
        List<List<String>> table = pinTables.values().iterator().next();
        return table == null || table.isEmpty() ? CanonicalHeaders.sentinelTable() : table;
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
