package com.example.datasheet.controller;

import com.example.datasheet.exception.DocumentNotFoundException;
import com.example.datasheet.exception.UnsupportedFormatException;
import com.example.datasheet.service.DatasheetIdentifyService;
import com.example.datasheet.service.DatasheetSnapshotService;
import com.example.datasheet.service.PinTableService;
import com.example.datasheet.util.identify.dto.IdentifyResult;
import com.example.datasheet.util.rule.dto.DatasheetSnapshot;
import com.example.datasheet.util.rule.dto.SnapshotRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据手册抽取控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/datasheet")
public class DatasheetController {

    @Autowired
    private DatasheetIdentifyService identifyService;

    @Autowired
    private PinTableService pinTableService;

    @Autowired
    private DatasheetSnapshotService snapshotService;

    /**
     * 识别器件标识符和封装
     *
     * @param path 服务器本地的 HTML/PDF 文件路径
     */
    @GetMapping("/identify")
    public ResponseEntity<Map<String, Object>> identify(@RequestParam("path") String path) {
        Map<String, Object> result = new HashMap<>();
        try {
            IdentifyResult identity = identifyService.identify(Paths.get(path));
            result.put("success", true);
            result.put("result", identity);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            return failure(result, path, e);
        }
    }

    /**
     * 抽取归一化引脚表
     *
     * @param path 服务器本地的 HTML/PDF 文件路径
     */
    @GetMapping("/pin-table")
    public ResponseEntity<Map<String, Object>> pinTable(@RequestParam("path") String path) {
        Map<String, Object> result = new HashMap<>();
        try {
            Map<String, List<List<String>>> tables = pinTableService.extractPinTable(Paths.get(path));
            result.put("success", true);
            result.put("result", tables);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            return failure(result, path, e);
        }
    }

    /**
     * 组装结果快照（引脚表 + 规则清单）
     */
    @PostMapping("/snapshot")
    public ResponseEntity<Map<String, Object>> snapshot(@RequestBody SnapshotRequest request) {
        Map<String, Object> result = new HashMap<>();
        if (request.getPath() == null || request.getPath().trim().isEmpty()) {
            result.put("success", false);
            result.put("message", "path 不能为空");
            return ResponseEntity.badRequest().body(result);
        }
        try {
            Path path = Paths.get(request.getPath().trim());
            Map<String, DatasheetSnapshot> snapshot = snapshotService.buildSnapshot(path, request.getRules());
            result.put("success", true);
            result.put("result", snapshot);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            return failure(result, request.getPath(), e);
        }
    }

    private ResponseEntity<Map<String, Object>> failure(Map<String, Object> result, String path, Exception e) {
        result.put("success", false);
        result.put("message", e.getMessage());
        if (e instanceof DocumentNotFoundException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        if (e instanceof UnsupportedFormatException) {
            return ResponseEntity.badRequest().body(result);
        }
        log.error("处理失败: {}, {}", path, e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }
}
