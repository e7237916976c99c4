package com.mccengine.api.controller;

import com.mccengine.api.serializer.MccSerializer;
import com.mccengine.api.serializer.SerializationOptions;
import com.mccengine.codes.Code;
import com.mccengine.codes.CodeAttribute;
import com.mccengine.collection.MccCollection;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for MCC lookup and search.
 */
@RestController
@RequestMapping("/api/v1/mcc/codes")
@RequiredArgsConstructor
@Tag(name = "Codes", description = "MCC lookup and search API")
public class CodeController {

    private final MccCollection collection;
    private final MccSerializer serializer;

    @GetMapping
    @Operation(summary = "Search codes by code or description; all codes when no query is given")
    public ResponseEntity<List<Map<String, Object>>> searchCodes(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(name = "allDescriptions", defaultValue = "false") boolean allDescriptions) {
        List<Code> codes = collection.search(query);
        return ResponseEntity.ok(serializer.serializeCollection(codes, options(allDescriptions)));
    }

    @GetMapping("/reportable")
    @Operation(summary = "Get all codes reportable under IRS 6050W")
    public ResponseEntity<List<Map<String, Object>>> getReportableCodes() {
        List<Code> codes = collection.where(Map.of(CodeAttribute.IRS_REPORTABLE, Boolean.TRUE));
        return ResponseEntity.ok(serializer.serializeCollection(codes, SerializationOptions.defaults()));
    }

    @GetMapping("/{mcc}")
    @Operation(summary = "Get a single code")
    public ResponseEntity<Map<String, Object>> getCode(
            @PathVariable String mcc,
            @RequestParam(name = "allDescriptions", defaultValue = "false") boolean allDescriptions) {
        Code code = collection.findOrThrow(mcc);
        return ResponseEntity.ok(serializer.serializeCode(code, options(allDescriptions)));
    }

    private static SerializationOptions options(boolean allDescriptions) {
        return SerializationOptions.builder().includeAllDescriptions(allDescriptions).build();
    }
}
