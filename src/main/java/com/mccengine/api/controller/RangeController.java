package com.mccengine.api.controller;

import com.mccengine.api.serializer.MccSerializer;
import com.mccengine.api.serializer.SerializationOptions;
import com.mccengine.collection.MccCollection;
import com.mccengine.ranges.MccRange;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for ISO 18245 ranges.
 */
@RestController
@RequestMapping("/api/v1/mcc/ranges")
@RequiredArgsConstructor
@Tag(name = "Ranges", description = "ISO 18245 range API")
public class RangeController {

    private final MccCollection collection;
    private final MccSerializer serializer;

    @GetMapping
    @Operation(summary = "List ranges; eligibleOnly drops reserved ranges unless configured otherwise")
    public ResponseEntity<List<Map<String, Object>>> getRanges(
            @RequestParam(name = "eligibleOnly", defaultValue = "false") boolean eligibleOnly) {
        List<MccRange> ranges = eligibleOnly ? collection.eligibleRanges() : collection.ranges();
        return ResponseEntity.ok(ranges.stream().map(serializer::serializeRange).collect(Collectors.toList()));
    }

    @GetMapping("/{name}/codes")
    @Operation(summary = "Get all codes in a range, matched by name case-insensitively")
    public ResponseEntity<List<Map<String, Object>>> getRangeCodes(@PathVariable String name) {
        return ResponseEntity.ok(
            serializer.serializeCollection(collection.inRange(name), SerializationOptions.defaults()));
    }
}
