package com.mccengine.api.controller;

import com.mccengine.api.serializer.MccSerializer;
import com.mccengine.api.serializer.SerializationOptions;
import com.mccengine.categories.RiskCategory;
import com.mccengine.collection.MccCollection;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for risk categories.
 */
@RestController
@RequestMapping("/api/v1/mcc/categories")
@RequiredArgsConstructor
@Tag(name = "Categories", description = "Risk category API")
public class CategoryController {

    private final MccCollection collection;
    private final MccSerializer serializer;

    @GetMapping
    @Operation(summary = "List risk categories")
    public ResponseEntity<List<Map<String, Object>>> getCategories(
            @RequestParam(name = "includeCodes", defaultValue = "false") boolean includeCodes) {
        return ResponseEntity.ok(collection.categories().stream()
            .map(category -> serializer.serializeCategory(category, includeCodes))
            .collect(Collectors.toList()));
    }

    @GetMapping("/{categoryId}")
    @Operation(summary = "Get a risk category with its code entries")
    public ResponseEntity<Map<String, Object>> getCategory(@PathVariable String categoryId) {
        RiskCategory category = collection.requireCategory(categoryId);
        return ResponseEntity.ok(serializer.serializeCategory(category, true));
    }

    @GetMapping("/{categoryId}/codes")
    @Operation(summary = "Get all loaded codes belonging to a risk category")
    public ResponseEntity<List<Map<String, Object>>> getCategoryCodes(@PathVariable String categoryId) {
        RiskCategory category = collection.requireCategory(categoryId);
        return ResponseEntity.ok(serializer.serializeCollection(
            collection.inCategory(category), SerializationOptions.defaults()));
    }
}
