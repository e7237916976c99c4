package com.mccengine.api.controller;

import com.mccengine.api.dto.ReloadResponse;
import com.mccengine.api.dto.ValidateMccRequest;
import com.mccengine.api.dto.ValidateMccResponse;
import com.mccengine.collection.MccCollection;
import com.mccengine.validation.MccValidator;
import com.mccengine.validation.ValidationOptions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * REST API for MCC validation and dataset maintenance.
 */
@RestController
@RequestMapping("/api/v1/mcc")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Validation", description = "MCC validation API")
public class ValidationController {

    private final MccCollection collection;

    @PostMapping("/validate")
    @Operation(summary = "Validate a candidate MCC")
    public ResponseEntity<ValidateMccResponse> validate(@Valid @RequestBody ValidateMccRequest request) {
        ValidationOptions options = ValidationOptions.builder()
            .strict(request.getStrict() == null || request.getStrict())
            .denyCategories(toSet(request.getDenyCategories()))
            .allowCategories(request.getAllowCategories() == null ? null : toSet(request.getAllowCategories()))
            .build();

        List<String> errors = new MccValidator(collection, options).validate(request.getMcc());
        return ResponseEntity.ok(new ValidateMccResponse(request.getMcc(), errors.isEmpty(), errors));
    }

    @PostMapping("/reload")
    @Operation(summary = "Reload the MCC dataset from its data source")
    public ResponseEntity<ReloadResponse> reload() {
        collection.reload();
        log.info("MCC dataset reloaded on request");
        return ResponseEntity.ok(new ReloadResponse(
            collection.count(), collection.ranges().size(), collection.categories().size()));
    }

    private static Set<String> toSet(List<String> categoryIds) {
        return categoryIds == null ? Set.of() : new LinkedHashSet<>(categoryIds);
    }
}
