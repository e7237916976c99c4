package com.mccengine.common.exception;

/**
 * Thrown when a category id is not part of the loaded dataset.
 */
public class CategoryNotFoundException extends MccEngineException {

    public CategoryNotFoundException(String categoryId) {
        super("Category not found: " + categoryId);
    }
}
