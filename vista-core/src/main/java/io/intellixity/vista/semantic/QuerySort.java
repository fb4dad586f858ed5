package io.intellixity.vista.semantic;

/** Sort on a dimension or measure id; direction is {@code asc} or {@code desc}. */
public record QuerySort(String fieldId, String direction) {}
