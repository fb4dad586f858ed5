package io.intellixity.vista.semantic;

/** Filter on a dimension; the operator is kept raw and parsed by the compiler. */
public record QueryFilter(String dimensionId, String operator, Object value) {}
