package io.formulakit.core.model;

/**
 * An {@code (id, expression)} pair as stored in catalogs and handed to the registry.
 *
 * @param id         unique formula identifier
 * @param expression formula source text
 */
public record FormulaDefinition(String id, String expression) {}
