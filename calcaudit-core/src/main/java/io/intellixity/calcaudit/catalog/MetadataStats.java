package io.intellixity.calcaudit.catalog;

/** Completeness counts over the whole metadata catalog. */
public record MetadataStats(
    int datagroupTotal,
    int datagroupMissingDescription,
    int keyTotal,
    int keyMissingDescription,
    int keyRaw,
    int keyCalculated,
    int keyCalculatedWithoutFormula
) {}
