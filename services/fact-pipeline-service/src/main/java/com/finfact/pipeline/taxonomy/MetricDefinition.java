package com.finfact.pipeline.taxonomy;

import java.util.List;

public record MetricDefinition(
    String code,
    String nameCn,
    String nameEn,
    StatementType statementType,
    ValueNature valueNature,
    SignConvention signConvention,
    String parentCode,
    List<String> patterns,
    List<String> exactPatterns
) {
    public MetricDefinition {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        exactPatterns = exactPatterns == null ? List.of() : List.copyOf(exactPatterns);
        signConvention = signConvention == null ? SignConvention.AS_REPORTED : signConvention;
    }
}
