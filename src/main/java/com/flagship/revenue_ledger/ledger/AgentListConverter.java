package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores contributing agents as a comma-separated list of enum names.
 */
@Converter
public class AgentListConverter implements AttributeConverter<List<Agent>, String> {

    @Override
    public String convertToDatabaseColumn(List<Agent> agents) {
        if (agents == null || agents.isEmpty()) {
            return "";
        }
        return agents.stream().map(Agent::name).collect(Collectors.joining(","));
    }

    @Override
    public List<Agent> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .map(Agent::valueOf)
                .toList();
    }
}
