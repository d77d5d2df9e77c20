package com.gillianbc.retirement.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.SpendingPhaseConfig;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stable JSON rendering of projection inputs.
 * <p>
 * Properties and map keys are alphabetical and decimals are written without trailing zeros,
 * so {@code 0.070} and {@code 0.07} render the same. {@link #normalize(ProjectionInput)} removes
 * differences that cannot change a projection: stream and phase order, and switched-off
 * phase or depletion settings.
 */
@Component
public class CanonicalJson {

    private final ObjectMapper mapper;

    public CanonicalJson() {
        SimpleModule decimals = new SimpleModule("canonical-decimals");
        decimals.addSerializer(BigDecimal.class, new PlainDecimalSerializer());
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .addModule(decimals)
                .build();
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise " + value, e);
        }
    }

    public ProjectionInput normalize(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        List<IncomeStream> streams = new ArrayList<>(input.getIncomeStreams());
        streams.sort(Comparator.comparing(IncomeStream::getId));

        SpendingPhaseConfig phases = input.getSpendingPhaseConfig();
        if (phases != null) {
            phases = phases.isEnabled()
                    ? phases.toBuilder().clearPhases().phases(phases.sortedPhases()).build()
                    : null;
        }

        return input.toBuilder()
                .clearIncomeStreams()
                .incomeStreams(streams)
                .spendingPhaseConfig(phases)
                .depletionTarget(input.hasEnabledDepletionTarget() ? input.getDepletionTarget() : null)
                .build();
    }

    static class PlainDecimalSerializer extends StdSerializer<BigDecimal> {

        PlainDecimalSerializer() {
            super(BigDecimal.class);
        }

        @Override
        public void serialize(BigDecimal value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeNumber(value.stripTrailingZeros().toPlainString());
        }
    }
}
