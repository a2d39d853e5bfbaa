package com.soundbank.generator.render.state;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Value;

@Value
public class ParamCombo {

    List<ParamValue> values;

    public ParamCombo(List<ParamValue> values) {
        this.values = List.copyOf(values);
    }

    public Optional<ParamValue> find(long paramId) {
        return values.stream()
                .filter(value -> value.getParamId() == paramId)
                .findFirst();
    }

    @Override
    public String toString() {
        return values.stream().map(ParamValue::toString).collect(Collectors.joining(" "));
    }
}
