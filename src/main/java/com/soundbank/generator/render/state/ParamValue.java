package com.soundbank.generator.render.state;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A real-time parameter pinned to one bucket value.
 */
@Value(staticConstructor = "of")
public class ParamValue {

    long paramId;
    double value;

    @EqualsAndHashCode.Exclude
    String paramName;

    public static ParamValue of(long paramId, double value) {
        return of(paramId, value, null);
    }

    @Override
    public String toString() {
        return (paramName != null ? paramName : String.valueOf(paramId)) + "=" + value;
    }
}
